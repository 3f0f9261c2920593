package com.example.pageedit.interfaces.api.dto;

public record PageTextRequest(String text) {
}
