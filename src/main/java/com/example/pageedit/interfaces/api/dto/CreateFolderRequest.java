package com.example.pageedit.interfaces.api.dto;

import java.util.UUID;

public record CreateFolderRequest(String title, UUID parentId) {
}
