package com.example.pageedit.interfaces.api.dto;

import com.example.pageedit.domain.model.PageRotation;

import java.util.List;
import java.util.UUID;

/**
 * Request body rotating pages by clockwise angles.
 */
public record RotateRequest(List<Item> pages) {

    public List<PageRotation> toRotations() {
        if (pages == null) {
            return List.of();
        }
        return pages.stream()
                .map(item -> new PageRotation(item.id(), item.angle()))
                .toList();
    }

    public record Item(UUID id, int angle) {
    }
}
