package com.example.pageedit.interfaces.api.dto;

import com.example.pageedit.domain.model.PageReorder;

import java.util.List;
import java.util.UUID;

/**
 * Request body assigning a new position to every page of a version.
 */
public record ReorderRequest(List<Item> pages) {

    public List<PageReorder> toReorders() {
        if (pages == null) {
            return List.of();
        }
        return pages.stream()
                .map(item -> new PageReorder(item.id(), item.oldNumber(), item.newNumber()))
                .toList();
    }

    public record Item(UUID id, int oldNumber, int newNumber) {
    }
}
