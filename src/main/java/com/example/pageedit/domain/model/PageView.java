package com.example.pageedit.domain.model;

import java.util.UUID;

/**
 * Read model of a page returned to callers.
 */
public record PageView(
        UUID id,
        int number,
        String text,
        String lang,
        UUID documentId,
        UUID versionId,
        int versionNumber,
        boolean archived
) {

    public static PageView of(PageLocation location) {
        Page page = location.page();
        return new PageView(
                page.id(),
                page.number(),
                page.text().orElse(null),
                page.lang(),
                page.documentId(),
                page.versionId(),
                page.versionNumber(),
                location.isArchived()
        );
    }
}
