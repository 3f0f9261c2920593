package com.example.pageedit.domain.model;

import java.util.UUID;

/**
 * Read model describing a document through its current version.
 */
public record DocumentSummary(
        UUID id,
        String title,
        String lang,
        UUID folderId,
        int versionCount,
        int versionNumber,
        int pageCount,
        String text
) {

    public static DocumentSummary of(Document document, DocumentVersion current) {
        return new DocumentSummary(
                document.id(),
                document.title(),
                document.lang(),
                document.folderId(),
                document.versions().size(),
                current.number(),
                current.pageCount(),
                current.text().orElse("")
        );
    }
}
