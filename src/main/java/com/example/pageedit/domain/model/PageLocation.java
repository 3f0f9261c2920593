package com.example.pageedit.domain.model;

/**
 * A page resolved together with the version and document that own it.
 */
public record PageLocation(Document document, DocumentVersion version, Page page) {

    public boolean isArchived() {
        return !version.isCurrent();
    }
}
