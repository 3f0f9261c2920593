package com.example.pageedit.domain.model;

import java.util.List;

/**
 * Validated set of pages of one current version, sorted by page number.
 */
public record PageSelection(Document document, DocumentVersion version, List<Page> pages) {

    public List<Integer> numbers() {
        return pages.stream().map(Page::number).toList();
    }

    public int size() {
        return pages.size();
    }
}
