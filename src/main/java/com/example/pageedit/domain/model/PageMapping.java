package com.example.pageedit.domain.model;

/**
 * One position correspondence between a new version and the version its page came from.
 *
 * @param newNumber 1-based position in the new version
 * @param oldNumber 1-based position in the originating version
 * @param origin    which version {@code oldNumber} refers to
 */
public record PageMapping(int newNumber, int oldNumber, PageOrigin origin) {

    public PageMapping {
        if (newNumber < 1 || oldNumber < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based: " + newNumber + " <- " + oldNumber);
        }
        if (origin == null) {
            throw new IllegalArgumentException("Page origin is required");
        }
    }

    public static PageMapping retained(int newNumber, int oldNumber) {
        return new PageMapping(newNumber, oldNumber, PageOrigin.RETAINED);
    }

    public static PageMapping inserted(int newNumber, int oldNumber) {
        return new PageMapping(newNumber, oldNumber, PageOrigin.INSERTED);
    }

    public boolean isRetained() {
        return origin == PageOrigin.RETAINED;
    }
}
