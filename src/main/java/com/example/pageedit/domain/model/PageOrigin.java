package com.example.pageedit.domain.model;

/**
 * Tells which version the old number of a {@link PageMapping} points into.
 */
public enum PageOrigin {
    /**
     * The page comes from the previous version of the same document.
     */
    RETAINED,
    /**
     * The page comes from a version of another document (moves and extractions).
     */
    INSERTED
}
