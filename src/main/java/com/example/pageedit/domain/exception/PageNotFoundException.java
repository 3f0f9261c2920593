package com.example.pageedit.domain.exception;

import java.util.UUID;

/**
 * Raised when a page id cannot be resolved.
 */
public class PageNotFoundException extends DomainException {

    public PageNotFoundException(UUID pageId) {
        super("Page not found: " + pageId);
    }
}
