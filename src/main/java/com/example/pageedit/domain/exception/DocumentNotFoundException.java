package com.example.pageedit.domain.exception;

import java.util.UUID;

/**
 * Raised when a document id cannot be resolved, or the document has no committed version yet.
 */
public class DocumentNotFoundException extends DomainException {

    public DocumentNotFoundException(UUID documentId) {
        super("Document not found: " + documentId);
    }
}
