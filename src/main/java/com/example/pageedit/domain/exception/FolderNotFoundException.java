package com.example.pageedit.domain.exception;

import java.util.UUID;

/**
 * Raised when a destination or parent folder id cannot be resolved.
 */
public class FolderNotFoundException extends DomainException {

    public FolderNotFoundException(UUID folderId) {
        super("Folder not found: " + folderId);
    }
}
