package com.example.pageedit.domain.exception;

import java.util.UUID;

/**
 * Raised when an edit targets a page that does not belong to its document's current version.
 * Archived versions are read-only history.
 */
public class ArchivedPageEditException extends DomainException {

	/**
	 * @param pageId page of a non-current version
	 */
    public ArchivedPageEditException(UUID pageId) {
        super("Page " + pageId + " belongs to an archived document version and cannot be edited.");
    }
}
