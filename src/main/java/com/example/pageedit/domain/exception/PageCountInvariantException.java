package com.example.pageedit.domain.exception;

/**
 * Raised when an edit would leave a document version without pages.
 */
public class PageCountInvariantException extends DomainException {

	/**
	 * @param pageCount page count the edit would produce
	 */
    public PageCountInvariantException(int pageCount) {
        super("Document version must have at least one page, the edit would leave " + pageCount + ".");
    }
}
