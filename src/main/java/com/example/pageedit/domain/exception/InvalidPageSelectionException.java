package com.example.pageedit.domain.exception;

/**
 * Raised when a request names no pages, repeats a page, mixes pages of different versions or
 * addresses a position that does not exist.
 */
public class InvalidPageSelectionException extends DomainException {

	/**
	 * @param message description of what is wrong with the selection
	 */
    public InvalidPageSelectionException(String message) {
        super(message);
    }
}
