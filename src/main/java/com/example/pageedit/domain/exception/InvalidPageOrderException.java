package com.example.pageedit.domain.exception;

/**
 * Raised when reorder assignments are not a permutation of 1..pageCount.
 */
public class InvalidPageOrderException extends DomainException {

	/**
	 * @param message description of the missing or duplicated positions
	 */
    public InvalidPageOrderException(String message) {
        super(message);
    }
}
