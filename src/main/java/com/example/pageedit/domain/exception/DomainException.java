package com.example.pageedit.domain.exception;

/**
 * Base type for all domain-level exceptions in the page editing model.
 * Subclasses describe rejected requests and broken invariants without leaking infrastructure types.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule was violated
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule was violated
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
