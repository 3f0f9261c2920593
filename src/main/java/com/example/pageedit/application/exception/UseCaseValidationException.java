package com.example.pageedit.application.exception;

/**
 * Signals validation issues detected while running an application layer use case,
 * such as a blank folder title.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
