package com.example.pageedit.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when the byte store cannot read, write or copy a path.
 */
public class StorageException extends InfrastructureException {

	/**
	 * @param message storage path and operation that failed
	 * @param cause   underlying IO failure
	 */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
