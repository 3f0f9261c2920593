package com.example.pageedit.application.exception;

import java.util.UUID;

/**
 * Thrown when the exclusive lease on a document cannot be acquired in time because another
 * structural edit is still running on it.
 */
public class DocumentBusyException extends ApplicationException {

	/**
	 * @param documentId document whose lease timed out
	 */
    public DocumentBusyException(UUID documentId) {
        super("Document " + documentId + " is being edited by another request, please retry.");
    }

	/**
	 * @param documentId document whose lease wait was interrupted
	 * @param cause      interruption
	 */
    public DocumentBusyException(UUID documentId, Throwable cause) {
        super("Interrupted while waiting to edit document " + documentId + ".", cause);
    }
}
