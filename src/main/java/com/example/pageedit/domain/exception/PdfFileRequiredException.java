package com.example.pageedit.domain.exception;

/**
 * Raised when the client attempts to create a document without providing a PDF file.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to upload.");
    }
}
