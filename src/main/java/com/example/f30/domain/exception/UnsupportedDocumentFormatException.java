package com.example.f30.domain.exception;

/**
 * Raised when the referenced file does not look like a PDF. F30 certificates are only issued as PDF.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * @param fileReference offending reference supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileReference) {
        super("F30 certificates are only accepted as PDF: " + fileReference);
    }
}
