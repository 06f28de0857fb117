package com.example.f30.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while reading a PDF from memory.
 */
public class UnreadableDocumentException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public UnreadableDocumentException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnreadableDocumentException(String message) {
        super(message, null);
    }
}
