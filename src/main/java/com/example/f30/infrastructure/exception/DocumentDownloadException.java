package com.example.f30.infrastructure.exception;

/**
 * Signals that the referenced document could not be fetched from its origin.
 */
public class DocumentDownloadException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   transport or file system failure
	 */
    public DocumentDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
