package com.example.f30.application.exception;

/**
 * Thrown at admission when a job for the same document id is still in flight.
 */
public class DuplicateDocumentException extends UseCaseValidationException {

	/**
	 * @param documentId id of the document already being processed
	 */
    public DuplicateDocumentException(String documentId) {
        super("Document " + documentId + " is already being processed.");
    }
}
