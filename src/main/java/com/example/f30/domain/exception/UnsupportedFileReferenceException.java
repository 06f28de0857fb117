package com.example.f30.domain.exception;

/**
 * Raised when the file reference is not an absolute http(s) URL.
 */
public class UnsupportedFileReferenceException extends DomainException {

	/**
	 * @param fileReference offending reference supplied by the client
	 */
    public UnsupportedFileReferenceException(String fileReference) {
        super("The file reference must be an http or https URL: " + fileReference);
    }
}
