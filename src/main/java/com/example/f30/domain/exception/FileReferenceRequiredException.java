package com.example.f30.domain.exception;

/**
 * Raised when an intake request carries no file reference.
 */
public class FileReferenceRequiredException extends DomainException {

    public FileReferenceRequiredException() {
        super("A file reference (file_url) is required.");
    }
}
