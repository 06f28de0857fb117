package com.example.f30.domain.exception;

/**
 * Raised when an intake request carries no document id.
 */
public class DocumentIdRequiredException extends DomainException {

    public DocumentIdRequiredException() {
        super("A document id is required.");
    }
}
