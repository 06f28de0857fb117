package com.example.f30.application.exception;

/**
 * Thrown when no terminal decision is stored for a document id.
 */
public class DecisionNotFoundException extends ApplicationException {

    public DecisionNotFoundException(String documentId) {
        super("No decision recorded for document " + documentId + ".");
    }
}
