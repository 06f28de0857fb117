package com.example.f30.application.exception;

/**
 * Thrown at startup when the document type profiles cannot be loaded.
 */
public class ProfileConfigurationException extends ApplicationException {

    public ProfileConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProfileConfigurationException(String message) {
        super(message);
    }
}
