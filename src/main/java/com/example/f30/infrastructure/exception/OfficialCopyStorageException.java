package com.example.f30.infrastructure.exception;

/**
 * Signals that an official copy retrieved from the registry could not be stored or read back.
 */
public class OfficialCopyStorageException extends InfrastructureException {

    public OfficialCopyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
