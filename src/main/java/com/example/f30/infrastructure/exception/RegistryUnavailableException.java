package com.example.f30.infrastructure.exception;

/**
 * Transient failure of the registry automation (timeout, unresponsive portal, crash).
 * Drives the verification retry loop; never means the certificate is invalid.
 */
public class RegistryUnavailableException extends InfrastructureException {

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegistryUnavailableException(String message) {
        super(message, null);
    }
}
