package com.example.f30.domain.exception;

/**
 * Raised when a request declares a certificate variant that has no registered profile.
 * The request is invalid, not the document, so no processing stage runs.
 */
public class UnknownVariantException extends DomainException {

	/**
	 * @param variant declared variant as received
	 */
    public UnknownVariantException(String variant) {
        super("Unknown certificate variant: " + (variant == null ? "<none>" : variant)
                + ". Expected 'razon_social' or 'persona_natural'.");
    }
}
