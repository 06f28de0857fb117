package com.example.f30.domain.exception;

import java.util.List;

/**
 * Raised at intake when the caller-supplied identity data lacks a concept the profile needs.
 */
public class MissingIdentityDataException extends DomainException {

	/**
	 * @param aliases accepted keys for the missing concept
	 */
    public MissingIdentityDataException(List<String> aliases) {
        super("Identity data must include one of: " + String.join(", ", aliases));
    }
}
