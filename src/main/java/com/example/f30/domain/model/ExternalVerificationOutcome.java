package com.example.f30.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of cross-checking a certificate against the external registry.
 * {@code valid} is only ever true when the call was attempted and completed without technical error.
 *
 * @param attempted        whether any submission was made
 * @param success          the automation completed and the registry gave a definitive answer
 * @param valid            the registry confirmed the certificate
 * @param message          registry or failure message
 * @param submittedInputs  exact field values entered into the registry
 * @param retrievedCopyRef reference to the stored official copy, only when valid
 * @param attempts         one entry per submission
 */
public record ExternalVerificationOutcome(
        boolean attempted,
        boolean success,
        boolean valid,
        String message,
        Map<String, String> submittedInputs,
        String retrievedCopyRef,
        List<VerificationAttempt> attempts
) {
    public ExternalVerificationOutcome {
        if (valid && !(attempted && success)) {
            throw new IllegalArgumentException("A registry confirmation requires a successful attempt");
        }
        submittedInputs = submittedInputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(submittedInputs));
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static ExternalVerificationOutcome notAttempted(String message) {
        return new ExternalVerificationOutcome(false, false, false, message, Map.of(), null, List.of());
    }
}
