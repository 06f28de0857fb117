package com.example.f30.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit record of one submission to the external registry.
 */
public record VerificationAttempt(
        int attempt,
        Map<String, String> submittedInputs,
        String result
) {
    public VerificationAttempt {
        submittedInputs = Collections.unmodifiableMap(new LinkedHashMap<>(submittedInputs));
    }
}
