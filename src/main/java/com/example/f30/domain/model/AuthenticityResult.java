package com.example.f30.domain.model;

import java.util.List;

/**
 * Verdict of the authenticity heuristics with the signals that produced it.
 */
public record AuthenticityResult(
        AuthenticityVerdict verdict,
        List<String> signals
) {
    public AuthenticityResult {
        signals = List.copyOf(signals);
    }

    public static AuthenticityResult passed() {
        return new AuthenticityResult(AuthenticityVerdict.PASSED, List.of());
    }
}
