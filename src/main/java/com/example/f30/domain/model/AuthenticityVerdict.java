package com.example.f30.domain.model;

/**
 * Tri-state outcome of the authenticity heuristics, ordered by severity.
 */
public enum AuthenticityVerdict {
    PASSED,
    WARNING,
    FAILED;

    /**
     * @param other verdict to combine with
     * @return the more severe of the two verdicts
     */
    public AuthenticityVerdict escalate(AuthenticityVerdict other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
