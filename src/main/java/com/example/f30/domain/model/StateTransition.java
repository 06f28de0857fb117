package com.example.f30.domain.model;

import java.time.Instant;

/**
 * Append-only audit entry of a job entering a state.
 */
public record StateTransition(
        String documentId,
        ProcessingState state,
        Instant at
) {
}
