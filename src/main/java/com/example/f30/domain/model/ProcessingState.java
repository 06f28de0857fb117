package com.example.f30.domain.model;

/**
 * Lifecycle of a {@link ProcessingJob}. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum ProcessingState {
    PENDING,
    OCR,
    VALIDATION,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
