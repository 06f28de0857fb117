package com.example.f30.domain.model;

/**
 * Final verdict carried by a {@link Decision}.
 */
public enum DecisionStatus {
    APPROVED,
    REJECTED,
    MANUAL_REVIEW,
    ERROR
}
