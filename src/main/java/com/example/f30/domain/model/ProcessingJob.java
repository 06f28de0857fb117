package com.example.f30.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One submitted document for the duration of a processing run. Only the state changes; it only
 * moves forward and never leaves a terminal state.
 */
public class ProcessingJob {

    private final String documentId;
    private final String fileReference;
    private final CertificateVariant variant;
    private final Map<String, String> identityData;
    private final String callbackUrl;
    private final Instant createdAt;
    private volatile ProcessingState state = ProcessingState.PENDING;

    public ProcessingJob(String documentId,
                         String fileReference,
                         CertificateVariant variant,
                         Map<String, String> identityData,
                         String callbackUrl,
                         Instant createdAt) {
        this.documentId = documentId;
        this.fileReference = fileReference;
        this.variant = variant;
        this.identityData = Collections.unmodifiableMap(new LinkedHashMap<>(identityData));
        this.callbackUrl = callbackUrl;
        this.createdAt = createdAt;
    }

    /**
     * Moves the job to the given state.
     *
     * @param next target state
     * @throws IllegalStateException when the job is already terminal or the move goes backwards
     */
    public synchronized void transitionTo(ProcessingState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Job " + documentId + " is already " + state);
        }
        if (next != ProcessingState.FAILED && next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + documentId);
        }
        state = next;
    }

    public String documentId() {
        return documentId;
    }

    public String fileReference() {
        return fileReference;
    }

    public CertificateVariant variant() {
        return variant;
    }

    public Map<String, String> identityData() {
        return identityData;
    }

    public String callbackUrl() {
        return callbackUrl;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ProcessingState state() {
        return state;
    }
}
