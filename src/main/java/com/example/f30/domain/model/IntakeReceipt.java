package com.example.f30.domain.model;

/**
 * Synchronous acknowledgement that a job was admitted and runs in the background.
 */
public record IntakeReceipt(
        String documentId,
        String status
) {
    public static final String PROCESSING = "PROCESSING";

    public static IntakeReceipt processing(String documentId) {
        return new IntakeReceipt(documentId, PROCESSING);
    }
}
