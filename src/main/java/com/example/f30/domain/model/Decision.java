package com.example.f30.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal, immutable record of one processing run.
 * The processing log is never empty, and rejection reasons are present exactly for
 * {@link DecisionStatus#REJECTED} and {@link DecisionStatus#MANUAL_REVIEW}.
 */
public record Decision(
        String documentId,
        CertificateVariant variant,
        DecisionStatus status,
        Map<String, String> extractedData,
        List<ValidationResult> validationResults,
        List<RejectionReason> rejectionReasons,
        AuthenticityResult authenticityResult,
        ExternalVerificationOutcome externalVerificationOutcome,
        List<String> processingLog,
        Instant processedAt
) {
    public Decision {
        if (processingLog == null || processingLog.isEmpty()) {
            throw new IllegalArgumentException("A decision requires a processing log");
        }
        rejectionReasons = rejectionReasons == null ? List.of() : List.copyOf(rejectionReasons);
        boolean needsReasons = status == DecisionStatus.REJECTED || status == DecisionStatus.MANUAL_REVIEW;
        if (needsReasons && rejectionReasons.isEmpty()) {
            throw new IllegalArgumentException(status + " decision requires at least one rejection reason");
        }
        if (status == DecisionStatus.APPROVED && !rejectionReasons.isEmpty()) {
            throw new IllegalArgumentException("APPROVED decision cannot carry rejection reasons");
        }
        extractedData = extractedData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
        validationResults = validationResults == null ? List.of() : List.copyOf(validationResults);
        processingLog = List.copyOf(processingLog);
    }
}
