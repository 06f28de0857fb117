package com.example.f30.domain.model;

import java.util.List;

/**
 * Structured explanation of one failed check attached to a non-approved {@link Decision}.
 *
 * @param type        rejection category
 * @param rule        originating rule name, {@code null} when not rule-driven
 * @param details     free text
 * @param differences field-level discrepancies, only for {@link RejectionType#DATA_MISMATCH}
 */
public record RejectionReason(
        RejectionType type,
        String rule,
        String details,
        List<FieldDifference> differences
) {
    public RejectionReason {
        differences = differences == null ? List.of() : List.copyOf(differences);
    }

    public static RejectionReason of(RejectionType type, String details) {
        return new RejectionReason(type, null, details, List.of());
    }

    public static RejectionReason forRule(String rule, String details) {
        return new RejectionReason(RejectionType.CROSS_VALIDATION, rule, details, List.of());
    }
}
