package com.example.f30.domain.model;

/**
 * Outcome of a single {@link ValidationRule} evaluation, kept verbatim in the audit trail.
 *
 * @param rule        rule name
 * @param description rule description
 * @param field       extracted field the rule inspected
 * @param passed      whether the rule passed
 * @param message     human readable explanation
 * @param score       similarity score for text rules, {@code null} otherwise
 */
public record ValidationResult(
        String rule,
        String description,
        String field,
        boolean passed,
        String message,
        Double score
) {
}
