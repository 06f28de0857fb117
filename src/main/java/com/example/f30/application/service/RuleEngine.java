package com.example.f30.application.service;

import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.MatchOperator;
import com.example.f30.domain.model.RejectionReason;
import com.example.f30.domain.model.ValidationResult;
import com.example.f30.domain.model.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates a profile's cross-validation rules against extracted fields and caller identity data.
 * All rules run in declaration order with no short-circuit; every rule yields one result and every
 * failing rule one {@code cross_validation} rejection.
 */
@Service
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);
    private static final String DECORATION = "[\\s\\-–—_*•·:.]+";

    /**
     * Results of one evaluation pass.
     */
    public record Evaluation(List<ValidationResult> results, List<RejectionReason> rejections) {
        public Evaluation {
            results = List.copyOf(results);
            rejections = List.copyOf(rejections);
        }

        public boolean allPassed() {
            return rejections.isEmpty();
        }
    }

    /**
     * Runs every rule of the profile.
     *
     * @param profile         profile of the declared variant
     * @param extractedFields fields read from the document
     * @param identityData    caller-supplied identity data
     * @return ordered results and rejections
     */
    public Evaluation evaluate(DocumentTypeProfile profile,
                               Map<String, String> extractedFields,
                               Map<String, String> identityData) {
        List<ValidationResult> results = new ArrayList<>();
        List<RejectionReason> rejections = new ArrayList<>();

        for (ValidationRule rule : profile.rules()) {
            ValidationResult result = evaluateRule(rule, extractedFields, identityData);
            results.add(result);
            if (!result.passed()) {
                rejections.add(RejectionReason.forRule(rule.name(), result.message()));
            }
        }
        log.debug("Evaluated {} rules for profile {}: {} failed",
                results.size(), profile.variant().code(), rejections.size());
        return new Evaluation(results, rejections);
    }

    private ValidationResult evaluateRule(ValidationRule rule,
                                          Map<String, String> extractedFields,
                                          Map<String, String> identityData) {
        String extracted = extractedFields.get(rule.field());
        if (extracted == null || extracted.isBlank()) {
            return result(rule, false, "Field '" + rule.field() + "' was not extracted from the document", null);
        }
        if (rule instanceof ValidationRule.IdentityMatch identity) {
            return evaluateIdentity(identity, extracted, identityData);
        }
        if (rule instanceof ValidationRule.TextMatch text) {
            return evaluateText(text, extracted, identityData);
        }
        return evaluateValue((ValidationRule.ValueMatch) rule, extracted);
    }

    private ValidationResult evaluateIdentity(ValidationRule.IdentityMatch rule,
                                              String extracted,
                                              Map<String, String> identityData) {
        Optional<String> supplied = IdentityValues.firstPresent(rule.aliases(), identityData);
        if (supplied.isEmpty()) {
            return missingConcept(rule, rule.aliases());
        }
        boolean matches = IdentityValues.normalizeIdentifier(extracted)
                .equals(IdentityValues.normalizeIdentifier(supplied.get()));
        String message = matches
                ? "Document value '" + extracted + "' matches supplied value"
                : "Document value '" + extracted + "' does not match supplied value '" + supplied.get() + "'";
        return result(rule, matches, message, null);
    }

    private ValidationResult evaluateText(ValidationRule.TextMatch rule,
                                          String extracted,
                                          Map<String, String> identityData) {
        Optional<String> supplied = IdentityValues.firstPresent(rule.aliases(), identityData);
        if (supplied.isEmpty()) {
            return missingConcept(rule, rule.aliases());
        }
        double score = TextSimilarity.tokenSetRatio(extracted, supplied.get());
        boolean passes = score >= rule.threshold();
        String message = String.format(Locale.ROOT, "Similarity %.2f between '%s' and '%s' (threshold %.2f)",
                score, extracted, supplied.get(), rule.threshold());
        return result(rule, passes, message, score);
    }

    private ValidationResult evaluateValue(ValidationRule.ValueMatch rule, String extracted) {
        String actual = normalizeValue(extracted);
        String expected = normalizeValue(rule.expected());
        boolean passes = rule.operator() == MatchOperator.CONTAINS_CASE_INSENSITIVE
                ? actual.contains(expected)
                : actual.equals(expected);
        String message = passes
                ? "Value '" + extracted + "' satisfies expected '" + rule.expected() + "'"
                : "Value '" + extracted + "' does not satisfy expected '" + rule.expected()
                + "' (" + rule.operator().code() + ")";
        return result(rule, passes, message, null);
    }

    /**
     * Trims decorative characters (dashes, bullets, extra whitespace) and upper-cases.
     */
    static String normalizeValue(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("^" + DECORATION, "")
                .replaceAll(DECORATION + "$", "")
                .replaceAll("\\s+", " ")
                .toUpperCase(Locale.ROOT);
    }

    private ValidationResult missingConcept(ValidationRule rule, List<String> aliases) {
        return result(rule, false, "Missing identity concept: none of " + aliases + " was supplied", null);
    }

    private ValidationResult result(ValidationRule rule, boolean passed, String message, Double score) {
        return new ValidationResult(rule.name(), rule.description(), rule.field(), passed, message, score);
    }
}
