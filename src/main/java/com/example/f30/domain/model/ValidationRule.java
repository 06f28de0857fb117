package com.example.f30.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Declarative cross-validation rule. Every rule names the extracted field it inspects and carries
 * the name and description used verbatim in the audit trail.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ValidationRule.IdentityMatch.class, name = "identity_match"),
        @JsonSubTypes.Type(value = ValidationRule.TextMatch.class, name = "text_match"),
        @JsonSubTypes.Type(value = ValidationRule.ValueMatch.class, name = "value_match")
})
public sealed interface ValidationRule
        permits ValidationRule.IdentityMatch, ValidationRule.TextMatch, ValidationRule.ValueMatch {

    String name();

    String description();

    String field();

    /**
     * Exact match, after separator normalization, against the first present identity alias.
     */
    record IdentityMatch(String name, String description, String field, List<String> aliases)
            implements ValidationRule {
        public IdentityMatch {
            aliases = List.copyOf(aliases);
        }
    }

    /**
     * Similarity match against the first present identity alias; passes when the score reaches the threshold.
     */
    record TextMatch(String name, String description, String field, List<String> aliases, double threshold)
            implements ValidationRule {
        public TextMatch {
            aliases = List.copyOf(aliases);
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("Similarity threshold must be within [0,1]: " + threshold);
            }
        }
    }

    /**
     * Comparison of an extracted field against a literal expected value.
     */
    record ValueMatch(String name, String description, String field, String expected, MatchOperator operator)
            implements ValidationRule {
    }
}
