package com.example.f30.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Comparison applied by a {@link ValidationRule.ValueMatch} rule.
 */
public enum MatchOperator {
    EQUALS_CASE_INSENSITIVE("equals_case_insensitive"),
    CONTAINS_CASE_INSENSITIVE("contains_case_insensitive");

    private final String code;

    MatchOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static MatchOperator fromCode(String code) {
        return Arrays.stream(values())
                .filter(operator -> operator.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown match operator: " + code));
    }
}
