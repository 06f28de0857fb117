package com.example.f30.domain.model;

/**
 * One field that differs between the submitted document and the official copy.
 */
public record FieldDifference(
        String field,
        String submittedValue,
        String retrievedValue
) {
}
