package com.example.f30.domain.model;

/**
 * Extractable field of a document type.
 *
 * @param name        field key in the extracted data
 * @param type        semantic type (rut, text, code, date, number)
 * @param description free text shown to extraction collaborators
 * @param pattern     regular expression whose first group yields the value in the document text
 * @param required    whether extraction fails when the field is absent
 * @param marker      whether the field identifies the document variant
 */
public record FieldDefinition(
        String name,
        String type,
        String description,
        String pattern,
        boolean required,
        boolean marker
) {
}
