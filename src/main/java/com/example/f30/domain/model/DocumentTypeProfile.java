package com.example.f30.domain.model;

import java.util.List;

/**
 * Immutable per-variant schema: extractable fields, the fields submitted to the external registry
 * and the ordered cross-validation rules.
 */
public record DocumentTypeProfile(
        CertificateVariant variant,
        String name,
        String description,
        List<FieldDefinition> fields,
        List<String> submissionFields,
        List<ValidationRule> rules
) {
    public DocumentTypeProfile {
        fields = List.copyOf(fields);
        submissionFields = List.copyOf(submissionFields);
        rules = List.copyOf(rules);
    }

    public List<FieldDefinition> markerFields() {
        return fields.stream().filter(FieldDefinition::marker).toList();
    }

    public List<FieldDefinition> requiredFields() {
        return fields.stream().filter(FieldDefinition::required).toList();
    }

    /**
     * @return alias lists of the identity rules; intake requires one present value per list
     */
    public List<List<String>> requiredIdentityAliases() {
        return rules.stream()
                .filter(ValidationRule.IdentityMatch.class::isInstance)
                .map(rule -> ((ValidationRule.IdentityMatch) rule).aliases())
                .toList();
    }
}
