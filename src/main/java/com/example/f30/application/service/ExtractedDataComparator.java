package com.example.f30.application.service;

import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.FieldDefinition;
import com.example.f30.domain.model.FieldDifference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares the fields of the submitted document with those read from the registry's official copy.
 * Values are compared upper-cased with whitespace collapsed; a field present on one side only differs.
 */
@Component
public class ExtractedDataComparator {

    /**
     * @param profile   profile giving the field order
     * @param submitted fields of the submitted document
     * @param retrieved fields of the official copy
     * @return differing fields in profile order, followed by any field the profile does not declare
     */
    public List<FieldDifference> compare(DocumentTypeProfile profile,
                                         Map<String, String> submitted,
                                         Map<String, String> retrieved) {
        Set<String> fieldNames = new LinkedHashSet<>();
        profile.fields().stream().map(FieldDefinition::name).forEach(fieldNames::add);
        fieldNames.addAll(submitted.keySet());
        fieldNames.addAll(retrieved.keySet());

        List<FieldDifference> differences = new ArrayList<>();
        for (String field : fieldNames) {
            String left = submitted.get(field);
            String right = retrieved.get(field);
            if (!Objects.equals(normalize(left), normalize(right))) {
                differences.add(new FieldDifference(field, left, right));
            }
        }
        return differences;
    }

    static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
