package com.example.f30.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the extraction collaborator.
 *
 * @param matchedVariant whether the document is the declared variant
 * @param reason         explanation of the classification
 * @param fields         extracted field values keyed by field name
 * @param missingFields  required fields that could not be extracted
 * @param rawText        text the fields were read from
 */
public record ExtractionResult(
        boolean matchedVariant,
        String reason,
        Map<String, String> fields,
        List<String> missingFields,
        String rawText
) {
    public ExtractionResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        missingFields = List.copyOf(missingFields);
    }
}
