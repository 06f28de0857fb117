package com.example.f30.infrastructure.extraction;

import com.example.f30.application.port.ExtractionEngine;
import com.example.f30.application.service.DocumentTypeProfileRegistry;
import com.example.f30.domain.model.DocumentContent;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.ExtractionResult;
import com.example.f30.domain.model.FieldDefinition;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction engine driven by the regular expressions declared on each profile field.
 * The first capturing group of a field pattern holds its value.
 * <p>
 * A document is classified as the declared variant when every marker field of that profile is
 * found and no other registered profile has its complete marker set present.
 */
@Service
public class PatternExtractionEngine implements ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternExtractionEngine.class);
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    private final DocumentTypeProfileRegistry profiles;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public PatternExtractionEngine(DocumentTypeProfileRegistry profiles) {
        this.profiles = profiles;
    }

    @Override
    public ExtractionResult extract(DocumentContent content, DocumentTypeProfile profile) {
        String text = content.text();
        if (text == null || text.isBlank()) {
            throw new UnreadableDocumentException("Document has no readable text layer");
        }

        Map<String, String> fields = extractFields(profile, text);
        List<String> missingMarkers = profile.markerFields().stream()
                .map(FieldDefinition::name)
                .filter(name -> !fields.containsKey(name))
                .toList();
        if (!missingMarkers.isEmpty()) {
            String reason = "Document is not a " + profile.variant().code()
                    + " certificate: identifiers not found (" + String.join(", ", missingMarkers) + ")";
            log.info(reason);
            return new ExtractionResult(false, reason, fields, List.of(), text);
        }

        for (DocumentTypeProfile other : profiles.all()) {
            if (other.variant() != profile.variant() && !other.markerFields().isEmpty() && hasAllMarkers(other, text)) {
                String reason = "Document carries the identifiers of a " + other.variant().code()
                        + " certificate, declared " + profile.variant().code();
                log.info(reason);
                return new ExtractionResult(false, reason, fields, List.of(), text);
            }
        }

        List<String> missing = profile.requiredFields().stream()
                .map(FieldDefinition::name)
                .filter(name -> !fields.containsKey(name))
                .toList();
        log.debug("Extracted {} of {} fields, missing required {}", fields.size(), profile.fields().size(), missing);
        return new ExtractionResult(true, "Document matches " + profile.variant().code(), fields, missing, text);
    }

    private Map<String, String> extractFields(DocumentTypeProfile profile, String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldDefinition field : profile.fields()) {
            String value = find(field, text);
            if (value != null) {
                fields.put(field.name(), value);
            }
        }
        return fields;
    }

    private boolean hasAllMarkers(DocumentTypeProfile profile, String text) {
        return profile.markerFields().stream().allMatch(field -> find(field, text) != null);
    }

    private String find(FieldDefinition field, String text) {
        if (field.pattern() == null || field.pattern().isBlank()) {
            return null;
        }
        Pattern pattern = patternCache.computeIfAbsent(field.pattern(), regex -> Pattern.compile(regex, FLAGS));
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find() || matcher.groupCount() < 1 || matcher.group(1) == null) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
