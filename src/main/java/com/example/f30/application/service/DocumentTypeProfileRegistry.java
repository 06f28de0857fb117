package com.example.f30.application.service;

import com.example.f30.application.exception.ProfileConfigurationException;
import com.example.f30.domain.exception.UnknownVariantException;
import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup of document type profiles keyed by variant.
 * Loaded once at startup and shared by every job; adding a document kind only needs a new profile entry.
 */
public class DocumentTypeProfileRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentTypeProfileRegistry.class);
    private static final ObjectMapper PROFILE_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final Map<CertificateVariant, DocumentTypeProfile> profiles;

    /**
     * @param profiles profiles to register, at most one per variant
     * @throws ProfileConfigurationException when two profiles declare the same variant
     */
    public DocumentTypeProfileRegistry(Collection<DocumentTypeProfile> profiles) {
        EnumMap<CertificateVariant, DocumentTypeProfile> byVariant = new EnumMap<>(CertificateVariant.class);
        for (DocumentTypeProfile profile : profiles) {
            if (byVariant.putIfAbsent(profile.variant(), profile) != null) {
                throw new ProfileConfigurationException("Duplicate profile for variant " + profile.variant().code());
            }
        }
        this.profiles = Collections.unmodifiableMap(byVariant);
        log.info("Registered document type profiles: {}", byVariant.keySet());
    }

    /**
     * Reads a JSON array of profiles.
     *
     * @param json profile document
     * @return populated registry
     * @throws ProfileConfigurationException when the document cannot be parsed
     */
    public static DocumentTypeProfileRegistry fromJson(InputStream json) {
        try (json) {
            List<DocumentTypeProfile> loaded = PROFILE_MAPPER.readValue(json, new TypeReference<>() {
            });
            return new DocumentTypeProfileRegistry(loaded);
        } catch (IOException ex) {
            throw new ProfileConfigurationException("Unable to read document type profiles", ex);
        }
    }

    /**
     * @param variant declared variant
     * @return its profile
     * @throws UnknownVariantException when no profile is registered for the variant
     */
    public DocumentTypeProfile profileFor(CertificateVariant variant) {
        DocumentTypeProfile profile = variant == null ? null : profiles.get(variant);
        if (profile == null) {
            throw new UnknownVariantException(variant == null ? null : variant.code());
        }
        return profile;
    }

    public Collection<DocumentTypeProfile> all() {
        return profiles.values();
    }
}
