package com.example.f30.domain.model;

import com.example.f30.domain.exception.UnknownVariantException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * The two structurally distinct F30 certificate kinds.
 * {@link #RAZON_SOCIAL} is identified by a single certificate code, {@link #PERSONA_NATURAL}
 * by a four-part folio (office, year, sequence number, verification code).
 */
public enum CertificateVariant {
    RAZON_SOCIAL("razon_social"),
    PERSONA_NATURAL("persona_natural");

    private final String code;

    CertificateVariant(String code) {
        this.code = code;
    }

    /**
     * @return wire code used by callers and in the profile configuration
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a caller-declared variant code.
     *
     * @param rawValue declared variant, case-insensitive
     * @return matching variant
     * @throws UnknownVariantException when the code does not name a known variant
     */
    @JsonCreator
    public static CertificateVariant fromCode(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnknownVariantException(rawValue);
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(variant -> variant.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnknownVariantException(rawValue));
    }
}
