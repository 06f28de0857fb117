package com.example.f30.application.service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup helpers over caller-supplied identity data, where one concept may arrive under several keys.
 */
public final class IdentityValues {

    private IdentityValues() {
    }

    /**
     * Probes the aliases in order and returns the first present, non-blank value.
     *
     * @param aliases accepted keys, in priority order
     * @param data    identity data
     * @return first usable value, trimmed
     */
    public static Optional<String> firstPresent(List<String> aliases, Map<String, String> data) {
        if (aliases == null || data == null) {
            return Optional.empty();
        }
        return aliases.stream()
                .map(data::get)
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .findFirst();
    }

    /**
     * Normalizes a RUT/tax-id style identifier: separators stripped, check digit upper-cased,
     * leading zeros removed.
     */
    public static String normalizeIdentifier(String value) {
        if (value == null) {
            return "";
        }
        String compact = value.replaceAll("[\\s.\\-_/]", "").toUpperCase(Locale.ROOT);
        return compact.replaceFirst("^0+(?=.)", "");
    }
}
