package com.example.f30.domain.model;

/**
 * Answer of the registry automation for one submission.
 */
public sealed interface RegistryAnswer permits RegistryAnswer.TechnicalFailure, RegistryAnswer.Definitive {

    /**
     * The automation could not complete (timeout, unresponsive page, crash). Worth retrying.
     */
    record TechnicalFailure(String reason) implements RegistryAnswer {
    }

    /**
     * The registry answered. {@code officialCopy} holds the downloaded certificate when valid.
     */
    record Definitive(boolean valid, String message, byte[] officialCopy) implements RegistryAnswer {
    }
}
