package com.example.f30.application.port;

/**
 * Keeps the official certificate copies downloaded from the registry.
 */
public interface OfficialCopyStore {

    /**
     * @return opaque reference to the stored copy
     */
    String store(String documentId, byte[] content);

    byte[] load(String reference);
}
