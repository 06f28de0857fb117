package com.example.f30.domain.model;

/**
 * Bytes of a document as fetched from its origin.
 */
public record FetchedDocument(
        byte[] bytes,
        OriginMetadata origin
) {
}
