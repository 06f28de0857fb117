package com.example.f30.domain.model;

/**
 * Raw bytes of a fetched document together with its text layer and origin metadata.
 */
public record DocumentContent(
        byte[] bytes,
        String text,
        OriginMetadata origin
) {
}
