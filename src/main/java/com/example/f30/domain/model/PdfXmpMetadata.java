package com.example.f30.domain.model;

import java.time.Instant;

/**
 * Provenance fields of the XMP packet (xmp basic and pdf schemas).
 */
public record PdfXmpMetadata(
        String creatorTool,
        String producer,
        Instant createDate,
        Instant modifyDate,
        Instant metadataDate
) {
}
