package com.example.f30.domain.model;

import java.time.Instant;

/**
 * Subset of the PDF info dictionary relevant to provenance checks.
 * Populated by infrastructure readers and consumed by the authenticity heuristics.
 */
public record PdfInfoDictionary(
        String title,
        String author,
        String creator,
        String producer,
        Instant creationDate,
        Instant modificationDate
) {
}
