package com.example.f30.domain.model;

/**
 * Aggregated PDF-level metadata and structure counters.
 * Constructed by infrastructure readers; either metadata part may be {@code null} when absent.
 *
 * @param incrementalUpdates number of revisions appended after the original file
 * @param annotationCount    annotations found across all pages
 */
public record PdfDocumentMetadata(
        PdfInfoDictionary infoDictionary,
        PdfXmpMetadata xmpMetadata,
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        long fileSizeBytes,
        int incrementalUpdates,
        int annotationCount
) {
}
