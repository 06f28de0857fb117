package com.example.f30.domain.model;

/**
 * Transport metadata reported by the origin the file was fetched from.
 *
 * @param source                file reference as submitted
 * @param contentType           declared content type, {@code null} for local files
 * @param declaredContentLength declared length in bytes, {@code null} when not reported
 */
public record OriginMetadata(
        String source,
        String contentType,
        Long declaredContentLength
) {
    public static OriginMetadata local(String source) {
        return new OriginMetadata(source, null, null);
    }
}
