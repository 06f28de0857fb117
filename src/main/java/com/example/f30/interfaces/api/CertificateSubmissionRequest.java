package com.example.f30.interfaces.api;

import com.example.f30.domain.model.IntakeRequest;

import java.util.Map;

/**
 * Request body of a certificate submission. Keys are snake_case on the wire
 * ({@code document_id}, {@code file_url}, {@code tipo_f30}, {@code user_data}, {@code response_url}).
 */
public record CertificateSubmissionRequest(
        String documentId,
        String fileUrl,
        String tipoF30,
        Map<String, String> userData,
        String responseUrl
) {
    IntakeRequest toIntakeRequest() {
        return new IntakeRequest(documentId, fileUrl, tipoF30, userData, responseUrl);
    }
}
