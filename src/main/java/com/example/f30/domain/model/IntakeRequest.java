package com.example.f30.domain.model;

import java.util.Map;

/**
 * Submission of one certificate for validation, as handed over by the ingress layer.
 *
 * @param documentId    caller's identity key for the document
 * @param fileReference http(s) URL, {@code file:} URI or local path of the PDF
 * @param variantCode   declared variant code
 * @param identityData  caller-supplied identity concepts
 * @param callbackUrl   optional endpoint notified with the final decision
 */
public record IntakeRequest(
        String documentId,
        String fileReference,
        String variantCode,
        Map<String, String> identityData,
        String callbackUrl
) {
}
