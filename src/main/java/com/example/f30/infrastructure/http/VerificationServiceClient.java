package com.example.f30.infrastructure.http;

import com.example.f30.application.port.RegistryVerificationAgent;
import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.RegistryAnswer;
import com.example.f30.infrastructure.config.F30Properties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client of the verification service that drives the registry portal. One endpoint per variant;
 * {@code success=false} in the response means the automation did not finish.
 */
@Component
public class VerificationServiceClient implements RegistryVerificationAgent {

    private static final Logger log = LoggerFactory.getLogger(VerificationServiceClient.class);

    static final String RAZON_SOCIAL_PATH = "/verificar/portal-documental";
    static final String PERSONA_NATURAL_PATH = "/verificar/persona-natural";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public VerificationServiceClient(@Qualifier("verificationRestTemplate") RestTemplate restTemplate,
                                     F30Properties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = stripTrailingSlash(properties.verification().baseUrl());
    }

    @Override
    public RegistryAnswer submitAndVerify(CertificateVariant variant, Map<String, String> submissionFields) {
        String path;
        Map<String, String> payload = new LinkedHashMap<>();
        if (variant == CertificateVariant.RAZON_SOCIAL) {
            path = RAZON_SOCIAL_PATH;
            payload.put("codigo", formatCertificateCode(submissionFields.get("codigo_certificado")));
        } else {
            path = PERSONA_NATURAL_PATH;
            payload.put("folio_oficina", submissionFields.get("folio_oficina"));
            payload.put("folio_anio", submissionFields.get("folio_anio"));
            payload.put("folio_numero", submissionFields.get("folio_numero_consecutivo"));
            payload.put("codigo_verificacion", submissionFields.get("codigo_verificacion"));
        }

        VerificationResponse response;
        try {
            response = restTemplate.postForObject(baseUrl + path, payload, VerificationResponse.class);
        } catch (RestClientException e) {
            log.warn("Verification service call to {} failed: {}", path, e.getMessage());
            return new RegistryAnswer.TechnicalFailure("Verification service unreachable: " + e.getMessage());
        }
        if (response == null) {
            return new RegistryAnswer.TechnicalFailure("Empty response from verification service");
        }
        if (!response.success()) {
            return new RegistryAnswer.TechnicalFailure(firstNonBlank(response.errorMessage(), response.error(),
                    response.message(), "Verification did not complete"));
        }
        String message = firstNonBlank(response.message(), response.errorMessage(), response.valid() ? "valid" : "invalid");
        return new RegistryAnswer.Definitive(response.valid(), message, decodeCopy(response.pdfBase64()));
    }

    /**
     * Formats a certificate code as the portal expects it: upper case, groups of four separated by spaces.
     */
    static String formatCertificateCode(String code) {
        if (code == null) {
            return null;
        }
        String compact = code.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        StringBuilder grouped = new StringBuilder();
        for (int i = 0; i < compact.length(); i += 4) {
            if (i > 0) {
                grouped.append(' ');
            }
            grouped.append(compact, i, Math.min(i + 4, compact.length()));
        }
        return grouped.toString();
    }

    private byte[] decodeCopy(String pdfBase64) {
        if (pdfBase64 == null || pdfBase64.isBlank()) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(pdfBase64.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Official copy returned by the verification service is not valid base64");
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerificationResponse(
            boolean success,
            boolean valid,
            String message,
            String error,
            @JsonProperty("error_message") String errorMessage,
            @JsonProperty("pdf_base64") String pdfBase64
    ) {
    }
}
