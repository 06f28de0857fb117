package com.example.f30.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a {@link RejectionReason}.
 */
public enum RejectionType {
    CLASSIFICATION_MISMATCH("classification_mismatch"),
    EXTRACTION_FAILED("extraction_failed"),
    CROSS_VALIDATION("cross_validation"),
    AUTHENTICITY_FAILED("authenticity_failed"),
    INVALID_CERTIFICATE("invalid_certificate"),
    DOWNLOAD_ERROR("download_error"),
    DATA_MISMATCH("data_mismatch");

    private final String code;

    RejectionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
