package com.example.f30.application.port;

import com.example.f30.domain.model.DocumentContent;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.ExtractionResult;

/**
 * Classifies a document against a declared profile and extracts its structured fields.
 */
public interface ExtractionEngine {

    /**
     * @param content document bytes and text
     * @param profile profile of the declared variant
     * @return classification verdict and extracted fields
     * @throws com.example.f30.infrastructure.exception.UnreadableDocumentException when the content cannot be read
     */
    ExtractionResult extract(DocumentContent content, DocumentTypeProfile profile);
}
