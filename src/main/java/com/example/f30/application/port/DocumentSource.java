package com.example.f30.application.port;

import com.example.f30.domain.model.FetchedDocument;

/**
 * Fetches a submitted file by reference.
 */
public interface DocumentSource {

    /**
     * @param fileReference http(s) URL, {@code file:} URI or local path
     * @return fetched bytes with origin metadata
     * @throws com.example.f30.infrastructure.exception.DocumentDownloadException when the file cannot be fetched
     */
    FetchedDocument fetch(String fileReference);
}
