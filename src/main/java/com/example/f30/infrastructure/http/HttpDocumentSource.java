package com.example.f30.infrastructure.http;

import com.example.f30.application.port.DocumentSource;
import com.example.f30.domain.model.FetchedDocument;
import com.example.f30.domain.model.OriginMetadata;
import com.example.f30.infrastructure.exception.DocumentDownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Locale;

/**
 * Fetches submitted files over HTTP(S) with {@link RestTemplate}. The origin reports content type
 * and declared length. Other schemes and local paths are refused.
 */
@Component
public class HttpDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentSource.class);

    private final RestTemplate restTemplate;

    public HttpDocumentSource(@Qualifier("downloadRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public FetchedDocument fetch(String fileReference) {
        String lowered = fileReference.toLowerCase(Locale.ROOT);
        if (!lowered.startsWith("http://") && !lowered.startsWith("https://")) {
            throw new DocumentDownloadException("Only http(s) references can be fetched: " + fileReference, null);
        }
        return download(fileReference);
    }

    private FetchedDocument download(String url) {
        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.getForEntity(URI.create(url), byte[].class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new DocumentDownloadException("Unable to download " + url + ": " + e.getMessage(), e);
        }
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new DocumentDownloadException("Empty response body from " + url, null);
        }
        HttpHeaders headers = response.getHeaders();
        String contentType = headers.getContentType() != null ? headers.getContentType().toString() : null;
        long contentLength = headers.getContentLength();
        log.debug("Downloaded {} bytes ({}) from {}", body.length, contentType, url);
        return new FetchedDocument(body, new OriginMetadata(url, contentType, contentLength >= 0 ? contentLength : null));
    }
}
