package com.example.f30.application.service;

import com.example.f30.domain.model.AuthenticityResult;
import com.example.f30.domain.model.AuthenticityVerdict;
import com.example.f30.domain.model.OriginMetadata;
import com.example.f30.domain.model.PdfDocumentMetadata;
import com.example.f30.domain.model.PdfInfoDictionary;
import com.example.f30.domain.model.PdfXmpMetadata;
import com.example.f30.infrastructure.config.F30Properties;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;
import com.example.f30.infrastructure.pdf.PdfBoxMetadataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Inspects technical signals of the original file (producer metadata, internal dates, size and
 * transport headers) and aggregates them into a tri-state verdict. Never rejects by itself.
 */
@Service
public class AuthenticityScorer {

    private static final Logger log = LoggerFactory.getLogger(AuthenticityScorer.class);
    private static final Set<String> PDF_CONTENT_TYPES = Set.of("application/pdf", "application/x-pdf");

    private final PdfBoxMetadataReader metadataReader;
    private final F30Properties.Authenticity settings;

    public AuthenticityScorer(PdfBoxMetadataReader metadataReader, F30Properties properties) {
        this.metadataReader = metadataReader;
        this.settings = properties.authenticity();
    }

    /**
     * Runs every check and collects the signals in a fixed order: metadata, structure, size, headers.
     *
     * @param rawFileBytes original file bytes
     * @param origin       transport metadata of the fetch, may be {@code null}
     * @return verdict and signals
     */
    public AuthenticityResult assess(byte[] rawFileBytes, OriginMetadata origin) {
        Signals signals = new Signals();

        try {
            PdfDocumentMetadata metadata = metadataReader.readMetadata(rawFileBytes);
            checkEditors(metadata, signals);
            checkDates(metadata, signals);
            checkProducerConsistency(metadata, signals);
            if (metadata.incrementalUpdates() > 0) {
                signals.warning("pdf_incremental_updates:" + metadata.incrementalUpdates());
            }
            if (metadata.annotationCount() > 0) {
                signals.warning("pdf_contains_annotations");
            }
        } catch (UnreadableDocumentException e) {
            log.warn("PDF metadata could not be read: {}", e.getMessage());
            signals.warning("pdf_metadata_unreadable");
        }

        long sizeKb = rawFileBytes.length / 1024;
        if (sizeKb < settings.minSizeKb() || sizeKb > settings.maxSizeKb()) {
            signals.warning("suspicious_file_size:" + sizeKb + "KB");
        }
        checkOrigin(rawFileBytes.length, origin, signals);

        AuthenticityResult result = new AuthenticityResult(signals.verdict, signals.found);
        log.info("Authenticity verdict {} with {} signal(s)", result.verdict(), result.signals().size());
        return result;
    }

    private void checkEditors(PdfDocumentMetadata metadata, Signals signals) {
        PdfInfoDictionary info = metadata.infoDictionary();
        PdfXmpMetadata xmp = metadata.xmpMetadata();
        List<String> tools = Stream.of(
                        info != null ? info.creator() : null,
                        info != null ? info.producer() : null,
                        xmp != null ? xmp.creatorTool() : null,
                        xmp != null ? xmp.producer() : null)
                .filter(value -> value != null && !value.isBlank())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .toList();

        for (String editor : settings.editorDenylist()) {
            String needle = editor.toLowerCase(Locale.ROOT);
            if (tools.stream().anyMatch(tool -> tool.contains(needle))) {
                signals.failed("pdf_editor_detected:" + editor);
            }
        }
    }

    private void checkDates(PdfDocumentMetadata metadata, Signals signals) {
        PdfInfoDictionary info = metadata.infoDictionary();
        PdfXmpMetadata xmp = metadata.xmpMetadata();
        boolean inconsistent = info != null && before(info.modificationDate(), info.creationDate())
                || xmp != null && before(xmp.modifyDate(), xmp.createDate());
        if (inconsistent) {
            signals.failed("metadata_dates_inconsistent");
        }
    }

    private void checkProducerConsistency(PdfDocumentMetadata metadata, Signals signals) {
        PdfInfoDictionary info = metadata.infoDictionary();
        PdfXmpMetadata xmp = metadata.xmpMetadata();
        if (info == null || xmp == null || isBlank(info.producer()) || isBlank(xmp.producer())) {
            return;
        }
        if (!info.producer().trim().equalsIgnoreCase(xmp.producer().trim())) {
            signals.failed("metadata_producer_inconsistent");
        }
    }

    private void checkOrigin(int actualLength, OriginMetadata origin, Signals signals) {
        if (origin == null) {
            return;
        }
        Long declared = origin.declaredContentLength();
        if (declared != null && declared != actualLength) {
            signals.warning("content_length_mismatch:" + declared + ":" + actualLength);
        }
        String contentType = origin.contentType();
        if (contentType != null) {
            String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            if (!PDF_CONTENT_TYPES.contains(mediaType)) {
                signals.warning("mime_mismatch:" + mediaType);
            }
        }
    }

    private static boolean before(Instant candidate, Instant reference) {
        return candidate != null && reference != null && candidate.isBefore(reference);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Signals {
        private final List<String> found = new ArrayList<>();
        private AuthenticityVerdict verdict = AuthenticityVerdict.PASSED;

        void failed(String signal) {
            found.add(signal);
            verdict = verdict.escalate(AuthenticityVerdict.FAILED);
        }

        void warning(String signal) {
            found.add(signal);
            verdict = verdict.escalate(AuthenticityVerdict.WARNING);
        }
    }
}
