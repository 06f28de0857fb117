package com.example.f30.application.service;

import com.example.f30.application.port.ProcessingJobStore;
import com.example.f30.domain.exception.DocumentIdRequiredException;
import com.example.f30.domain.exception.FileReferenceRequiredException;
import com.example.f30.domain.exception.MissingIdentityDataException;
import com.example.f30.domain.exception.UnsupportedDocumentFormatException;
import com.example.f30.domain.exception.UnsupportedFileReferenceException;
import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.IntakeReceipt;
import com.example.f30.domain.model.IntakeRequest;
import com.example.f30.domain.model.ProcessingJob;
import com.example.f30.domain.model.ProcessingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Validates intake requests and admits them for background processing.
 * Every check runs synchronously, before any pipeline stage starts.
 */
@Service
public class CertificateIntakeService {

    private static final Logger log = LoggerFactory.getLogger(CertificateIntakeService.class);

    private final DocumentTypeProfileRegistry profiles;
    private final ActiveJobRegistry activeJobs;
    private final CertificateValidationPipeline pipeline;
    private final ProcessingJobStore jobStore;
    private final Executor executor;
    private final Clock clock;

    public CertificateIntakeService(DocumentTypeProfileRegistry profiles,
                                    ActiveJobRegistry activeJobs,
                                    CertificateValidationPipeline pipeline,
                                    ProcessingJobStore jobStore,
                                    @Qualifier("certificateTaskExecutor") Executor executor,
                                    Clock clock) {
        this.profiles = profiles;
        this.activeJobs = activeJobs;
        this.pipeline = pipeline;
        this.jobStore = jobStore;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Admits a certificate for validation.
     *
     * @param request intake request
     * @return receipt with status {@code PROCESSING}
     * @throws com.example.f30.domain.exception.DomainException when the request itself is invalid
     * @throws com.example.f30.application.exception.DuplicateDocumentException when the document is already in flight
     */
    public IntakeReceipt submit(IntakeRequest request) {
        if (request.documentId() == null || request.documentId().isBlank()) {
            throw new DocumentIdRequiredException();
        }
        if (request.fileReference() == null || request.fileReference().isBlank()) {
            throw new FileReferenceRequiredException();
        }
        URI fileUrl = httpReference(request.fileReference());
        if (fileUrl == null) {
            throw new UnsupportedFileReferenceException(request.fileReference());
        }
        if (!isPdfReference(fileUrl)) {
            throw new UnsupportedDocumentFormatException(request.fileReference());
        }
        CertificateVariant variant = CertificateVariant.fromCode(request.variantCode());
        DocumentTypeProfile profile = profiles.profileFor(variant);
        Map<String, String> identityData = request.identityData() == null ? Map.of() : request.identityData();
        for (List<String> aliases : profile.requiredIdentityAliases()) {
            if (IdentityValues.firstPresent(aliases, identityData).isEmpty()) {
                throw new MissingIdentityDataException(aliases);
            }
        }

        String documentId = request.documentId().trim();
        ProcessingJob job = new ProcessingJob(documentId, request.fileReference().trim(), variant,
                identityData, request.callbackUrl(), clock.instant());
        activeJobs.register(job);
        try {
            jobStore.recordTransition(documentId, ProcessingState.PENDING, job.createdAt());
            executor.execute(() -> {
                try {
                    pipeline.process(job);
                } finally {
                    activeJobs.release(documentId);
                }
            });
        } catch (RuntimeException e) {
            activeJobs.release(documentId);
            throw e;
        }
        log.info("Admitted document {} as {}", documentId, variant.code());
        return IntakeReceipt.processing(documentId);
    }

    /**
     * @return the parsed reference, or {@code null} unless it is an absolute http(s) URL with a host
     */
    static URI httpReference(String fileReference) {
        try {
            URI uri = new URI(fileReference.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null) {
                return uri;
            }
            return null;
        } catch (URISyntaxException e) {
            log.debug("Rejected file reference {}: {}", fileReference, e.getMessage());
            return null;
        }
    }

    /**
     * Storage and signed download links often carry no extension; only an explicit non-PDF
     * extension in the last path segment is refused. The downloaded bytes are checked later.
     */
    static boolean isPdfReference(URI fileUrl) {
        String path = fileUrl.getPath() == null ? "" : fileUrl.getPath();
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0) {
            return true;
        }
        return lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT).equals("pdf");
    }
}
