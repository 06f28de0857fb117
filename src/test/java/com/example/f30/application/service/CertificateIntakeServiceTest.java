package com.example.f30.application.service;

import com.example.f30.CertificateFixtures;
import com.example.f30.application.exception.DuplicateDocumentException;
import com.example.f30.domain.exception.DocumentIdRequiredException;
import com.example.f30.domain.exception.FileReferenceRequiredException;
import com.example.f30.domain.exception.MissingIdentityDataException;
import com.example.f30.domain.exception.UnknownVariantException;
import com.example.f30.domain.exception.UnsupportedDocumentFormatException;
import com.example.f30.domain.exception.UnsupportedFileReferenceException;
import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.IntakeReceipt;
import com.example.f30.domain.model.IntakeRequest;
import com.example.f30.domain.model.ProcessingJob;
import com.example.f30.domain.model.ProcessingState;
import com.example.f30.domain.model.StateTransition;
import com.example.f30.infrastructure.persistence.InMemoryProcessingJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

/**
 * Unit tests for intake validation and single-flight admission.
 */
class CertificateIntakeServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-20T12:00:00Z");

    private final List<Runnable> queued = new ArrayList<>();
    private CertificateValidationPipeline pipeline;
    private ActiveJobRegistry activeJobs;
    private InMemoryProcessingJobStore jobStore;
    private CertificateIntakeService intakeService;

    @BeforeEach
    void setUp() {
        pipeline = mock(CertificateValidationPipeline.class);
        activeJobs = new ActiveJobRegistry();
        jobStore = new InMemoryProcessingJobStore();
        intakeService = new CertificateIntakeService(CertificateFixtures.profiles(), activeJobs, pipeline, jobStore,
                queued::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static IntakeRequest razonSocialRequest(String documentId) {
        return new IntakeRequest(documentId, "https://storage.example.org/f30/cert.pdf", "razon_social",
                Map.of("rut_empleador", "77301140-0", "razon_social", "SOC COMERCIAL GAS MACUL LIMITADA"), null);
    }

    @Test
    void admitsValidRequest() {
        IntakeReceipt receipt = intakeService.submit(razonSocialRequest("doc-1"));

        assertThat(receipt).isEqualTo(new IntakeReceipt("doc-1", "PROCESSING"));
        assertThat(queued).hasSize(1);
        assertThat(activeJobs.find("doc-1")).isPresent();
        assertThat(jobStore.transitions("doc-1")).extracting(StateTransition::state)
                .containsExactly(ProcessingState.PENDING);
    }

    @Test
    void runningJobProcessesAndReleasesDocumentId() {
        intakeService.submit(razonSocialRequest("doc-1"));

        queued.get(0).run();

        ArgumentCaptor<ProcessingJob> job = ArgumentCaptor.forClass(ProcessingJob.class);
        then(pipeline).should().process(job.capture());
        assertThat(job.getValue().documentId()).isEqualTo("doc-1");
        assertThat(job.getValue().variant()).isEqualTo(CertificateVariant.RAZON_SOCIAL);
        assertThat(activeJobs.find("doc-1")).isEmpty();
    }

    @Test
    void duplicateActiveDocumentIsRejectedSynchronously() {
        intakeService.submit(razonSocialRequest("doc-1"));

        assertThrows(DuplicateDocumentException.class, () -> intakeService.submit(razonSocialRequest("doc-1")));

        assertThat(queued).hasSize(1);
        assertThat(activeJobs.size()).isEqualTo(1);
    }

    @Test
    void documentIdCanBeResubmittedAfterCompletion() {
        intakeService.submit(razonSocialRequest("doc-1"));
        queued.get(0).run();

        intakeService.submit(razonSocialRequest("doc-1"));

        assertThat(queued).hasSize(2);
    }

    @Test
    void releasesDocumentIdWhenPipelineFails() {
        given(pipeline.process(any())).willThrow(new IllegalStateException("boom"));
        intakeService.submit(razonSocialRequest("doc-1"));

        assertThrows(IllegalStateException.class, () -> queued.get(0).run());

        assertThat(activeJobs.find("doc-1")).isEmpty();
    }

    @Test
    void unknownVariantIsRejectedBeforeAdmission() {
        IntakeRequest request = new IntakeRequest("doc-1", "https://x.org/cert.pdf", "boleta",
                Map.of("rut", "1-9"), null);

        assertThrows(UnknownVariantException.class, () -> intakeService.submit(request));

        assertThat(queued).isEmpty();
        assertThat(activeJobs.size()).isZero();
    }

    @Test
    void missingIdentityConceptIsRejected() {
        IntakeRequest request = new IntakeRequest("doc-1", "https://x.org/cert.pdf", "persona_natural",
                Map.of("full_name", "Ruth Aguayo"), null);

        MissingIdentityDataException error = assertThrows(MissingIdentityDataException.class,
                () -> intakeService.submit(request));

        assertThat(error.getMessage()).contains("rut", "run", "national_id");
        assertThat(queued).isEmpty();
    }

    @Test
    void blankFieldsAndNonPdfReferencesAreRejected() {
        assertThrows(DocumentIdRequiredException.class, () -> intakeService.submit(
                new IntakeRequest(" ", "https://x.org/cert.pdf", "razon_social", Map.of(), null)));
        assertThrows(FileReferenceRequiredException.class, () -> intakeService.submit(
                new IntakeRequest("doc-1", null, "razon_social", Map.of(), null)));
        assertThrows(UnsupportedDocumentFormatException.class, () -> intakeService.submit(
                new IntakeRequest("doc-1", "https://x.org/cert.docx", "razon_social", Map.of(), null)));
        then(pipeline).should(never()).process(any());
    }

    @Test
    void pdfReferenceIgnoresQueryString() {
        assertThat(CertificateIntakeService.isPdfReference(URI.create("https://x.org/cert.PDF?token=abc#page=1"))).isTrue();
        assertThat(CertificateIntakeService.isPdfReference(URI.create("https://x.org/files/cert.docx?v=1.pdf"))).isFalse();
    }

    @Test
    void extensionlessDownloadLinksAreAdmitted() {
        IntakeRequest request = new IntakeRequest("doc-x", "https://storage.example.org/download?id=abc123",
                "razon_social", Map.of("rut_empleador", "77301140-0", "razon_social", "SOC COMERCIAL GAS MACUL LIMITADA"),
                null);

        IntakeReceipt receipt = intakeService.submit(request);

        assertThat(receipt.documentId()).isEqualTo("doc-x");
        assertThat(queued).hasSize(1);
        assertThat(CertificateIntakeService.isPdfReference(URI.create("https://storage.example.org"))).isTrue();
        assertThat(CertificateIntakeService.isPdfReference(URI.create("https://x.org/v1.2/objects/abc"))).isTrue();
    }

    @Test
    void localFileReferencesAreRefused() {
        for (String reference : List.of("file:///srv/downloads/f30/official_doc-1_1742040000000.pdf",
                "/srv/downloads/f30/official_doc-1_1742040000000.pdf",
                "ftp://files.example.org/cert.pdf",
                "https:///cert.pdf",
                "https://x.org/my cert.pdf")) {
            IntakeRequest request = new IntakeRequest("doc-1", reference, "razon_social",
                    Map.of("rut_empleador", "77301140-0", "razon_social", "SOC COMERCIAL GAS MACUL LIMITADA"), null);

            assertThrows(UnsupportedFileReferenceException.class, () -> intakeService.submit(request), reference);
        }
        assertThat(queued).isEmpty();
        assertThat(activeJobs.size()).isZero();
    }

    @Test
    void rejectedExecutionReleasesDocumentId() {
        CertificateIntakeService saturated = new CertificateIntakeService(CertificateFixtures.profiles(), activeJobs,
                pipeline, jobStore, runnable -> {
                    throw new RejectedExecutionException("queue full");
                }, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(RejectedExecutionException.class, () -> saturated.submit(razonSocialRequest("doc-9")));

        assertThat(activeJobs.find("doc-9")).isEmpty();
    }
}
