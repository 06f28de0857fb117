package com.example.f30.application.service;

import com.example.f30.application.port.DecisionNotifier;
import com.example.f30.application.port.DocumentSource;
import com.example.f30.application.port.ExtractionEngine;
import com.example.f30.application.port.OfficialCopyStore;
import com.example.f30.application.port.ProcessingJobStore;
import com.example.f30.domain.model.AuthenticityResult;
import com.example.f30.domain.model.AuthenticityVerdict;
import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.DecisionStatus;
import com.example.f30.domain.model.DocumentContent;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.ExternalVerificationOutcome;
import com.example.f30.domain.model.ExtractionResult;
import com.example.f30.domain.model.FetchedDocument;
import com.example.f30.domain.model.FieldDifference;
import com.example.f30.domain.model.OriginMetadata;
import com.example.f30.domain.model.ProcessingJob;
import com.example.f30.domain.model.ProcessingState;
import com.example.f30.domain.model.RejectionReason;
import com.example.f30.domain.model.RejectionType;
import com.example.f30.domain.model.ValidationResult;
import com.example.f30.infrastructure.exception.DocumentDownloadException;
import com.example.f30.infrastructure.exception.InfrastructureException;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;
import com.example.f30.infrastructure.pdf.PdfBoxTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one {@link ProcessingJob} through OCR, classification/extraction, authenticity, rule evaluation
 * and external verification, and finalizes exactly one {@link Decision}.
 * <p>
 * Business failures are collected as {@link RejectionReason}s. Technical failures end the run in
 * {@link ProcessingState#FAILED} with an {@link DecisionStatus#ERROR} decision.
 */
@Service
public class CertificateValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CertificateValidationPipeline.class);

    static final String MDC_DOCUMENT_ID = "documentId";
    static final String MDC_VARIANT = "variant";
    static final String MDC_STAGE = "stage";

    private static final Set<RejectionType> SHORT_CIRCUIT_TYPES =
            EnumSet.of(RejectionType.CLASSIFICATION_MISMATCH, RejectionType.EXTRACTION_FAILED);
    private static final Set<RejectionType> DEFINITIVE_TYPES = EnumSet.of(
            RejectionType.AUTHENTICITY_FAILED,
            RejectionType.CROSS_VALIDATION,
            RejectionType.INVALID_CERTIFICATE,
            RejectionType.DATA_MISMATCH);

    private final DocumentSource documentSource;
    private final PdfBoxTextReader textReader;
    private final ExtractionEngine extractionEngine;
    private final AuthenticityScorer authenticityScorer;
    private final RuleEngine ruleEngine;
    private final ExternalVerificationCoordinator verificationCoordinator;
    private final OfficialCopyStore officialCopyStore;
    private final ExtractedDataComparator comparator;
    private final DocumentTypeProfileRegistry profiles;
    private final ProcessingJobStore jobStore;
    private final DecisionNotifier notifier;
    private final Clock clock;

    public CertificateValidationPipeline(DocumentSource documentSource,
                                         PdfBoxTextReader textReader,
                                         ExtractionEngine extractionEngine,
                                         AuthenticityScorer authenticityScorer,
                                         RuleEngine ruleEngine,
                                         ExternalVerificationCoordinator verificationCoordinator,
                                         OfficialCopyStore officialCopyStore,
                                         ExtractedDataComparator comparator,
                                         DocumentTypeProfileRegistry profiles,
                                         ProcessingJobStore jobStore,
                                         DecisionNotifier notifier,
                                         Clock clock) {
        this.documentSource = documentSource;
        this.textReader = textReader;
        this.extractionEngine = extractionEngine;
        this.authenticityScorer = authenticityScorer;
        this.ruleEngine = ruleEngine;
        this.verificationCoordinator = verificationCoordinator;
        this.officialCopyStore = officialCopyStore;
        this.comparator = comparator;
        this.profiles = profiles;
        this.jobStore = jobStore;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Processes the job to a terminal state. Never throws: unexpected faults are mapped to an
     * {@link DecisionStatus#ERROR} decision.
     *
     * @param job admitted job in state {@link ProcessingState#PENDING}
     * @return the terminal decision, already persisted
     */
    public Decision process(ProcessingJob job) {
        MDC.put(MDC_DOCUMENT_ID, job.documentId());
        MDC.put(MDC_VARIANT, job.variant().code());
        Run run = new Run(job);
        try {
            run.trace("Processing started for variant " + job.variant().code());
            Decision decision = validate(run);
            finish(run, decision);
            return decision;
        } catch (DocumentDownloadException | UnreadableDocumentException e) {
            log.warn("Technical failure while reading document: {}", e.getMessage());
            return fail(run, "Technical failure: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while processing document", e);
            return fail(run, "Unexpected error: " + e.getMessage());
        } finally {
            MDC.remove(MDC_DOCUMENT_ID);
            MDC.remove(MDC_VARIANT);
            MDC.remove(MDC_STAGE);
        }
    }

    private Decision validate(Run run) {
        ProcessingJob job = run.job;

        transition(run, ProcessingState.OCR);
        stage("ocr");
        FetchedDocument fetched = documentSource.fetch(job.fileReference());
        run.trace("Fetched " + fetched.bytes().length + " bytes from " + job.fileReference());
        String text = textReader.readText(fetched.bytes());
        run.trace("Text layer read: " + text.length() + " characters");
        DocumentContent content = new DocumentContent(fetched.bytes(), text, fetched.origin());

        transition(run, ProcessingState.VALIDATION);
        DocumentTypeProfile profile = profiles.profileFor(job.variant());

        stage("classification");
        ExtractionResult extraction = extractionEngine.extract(content, profile);
        run.extractedData = extraction.fields();
        if (!extraction.matchedVariant()) {
            run.reject(RejectionReason.of(RejectionType.CLASSIFICATION_MISMATCH, extraction.reason()));
            run.trace("Classification mismatch, remaining stages skipped");
            return decide(run);
        }
        if (!extraction.missingFields().isEmpty()) {
            run.reject(RejectionReason.of(RejectionType.EXTRACTION_FAILED,
                    "Required fields could not be extracted: " + String.join(", ", extraction.missingFields())));
            run.trace("Extraction incomplete, remaining stages skipped");
            return decide(run);
        }
        run.trace("Document classified as " + job.variant().code() + " with " + extraction.fields().size() + " fields");

        stage("authenticity");
        AuthenticityResult authenticity = authenticityScorer.assess(fetched.bytes(), fetched.origin());
        run.authenticity = authenticity;
        if (authenticity.verdict() == AuthenticityVerdict.FAILED) {
            run.reject(RejectionReason.of(RejectionType.AUTHENTICITY_FAILED,
                    "Authenticity signals: " + String.join(", ", authenticity.signals())));
        } else if (authenticity.verdict() == AuthenticityVerdict.WARNING) {
            run.trace("Authenticity warning: " + String.join(", ", authenticity.signals()));
        } else {
            run.trace("Authenticity passed");
        }

        stage("rules");
        RuleEngine.Evaluation evaluation = ruleEngine.evaluate(profile, extraction.fields(), job.identityData());
        run.validationResults = evaluation.results();
        for (ValidationResult result : evaluation.results()) {
            run.trace("Rule '" + result.rule() + "' " + (result.passed() ? "passed" : "failed") + ": " + result.message());
        }
        evaluation.rejections().forEach(run.rejections::add);

        stage("external_verification");
        if (authenticity.verdict() == AuthenticityVerdict.FAILED) {
            run.verification = ExternalVerificationOutcome.notAttempted("Skipped because authenticity failed");
            run.trace("External verification skipped because authenticity failed");
        } else {
            verifyExternally(run, profile, extraction.fields());
        }
        return decide(run);
    }

    private void verifyExternally(Run run, DocumentTypeProfile profile, Map<String, String> fields) {
        ExternalVerificationOutcome outcome = verificationCoordinator.verify(run.job.documentId(), profile, fields);
        run.verification = outcome;
        run.trace("External verification submitted " + outcome.submittedInputs() + ": " + outcome.message());

        if (!outcome.attempted() || !outcome.success()) {
            run.reject(RejectionReason.of(RejectionType.DOWNLOAD_ERROR,
                    "Registry verification could not be completed: " + outcome.message()));
            return;
        }
        if (!outcome.valid()) {
            run.reject(RejectionReason.of(RejectionType.INVALID_CERTIFICATE,
                    "Registry reports the certificate as invalid: " + outcome.message()));
            return;
        }
        if (outcome.retrievedCopyRef() != null) {
            compareWithOfficialCopy(run, profile, fields, outcome.retrievedCopyRef());
        }
    }

    private void compareWithOfficialCopy(Run run, DocumentTypeProfile profile,
                                         Map<String, String> fields, String copyRef) {
        try {
            byte[] copy = officialCopyStore.load(copyRef);
            String copyText = textReader.readText(copy);
            ExtractionResult official = extractionEngine.extract(
                    new DocumentContent(copy, copyText, OriginMetadata.local(copyRef)), profile);
            List<FieldDifference> differences = comparator.compare(profile, fields, official.fields());
            if (differences.isEmpty()) {
                run.trace("Submitted document matches the official copy");
                return;
            }
            String names = differences.stream().map(FieldDifference::field).collect(Collectors.joining(", "));
            run.reject(new RejectionReason(RejectionType.DATA_MISMATCH, null,
                    differences.size() + " field(s) differ from the official copy: " + names, differences));
        } catch (InfrastructureException e) {
            log.warn("Official copy {} could not be compared", copyRef, e);
            run.trace("Official copy could not be compared: " + e.getMessage());
        }
    }

    private Decision decide(Run run) {
        stage("decision");
        DecisionStatus status = deriveStatus(run.rejections);
        run.trace("Decision: " + status);
        return run.toDecision(status, clock);
    }

    /**
     * Derives the final status from the accumulated reasons: extraction failures first, then
     * definitive business failures, then an unverifiable registry answer.
     */
    static DecisionStatus deriveStatus(List<RejectionReason> rejections) {
        Set<RejectionType> types = rejections.stream()
                .map(RejectionReason::type)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(RejectionType.class)));
        if (types.stream().anyMatch(SHORT_CIRCUIT_TYPES::contains)) {
            return DecisionStatus.REJECTED;
        }
        if (types.stream().anyMatch(DEFINITIVE_TYPES::contains)) {
            return DecisionStatus.REJECTED;
        }
        if (types.contains(RejectionType.DOWNLOAD_ERROR)) {
            return DecisionStatus.MANUAL_REVIEW;
        }
        return DecisionStatus.APPROVED;
    }

    private void finish(Run run, Decision decision) {
        transition(run, ProcessingState.COMPLETED);
        jobStore.saveDecision(decision);
        log.info("Decision {} persisted with {} rejection reason(s)",
                decision.status(), decision.rejectionReasons().size());
        notifyCaller(run, decision);
    }

    private Decision fail(Run run, String message) {
        run.rejections.clear();
        run.trace(message);
        Decision decision = run.toDecision(DecisionStatus.ERROR, clock);
        try {
            if (!run.job.state().isTerminal()) {
                transition(run, ProcessingState.FAILED);
            }
            jobStore.saveDecision(decision);
        } catch (RuntimeException e) {
            log.error("Error decision could not be persisted", e);
            return decision;
        }
        notifyCaller(run, decision);
        return decision;
    }

    private void notifyCaller(Run run, Decision decision) {
        String callbackUrl = run.job.callbackUrl();
        if (callbackUrl == null || callbackUrl.isBlank()) {
            return;
        }
        stage("notify");
        notifier.notify(callbackUrl, decision);
    }

    private void transition(Run run, ProcessingState state) {
        run.job.transitionTo(state);
        jobStore.recordTransition(run.job.documentId(), state, clock.instant());
        run.trace("State changed to " + state);
    }

    private static void stage(String stage) {
        MDC.put(MDC_STAGE, stage);
    }

    /**
     * Mutable accumulator of one run; confined to the processing thread.
     */
    private static final class Run {
        private final ProcessingJob job;
        private final List<String> processingLog = new ArrayList<>();
        private final List<RejectionReason> rejections = new ArrayList<>();
        private Map<String, String> extractedData = Map.of();
        private List<ValidationResult> validationResults = List.of();
        private AuthenticityResult authenticity;
        private ExternalVerificationOutcome verification;

        private Run(ProcessingJob job) {
            this.job = job;
        }

        void trace(String entry) {
            processingLog.add(entry);
            log.info(entry);
        }

        void reject(RejectionReason reason) {
            rejections.add(reason);
            trace("Rejection " + reason.type().code() + ": " + reason.details());
        }

        Decision toDecision(DecisionStatus status, Clock clock) {
            return new Decision(job.documentId(), job.variant(), status, extractedData, validationResults,
                    rejections, authenticity, verification, processingLog, clock.instant());
        }
    }
}
