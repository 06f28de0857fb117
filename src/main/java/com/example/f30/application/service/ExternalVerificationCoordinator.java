package com.example.f30.application.service;

import com.example.f30.application.port.OfficialCopyStore;
import com.example.f30.application.port.RegistryVerificationAgent;
import com.example.f30.domain.model.DocumentTypeProfile;
import com.example.f30.domain.model.ExternalVerificationOutcome;
import com.example.f30.domain.model.RegistryAnswer;
import com.example.f30.domain.model.VerificationAttempt;
import com.example.f30.infrastructure.config.F30Properties;
import com.example.f30.infrastructure.exception.OfficialCopyStorageException;
import com.example.f30.infrastructure.exception.RegistryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Submits the certificate identifiers to the external registry through a {@link RegistryVerificationAgent}
 * and turns the answers into an {@link ExternalVerificationOutcome}.
 * <p>
 * Technical failures are retried up to the configured attempt count; a definitive answer, valid or
 * not, ends the loop at once. Exhausted retries yield {@code success=false}, never {@code valid=false}.
 */
@Service
public class ExternalVerificationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExternalVerificationCoordinator.class);

    private final RegistryVerificationAgent agent;
    private final OfficialCopyStore copyStore;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public ExternalVerificationCoordinator(RegistryVerificationAgent agent,
                                           OfficialCopyStore copyStore,
                                           F30Properties properties) {
        this.agent = agent;
        this.copyStore = copyStore;
        F30Properties.Verification verification = properties.verification();
        this.maxAttempts = Math.max(1, verification.maxAttempts());
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(RegistryUnavailableException.class);
        long backoffMillis = verification.backoff() == null ? 0 : verification.backoff().toMillis();
        this.retryTemplate = backoffMillis > 0
                ? builder.fixedBackoff(backoffMillis).build()
                : builder.noBackoff().build();
    }

    /**
     * Verifies the extracted certificate identifiers against the registry.
     *
     * @param documentId      job the official copy belongs to
     * @param profile         profile naming the submission fields
     * @param extractedFields fields extracted from the submitted document
     * @return outcome with the verbatim submitted inputs and one audit entry per attempt
     */
    public ExternalVerificationOutcome verify(String documentId,
                                              DocumentTypeProfile profile,
                                              Map<String, String> extractedFields) {
        List<String> missing = profile.submissionFields().stream()
                .filter(field -> isBlank(extractedFields.get(field)))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Registry verification not attempted, missing submission fields {}", missing);
            return ExternalVerificationOutcome.notAttempted("Missing submission fields: " + String.join(", ", missing));
        }

        Map<String, String> inputs = new LinkedHashMap<>();
        profile.submissionFields().forEach(field -> inputs.put(field, extractedFields.get(field).trim()));

        List<VerificationAttempt> attempts = new ArrayList<>();
        AtomicReference<String> lastFailure = new AtomicReference<>("unknown error");

        Optional<RegistryAnswer.Definitive> answer = retryTemplate.execute(context -> {
            int attempt = context.getRetryCount() + 1;
            log.info("Registry verification attempt {}/{} for {}", attempt, maxAttempts, profile.variant().code());
            RegistryAnswer registryAnswer;
            try {
                registryAnswer = agent.submitAndVerify(profile.variant(), inputs);
            } catch (RuntimeException e) {
                attempts.add(new VerificationAttempt(attempt, inputs, "error: " + e.getMessage()));
                throw new RegistryUnavailableException("Registry automation failed: " + e.getMessage(), e);
            }
            if (registryAnswer instanceof RegistryAnswer.TechnicalFailure failure) {
                attempts.add(new VerificationAttempt(attempt, inputs, "technical_failure: " + failure.reason()));
                throw new RegistryUnavailableException(failure.reason());
            }
            RegistryAnswer.Definitive definitive = (RegistryAnswer.Definitive) registryAnswer;
            attempts.add(new VerificationAttempt(attempt, inputs,
                    (definitive.valid() ? "valid: " : "invalid: ") + definitive.message()));
            return Optional.of(definitive);
        }, context -> {
            if (context.getLastThrowable() != null) {
                lastFailure.set(context.getLastThrowable().getMessage());
            }
            return Optional.empty();
        });

        if (answer.isEmpty()) {
            String message = "Registry unavailable after " + attempts.size() + " attempt(s): " + lastFailure.get();
            log.warn(message);
            return new ExternalVerificationOutcome(true, false, false, message, inputs, null, attempts);
        }

        RegistryAnswer.Definitive definitive = answer.get();
        String copyRef = definitive.valid() ? storeCopy(documentId, definitive.officialCopy()) : null;
        log.info("Registry answered valid={} after {} attempt(s)", definitive.valid(), attempts.size());
        return new ExternalVerificationOutcome(true, true, definitive.valid(), definitive.message(),
                inputs, copyRef, attempts);
    }

    private String storeCopy(String documentId, byte[] officialCopy) {
        if (officialCopy == null || officialCopy.length == 0) {
            return null;
        }
        try {
            return copyStore.store(documentId, officialCopy);
        } catch (OfficialCopyStorageException e) {
            log.warn("Official copy for {} could not be stored", documentId, e);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
