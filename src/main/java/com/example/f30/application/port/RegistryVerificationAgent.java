package com.example.f30.application.port;

import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.RegistryAnswer;

import java.util.Map;

/**
 * Automation that submits certificate identifiers to the external registry portal.
 * Implementations report transient problems as {@link RegistryAnswer.TechnicalFailure} or by throwing.
 */
public interface RegistryVerificationAgent {

    RegistryAnswer submitAndVerify(CertificateVariant variant, Map<String, String> submissionFields);
}
