package com.example.f30.application.service;

import com.example.f30.application.exception.DecisionNotFoundException;
import com.example.f30.application.port.ProcessingJobStore;
import com.example.f30.domain.model.Decision;
import org.springframework.stereotype.Service;

/**
 * Read side of the job store for the ingress layer.
 */
@Service
public class DecisionQueryService {

    private final ProcessingJobStore jobStore;

    public DecisionQueryService(ProcessingJobStore jobStore) {
        this.jobStore = jobStore;
    }

    /**
     * @throws DecisionNotFoundException when no decision was recorded for the document
     */
    public Decision decisionFor(String documentId) {
        return jobStore.findDecision(documentId)
                .orElseThrow(() -> new DecisionNotFoundException(documentId));
    }
}
