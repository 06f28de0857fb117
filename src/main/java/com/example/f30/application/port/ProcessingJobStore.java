package com.example.f30.application.port;

import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.ProcessingState;
import com.example.f30.domain.model.StateTransition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence of job state transitions and final decisions.
 */
public interface ProcessingJobStore {

    void recordTransition(String documentId, ProcessingState state, Instant at);

    void saveDecision(Decision decision);

    Optional<Decision> findDecision(String documentId);

    List<StateTransition> transitions(String documentId);
}
