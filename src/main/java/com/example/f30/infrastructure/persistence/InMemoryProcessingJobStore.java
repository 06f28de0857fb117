package com.example.f30.infrastructure.persistence;

import com.example.f30.application.port.ProcessingJobStore;
import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.ProcessingState;
import com.example.f30.domain.model.StateTransition;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe, process-local job store. Transitions are append-only; the latest decision per
 * document id wins.
 */
@Repository
public class InMemoryProcessingJobStore implements ProcessingJobStore {

    private final Map<String, List<StateTransition>> transitions = new ConcurrentHashMap<>();
    private final Map<String, Decision> decisions = new ConcurrentHashMap<>();

    @Override
    public void recordTransition(String documentId, ProcessingState state, Instant at) {
        transitions.computeIfAbsent(documentId, id -> new CopyOnWriteArrayList<>())
                .add(new StateTransition(documentId, state, at));
    }

    @Override
    public void saveDecision(Decision decision) {
        decisions.put(decision.documentId(), decision);
    }

    @Override
    public Optional<Decision> findDecision(String documentId) {
        return Optional.ofNullable(decisions.get(documentId));
    }

    @Override
    public List<StateTransition> transitions(String documentId) {
        return List.copyOf(transitions.getOrDefault(documentId, List.of()));
    }
}
