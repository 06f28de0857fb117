package com.example.f30.application.service;

import com.example.f30.application.exception.DuplicateDocumentException;
import com.example.f30.domain.model.ProcessingJob;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Index of jobs with a non-terminal run, keyed by document id. Admission is a single atomic
 * check-and-register.
 */
@Component
public class ActiveJobRegistry {

    private final ConcurrentMap<String, ProcessingJob> active = new ConcurrentHashMap<>();

    /**
     * @throws DuplicateDocumentException when a run for the same document id is still active
     */
    public void register(ProcessingJob job) {
        if (active.putIfAbsent(job.documentId(), job) != null) {
            throw new DuplicateDocumentException(job.documentId());
        }
    }

    public void release(String documentId) {
        active.remove(documentId);
    }

    Optional<ProcessingJob> find(String documentId) {
        return Optional.ofNullable(active.get(documentId));
    }

    int size() {
        return active.size();
    }
}
