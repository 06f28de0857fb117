package com.example.f30.application.port;

import com.example.f30.domain.model.Decision;

/**
 * Best-effort delivery of a terminal decision to the caller's callback endpoint.
 * Implementations make a single, time-bounded attempt and never throw.
 */
public interface DecisionNotifier {

    void notify(String callbackUrl, Decision decision);
}
