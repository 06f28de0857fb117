package com.example.f30.infrastructure.http;

import com.example.f30.application.port.DecisionNotifier;
import com.example.f30.domain.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts the final decision to the caller's callback URL. Single attempt; failures are logged only.
 */
@Component
public class RestDecisionNotifier implements DecisionNotifier {

    private static final Logger log = LoggerFactory.getLogger(RestDecisionNotifier.class);

    private final RestTemplate restTemplate;

    public RestDecisionNotifier(@Qualifier("callbackRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void notify(String callbackUrl, Decision decision) {
        try {
            restTemplate.postForEntity(callbackUrl, decision, Void.class);
            log.info("Decision {} delivered to {}", decision.status(), callbackUrl);
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Callback to {} failed: {}", callbackUrl, e.getMessage());
        }
    }
}
