package com.example.f30.infrastructure.http;

import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.DecisionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestDecisionNotifierTest {

    private MockRestServiceServer server;
    private RestDecisionNotifier notifier;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        notifier = new RestDecisionNotifier(restTemplate);
    }

    @Test
    void postsDecisionToCallback() {
        server.expect(requestTo("https://caller.example.org/hooks/f30"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());

        notifier.notify("https://caller.example.org/hooks/f30", approved());

        server.verify();
    }

    @Test
    void callbackFailureIsNotPropagated() {
        server.expect(requestTo("https://caller.example.org/hooks/f30"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatCode(() -> notifier.notify("https://caller.example.org/hooks/f30", approved()))
                .doesNotThrowAnyException();
    }

    private static Decision approved() {
        return new Decision("doc-1", CertificateVariant.RAZON_SOCIAL, DecisionStatus.APPROVED, Map.of(), List.of(),
                List.of(), null, null, List.of("Decision: APPROVED"), Instant.parse("2025-03-20T12:00:00Z"));
    }
}
