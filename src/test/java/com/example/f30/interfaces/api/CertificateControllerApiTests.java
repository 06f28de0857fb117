package com.example.f30.interfaces.api;

import com.example.f30.application.exception.DecisionNotFoundException;
import com.example.f30.application.exception.DuplicateDocumentException;
import com.example.f30.application.service.CertificateIntakeService;
import com.example.f30.application.service.DecisionQueryService;
import com.example.f30.domain.exception.MissingIdentityDataException;
import com.example.f30.domain.exception.UnknownVariantException;
import com.example.f30.domain.model.CertificateVariant;
import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.DecisionStatus;
import com.example.f30.domain.model.IntakeReceipt;
import com.example.f30.domain.model.IntakeRequest;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;
import com.example.f30.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = CertificateController.class)
@Import(GlobalExceptionHandler.class)
class CertificateControllerApiTests {

    private static final String SUBMISSION = """
            {
              "document_id": "doc-1",
              "file_url": "https://storage.example.org/f30/cert.pdf",
              "tipo_f30": "razon_social",
              "user_data": {"rut": "77301140-0", "razon_social": "SOC COMERCIAL GAS MACUL LIMITADA"},
              "response_url": "https://caller.example.org/hooks/f30"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CertificateIntakeService intakeService;

    @MockBean
    private DecisionQueryService decisionQueryService;

    /**
     * Verifies that an admitted submission answers 202 with the snake_case receipt.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void submissionAcceptedWithReceipt() throws Exception {
        BDDMockito.given(intakeService.submit(BDDMockito.any(IntakeRequest.class)))
                .willReturn(IntakeReceipt.processing("doc-1"));

        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBMISSION))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.document_id").value("doc-1"))
                .andExpect(jsonPath("$.status").value("PROCESSING"));

        ArgumentCaptor<IntakeRequest> captor = ArgumentCaptor.forClass(IntakeRequest.class);
        BDDMockito.then(intakeService).should().submit(captor.capture());
        assertThat(captor.getValue().variantCode()).isEqualTo("razon_social");
        assertThat(captor.getValue().identityData()).containsEntry("rut", "77301140-0");
        assertThat(captor.getValue().callbackUrl()).isEqualTo("https://caller.example.org/hooks/f30");
    }

    /**
     * Verifies that an unknown variant translates to HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownVariantMappedToBadRequest() throws Exception {
        BDDMockito.given(intakeService.submit(BDDMockito.any(IntakeRequest.class)))
                .willThrow(new UnknownVariantException("boleta"));

        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBMISSION))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_VARIANT"))
                .andExpect(jsonPath("$.path").value("/api/v1/certificates/f30"));
    }

    @Test
    void missingIdentityMappedToBadRequest() throws Exception {
        BDDMockito.given(intakeService.submit(BDDMockito.any(IntakeRequest.class)))
                .willThrow(new MissingIdentityDataException(List.of("rut", "run")));

        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBMISSION))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_IDENTITY_DATA"));
    }

    /**
     * Verifies that a resubmission while the document is in flight translates to HTTP 409.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void duplicateSubmissionMappedToConflict() throws Exception {
        BDDMockito.given(intakeService.submit(BDDMockito.any(IntakeRequest.class)))
                .willThrow(new DuplicateDocumentException("doc-1"));

        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBMISSION))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DOCUMENT_ALREADY_PROCESSING"));
    }

    @Test
    void malformedBodyMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(intakeService.submit(BDDMockito.any(IntakeRequest.class)))
                .willThrow(new UnreadableDocumentException("broken"));

        mockMvc.perform(post("/api/v1/certificates/f30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBMISSION))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void decisionReturnedInSnakeCase() throws Exception {
        Decision decision = new Decision("doc-1", CertificateVariant.RAZON_SOCIAL, DecisionStatus.APPROVED,
                Map.of("rut_empleador", "77.301.140-0"), List.of(), List.of(), null, null,
                List.of("State changed to OCR", "Decision: APPROVED"), Instant.parse("2025-03-20T12:00:00Z"));
        BDDMockito.given(decisionQueryService.decisionFor("doc-1")).willReturn(decision);

        mockMvc.perform(get("/api/v1/certificates/f30/doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document_id").value("doc-1"))
                .andExpect(jsonPath("$.variant").value("razon_social"))
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.extracted_data.rut_empleador").value("77.301.140-0"))
                .andExpect(jsonPath("$.processing_log[1]").value("Decision: APPROVED"));
    }

    /**
     * Verifies that a lookup before any decision exists translates to HTTP 404.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownDecisionMappedToNotFound() throws Exception {
        BDDMockito.given(decisionQueryService.decisionFor("doc-9"))
                .willThrow(new DecisionNotFoundException("doc-9"));

        mockMvc.perform(get("/api/v1/certificates/f30/doc-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("DECISION_NOT_FOUND"));
    }
}
