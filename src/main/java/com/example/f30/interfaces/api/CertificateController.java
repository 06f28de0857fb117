package com.example.f30.interfaces.api;

import com.example.f30.application.service.CertificateIntakeService;
import com.example.f30.application.service.DecisionQueryService;
import com.example.f30.domain.model.Decision;
import com.example.f30.domain.model.IntakeReceipt;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interfaces-layer REST controller for F30 certificate submissions and decision lookups.
 */
@RestController
@RequestMapping("/api/v1/certificates/f30")
public class CertificateController {

    private final CertificateIntakeService intakeService;
    private final DecisionQueryService decisionQueryService;

    /**
     * Creates the controller with the required application services.
     *
     * @param intakeService        service admitting certificates for background validation
     * @param decisionQueryService service reading stored decisions
     */
    public CertificateController(CertificateIntakeService intakeService, DecisionQueryService decisionQueryService) {
        this.intakeService = intakeService;
        this.decisionQueryService = decisionQueryService;
    }

    /**
     * Admits a certificate; validation continues in the background.
     *
     * @param request submission body
     * @return 202 with the document id and status {@code PROCESSING}
     */
    @PostMapping
    public ResponseEntity<IntakeReceipt> submit(@RequestBody CertificateSubmissionRequest request) {
        IntakeReceipt receipt = intakeService.submit(request.toIntakeRequest());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(receipt);
    }

    @GetMapping("/{documentId}")
    public Decision decision(@PathVariable String documentId) {
        return decisionQueryService.decisionFor(documentId);
    }
}
