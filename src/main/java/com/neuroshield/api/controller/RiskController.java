package com.neuroshield.api.controller;

import com.neuroshield.api.dto.AssessRiskRequest;
import com.neuroshield.risk.RiskAssessment;
import com.neuroshield.risk.RiskAssessmentRequest;
import com.neuroshield.risk.RiskAssessmentService;
import com.neuroshield.risk.fusion.AddressActivity;
import com.neuroshield.risk.fusion.MlLabel;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * POST /risk/assess. Always answers; degraded inputs show up in the assessment, not as errors.
 */
@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
public class RiskController {

    private final RiskAssessmentService riskAssessmentService;

    @PostMapping("/assess")
    public Mono<RiskAssessment> assess(@Valid @RequestBody AssessRiskRequest request) {
        return riskAssessmentService.assess(toServiceRequest(request));
    }

    static RiskAssessmentRequest toServiceRequest(AssessRiskRequest request) {
        AddressActivity activity = null;
        if (request.balance() != null || request.transactionCount() != null) {
            activity = new AddressActivity(
                    request.balance() != null ? request.balance() : BigInteger.ZERO,
                    request.transactionCount() != null ? request.transactionCount() : 0L);
        }
        return new RiskAssessmentRequest(
                request.address(),
                MlLabel.parse(request.mlLabel()).orElse(null),
                request.features(),
                activity,
                request.allowListed(),
                MlLabel.parse(request.fallbackLabel()).orElse(null));
    }
}
