package com.neuroshield.risk;

import com.neuroshield.common.Addresses;
import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.mirror.LedgerMirror;
import com.neuroshield.risk.fusion.FusedRisk;
import com.neuroshield.risk.fusion.MlLabel;
import com.neuroshield.risk.fusion.RiskBand;
import com.neuroshield.risk.fusion.RiskFusionEngine;
import com.neuroshield.risk.ml.FraudClassifierClient;
import com.neuroshield.risk.ml.MlUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers every risk query. Classifier outages fall back to a label, ledger read failures to the
 * under-review boost; both are logged and listed in the assessment reasons.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskAssessmentService {

    private final FraudClassifierClient fraudClassifierClient;
    private final LedgerMirror ledgerMirror;
    private final RiskFusionEngine riskFusionEngine;
    private final RiskProperties riskProperties;

    public Mono<RiskAssessment> assess(RiskAssessmentRequest request) {
        String address = Addresses.normalize(request.address());
        return Mono.zip(resolveLabel(address, request), readTrust(address))
                .map(t -> combine(address, request, t.getT1(), t.getT2()));
    }

    private Mono<LabelRead> resolveLabel(String address, RiskAssessmentRequest request) {
        if (request.mlLabel() != null) {
            return Mono.just(new LabelRead(request.mlLabel(), true, "ML label supplied by caller: " + request.mlLabel().wireName()));
        }
        MlLabel fallback = request.fallbackLabel() != null ? request.fallbackLabel() : riskProperties.getFallbackLabel();
        if (request.features() == null || request.features().isEmpty()) {
            return Mono.just(new LabelRead(fallback, false,
                    "No ML input; using fallback label " + fallback.wireName()));
        }
        return fraudClassifierClient.classify(address, request.features())
                .map(label -> new LabelRead(label, true, "ML classifier: " + label.wireName()))
                .onErrorResume(MlUnavailableException.class, e -> {
                    log.warn("Classifier unavailable for {}, falling back to {}: {}", address, fallback, e.getMessage());
                    return Mono.just(new LabelRead(fallback, false,
                            "ML unavailable (" + e.getMessage() + "); using fallback label " + fallback.wireName()));
                });
    }

    private Mono<TrustRead> readTrust(String address) {
        return Mono.fromCallable(() -> new TrustRead(ledgerMirror.snapshot(address), true))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(RuntimeException.class, e -> {
                    log.warn("Trust state unavailable for {}; treating as under review", address, e);
                    return Mono.just(new TrustRead(TrustSnapshot.unknown(address), false));
                });
    }

    private RiskAssessment combine(String address, RiskAssessmentRequest request, LabelRead label, TrustRead trust) {
        TrustSnapshot snapshot = trust.snapshot();
        // An unreadable ledger counts as an unresolved proposal: moderate boost, no dampening.
        boolean underReview = !trust.available() || snapshot.hasActiveProposal();
        FusedRisk fused = riskFusionEngine.fuse(label.label(), request.activity(), snapshot, underReview, request.allowListed());

        List<String> reasons = new ArrayList<>();
        reasons.add(label.reason());
        if (!trust.available()) {
            reasons.add("Community trust state unavailable; applied under-review boost");
        } else if (snapshot.confirmedScam()) {
            reasons.add("DAO-confirmed scam, score " + snapshot.scamScore());
        } else if (snapshot.hasActiveProposal()) {
            reasons.add("Address is under community review");
        }
        if (fused.dampened()) {
            reasons.add("New address with no history or DAO evidence; ML risk capped");
        }
        if (fused.allowListOverride()) {
            reasons.add("Allow-listed by caller; band forced to SAFE");
        }
        reasons.add(explain(fused.band()));

        return new RiskAssessment(address, fused.combinedRisk(), fused.band(), fused.mlRisk(), fused.daoBoost(),
                label.label(), fused.dampened(), fused.allowListOverride(), label.available(), trust.available(), reasons);
    }

    static String explain(RiskBand band) {
        return switch (band) {
            case BLOCKED -> "High risk: this address has been associated with suspicious activity";
            case SUSPICIOUS -> "Medium risk: exercise caution with this transaction";
            case SAFE -> "Low risk: no significant risk factors detected";
        };
    }

    private record LabelRead(MlLabel label, boolean available, String reason) {
    }

    private record TrustRead(TrustSnapshot snapshot, boolean available) {
    }
}
