package com.neuroshield.risk.fusion;

import com.neuroshield.domain.TrustSnapshot;

/**
 * Deterministic fusion of an ML verdict with community trust state. No I/O, no clock:
 * everything it depends on is passed in, including whether a proposal is open.
 */
public class RiskFusionEngine {

    static final double DAMPENED_CAP = 0.45;

    private final FusionPolicy policy;

    public RiskFusionEngine(FusionPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param activity          destination footprint, or null when unknown (never dampens)
     * @param hasActiveProposal whether an unresolved proposal targets the destination
     * @param allowListed       caller-side allow list hit; forces SAFE whatever the computed band
     */
    public FusedRisk fuse(MlLabel label, AddressActivity activity, TrustSnapshot trust,
                          boolean hasActiveProposal, boolean allowListed) {
        double mlRisk = label.baseRisk();
        boolean dampened = false;
        if (mlRisk > DAMPENED_CAP && isBlankDestination(activity, trust, hasActiveProposal)) {
            mlRisk = DAMPENED_CAP;
            dampened = true;
        }

        FusionOutcome outcome = policy.fuse(mlRisk, trust, hasActiveProposal);
        double combined = Math.max(0.0, Math.min(1.0, outcome.risk()));
        RiskBand band = RiskBand.of(combined);
        boolean override = false;
        if (allowListed && band != RiskBand.SAFE) {
            band = RiskBand.SAFE;
            override = true;
        }
        return new FusedRisk(combined, band, mlRisk, outcome.daoBoost(), dampened, override, outcome.rule());
    }

    public FusionPolicy policy() {
        return policy;
    }

    private static boolean isBlankDestination(AddressActivity activity, TrustSnapshot trust, boolean hasActiveProposal) {
        return activity != null
                && activity.isPristine()
                && !trust.hasRecord()
                && !trust.confirmedScam()
                && !hasActiveProposal;
    }
}
