package com.neuroshield.risk.fusion;

import com.neuroshield.domain.TrustSnapshot;

/**
 * combinedRisk = mlRisk + boost, where boost is half the scam score (as a fraction) for a confirmed scam,
 * a flat 0.15 while a proposal is open, and zero otherwise.
 */
public class AdditiveFusionPolicy implements FusionPolicy {

    static final double MAX_CONFIRMED_BOOST = 0.5;
    static final double UNDER_REVIEW_BOOST = 0.15;

    @Override
    public FusionOutcome fuse(double mlRisk, TrustSnapshot trust, boolean hasActiveProposal) {
        double boost;
        String rule;
        if (trust.confirmedScam()) {
            boost = Math.min(MAX_CONFIRMED_BOOST, trust.scamScore() / 100.0 * MAX_CONFIRMED_BOOST);
            rule = "confirmed-scam";
        } else if (hasActiveProposal) {
            boost = UNDER_REVIEW_BOOST;
            rule = "under-review";
        } else {
            boost = 0.0;
            rule = "ml-only";
        }
        return new FusionOutcome(mlRisk + boost, boost, rule);
    }
}
