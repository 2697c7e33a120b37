package com.neuroshield.risk.fusion;

import com.neuroshield.domain.TrustSnapshot;

/**
 * Rule-list fusion used by the wallet client. The first of these rules that matches sets the risk:
 * <ol>
 *     <li>confirmed scam: 0.95</li>
 *     <li>ML above 0.60 and score above 30: half ML, half score, plus 0.15 (max 1)</li>
 *     <li>some score but ML below 0.30: at least 0.40, or the score fraction when higher</li>
 * </ol>
 * Afterwards an open proposal lifts anything below 0.30 to 0.30.
 */
public class LayeredRuleFusionPolicy implements FusionPolicy {

    static final double CONFIRMED_RISK = 0.95;
    static final double UNDER_REVIEW_FLOOR = 0.30;

    @Override
    public FusionOutcome fuse(double mlRisk, TrustSnapshot trust, boolean hasActiveProposal) {
        double score = trust.scamScore() / 100.0;
        double risk;
        String rule;
        if (trust.confirmedScam()) {
            risk = CONFIRMED_RISK;
            rule = "confirmed-scam";
        } else if (mlRisk > 0.60 && trust.scamScore() > 30) {
            risk = Math.min(1.0, mlRisk * 0.5 + score * 0.5 + 0.15);
            rule = "ml-and-community-agree";
        } else if (trust.scamScore() > 0 && mlRisk < 0.30) {
            risk = Math.max(0.40, score);
            rule = "community-overrides-ml";
        } else {
            risk = mlRisk;
            rule = "ml-only";
        }
        if (hasActiveProposal && risk < UNDER_REVIEW_FLOOR) {
            risk = UNDER_REVIEW_FLOOR;
            rule = rule + "+under-review";
        }
        return new FusionOutcome(risk, Math.max(0.0, risk - mlRisk), rule);
    }
}
