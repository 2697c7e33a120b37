package com.neuroshield.risk.fusion;

/**
 * What a policy made of the ML risk: the combined risk (before clamping) and the DAO share of it.
 *
 * @param rule short name of the rule that decided, for the assessment reasons
 */
public record FusionOutcome(double risk, double daoBoost, String rule) {
}
