package com.neuroshield.risk.fusion;

public record FusedRisk(
        double combinedRisk,
        RiskBand band,
        double mlRisk,
        double daoBoost,
        boolean dampened,
        boolean allowListOverride,
        String rule
) {
}
