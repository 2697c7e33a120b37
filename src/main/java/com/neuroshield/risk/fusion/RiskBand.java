package com.neuroshield.risk.fusion;

public enum RiskBand {

    SAFE,
    SUSPICIOUS,
    BLOCKED;

    static final double BLOCKED_ABOVE = 0.7;
    static final double SUSPICIOUS_ABOVE = 0.3;

    public static RiskBand of(double combinedRisk) {
        if (combinedRisk > BLOCKED_ABOVE) {
            return BLOCKED;
        }
        if (combinedRisk > SUSPICIOUS_ABOVE) {
            return SUSPICIOUS;
        }
        return SAFE;
    }
}
