package com.neuroshield.risk.oracle;

/**
 * Human-facing threat category for a 0..100 scam score.
 */
public enum RiskLabel {

    CRITICAL(75, "CRITICAL", "#DC2626"),
    HIGH_RISK(50, "HIGH RISK", "#D97706"),
    UNDER_REVIEW(20, "UNDER REVIEW", "#2563EB"),
    CLEAN(0, "CLEAN", "#059669");

    private final int minScore;
    private final String displayName;
    private final String color;

    RiskLabel(int minScore, String displayName, String color) {
        this.minScore = minScore;
        this.displayName = displayName;
        this.color = color;
    }

    public String displayName() {
        return displayName;
    }

    public String color() {
        return color;
    }

    public static RiskLabel forScore(int score) {
        for (RiskLabel label : values()) {
            if (score >= label.minScore) {
                return label;
            }
        }
        return CLEAN;
    }
}
