package com.neuroshield.risk.fusion;

import java.util.Locale;
import java.util.Optional;

/**
 * Classifier verdict and the base risk each one maps to.
 */
public enum MlLabel {

    FRAUD("Fraud", 0.85),
    SUSPICIOUS("Suspicious", 0.50),
    NON_FRAUD("Non-Fraud", 0.10);

    private final String wireName;
    private final double baseRisk;

    MlLabel(String wireName, double baseRisk) {
        this.wireName = wireName;
        this.baseRisk = baseRisk;
    }

    public String wireName() {
        return wireName;
    }

    public double baseRisk() {
        return baseRisk;
    }

    /**
     * Strict parse of a label name ("Fraud", "SUSPICIOUS", "non-fraud", "safe"...). Empty when unrecognised.
     */
    public static Optional<MlLabel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (v) {
            case "FRAUD" -> Optional.of(FRAUD);
            case "SUSPICIOUS" -> Optional.of(SUSPICIOUS);
            case "NON_FRAUD", "SAFE" -> Optional.of(NON_FRAUD);
            default -> Optional.empty();
        };
    }

    /**
     * Lenient mapping of a classifier prediction: anything not recognised counts as NON_FRAUD.
     */
    public static MlLabel fromPrediction(String prediction) {
        return parse(prediction).orElse(NON_FRAUD);
    }
}
