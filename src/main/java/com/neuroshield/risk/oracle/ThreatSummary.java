package com.neuroshield.risk.oracle;

/**
 * The oracle contract relied on by external protocols.
 */
public record ThreatSummary(String address, int threatScore, boolean confirmedScam, int confidencePercent) {
}
