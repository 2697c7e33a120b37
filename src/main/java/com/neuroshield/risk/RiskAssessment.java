package com.neuroshield.risk;

import com.neuroshield.risk.fusion.MlLabel;
import com.neuroshield.risk.fusion.RiskBand;

import java.util.List;

public record RiskAssessment(
        String address,
        double combinedRisk,
        RiskBand band,
        double mlRisk,
        double daoBoost,
        MlLabel mlLabel,
        boolean dampened,
        boolean allowListOverride,
        boolean mlAvailable,
        boolean trustAvailable,
        List<String> reasons
) {

    public RiskAssessment {
        reasons = List.copyOf(reasons);
    }
}
