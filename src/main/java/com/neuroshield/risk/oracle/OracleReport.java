package com.neuroshield.risk.oracle;

import com.neuroshield.governance.proposal.DaoConfidence;

import java.util.List;

public record OracleReport(
        String address,
        int score,
        RiskLabel riskLabel,
        String riskColor,
        boolean confirmedScam,
        boolean underReview,
        DaoConfidence confidence,
        List<String> explanation
) {

    public OracleReport {
        explanation = List.copyOf(explanation);
    }
}
