package com.neuroshield.risk.oracle;

import com.neuroshield.common.Addresses;
import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.governance.proposal.DaoConfidence;
import com.neuroshield.governance.proposal.ProposalQueryService;
import com.neuroshield.governance.trust.TrustRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Threat oracle read surface. Reads the trust registry directly, so answers reflect every committed settlement.
 */
@Service
@RequiredArgsConstructor
public class OracleService {

    private final TrustRegistry trustRegistry;
    private final ProposalQueryService proposalQueryService;

    public int threatScore(String address) {
        return trustRegistry.threatScore(Addresses.normalize(address));
    }

    public boolean isConfirmedScam(String address) {
        return trustRegistry.isConfirmedScam(Addresses.normalize(address));
    }

    public DaoConfidence daoConfidence(String address) {
        return proposalQueryService.getDaoConfidence(Addresses.normalize(address));
    }

    public ThreatSummary summary(String address) {
        String normalized = Addresses.normalize(address);
        TrustSnapshot snapshot = trustRegistry.snapshot(normalized);
        DaoConfidence confidence = proposalQueryService.getDaoConfidence(normalized);
        return new ThreatSummary(normalized, snapshot.scamScore(), snapshot.confirmedScam(), confidence.confidencePercent());
    }

    public OracleReport fullReport(String address) {
        String normalized = Addresses.normalize(address);
        TrustSnapshot snapshot = trustRegistry.snapshot(normalized);
        DaoConfidence confidence = proposalQueryService.getDaoConfidence(normalized);
        RiskLabel label = RiskLabel.forScore(snapshot.scamScore());
        return new OracleReport(normalized, snapshot.scamScore(), label, label.color(), snapshot.confirmedScam(),
                snapshot.hasActiveProposal(), confidence, explain(snapshot, confidence, label));
    }

    static List<String> explain(TrustSnapshot snapshot, DaoConfidence confidence, RiskLabel label) {
        List<String> lines = new ArrayList<>();
        if (snapshot.confirmedScam()) {
            lines.add("DAO community confirmed this address as a scammer");
        }
        if (confidence.totalVoters() > 0) {
            lines.add(confidence.totalVoters() + " voters reached " + confidence.confidencePercent() + "% consensus");
        }
        switch (label) {
            case CRITICAL -> lines.add("Threat level CRITICAL: avoid all interaction");
            case HIGH_RISK -> lines.add("Threat level HIGH: exercise extreme caution");
            case UNDER_REVIEW -> lines.add("Address has been flagged by the community");
            case CLEAN -> lines.add("No threats detected by the DAO oracle");
        }
        if (snapshot.hasActiveProposal()) {
            lines.add("Address is currently under community review");
        }
        return lines;
    }
}
