package com.neuroshield.risk.oracle;

import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.governance.proposal.DaoConfidence;
import com.neuroshield.governance.proposal.ProposalQueryService;
import com.neuroshield.governance.trust.TrustRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OracleServiceTest {

    private static final String MIXED = "0xAbCdEf0000000000000000000000000000000001";
    private static final String ADDR = "0xabcdef0000000000000000000000000000000001";

    @Mock
    TrustRegistry trustRegistry;
    @Mock
    ProposalQueryService proposalQueryService;

    @InjectMocks
    OracleService oracleService;

    @Test
    @DisplayName("labels follow the score thresholds")
    void labelThresholds() {
        assertThat(RiskLabel.forScore(100)).isEqualTo(RiskLabel.CRITICAL);
        assertThat(RiskLabel.forScore(75)).isEqualTo(RiskLabel.CRITICAL);
        assertThat(RiskLabel.forScore(74)).isEqualTo(RiskLabel.HIGH_RISK);
        assertThat(RiskLabel.forScore(50)).isEqualTo(RiskLabel.HIGH_RISK);
        assertThat(RiskLabel.forScore(20)).isEqualTo(RiskLabel.UNDER_REVIEW);
        assertThat(RiskLabel.forScore(19)).isEqualTo(RiskLabel.CLEAN);
        assertThat(RiskLabel.forScore(0)).isEqualTo(RiskLabel.CLEAN);
    }

    @Test
    @DisplayName("lookups normalise the address before reading the registry")
    void normalisesAddress() {
        when(trustRegistry.threatScore(ADDR)).thenReturn(40);
        when(trustRegistry.isConfirmedScam(ADDR)).thenReturn(true);

        assertThat(oracleService.threatScore(MIXED)).isEqualTo(40);
        assertThat(oracleService.isConfirmedScam(MIXED)).isTrue();
    }

    @Test
    @DisplayName("summary combines score, flag and confidence")
    void summary() {
        when(trustRegistry.snapshot(ADDR)).thenReturn(new TrustSnapshot(ADDR, true, 40, true, false));
        when(proposalQueryService.getDaoConfidence(ADDR)).thenReturn(DaoConfidence.of(900, 100, 4));

        ThreatSummary summary = oracleService.summary(MIXED);

        assertThat(summary).isEqualTo(new ThreatSummary(ADDR, 40, true, 90));
    }

    @Test
    @DisplayName("full report for a confirmed critical address explains the verdict")
    void fullReportCritical() {
        when(trustRegistry.snapshot(ADDR)).thenReturn(new TrustSnapshot(ADDR, true, 80, true, true));
        when(proposalQueryService.getDaoConfidence(ADDR)).thenReturn(DaoConfidence.of(300, 100, 3));

        OracleReport report = oracleService.fullReport(ADDR);

        assertThat(report.riskLabel()).isEqualTo(RiskLabel.CRITICAL);
        assertThat(report.riskColor()).isEqualTo("#DC2626");
        assertThat(report.underReview()).isTrue();
        assertThat(report.explanation()).containsExactly(
                "DAO community confirmed this address as a scammer",
                "3 voters reached 75% consensus",
                "Threat level CRITICAL: avoid all interaction",
                "Address is currently under community review");
    }

    @Test
    @DisplayName("unknown address reports clean with no consensus line")
    void fullReportClean() {
        when(trustRegistry.snapshot(ADDR)).thenReturn(TrustSnapshot.unknown(ADDR));
        when(proposalQueryService.getDaoConfidence(ADDR)).thenReturn(DaoConfidence.NONE);

        OracleReport report = oracleService.fullReport(ADDR);

        assertThat(report.score()).isZero();
        assertThat(report.riskLabel()).isEqualTo(RiskLabel.CLEAN);
        assertThat(report.explanation()).containsExactly("No threats detected by the DAO oracle");
    }
}
