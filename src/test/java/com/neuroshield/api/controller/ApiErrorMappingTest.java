package com.neuroshield.api.controller;

import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.command.LedgerCommand;
import com.neuroshield.governance.command.LedgerCommandGateway;
import com.neuroshield.governance.proposal.ProposalQueryService;
import com.neuroshield.risk.oracle.OracleService;
import com.neuroshield.risk.oracle.ThreatSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {GovernanceController.class, OracleController.class, TokenController.class})
class ApiErrorMappingTest {

    private static final String CALLER = "0x2000000000000000000000000000000000000002";
    private static final String TARGET = "0x3000000000000000000000000000000000000003";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    LedgerCommandGateway ledgerCommandGateway;
    @MockBean
    ProposalQueryService proposalQueryService;
    @MockBean
    OracleService oracleService;

    @Test
    @DisplayName("state conflicts map to 409 with the error code")
    void stateConflict() {
        when(ledgerCommandGateway.dispatch(any(LedgerCommand.ExecuteProposal.class)))
                .thenThrow(new GovernanceException(GovernanceError.VOTING_STILL_OPEN, "Voting still open"));

        webTestClient.post().uri("/api/v1/proposals/7/execute")
                .header(GovernanceController.CALLER_HEADER, CALLER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("VOTING_STILL_OPEN")
                .jsonPath("$.message").isEqualTo("Voting still open")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("token credit by a caller other than the token admin maps to 403")
    void unauthorisedCredit() {
        when(ledgerCommandGateway.dispatch(any(LedgerCommand.CreditTokens.class)))
                .thenThrow(new GovernanceException(GovernanceError.UNAUTHORIZED_CALLER,
                        "Only the token admin may credit tokens: " + CALLER));

        webTestClient.post().uri("/api/v1/tokens/" + TARGET + "/credit")
                .header(GovernanceController.CALLER_HEADER, CALLER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":1000000}")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody().jsonPath("$.error").isEqualTo("UNAUTHORIZED_CALLER");
    }

    @Test
    @DisplayName("unknown proposal maps to 404")
    void notFound() {
        when(proposalQueryService.getProposal(42L))
                .thenThrow(new GovernanceException(GovernanceError.PROPOSAL_NOT_FOUND, "Proposal not found: 42"));

        webTestClient.get().uri("/api/v1/proposals/42")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("PROPOSAL_NOT_FOUND");
    }

    @Test
    @DisplayName("missing caller header is rejected before reaching the gateway")
    void missingCaller() {
        webTestClient.post().uri("/api/v1/proposals/7/votes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"support\":true,\"tokensStaked\":10}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_CALLER");

        verify(ledgerCommandGateway, never()).dispatch(any());
    }

    @Test
    @DisplayName("body validation reports the field's error code")
    void bodyValidation() {
        webTestClient.post().uri("/api/v1/proposals")
                .header(GovernanceController.CALLER_HEADER, CALLER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"targetAddress\":\"" + TARGET + "\",\"description\":\"  \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_DESCRIPTION")
                .jsonPath("$.message").isEqualTo("Description required");

        webTestClient.post().uri("/api/v1/proposals/7/votes")
                .header(GovernanceController.CALLER_HEADER, CALLER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tokensStaked\":10}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_VOTE");
    }

    @Test
    @DisplayName("oracle summary answers for a well-formed address and rejects a malformed one")
    void oracle() {
        when(oracleService.summary(eq(TARGET))).thenReturn(new ThreatSummary(TARGET, 50, true, 80));

        webTestClient.get().uri("/api/v1/oracle/" + TARGET)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.threatScore").isEqualTo(50)
                .jsonPath("$.confirmedScam").isEqualTo(true)
                .jsonPath("$.confidencePercent").isEqualTo(80);

        webTestClient.get().uri("/api/v1/oracle/garbage/full")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }
}
