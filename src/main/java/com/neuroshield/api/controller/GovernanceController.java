package com.neuroshield.api.controller;

import com.neuroshield.api.dto.CastVoteRequest;
import com.neuroshield.api.dto.ErrorBody;
import com.neuroshield.api.dto.ProposalResponse;
import com.neuroshield.api.dto.SubmitProposalRequest;
import com.neuroshield.api.dto.VoteResponse;
import com.neuroshield.api.dto.VoterStatsResponse;
import com.neuroshield.common.Addresses;
import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.domain.Vote;
import com.neuroshield.domain.VoterProfile;
import com.neuroshield.governance.command.LedgerCommand;
import com.neuroshield.governance.command.LedgerCommandGateway;
import com.neuroshield.governance.proposal.ProposalQueryService;
import com.neuroshield.governance.proposal.SettlementResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Proposals and voters: submit, vote, execute, and the matching reads.
 * Writes go through the ledger command gateway under the X-Caller-Address identity.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GovernanceController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final LedgerCommandGateway ledgerCommandGateway;
    private final ProposalQueryService proposalQueryService;

    @PostMapping("/proposals")
    public ResponseEntity<ProposalResponse> submit(@RequestHeader(name = CALLER_HEADER, required = false) String caller,
                                                   @Valid @RequestBody SubmitProposalRequest request) {
        Proposal created = ledgerCommandGateway.dispatch(new LedgerCommand.SubmitProposal(
                request.targetAddress(), request.description(), request.evidenceRef(), caller));
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(created));
    }

    @GetMapping("/proposals")
    public ResponseEntity<?> list(@RequestParam(required = false) String status) {
        ProposalStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = ProposalStatus.valueOf(status.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_STATUS", "Unknown proposal status: " + status));
            }
        }
        List<ProposalResponse> proposals = proposalQueryService.listProposals(filter).stream()
                .map(ProposalResponse::from)
                .toList();
        return ResponseEntity.ok(proposals);
    }

    @GetMapping("/proposals/{id}")
    public ProposalResponse get(@PathVariable long id) {
        return ProposalResponse.from(proposalQueryService.getProposal(id));
    }

    @GetMapping("/proposals/{id}/votes")
    public List<VoteResponse> votes(@PathVariable long id) {
        return proposalQueryService.getProposalVotes(id).stream().map(VoteResponse::from).toList();
    }

    @PostMapping("/proposals/{id}/votes")
    public ResponseEntity<VoteResponse> vote(@PathVariable long id,
                                             @RequestHeader(name = CALLER_HEADER, required = false) String caller,
                                             @Valid @RequestBody CastVoteRequest request) {
        Vote vote = ledgerCommandGateway.dispatch(
                new LedgerCommand.CastVote(id, request.support(), request.tokensStaked(), caller));
        return ResponseEntity.status(HttpStatus.CREATED).body(VoteResponse.from(vote));
    }

    @PostMapping("/proposals/{id}/execute")
    public SettlementResult execute(@PathVariable long id,
                                    @RequestHeader(name = CALLER_HEADER, required = false) String caller) {
        return ledgerCommandGateway.dispatch(new LedgerCommand.ExecuteProposal(id, caller));
    }

    @GetMapping("/voters/{address}")
    public ResponseEntity<?> voter(@PathVariable String address) {
        if (!Addresses.isWellFormed(address)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
        }
        VoterProfile profile = proposalQueryService.getVoterStats(address);
        return ResponseEntity.ok(new VoterStatsResponse(profile.getAddress(), profile.getAccuracy(), profile.getParticipation()));
    }
}
