package com.neuroshield.api.controller;

import com.neuroshield.api.dto.CreditTokensRequest;
import com.neuroshield.api.dto.ErrorBody;
import com.neuroshield.api.dto.TokenBalanceResponse;
import com.neuroshield.common.Addresses;
import com.neuroshield.domain.TokenAccount;
import com.neuroshield.governance.command.LedgerCommand;
import com.neuroshield.governance.command.LedgerCommandGateway;
import com.neuroshield.governance.proposal.ProposalQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GET /tokens/{address}, POST /tokens/{address}/credit (distribution).
 */
@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final LedgerCommandGateway ledgerCommandGateway;
    private final ProposalQueryService proposalQueryService;

    @GetMapping("/{address}")
    public ResponseEntity<?> balance(@PathVariable String address) {
        if (!Addresses.isWellFormed(address)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
        }
        return ResponseEntity.ok(TokenBalanceResponse.from(proposalQueryService.getTokenBalance(address)));
    }

    @PostMapping("/{address}/credit")
    public TokenBalanceResponse credit(@PathVariable String address,
                                       @RequestHeader(name = GovernanceController.CALLER_HEADER, required = false) String caller,
                                       @Valid @RequestBody CreditTokensRequest request) {
        TokenAccount account = ledgerCommandGateway.dispatch(
                new LedgerCommand.CreditTokens(address, request.amount(), caller));
        return TokenBalanceResponse.from(account);
    }
}
