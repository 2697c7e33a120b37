package com.neuroshield.governance.command;

import com.neuroshield.common.Addresses;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.GovernanceProperties;
import com.neuroshield.governance.escrow.TokenEscrow;
import com.neuroshield.governance.proposal.ProposalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point for ledger writes. Commands are applied one at a time, in arrival order,
 * and each one commits (or rolls back) before the next starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandGateway {

    private final ReentrantLock writeLock = new ReentrantLock(true);

    private final ProposalService proposalService;
    private final TokenEscrow tokenEscrow;
    private final GovernanceProperties governanceProperties;

    @SuppressWarnings("unchecked")
    public <R> R dispatch(LedgerCommand<R> command) {
        writeLock.lock();
        try {
            log.debug("Dispatching {}", command);
            return (R) apply(command);
        } finally {
            writeLock.unlock();
        }
    }

    private Object apply(LedgerCommand<?> command) {
        if (command instanceof LedgerCommand.SubmitProposal submit) {
            return proposalService.submitProposal(
                    submit.targetAddress(), submit.description(), submit.evidenceRef(), submit.caller());
        }
        if (command instanceof LedgerCommand.CastVote vote) {
            return proposalService.castVote(vote.proposalId(), vote.caller(), vote.support(), vote.tokensStaked());
        }
        if (command instanceof LedgerCommand.ExecuteProposal execute) {
            return proposalService.executeProposal(execute.proposalId(), execute.caller());
        }
        if (command instanceof LedgerCommand.CreditTokens credit) {
            requireTokenAdmin(credit.caller());
            log.info("Token credit of {} to {} requested by {}", credit.amount(), credit.address(), credit.caller());
            return tokenEscrow.credit(credit.address(), credit.amount());
        }
        throw new IllegalArgumentException("Unsupported ledger command: " + command.getClass().getName());
    }

    private void requireTokenAdmin(String caller) {
        String admin = Addresses.normalize(governanceProperties.getTokenAdmin());
        if (admin == null || !admin.equals(caller)) {
            log.warn("Token credit refused for {}", caller);
            throw new GovernanceException(GovernanceError.UNAUTHORIZED_CALLER, "Only the token admin may credit tokens: " + caller);
        }
    }
}
