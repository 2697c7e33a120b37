package com.neuroshield.governance.command;

import com.neuroshield.common.Addresses;
import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.TokenAccount;
import com.neuroshield.domain.Vote;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.proposal.SettlementResult;

/**
 * Closed set of ledger writes. Each variant checks its own shape on construction and carries
 * normalised addresses, so a command that exists is well-formed; ledger-state checks happen on dispatch.
 *
 * @param <R> result of applying the command
 */
public sealed interface LedgerCommand<R> {

    /** Identity the command is issued under. */
    String caller();

    record SubmitProposal(String targetAddress, String description, String evidenceRef, String caller)
            implements LedgerCommand<Proposal> {

        public SubmitProposal {
            if (!Addresses.isUsableTarget(targetAddress)) {
                throw new GovernanceException(GovernanceError.INVALID_TARGET, "Invalid target address: " + targetAddress);
            }
            if (description == null || description.isBlank()) {
                throw new GovernanceException(GovernanceError.INVALID_DESCRIPTION, "Description required");
            }
            targetAddress = Addresses.normalize(targetAddress);
            description = description.strip();
            evidenceRef = evidenceRef == null || evidenceRef.isBlank() ? null : evidenceRef.strip();
            caller = requireAddress(caller);
        }
    }

    record CastVote(long proposalId, boolean support, long tokensStaked, String caller)
            implements LedgerCommand<Vote> {

        public CastVote {
            caller = requireAddress(caller);
            if (tokensStaked <= 0) {
                throw new GovernanceException(GovernanceError.INVALID_STAKE, "Stake must be positive: " + tokensStaked);
            }
        }
    }

    /** Anyone may settle, including the keeper, so the caller only has to be present. */
    record ExecuteProposal(long proposalId, String caller) implements LedgerCommand<SettlementResult> {

        public ExecuteProposal {
            if (caller == null || caller.isBlank()) {
                throw new GovernanceException(GovernanceError.INVALID_CALLER, "Caller identity required");
            }
            caller = caller.strip();
        }
    }

    record CreditTokens(String address, long amount, String caller) implements LedgerCommand<TokenAccount> {

        public CreditTokens {
            if (!Addresses.isWellFormed(address)) {
                throw new GovernanceException(GovernanceError.INVALID_TARGET, "Invalid token account address: " + address);
            }
            if (amount <= 0) {
                throw new GovernanceException(GovernanceError.INVALID_STAKE, "Credit amount must be positive: " + amount);
            }
            address = Addresses.normalize(address);
            caller = requireAddress(caller);
        }
    }

    private static String requireAddress(String caller) {
        if (!Addresses.isWellFormed(caller)) {
            throw new GovernanceException(GovernanceError.INVALID_CALLER, "Caller must be a wallet address: " + caller);
        }
        return Addresses.normalize(caller);
    }
}
