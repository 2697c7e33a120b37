package com.neuroshield.governance.proposal;

import com.neuroshield.common.Addresses;
import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.domain.TokenAccount;
import com.neuroshield.domain.Vote;
import com.neuroshield.domain.VoteRepository;
import com.neuroshield.domain.VoterProfile;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.escrow.TokenEscrow;
import com.neuroshield.governance.reputation.ReputationLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the ledger. Never writes and never takes the command lock.
 */
@Service
@RequiredArgsConstructor
public class ProposalQueryService {

    public static final String DAO_CONFIDENCE_CACHE = "daoConfidenceCache";

    private final ProposalRepository proposalRepository;
    private final VoteRepository voteRepository;
    private final ReputationLedger reputationLedger;
    private final TokenEscrow tokenEscrow;

    public Proposal getProposal(long proposalId) {
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> new GovernanceException(GovernanceError.PROPOSAL_NOT_FOUND,
                        "Proposal not found: " + proposalId));
    }

    /**
     * Newest first; all statuses when status is null.
     */
    public List<Proposal> listProposals(ProposalStatus status) {
        return status == null
                ? proposalRepository.findAllByOrderByIdDesc()
                : proposalRepository.findByStatusOrderByIdDesc(status);
    }

    public List<Vote> getProposalVotes(long proposalId) {
        getProposal(proposalId);
        return voteRepository.findByProposalIdOrderByCastAtAsc(proposalId);
    }

    public VoterProfile getVoterStats(String address) {
        return reputationLedger.profileOf(Addresses.normalize(address));
    }

    public TokenAccount getTokenBalance(String address) {
        return tokenEscrow.balanceOf(Addresses.normalize(address));
    }

    /**
     * Tallies of the latest executed proposal on the address. Evicted by the mirror on settlement.
     */
    @Cacheable(cacheNames = DAO_CONFIDENCE_CACHE, key = "#address")
    public DaoConfidence getDaoConfidence(String address) {
        return proposalRepository
                .findFirstByTargetAddressAndStatusOrderByIdDesc(address, ProposalStatus.EXECUTED)
                .map(p -> DaoConfidence.of(p.getForPower(), p.getAgainstPower(), voteRepository.countByProposalId(p.getId())))
                .orElse(DaoConfidence.NONE);
    }
}
