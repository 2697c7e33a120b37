package com.neuroshield.governance.proposal;

import com.neuroshield.common.Addresses;
import com.neuroshield.domain.LedgerSequence;
import com.neuroshield.domain.LedgerSequenceRepository;
import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalOutcome;
import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalSettledEvent;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.domain.ProposalSubmittedEvent;
import com.neuroshield.domain.TrustRecord;
import com.neuroshield.domain.Vote;
import com.neuroshield.domain.VoteRepository;
import com.neuroshield.domain.VoterProfile;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.GovernanceProperties;
import com.neuroshield.governance.escrow.TokenEscrow;
import com.neuroshield.governance.power.VotingPowerCalculator;
import com.neuroshield.governance.reputation.ReputationLedger;
import com.neuroshield.governance.trust.TrustRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Proposal state machine: submit, vote, settle. Sole writer of proposals, votes, voter profiles and trust records.
 * <p>
 * Every operation validates before its first write and runs in one transaction, so a rejected call
 * changes nothing. Callers are expected to go through {@link com.neuroshield.governance.command.LedgerCommandGateway},
 * which serialises writes into a single order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalService {

    private final ProposalRepository proposalRepository;
    private final VoteRepository voteRepository;
    private final LedgerSequenceRepository ledgerSequenceRepository;
    private final VotingPowerCalculator votingPowerCalculator;
    private final ReputationLedger reputationLedger;
    private final TokenEscrow tokenEscrow;
    private final TrustRegistry trustRegistry;
    private final GovernanceProperties governanceProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Opens a proposal against targetAddress with deadline = now + voting period.
     * Several open proposals on the same target are allowed and settle independently.
     *
     * @throws GovernanceException INVALID_TARGET, INVALID_DESCRIPTION, INVALID_CALLER
     */
    @Transactional
    public Proposal submitProposal(String targetAddress, String description, String evidenceRef, String proposer) {
        if (!Addresses.isUsableTarget(targetAddress)) {
            throw new GovernanceException(GovernanceError.INVALID_TARGET, "Invalid target address: " + targetAddress);
        }
        if (description == null || description.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_DESCRIPTION, "Description required");
        }
        String proposerAddress = requireAddressCaller(proposer);

        Instant now = Instant.now(clock);
        Proposal proposal = new Proposal();
        proposal.setId(ledgerSequenceRepository.next(LedgerSequence.PROPOSAL_ID));
        proposal.setTargetAddress(Addresses.normalize(targetAddress));
        proposal.setDescription(description.strip());
        proposal.setEvidenceRef(evidenceRef);
        proposal.setProposerAddress(proposerAddress);
        proposal.setCreatedAt(now);
        proposal.setDeadline(now.plus(governanceProperties.getVotingPeriod()));
        proposal.setStatus(ProposalStatus.ACTIVE);
        Proposal saved = proposalRepository.save(proposal);

        applicationEventPublisher.publishEvent(
                new ProposalSubmittedEvent(saved.getId(), saved.getTargetAddress(), saved.getDeadline()));
        log.info("Proposal {} created by {} against {}; deadline {}",
                saved.getId(), proposerAddress, saved.getTargetAddress(), saved.getDeadline());
        return saved;
    }

    /**
     * Stakes tokens on one side of an open proposal. Tokens go to escrow until settlement; power is
     * computed from the voter's reputation at this moment. Participation is credited only at settlement.
     *
     * @throws GovernanceException INVALID_CALLER, INVALID_STAKE, PROPOSAL_NOT_FOUND, PROPOSAL_CLOSED,
     *                             DUPLICATE_VOTE, INSUFFICIENT_TOKENS
     */
    @Transactional
    public Vote castVote(long proposalId, String voter, boolean support, long tokensStaked) {
        String voterAddress = requireAddressCaller(voter);
        if (tokensStaked <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_STAKE, "Stake must be positive: " + tokensStaked);
        }
        Proposal proposal = requireProposal(proposalId);
        Instant now = Instant.now(clock);
        if (!proposal.isOpenAt(now)) {
            throw new GovernanceException(GovernanceError.PROPOSAL_CLOSED,
                    "Voting closed for proposal " + proposalId + " (deadline " + proposal.getDeadline() + ")");
        }
        if (voteRepository.existsByProposalIdAndVoterAddress(proposalId, voterAddress)) {
            throw new GovernanceException(GovernanceError.DUPLICATE_VOTE,
                    "Already voted on proposal " + proposalId + ": " + voterAddress);
        }
        tokenEscrow.requireSpendable(voterAddress, tokensStaked);

        VoterProfile profile = reputationLedger.ensureProfile(voterAddress);
        long power = votingPowerCalculator.power(tokensStaked, profile);
        tokenEscrow.lock(voterAddress, tokensStaked);

        if (support) {
            proposal.setForPower(proposal.getForPower() + power);
        } else {
            proposal.setAgainstPower(proposal.getAgainstPower() + power);
        }
        proposalRepository.save(proposal);

        Vote vote = new Vote();
        vote.setProposalId(proposalId);
        vote.setVoterAddress(voterAddress);
        vote.setSupport(support);
        vote.setTokensStaked(tokensStaked);
        vote.setPower(power);
        vote.setCastAt(now);
        Vote saved = voteRepository.save(vote);
        log.info("Vote on proposal {} by {}: support={} tokens={} power={}",
                proposalId, voterAddress, support, tokensStaked, power);
        return saved;
    }

    /**
     * Settles a proposal once its deadline has passed. Anyone may call; it succeeds exactly once.
     * Zero total power rejects without touching trust. Otherwise passes iff for * 100 / total >= threshold;
     * a pass raises the target's scam score. Every voter's reputation is updated and every stake is returned.
     *
     * @throws GovernanceException INVALID_CALLER, PROPOSAL_NOT_FOUND, ALREADY_EXECUTED, VOTING_STILL_OPEN
     */
    @Transactional
    public SettlementResult executeProposal(long proposalId, String caller) {
        if (caller == null || caller.isBlank()) {
            throw new GovernanceException(GovernanceError.INVALID_CALLER, "Caller identity required");
        }
        Proposal proposal = requireProposal(proposalId);
        if (proposal.getStatus() != ProposalStatus.ACTIVE) {
            throw new GovernanceException(GovernanceError.ALREADY_EXECUTED, "Proposal already executed: " + proposalId);
        }
        Instant now = Instant.now(clock);
        if (now.isBefore(proposal.getDeadline())) {
            throw new GovernanceException(GovernanceError.VOTING_STILL_OPEN,
                    "Voting still open for proposal " + proposalId + " until " + proposal.getDeadline());
        }

        ProposalOutcome outcome = decide(proposal.getForPower(), proposal.getAgainstPower(),
                governanceProperties.getPassThresholdPercent());
        proposal.transitionTo(outcome == ProposalOutcome.PASSED ? ProposalStatus.PASSED : ProposalStatus.REJECTED);

        String target = proposal.getTargetAddress();
        int newScore;
        boolean confirmed;
        if (outcome == ProposalOutcome.PASSED) {
            TrustRecord record = trustRegistry.recordConfirmation(target, proposalId);
            newScore = record.getScamScore();
            confirmed = record.isConfirmedScam();
        } else {
            newScore = trustRegistry.threatScore(target);
            confirmed = trustRegistry.isConfirmedScam(target);
        }

        List<Vote> votes = voteRepository.findByProposalIdOrderByCastAtAsc(proposalId);
        reputationLedger.applySettlement(votes, outcome);
        long returned = 0;
        for (Vote vote : votes) {
            tokenEscrow.release(vote.getVoterAddress(), vote.getTokensStaked());
            vote.setRefunded(true);
            returned += vote.getTokensStaked();
        }
        voteRepository.saveAll(votes);

        proposal.setOutcome(outcome);
        proposal.setExecutedAt(now);
        proposal.setExecutedBy(caller.strip());
        proposal.transitionTo(ProposalStatus.EXECUTED);
        proposalRepository.save(proposal);

        List<String> voters = votes.stream().map(Vote::getVoterAddress).toList();
        applicationEventPublisher.publishEvent(
                new ProposalSettledEvent(proposalId, outcome, target, newScore, confirmed, voters));
        log.info("Proposal {} settled {} (for={} against={}); target {} scamScore={}; {} voters refunded {} tokens",
                proposalId, outcome, proposal.getForPower(), proposal.getAgainstPower(),
                target, newScore, voters.size(), returned);
        return new SettlementResult(proposalId, outcome, target, proposal.getForPower(), proposal.getAgainstPower(),
                newScore, outcome == ProposalOutcome.PASSED, voters, returned);
    }

    /**
     * Single threshold on the for-side; zero total power is a rejection (no mandate).
     */
    static ProposalOutcome decide(long forPower, long againstPower, int thresholdPercent) {
        long total = forPower + againstPower;
        if (total == 0) {
            return ProposalOutcome.REJECTED;
        }
        return forPower * 100 / total >= thresholdPercent ? ProposalOutcome.PASSED : ProposalOutcome.REJECTED;
    }

    private Proposal requireProposal(long proposalId) {
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> new GovernanceException(GovernanceError.PROPOSAL_NOT_FOUND,
                        "Proposal not found: " + proposalId));
    }

    private static String requireAddressCaller(String caller) {
        if (!Addresses.isWellFormed(caller)) {
            throw new GovernanceException(GovernanceError.INVALID_CALLER, "Caller must be a wallet address: " + caller);
        }
        return Addresses.normalize(caller);
    }
}
