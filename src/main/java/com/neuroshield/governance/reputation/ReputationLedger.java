package com.neuroshield.governance.reputation;

import com.neuroshield.domain.ProposalOutcome;
import com.neuroshield.domain.Vote;
import com.neuroshield.domain.VoterProfile;
import com.neuroshield.domain.VoterProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Voter accuracy and participation. Profiles are created on first vote and only settlement adjusts them:
 * +5 accuracy (cap 100) when the vote matched the outcome, -10 (floor 0) otherwise, participation +1 either way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReputationLedger {

    static final int ACCURACY_REWARD = 5;
    static final int ACCURACY_PENALTY = 10;

    private final VoterProfileRepository voterProfileRepository;

    /**
     * Current profile, or a zeroed profile (not persisted) when the address has never voted.
     */
    public VoterProfile profileOf(String voterAddress) {
        return voterProfileRepository.findById(voterAddress)
                .orElseGet(() -> VoterProfile.fresh(voterAddress));
    }

    /**
     * Returns the stored profile, creating it with accuracy 0 / participation 0 if missing.
     */
    public VoterProfile ensureProfile(String voterAddress) {
        return voterProfileRepository.findById(voterAddress)
                .orElseGet(() -> voterProfileRepository.save(VoterProfile.fresh(voterAddress)));
    }

    /**
     * Credits every voter of a settled proposal. Returns the updated profiles in vote order.
     */
    public List<VoterProfile> applySettlement(List<Vote> votes, ProposalOutcome outcome) {
        List<VoterProfile> updated = new ArrayList<>(votes.size());
        for (Vote vote : votes) {
            VoterProfile profile = profileOf(vote.getVoterAddress());
            boolean correct = outcome.matches(vote.isSupport());
            profile.setAccuracy(adjustAccuracy(profile.getAccuracy(), correct));
            profile.setParticipation(profile.getParticipation() + 1);
            updated.add(voterProfileRepository.save(profile));
            log.debug("Reputation {} on proposal {}: correct={} accuracy={} participation={}",
                    vote.getVoterAddress(), vote.getProposalId(), correct,
                    profile.getAccuracy(), profile.getParticipation());
        }
        return updated;
    }

    static int adjustAccuracy(int accuracy, boolean correct) {
        if (correct) {
            return Math.min(VoterProfile.MAX_ACCURACY, accuracy + ACCURACY_REWARD);
        }
        return Math.max(VoterProfile.MIN_ACCURACY, accuracy - ACCURACY_PENALTY);
    }
}
