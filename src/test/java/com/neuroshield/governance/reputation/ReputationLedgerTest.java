package com.neuroshield.governance.reputation;

import com.neuroshield.domain.ProposalOutcome;
import com.neuroshield.domain.Vote;
import com.neuroshield.domain.VoterProfile;
import com.neuroshield.domain.VoterProfileRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReputationLedgerTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x2222222222222222222222222222222222222222";

    @Mock
    VoterProfileRepository voterProfileRepository;

    @InjectMocks
    ReputationLedger reputationLedger;

    @Test
    @DisplayName("accuracy moves +5 / -10 and stays within [0, 100] for any sequence")
    void accuracyBounds() {
        int up = 0;
        int down = 100;
        for (int i = 0; i < 50; i++) {
            up = ReputationLedger.adjustAccuracy(up, true);
            down = ReputationLedger.adjustAccuracy(down, false);
            assertThat(up).isBetween(0, 100);
            assertThat(down).isBetween(0, 100);
        }
        assertThat(up).isEqualTo(100);
        assertThat(down).isZero();
        assertThat(ReputationLedger.adjustAccuracy(97, true)).isEqualTo(100);
        assertThat(ReputationLedger.adjustAccuracy(7, false)).isZero();
        assertThat(ReputationLedger.adjustAccuracy(50, true)).isEqualTo(55);
        assertThat(ReputationLedger.adjustAccuracy(50, false)).isEqualTo(40);
    }

    @Test
    @DisplayName("settlement rewards matching votes, penalises others, credits participation to all")
    void applySettlement() {
        VoterProfile alice = VoterProfile.fresh(ALICE);
        alice.setAccuracy(60);
        alice.setParticipation(2);
        VoterProfile bob = VoterProfile.fresh(BOB);
        bob.setAccuracy(60);
        when(voterProfileRepository.findById(ALICE)).thenReturn(Optional.of(alice));
        when(voterProfileRepository.findById(BOB)).thenReturn(Optional.of(bob));
        when(voterProfileRepository.save(any(VoterProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        List<VoterProfile> updated = reputationLedger.applySettlement(
                List.of(vote(ALICE, true), vote(BOB, false)), ProposalOutcome.PASSED);

        assertThat(updated).extracting(VoterProfile::getAccuracy).containsExactly(65, 50);
        assertThat(updated).extracting(VoterProfile::getParticipation).containsExactly(3, 1);
    }

    @Test
    @DisplayName("profileOf returns a zeroed profile without persisting it")
    void profileOfMissing() {
        when(voterProfileRepository.findById(ALICE)).thenReturn(Optional.empty());

        VoterProfile profile = reputationLedger.profileOf(ALICE);

        assertThat(profile.getAccuracy()).isZero();
        assertThat(profile.getParticipation()).isZero();
        verify(voterProfileRepository, never()).save(any());
    }

    private static Vote vote(String voter, boolean support) {
        Vote v = new Vote();
        v.setProposalId(1L);
        v.setVoterAddress(voter);
        v.setSupport(support);
        v.setTokensStaked(100);
        v.setPower(10);
        return v;
    }
}
