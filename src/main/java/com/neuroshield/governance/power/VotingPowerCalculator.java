package com.neuroshield.governance.power;

import com.neuroshield.common.IntMath;
import com.neuroshield.domain.VoterProfile;
import org.springframework.stereotype.Component;

/**
 * Quadratic voting power: floor(sqrt(tokens)), times 1.2 (floored) for voters with a proven record.
 * Pure; defined for every non-negative stake.
 */
@Component
public class VotingPowerCalculator {

    static final int BONUS_MIN_ACCURACY_EXCLUSIVE = 80;
    static final int BONUS_MIN_PARTICIPATION = 5;

    public long power(long tokensStaked, VoterProfile profile) {
        if (tokensStaked < 0) {
            throw new IllegalArgumentException("tokensStaked must be non-negative: " + tokensStaked);
        }
        long base = IntMath.floorSqrt(tokensStaked);
        if (qualifiesForBonus(profile)) {
            // x1.2 == x6/5; base <= ~3.04e9 so the product cannot overflow
            return base * 6 / 5;
        }
        return base;
    }

    public boolean qualifiesForBonus(VoterProfile profile) {
        return profile != null
                && profile.getAccuracy() > BONUS_MIN_ACCURACY_EXCLUSIVE
                && profile.getParticipation() >= BONUS_MIN_PARTICIPATION;
    }
}
