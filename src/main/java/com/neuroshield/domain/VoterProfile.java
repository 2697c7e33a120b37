package com.neuroshield.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Per-participant reputation. Created lazily on first vote; adjusted only by settlement.
 */
@Document(collection = "voter_profiles")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class VoterProfile {

    public static final int MIN_ACCURACY = 0;
    public static final int MAX_ACCURACY = 100;

    @Id
    @EqualsAndHashCode.Include
    private String address;
    /** 0..100. */
    private int accuracy;
    private int participation;

    public static VoterProfile fresh(String address) {
        VoterProfile profile = new VoterProfile();
        profile.setAddress(address);
        profile.setAccuracy(MIN_ACCURACY);
        profile.setParticipation(0);
        return profile;
    }
}
