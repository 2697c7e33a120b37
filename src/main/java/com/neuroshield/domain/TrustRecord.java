package com.neuroshield.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Community verdict for an address. Written only when a proposal on the address passes settlement.
 * scamScore never decreases and confirmed is never reset.
 */
@Document(collection = "trust_records")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TrustRecord {

    public static final int MAX_SCAM_SCORE = 100;

    @Id
    @EqualsAndHashCode.Include
    private String address;
    private int scamScore;
    private boolean confirmedScam;
    private int confirmations;
    private Long lastProposalId;
    private Instant updatedAt;
}
