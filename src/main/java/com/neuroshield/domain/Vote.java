package com.neuroshield.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One voter's stake on one proposal. Immutable once cast; only {@code refunded} flips at settlement.
 */
@Document(collection = "votes")
@CompoundIndex(name = "proposal_voter", def = "{'proposalId': 1, 'voterAddress': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Vote {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Long proposalId;
    private String voterAddress;
    private boolean support;
    private long tokensStaked;
    private long power;
    private Instant castAt;
    private boolean refunded;
}
