package com.neuroshield.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for votes; unique on (proposalId, voterAddress).
 */
public interface VoteRepository extends MongoRepository<Vote, String> {

    boolean existsByProposalIdAndVoterAddress(Long proposalId, String voterAddress);

    List<Vote> findByProposalIdOrderByCastAtAsc(Long proposalId);

    long countByProposalId(Long proposalId);
}
