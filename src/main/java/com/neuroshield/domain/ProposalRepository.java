package com.neuroshield.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for proposals keyed by the monotonically increasing proposal id.
 */
public interface ProposalRepository extends MongoRepository<Proposal, Long> {

    List<Proposal> findAllByOrderByIdDesc();

    List<Proposal> findByStatusOrderByIdDesc(ProposalStatus status);

    List<Proposal> findByTargetAddressAndStatus(String targetAddress, ProposalStatus status);

    boolean existsByTargetAddressAndStatus(String targetAddress, ProposalStatus status);

    /** Latest settled proposal on an address; backs the DAO confidence read. */
    Optional<Proposal> findFirstByTargetAddressAndStatusOrderByIdDesc(String targetAddress, ProposalStatus status);

    /** Active proposals whose deadline has passed; picked up by the settlement keeper. */
    List<Proposal> findByStatusAndDeadlineLessThanEqualOrderByIdAsc(ProposalStatus status, Instant cutoff);
}
