package com.neuroshield.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for voter_profiles keyed by normalized voter address.
 */
public interface VoterProfileRepository extends MongoRepository<VoterProfile, String> {
}
