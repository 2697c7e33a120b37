package com.neuroshield.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for trust_records keyed by normalized target address.
 */
public interface TrustRecordRepository extends MongoRepository<TrustRecord, String> {
}
