package com.neuroshield.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for token_accounts keyed by normalized holder address.
 */
public interface TokenAccountRepository extends MongoRepository<TokenAccount, String> {
}
