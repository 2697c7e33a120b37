package com.neuroshield.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed counter: findAndModify $inc with upsert, returning the incremented value.
 */
@Repository
@RequiredArgsConstructor
public class LedgerSequenceRepositoryImpl implements LedgerSequenceRepository {

    private final MongoTemplate mongoTemplate;

    @Override
    public long next(String sequenceName) {
        Query query = new Query(where("_id").is(sequenceName));
        Update update = new Update().inc("value", 1L);
        LedgerSequence sequence = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true).upsert(true), LedgerSequence.class);
        if (sequence == null) {
            throw new IllegalStateException("Sequence upsert returned nothing for " + sequenceName);
        }
        return sequence.getValue();
    }
}
