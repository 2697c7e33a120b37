package com.neuroshield.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Named counter in ledger_sequences. Incremented atomically by {@link LedgerSequenceRepositoryImpl}.
 */
@Document(collection = "ledger_sequences")
@NoArgsConstructor
@Getter
@Setter
public class LedgerSequence {

    public static final String PROPOSAL_ID = "proposal_id";

    @Id
    private String name;
    private long value;
}
