package com.neuroshield.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Governance token holdings: spendable balance plus the amount locked in proposal escrow.
 */
@Document(collection = "token_accounts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenAccount {

    @Id
    @EqualsAndHashCode.Include
    private String address;
    private long balance;
    private long escrowed;

    public static TokenAccount empty(String address) {
        TokenAccount account = new TokenAccount();
        account.setAddress(address);
        return account;
    }
}
