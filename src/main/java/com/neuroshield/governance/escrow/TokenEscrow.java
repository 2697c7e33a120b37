package com.neuroshield.governance.escrow;

import com.neuroshield.domain.TokenAccount;
import com.neuroshield.domain.TokenAccountRepository;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Governance token balances and proposal-scoped escrow. Tokens only move spendable → escrow on vote
 * and escrow → spendable at settlement; nothing is burned or confiscated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenEscrow {

    private final TokenAccountRepository tokenAccountRepository;

    public TokenAccount balanceOf(String address) {
        return tokenAccountRepository.findById(address).orElseGet(() -> TokenAccount.empty(address));
    }

    /**
     * Distribution: adds to the spendable balance.
     */
    public TokenAccount credit(String address, long amount) {
        if (amount <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_STAKE, "Credit amount must be positive: " + amount);
        }
        TokenAccount account = balanceOf(address);
        account.setBalance(Math.addExact(account.getBalance(), amount));
        log.info("Credited {} tokens to {}", amount, address);
        return tokenAccountRepository.save(account);
    }

    /**
     * Throws INSUFFICIENT_TOKENS when the spendable balance is below amount. Performs no write.
     */
    public void requireSpendable(String address, long amount) {
        requireSpendable(balanceOf(address), amount);
    }

    /**
     * Moves amount from spendable balance into escrow.
     */
    public TokenAccount lock(String address, long amount) {
        TokenAccount account = balanceOf(address);
        requireSpendable(account, amount);
        long escrowed = Math.addExact(account.getEscrowed(), amount);
        account.setBalance(account.getBalance() - amount);
        account.setEscrowed(escrowed);
        return tokenAccountRepository.save(account);
    }

    /**
     * Returns amount from escrow to the spendable balance.
     */
    public TokenAccount release(String address, long amount) {
        TokenAccount account = balanceOf(address);
        if (account.getEscrowed() < amount) {
            throw new IllegalStateException("Escrow " + account.getEscrowed() + " below release " + amount + " for " + address);
        }
        long balance = Math.addExact(account.getBalance(), amount);
        account.setEscrowed(account.getEscrowed() - amount);
        account.setBalance(balance);
        return tokenAccountRepository.save(account);
    }

    private static void requireSpendable(TokenAccount account, long amount) {
        if (account.getBalance() < amount) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_TOKENS,
                    "Balance " + account.getBalance() + " below stake " + amount + " for " + account.getAddress());
        }
    }
}
