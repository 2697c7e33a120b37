package com.neuroshield.api.dto;

import com.neuroshield.domain.TokenAccount;

public record TokenBalanceResponse(String address, long balance, long escrowed) {

    public static TokenBalanceResponse from(TokenAccount account) {
        return new TokenBalanceResponse(account.getAddress(), account.getBalance(), account.getEscrowed());
    }
}
