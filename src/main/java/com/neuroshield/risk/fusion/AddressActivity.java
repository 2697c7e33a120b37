package com.neuroshield.risk.fusion;

import java.math.BigInteger;

/**
 * On-chain footprint of the destination address, as far as the caller knows it.
 *
 * @param balance          native balance in wei
 * @param transactionCount transactions sent from the address
 */
public record AddressActivity(BigInteger balance, long transactionCount) {

    public static final AddressActivity NONE = new AddressActivity(BigInteger.ZERO, 0);

    /** Never funded and never used. */
    public boolean isPristine() {
        return balance != null && balance.signum() == 0 && transactionCount == 0;
    }
}
