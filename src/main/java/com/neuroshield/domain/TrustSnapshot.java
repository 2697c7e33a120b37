package com.neuroshield.domain;

/**
 * Read-side view of an address's community verdict plus whether an unresolved proposal targets it.
 * Produced by the trust registry or the ledger mirror; consumed by risk fusion.
 */
public record TrustSnapshot(
        String address,
        boolean hasRecord,
        int scamScore,
        boolean confirmedScam,
        boolean hasActiveProposal
) {

    public static TrustSnapshot unknown(String address) {
        return new TrustSnapshot(address, false, 0, false, false);
    }

    public static TrustSnapshot of(String address, TrustRecord record, boolean hasActiveProposal) {
        if (record == null) {
            return new TrustSnapshot(address, false, 0, false, hasActiveProposal);
        }
        return new TrustSnapshot(address, true, record.getScamScore(), record.isConfirmedScam(), hasActiveProposal);
    }

    /** No verdict and no open review. */
    public boolean isBlank() {
        return !hasRecord && !confirmedScam && scamScore == 0 && !hasActiveProposal;
    }
}
