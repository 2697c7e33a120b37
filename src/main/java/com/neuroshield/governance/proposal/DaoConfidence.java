package com.neuroshield.governance.proposal;

/**
 * Community backing behind an address's verdict, taken from its most recently executed proposal.
 * All zero when no proposal on the address has been executed.
 */
public record DaoConfidence(long forPower, long againstPower, long totalVoters, int confidencePercent) {

    public static final DaoConfidence NONE = new DaoConfidence(0, 0, 0, 0);

    public static DaoConfidence of(long forPower, long againstPower, long totalVoters) {
        long total = forPower + againstPower;
        int percent = total == 0 ? 0 : (int) (forPower * 100 / total);
        return new DaoConfidence(forPower, againstPower, totalVoters, percent);
    }
}
