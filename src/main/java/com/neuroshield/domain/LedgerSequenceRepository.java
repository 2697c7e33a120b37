package com.neuroshield.domain;

/**
 * Issues monotonically increasing ids. First value handed out for a fresh sequence is 1.
 */
public interface LedgerSequenceRepository {

    long next(String sequenceName);
}
