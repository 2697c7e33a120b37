package com.neuroshield.common;

import java.util.regex.Pattern;

/**
 * EVM address helpers shared by governance, risk and API layers.
 * Stored and compared form is trimmed lowercase.
 */
public final class Addresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private Addresses() {
    }

    public static boolean isWellFormed(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.strip()).matches();
    }

    /** Well-formed and not the zero address. */
    public static boolean isUsableTarget(String address) {
        return isWellFormed(address) && !ZERO_ADDRESS.equals(normalize(address));
    }

    /**
     * Trimmed lowercase form, or null for null/blank input.
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase();
    }
}
