package com.riskradar.domain;

import java.util.Locale;

/**
 * EVM address helpers.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private Addresses() {
    }

    /** Lowercase, stripped; null for null or blank input. */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String address) {
        return ZERO_ADDRESS.equals(normalize(address));
    }
}
