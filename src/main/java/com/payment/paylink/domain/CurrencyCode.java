package com.payment.paylink.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Currencies a checkout link can be issued in. Both use a 1:100 minor unit
 * (cents / céntimos), so no per-currency exponent table is kept.
 */
public enum CurrencyCode {
    USD,
    CRC;

    /** Exact, case-sensitive match against the ISO code. */
    public static Optional<CurrencyCode> fromWire(String value) {
        return Arrays.stream(values())
                .filter(c -> c.name().equals(value))
                .findFirst();
    }
}
