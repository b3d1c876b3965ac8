package com.payment.paylink.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Billing period of a recurring link. The interval count is always 1.
 */
public enum BillingInterval {
    MONTH("month"),
    YEAR("year");

    private final String wireName;

    BillingInterval(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<BillingInterval> fromWire(String value) {
        return Arrays.stream(values())
                .filter(i -> i.wireName.equals(value))
                .findFirst();
    }
}
