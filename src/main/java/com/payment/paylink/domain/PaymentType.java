package com.payment.paylink.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whether the link charges once or sets up a subscription.
 */
public enum PaymentType {
    ONE_TIME("one_time"),
    RECURRING("recurring");

    private final String wireName;

    PaymentType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<PaymentType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst();
    }
}
