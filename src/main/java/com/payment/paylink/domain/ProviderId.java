package com.payment.paylink.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of checkout processors. A new processor gets a new constant and its
 * own {@link com.payment.paylink.core.PaymentLinkProvider} implementation; existing
 * adapters are never branched on provider.
 */
public enum ProviderId {
    /** Single call per link. */
    TILOPAY("tilopay", "TiloPay"),
    /** Chain of dependent resources ending in a checkout session. */
    ONVO("onvo", "ONVO");

    private final String wireName;
    private final String displayName;

    ProviderId(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<ProviderId> fromWire(String value) {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(value))
                .findFirst();
    }
}
