package com.payment.paylink.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Validated payment link request. Every provider call consumes this; the amount
 * is already in the currency's minor unit.
 */
@Value
@Builder
public class NormalizedPaymentRequest {

    /** Amount in cents / céntimos, always > 0. */
    long amountMinor;

    CurrencyCode currency;

    PaymentType paymentType;

    /** Non-null iff {@link #paymentType} is {@link PaymentType#RECURRING}. */
    BillingInterval interval;

    /** Trimmed, never blank; null when absent. */
    String description;

    String successUrl;

    String cancelUrl;

    public boolean hasDescription() {
        return description != null;
    }
}
