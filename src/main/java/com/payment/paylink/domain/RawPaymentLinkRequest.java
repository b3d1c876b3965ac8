package com.payment.paylink.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Payment link request exactly as received from the caller, before any
 * validation. Field types are deliberately loose: the validator decides what
 * is acceptable.
 */
@Value
@Builder
public class RawPaymentLinkRequest {

    /** Major-unit amount; any JSON value (number, string, null...). */
    Object amount;

    String currency;

    /** "one_time" or "recurring". */
    String paymentType;

    /** "month" or "year"; only read for recurring links. */
    String interval;

    String description;

    String successUrl;

    String cancelUrl;
}
