package com.payment.paylink.domain;

import lombok.Value;

/**
 * Hosted checkout URL the payer is redirected to. The only successful output,
 * whatever the provider or payment type.
 */
@Value
public class PaymentLinkResult {

    String url;
}
