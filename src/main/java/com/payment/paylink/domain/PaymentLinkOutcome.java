package com.payment.paylink.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one orchestration run: exactly one of {@link #getResult()} and
 * {@link #getError()} is non-null.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentLinkOutcome {

    PaymentLinkResult result;
    ClassifiedError error;

    public static PaymentLinkOutcome success(PaymentLinkResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new PaymentLinkOutcome(result, null);
    }

    public static PaymentLinkOutcome failure(ClassifiedError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new PaymentLinkOutcome(null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
