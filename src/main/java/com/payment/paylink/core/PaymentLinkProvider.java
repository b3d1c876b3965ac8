package com.payment.paylink.core;

import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentLinkResult;
import com.payment.paylink.domain.ProviderId;

/**
 * Contract every checkout processor integration implements. Implementing it
 * keeps provider-specific step counts, payload shapes and error bodies out of
 * {@link PaymentLinkOrchestrator}:
 * <ul>
 *   <li>one adapter per {@link ProviderId}</li>
 *   <li>amounts arrive already in the minor unit</li>
 *   <li>failures are raised as {@link PaymentLinkException}, never returned as partial results</li>
 * </ul>
 * Calls are not idempotent in effect: invoking an operation twice with the same
 * request creates two sets of provider-side resources and two distinct URLs.
 */
public interface PaymentLinkProvider {

    /**
     * Processor this adapter talks to. Used by the orchestrator to route requests.
     */
    ProviderId getProviderId();

    /**
     * Create a hosted checkout link for a single payment.
     *
     * @param request validated request, {@code paymentType == ONE_TIME}
     * @return redirect URL (never null)
     */
    PaymentLinkResult createOneTimePaymentLink(NormalizedPaymentRequest request);

    /**
     * Create a hosted checkout link that starts a subscription billed every
     * {@link NormalizedPaymentRequest#getInterval()}.
     *
     * @param request validated request, {@code paymentType == RECURRING}
     * @return redirect URL (never null)
     */
    PaymentLinkResult createSubscriptionLink(NormalizedPaymentRequest request);
}
