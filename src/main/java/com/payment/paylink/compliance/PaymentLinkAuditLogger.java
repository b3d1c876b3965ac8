package com.payment.paylink.compliance;

import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentLinkOutcome;
import com.payment.paylink.domain.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs payment link attempts and outcomes for audit. Only validated requests are
 * audited; credentials and payer-facing URLs are never written.
 */
@Slf4j
@Component
public class PaymentLinkAuditLogger {

    public void logRequest(ProviderId provider, NormalizedPaymentRequest request) {
        log.info("[AUDIT] PAYMENT_LINK_REQUEST provider={} type={} amountMinor={} currency={} interval={}",
                provider,
                request.getPaymentType(),
                request.getAmountMinor(),
                request.getCurrency(),
                request.getInterval());
    }

    public void logResult(ProviderId provider, NormalizedPaymentRequest request, PaymentLinkOutcome outcome) {
        if (outcome.isSuccess()) {
            log.info("[AUDIT] PAYMENT_LINK_RESULT provider={} type={} status=CREATED",
                    provider, request.getPaymentType());
            return;
        }
        ClassifiedError error = outcome.getError();
        log.info("[AUDIT] PAYMENT_LINK_RESULT provider={} type={} status=FAILED kind={} providerStatus={} providerCode={}",
                provider,
                request.getPaymentType(),
                error.getKind(),
                error.getHttpStatus(),
                error.getProviderCode());
    }
}
