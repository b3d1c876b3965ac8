package com.payment.paylink.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.paylink.core.PaymentLinkException;
import com.payment.paylink.core.PaymentLinkProvider;
import com.payment.paylink.core.ProviderHttpClient;
import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentLinkResult;
import com.payment.paylink.domain.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TiloPay adapter. One call per link: TiloPay creates the payment intent or the
 * subscription and answers with the hosted checkout {@code url} directly.
 */
@Slf4j
@Component
public class TilopayPaymentLinkProvider implements PaymentLinkProvider {

    static final String PAYMENT_INTENTS_PATH = "/payment_intents";
    static final String SUBSCRIPTIONS_PATH = "/subscriptions";

    private final ProviderHttpClient httpClient;

    public TilopayPaymentLinkProvider(@Qualifier("tilopayHttpClient") ProviderHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.TILOPAY;
    }

    @Override
    public PaymentLinkResult createOneTimePaymentLink(NormalizedPaymentRequest request) {
        log.debug("TiloPay one-time link amount={} currency={}", request.getAmountMinor(), request.getCurrency());
        return callForUrl(PAYMENT_INTENTS_PATH, payload(request, false));
    }

    @Override
    public PaymentLinkResult createSubscriptionLink(NormalizedPaymentRequest request) {
        log.debug("TiloPay subscription link amount={} currency={} interval={}",
                request.getAmountMinor(), request.getCurrency(), request.getInterval());
        return callForUrl(SUBSCRIPTIONS_PATH, payload(request, true));
    }

    private PaymentLinkResult callForUrl(String path, Map<String, Object> payload) {
        JsonNode response = httpClient.post(path, payload);
        String url = response.path("url").asText(null);
        if (url == null || url.isBlank()) {
            throw PaymentLinkException.api("TiloPay API error: malformed response: missing url", null, null);
        }
        return new PaymentLinkResult(url);
    }

    private static Map<String, Object> payload(NormalizedPaymentRequest request, boolean recurring) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", request.getAmountMinor());
        payload.put("currency", request.getCurrency().name());
        if (recurring) {
            payload.put("interval", request.getInterval().getWireName());
        }
        if (request.hasDescription()) {
            payload.put("description", request.getDescription());
        }
        payload.put("success_url", request.getSuccessUrl());
        payload.put("cancel_url", request.getCancelUrl());
        return payload;
    }
}
