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
import java.util.List;
import java.util.Map;

/**
 * ONVO adapter. ONVO has no single "pay this amount" call: every link is the
 * end of a chain of dependent resources, each created with the id returned by
 * the previous one, terminating in a checkout session that carries the hosted
 * {@code url}.
 * <p>
 * One-time: Product, Price (one_time), PaymentIntent, CheckoutSession.<br>
 * Subscription: Customer, Product, Price (recurring), Subscription, CheckoutSession.
 * <p>
 * The first failing step aborts the chain and its error propagates unchanged.
 * Resources created by earlier steps are left on ONVO's side.
 */
@Slf4j
@Component
public class OnvoPaymentLinkProvider implements PaymentLinkProvider {

    static final String CUSTOMERS_PATH = "/customers";
    static final String PRODUCTS_PATH = "/products";
    static final String PRICES_PATH = "/prices";
    static final String PAYMENT_INTENTS_PATH = "/payment-intents";
    static final String SUBSCRIPTIONS_PATH = "/subscriptions";
    static final String CHECKOUT_SESSIONS_PATH = "/checkout/sessions/one-time-link";

    static final String DEFAULT_ONE_TIME_PRODUCT_NAME = "Payment";
    static final String DEFAULT_SUBSCRIPTION_PRODUCT_NAME = "Subscription";

    private final ProviderHttpClient httpClient;

    public OnvoPaymentLinkProvider(@Qualifier("onvoHttpClient") ProviderHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.ONVO;
    }

    @Override
    public PaymentLinkResult createOneTimePaymentLink(NormalizedPaymentRequest request) {
        String productId = createProduct(request, DEFAULT_ONE_TIME_PRODUCT_NAME);

        Map<String, Object> price = pricePayload(productId, request);
        price.put("type", "one_time");
        String priceId = createAndGetId(PRICES_PATH, price, "price");

        // Not referenced later, but ONVO only authorizes capture once the intent exists.
        createPaymentIntent(request);

        return createCheckoutSession(priceId, request);
    }

    @Override
    public PaymentLinkResult createSubscriptionLink(NormalizedPaymentRequest request) {
        String customerId = createAndGetId(CUSTOMERS_PATH, new LinkedHashMap<>(), "customer");
        String productId = createProduct(request, DEFAULT_SUBSCRIPTION_PRODUCT_NAME);

        Map<String, Object> recurring = new LinkedHashMap<>();
        recurring.put("interval", request.getInterval().getWireName());
        recurring.put("intervalCount", 1);
        Map<String, Object> price = pricePayload(productId, request);
        price.put("type", "recurring");
        price.put("recurring", recurring);
        String priceId = createAndGetId(PRICES_PATH, price, "price");

        Map<String, Object> subscription = new LinkedHashMap<>();
        subscription.put("customerId", customerId);
        // Payment is collected by the checkout session, not at creation.
        subscription.put("paymentBehavior", "allow_incomplete");
        subscription.put("items", List.of(lineItem(priceId)));
        String subscriptionId = createAndGetId(SUBSCRIPTIONS_PATH, subscription, "subscription");
        log.debug("ONVO subscription created subscriptionId={} customerId={}", subscriptionId, customerId);

        return createCheckoutSession(priceId, request);
    }

    private String createProduct(NormalizedPaymentRequest request, String defaultName) {
        Map<String, Object> product = new LinkedHashMap<>();
        product.put("name", request.hasDescription() ? request.getDescription() : defaultName);
        product.put("isActive", true);
        product.put("isShippable", false);
        return createAndGetId(PRODUCTS_PATH, product, "product");
    }

    private static Map<String, Object> pricePayload(String productId, NormalizedPaymentRequest request) {
        Map<String, Object> price = new LinkedHashMap<>();
        price.put("productId", productId);
        price.put("unitAmount", request.getAmountMinor());
        price.put("currency", request.getCurrency().name());
        price.put("isActive", true);
        return price;
    }

    private void createPaymentIntent(NormalizedPaymentRequest request) {
        Map<String, Object> intent = new LinkedHashMap<>();
        intent.put("amount", request.getAmountMinor());
        intent.put("currency", request.getCurrency().name());
        intent.put("captureMethod", "automatic");
        if (request.hasDescription()) {
            intent.put("description", request.getDescription());
        }
        String intentId = createAndGetId(PAYMENT_INTENTS_PATH, intent, "payment intent");
        log.debug("ONVO payment intent created paymentIntentId={}", intentId);
    }

    private PaymentLinkResult createCheckoutSession(String priceId, NormalizedPaymentRequest request) {
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("lineItems", List.of(lineItem(priceId)));
        session.put("redirectUrl", request.getSuccessUrl());
        session.put("cancelUrl", request.getCancelUrl());

        JsonNode response = httpClient.post(CHECKOUT_SESSIONS_PATH, session);
        String url = response.path("url").asText(null);
        if (url == null || url.isBlank()) {
            throw PaymentLinkException.api("ONVO API error: malformed response: missing url", null, null);
        }
        log.info("ONVO checkout session created sessionId={} priceId={}", response.path("id").asText(null), priceId);
        return new PaymentLinkResult(url);
    }

    private String createAndGetId(String path, Map<String, Object> payload, String resource) {
        JsonNode response = httpClient.post(path, payload);
        String id = response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw PaymentLinkException.api("ONVO API error: malformed response: missing " + resource + " id", null, null);
        }
        return id;
    }

    private static Map<String, Object> lineItem(String priceId) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("priceId", priceId);
        item.put("quantity", 1);
        return item;
    }
}
