package com.payment.paylink.core;

import com.payment.paylink.compliance.PaymentLinkAuditLogger;
import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.ErrorKind;
import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentLinkOutcome;
import com.payment.paylink.domain.PaymentLinkResult;
import com.payment.paylink.domain.PaymentType;
import com.payment.paylink.domain.ProviderId;
import com.payment.paylink.domain.RawPaymentLinkRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Validates a payment link request, picks the provider adapter and the operation
 * for its payment type, and turns whatever happens into a {@link PaymentLinkOutcome}.
 * No retries, no fallback provider: a failed step is final for the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLinkOrchestrator {

    private static final Map<PaymentType, BiFunction<PaymentLinkProvider, NormalizedPaymentRequest, PaymentLinkResult>> OPERATIONS;

    static {
        Map<PaymentType, BiFunction<PaymentLinkProvider, NormalizedPaymentRequest, PaymentLinkResult>> operations =
                new EnumMap<>(PaymentType.class);
        operations.put(PaymentType.ONE_TIME, PaymentLinkProvider::createOneTimePaymentLink);
        operations.put(PaymentType.RECURRING, PaymentLinkProvider::createSubscriptionLink);
        OPERATIONS = Collections.unmodifiableMap(operations);
    }

    private final List<PaymentLinkProvider> providers;
    private final PaymentLinkRequestValidator validator;
    private final PaymentLinkAuditLogger auditLogger;

    private Map<ProviderId, PaymentLinkProvider> providerById;

    @jakarta.annotation.PostConstruct
    void init() {
        Map<ProviderId, PaymentLinkProvider> byId = new EnumMap<>(ProviderId.class);
        for (PaymentLinkProvider provider : providers) {
            PaymentLinkProvider previous = byId.putIfAbsent(provider.getProviderId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for provider " + provider.getProviderId()
                        + ": " + previous.getClass().getSimpleName() + ", " + provider.getClass().getSimpleName());
            }
        }
        providerById = Collections.unmodifiableMap(byId);
        log.info("Registered payment link providers: {}", providerById.keySet());
        for (ProviderId id : ProviderId.values()) {
            if (!providerById.containsKey(id)) {
                log.warn("No adapter registered for provider {}; requests for it will be rejected", id);
            }
        }
    }

    /**
     * Create a hosted checkout link.
     *
     * @param provider wire name of the processor ("tilopay" or "onvo")
     * @param request  request as received
     * @return the URL, or the classified reason there is none (never null)
     */
    public PaymentLinkOutcome generate(String provider, RawPaymentLinkRequest request) {
        NormalizedPaymentRequest normalized;
        try {
            normalized = validator.validate(request);
        } catch (PaymentLinkException e) {
            log.debug("Rejected payment link request: {}", e.getMessage());
            return PaymentLinkOutcome.failure(e.getError());
        }

        Optional<ProviderId> providerId = ProviderId.fromWire(provider);
        PaymentLinkProvider adapter = providerId.map(providerById::get).orElse(null);
        if (adapter == null) {
            log.debug("Rejected payment link request: unknown provider {}", provider);
            return PaymentLinkOutcome.failure(ClassifiedError.of(ErrorKind.VALIDATION,
                    "provider must be \"tilopay\" or \"onvo\" (received \"" + provider + "\")"));
        }

        auditLogger.logRequest(adapter.getProviderId(), normalized);
        PaymentLinkOutcome outcome = invoke(adapter, normalized);
        auditLogger.logResult(adapter.getProviderId(), normalized, outcome);
        return outcome;
    }

    public Optional<PaymentLinkProvider> getProvider(ProviderId providerId) {
        return Optional.ofNullable(providerById.get(providerId));
    }

    private PaymentLinkOutcome invoke(PaymentLinkProvider adapter, NormalizedPaymentRequest request) {
        ProviderId providerId = adapter.getProviderId();
        try {
            PaymentLinkResult result = OPERATIONS.get(request.getPaymentType()).apply(adapter, request);
            if (result == null || result.getUrl() == null) {
                log.error("Adapter {} returned no URL for type={}", adapter.getClass().getSimpleName(), request.getPaymentType());
                return PaymentLinkOutcome.failure(ClassifiedError.of(ErrorKind.UNEXPECTED,
                        providerId.getDisplayName() + " adapter returned no URL"));
            }
            log.info("Payment link created provider={} type={}", providerId, request.getPaymentType());
            return PaymentLinkOutcome.success(result);
        } catch (PaymentLinkException e) {
            log.warn("Payment link failed provider={} type={} kind={} status={}: {}",
                    providerId, request.getPaymentType(), e.getKind(), e.getError().getHttpStatus(), e.getMessage());
            return PaymentLinkOutcome.failure(e.getError());
        } catch (RuntimeException e) {
            log.error("Unexpected error creating payment link provider={} type={}", providerId, request.getPaymentType(), e);
            return PaymentLinkOutcome.failure(ClassifiedError.of(ErrorKind.UNEXPECTED, getMessageOrCause(e)));
        }
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
