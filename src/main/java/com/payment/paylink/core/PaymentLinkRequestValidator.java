package com.payment.paylink.core;

import com.payment.paylink.domain.BillingInterval;
import com.payment.paylink.domain.CurrencyCode;
import com.payment.paylink.domain.NormalizedPaymentRequest;
import com.payment.paylink.domain.PaymentType;
import com.payment.paylink.domain.RawPaymentLinkRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Validates a raw payment link request and re-expresses its amount in the minor
 * currency unit. Rules run in a fixed order and the first failure wins.
 */
@Component
public class PaymentLinkRequestValidator {

    public static final int MAX_DESCRIPTION_LENGTH = 200;

    private static final int MINOR_UNIT_DIGITS = 2;
    private static final long MINOR_UNITS_PER_MAJOR = 100L;
    /** 2^63: doubles at or above it do not fit in a long. */
    private static final double LONG_RANGE_LIMIT = 0x1p63;

    /**
     * @throws PaymentLinkException with kind {@code VALIDATION} on the first broken rule
     */
    public NormalizedPaymentRequest validate(RawPaymentLinkRequest raw) {
        if (raw == null) {
            throw PaymentLinkException.validation("Request body must be a JSON object");
        }
        long amountMinor = validateAmount(raw.getAmount());
        CurrencyCode currency = validateCurrency(raw.getCurrency());

        PaymentType paymentType = PaymentType.fromWire(raw.getPaymentType())
                .orElseThrow(() -> PaymentLinkException.validation("type must be \"one_time\" or \"recurring\""));

        BillingInterval interval = null;
        if (paymentType == PaymentType.RECURRING) {
            interval = BillingInterval.fromWire(raw.getInterval())
                    .orElseThrow(() -> PaymentLinkException.validation("interval must be \"month\" or \"year\""));
        }

        requireHttpUrl(raw.getSuccessUrl(), "success_url");
        requireHttpUrl(raw.getCancelUrl(), "cancel_url");

        String description = normalizeDescription(raw.getDescription());

        return NormalizedPaymentRequest.builder()
                .amountMinor(amountMinor)
                .currency(currency)
                .paymentType(paymentType)
                .interval(interval)
                .description(description)
                .successUrl(raw.getSuccessUrl())
                .cancelUrl(raw.getCancelUrl())
                .build();
    }

    /**
     * Amount rule alone, for callers that check fields before building a full request.
     *
     * @return the amount in minor units
     */
    public long validateAmount(Object amount) {
        return toMinorUnits(amount);
    }

    public CurrencyCode validateCurrency(String currency) {
        return CurrencyCode.fromWire(currency)
                .orElseThrow(() -> PaymentLinkException.validation("currency must be \"USD\" or \"CRC\""));
    }

    /**
     * round(amount * 100). JSON fractions arrive as doubles and are scaled and
     * rounded as doubles, so 1.005 becomes 100. Exact decimals round half-up.
     */
    static long toMinorUnits(Object value) {
        if (value instanceof BigDecimal) {
            return toMinorUnits((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            return toMinorUnits(new BigDecimal((BigInteger) value));
        }
        if (value instanceof Double || value instanceof Float) {
            double amount = ((Number) value).doubleValue();
            if (!Double.isFinite(amount) || amount <= 0) {
                throw invalidAmount();
            }
            double scaled = amount * MINOR_UNITS_PER_MAJOR;
            if (scaled >= LONG_RANGE_LIMIT) {
                throw PaymentLinkException.validation("amount is too large");
            }
            return requireChargeable(Math.round(scaled));
        }
        if (value instanceof Number) {
            long amount = ((Number) value).longValue();
            if (amount <= 0) {
                throw invalidAmount();
            }
            try {
                return Math.multiplyExact(amount, MINOR_UNITS_PER_MAJOR);
            } catch (ArithmeticException e) {
                throw PaymentLinkException.validation("amount is too large");
            }
        }
        throw invalidAmount();
    }

    private static long toMinorUnits(BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw invalidAmount();
        }
        BigDecimal minor = amount.movePointRight(MINOR_UNIT_DIGITS).setScale(0, RoundingMode.HALF_UP);
        try {
            return requireChargeable(minor.longValueExact());
        } catch (ArithmeticException e) {
            throw PaymentLinkException.validation("amount is too large");
        }
    }

    private static long requireChargeable(long minor) {
        if (minor <= 0) {
            throw PaymentLinkException.validation("amount is too small to be charged");
        }
        return minor;
    }

    private static PaymentLinkException invalidAmount() {
        return PaymentLinkException.validation("amount must be a positive number");
    }

    private static void requireHttpUrl(String value, String field) {
        if (value == null || value.isEmpty()
                || !(value.startsWith("http://") || value.startsWith("https://"))) {
            throw PaymentLinkException.validation(field + " must be a valid URL (received \"" + value + "\")");
        }
    }

    private static String normalizeDescription(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = description.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw PaymentLinkException.validation(
                    "description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return trimmed;
    }
}
