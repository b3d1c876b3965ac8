package com.payment.paylink.core;

import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.ErrorKind;

/**
 * Raised by the validator, the provider adapters and {@link ProviderHttpClient}.
 * Always carries a {@link ClassifiedError}; {@link PaymentLinkOrchestrator} is the
 * only place it is caught and turned into an outcome.
 */
public class PaymentLinkException extends RuntimeException {

    private final transient ClassifiedError error;

    public PaymentLinkException(ClassifiedError error) {
        super(error.getMessage());
        this.error = error;
    }

    public PaymentLinkException(ClassifiedError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public ClassifiedError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }

    public static PaymentLinkException validation(String message) {
        return new PaymentLinkException(ClassifiedError.of(ErrorKind.VALIDATION, message));
    }

    public static PaymentLinkException config(String message) {
        return new PaymentLinkException(ClassifiedError.of(ErrorKind.PROVIDER_CONFIG, message));
    }

    public static PaymentLinkException network(String message, Throwable cause) {
        return new PaymentLinkException(ClassifiedError.of(ErrorKind.PROVIDER_NETWORK, message), cause);
    }

    public static PaymentLinkException api(String message, Integer httpStatus, String providerCode) {
        return new PaymentLinkException(ClassifiedError.builder()
                .kind(ErrorKind.PROVIDER_API)
                .message(message)
                .httpStatus(httpStatus)
                .providerCode(providerCode)
                .build());
    }

    public static PaymentLinkException unexpected(String message, Throwable cause) {
        return new PaymentLinkException(ClassifiedError.of(ErrorKind.UNEXPECTED, message), cause);
    }
}
