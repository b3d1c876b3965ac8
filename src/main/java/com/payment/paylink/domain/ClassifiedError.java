package com.payment.paylink.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Typed failure of a payment link request. {@code httpStatus} and
 * {@code providerCode} are only set when the processor itself answered.
 */
@Value
@Builder
public class ClassifiedError {

    ErrorKind kind;

    String message;

    /** HTTP status returned by the processor. */
    Integer httpStatus;

    /** Processor-specific error code, if the error body carried one. */
    String providerCode;

    public static ClassifiedError of(ErrorKind kind, String message) {
        return ClassifiedError.builder().kind(kind).message(message).build();
    }
}
