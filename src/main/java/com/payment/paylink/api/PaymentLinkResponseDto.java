package com.payment.paylink.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.ErrorKind;
import com.payment.paylink.domain.PaymentLinkOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for link generation: {@code url} on success, {@code error}
 * (plus kind and, when the processor answered, its status/code) otherwise.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentLinkResponseDto {

    String url;
    String error;
    ErrorKind kind;
    Integer providerStatus;
    String providerCode;

    public static PaymentLinkResponseDto from(PaymentLinkOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("PaymentLinkOutcome cannot be null");
        }
        if (outcome.isSuccess()) {
            return PaymentLinkResponseDto.builder().url(outcome.getResult().getUrl()).build();
        }
        return error(outcome.getError());
    }

    public static PaymentLinkResponseDto error(ClassifiedError error) {
        return PaymentLinkResponseDto.builder()
                .error(error.getMessage())
                .kind(error.getKind())
                .providerStatus(error.getHttpStatus())
                .providerCode(error.getProviderCode())
                .build();
    }
}
