package com.payment.paylink.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.payment.paylink.domain.RawPaymentLinkRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * REST API request body for generating a checkout link. Fields are bound
 * loosely and checked by {@link com.payment.paylink.core.PaymentLinkRequestValidator}.
 */
@Data
public class GenerateLinkRequestDto {

    /** Major-unit amount, e.g. 10.50 for $10.50. */
    @Schema(type = "number", example = "10.50")
    private Object amount;

    @Schema(allowableValues = {"USD", "CRC"})
    private String currency;

    @Schema(allowableValues = {"one_time", "recurring"})
    private String type;

    @Schema(allowableValues = {"tilopay", "onvo"})
    private String provider;

    /** Required when type is recurring. */
    @Schema(allowableValues = {"month", "year"})
    private String interval;

    private String description;

    @JsonProperty("success_url")
    private String successUrl;

    @JsonProperty("cancel_url")
    private String cancelUrl;

    public RawPaymentLinkRequest toRawRequest() {
        return RawPaymentLinkRequest.builder()
                .amount(amount)
                .currency(currency)
                .paymentType(type)
                .interval(interval)
                .description(description)
                .successUrl(successUrl)
                .cancelUrl(cancelUrl)
                .build();
    }
}
