package com.payment.paylink.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * Body of the TiloPay quick link endpoint. Redirect URLs are not supplied by the
 * caller; they are derived from the service's base URL.
 */
@Data
public class TilopayQuickLinkRequestDto {

    @Schema(type = "number", example = "2100.89")
    private Object amount;

    @Schema(allowableValues = {"USD", "CRC"})
    private String currency;

    @Schema(type = "string")
    private Object description;

    @JsonProperty("isRecurring")
    @Schema(type = "boolean")
    private Object isRecurring;
}
