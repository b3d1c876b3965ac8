package com.payment.paylink.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TilopayQuickLinkResponseDto {

    boolean success;
    String url;
    String error;

    public static TilopayQuickLinkResponseDto ok(String url) {
        return new TilopayQuickLinkResponseDto(true, url, null);
    }

    public static TilopayQuickLinkResponseDto failed(String error) {
        return new TilopayQuickLinkResponseDto(false, null, error);
    }
}
