package com.payment.paylink.api;

import com.payment.paylink.config.PaylinkProperties;
import com.payment.paylink.core.PaymentLinkException;
import com.payment.paylink.core.PaymentLinkOrchestrator;
import com.payment.paylink.core.PaymentLinkRequestValidator;
import com.payment.paylink.domain.BillingInterval;
import com.payment.paylink.domain.PaymentLinkOutcome;
import com.payment.paylink.domain.PaymentType;
import com.payment.paylink.domain.ProviderId;
import com.payment.paylink.domain.RawPaymentLinkRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shortcut for TiloPay links that return to this service's own success/cancel
 * pages. Recurring quick links are always billed monthly.
 */
@Slf4j
@RestController
@RequestMapping("/api/tilopay")
@RequiredArgsConstructor
@Tag(name = "TiloPay quick links", description = "TiloPay links redirecting back to this service")
public class TilopayQuickLinkController {

    private final PaymentLinkOrchestrator orchestrator;
    private final PaylinkProperties properties;
    private final PaymentLinkRequestValidator validator;

    @PostMapping("/create-link")
    @Operation(
            summary = "Create TiloPay link",
            description = "Like /api/generate with provider=tilopay, but success/cancel URLs point at "
                    + "{base-url}/success and {base-url}/cancel and recurring links bill monthly.")
    public ResponseEntity<TilopayQuickLinkResponseDto> createLink(@RequestBody TilopayQuickLinkRequestDto dto) {
        try {
            validator.validateAmount(dto.getAmount());
            validator.validateCurrency(dto.getCurrency());
        } catch (PaymentLinkException e) {
            return ResponseEntity.badRequest().body(TilopayQuickLinkResponseDto.failed(e.getMessage()));
        }
        if (!(dto.getIsRecurring() instanceof Boolean)) {
            return ResponseEntity.badRequest().body(TilopayQuickLinkResponseDto.failed("isRecurring must be a boolean"));
        }
        if (dto.getDescription() != null && !(dto.getDescription() instanceof String)) {
            return ResponseEntity.badRequest().body(TilopayQuickLinkResponseDto.failed("description must be a string"));
        }
        boolean recurring = (Boolean) dto.getIsRecurring();
        String base = stripTrailingSlash(properties.getApp().getBaseUrl());
        String providerQuery = "?provider=" + ProviderId.TILOPAY.getWireName();

        RawPaymentLinkRequest request = RawPaymentLinkRequest.builder()
                .amount(dto.getAmount())
                .currency(dto.getCurrency())
                .paymentType(recurring ? PaymentType.RECURRING.getWireName() : PaymentType.ONE_TIME.getWireName())
                .interval(recurring ? BillingInterval.MONTH.getWireName() : null)
                .description((String) dto.getDescription())
                .successUrl(base + "/success" + providerQuery)
                .cancelUrl(base + "/cancel" + providerQuery)
                .build();

        PaymentLinkOutcome outcome = orchestrator.generate(ProviderId.TILOPAY.getWireName(), request);
        if (outcome.isSuccess()) {
            return ResponseEntity.ok(TilopayQuickLinkResponseDto.ok(outcome.getResult().getUrl()));
        }
        HttpStatus status = outcome.getError().getKind().getResponseStatus();
        log.warn("[tilopay/create-link] {} {}", status.value(), outcome.getError().getMessage());
        return ResponseEntity.status(status).body(TilopayQuickLinkResponseDto.failed(outcome.getError().getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<TilopayQuickLinkResponseDto> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable quick link body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(TilopayQuickLinkResponseDto.failed("Invalid JSON body"));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
