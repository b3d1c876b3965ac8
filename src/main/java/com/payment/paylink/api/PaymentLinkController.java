package com.payment.paylink.api;

import com.payment.paylink.core.PaymentLinkOrchestrator;
import com.payment.paylink.domain.PaymentLinkOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for hosted checkout link generation.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Payment links", description = "Generate hosted checkout links on TiloPay or ONVO")
public class PaymentLinkController {

    private final PaymentLinkOrchestrator orchestrator;

    @PostMapping("/generate")
    @Operation(
            summary = "Generate checkout link",
            description = "Creates a one-time or recurring hosted checkout on the chosen provider and returns its URL. "
                    + "Amounts are given in the major unit and sent to the provider in cents/céntimos. "
                    + "Nothing is persisted: calling twice creates two independent links.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Link created. Body: { \"url\": ... }",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentLinkResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request (kind=VALIDATION). No provider call was made."),
            @ApiResponse(responseCode = "500", description = "Provider not configured (kind=PROVIDER_CONFIG) or unexpected error."),
            @ApiResponse(responseCode = "502", description = "Provider unreachable (PROVIDER_NETWORK) or refused the request (PROVIDER_API, with providerStatus/providerCode).")
    })
    public ResponseEntity<PaymentLinkResponseDto> generate(@RequestBody GenerateLinkRequestDto dto) {
        PaymentLinkOutcome outcome = orchestrator.generate(dto.getProvider(), dto.toRawRequest());
        HttpStatus status = outcome.isSuccess() ? HttpStatus.OK : outcome.getError().getKind().getResponseStatus();
        if (!outcome.isSuccess()) {
            log.debug("Generate failed provider={} status={} error={}", dto.getProvider(), status.value(), outcome.getError().getMessage());
        }
        return ResponseEntity.status(status).body(PaymentLinkResponseDto.from(outcome));
    }
}
