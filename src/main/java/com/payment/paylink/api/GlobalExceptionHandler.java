package com.payment.paylink.api;

import com.payment.paylink.domain.ClassifiedError;
import com.payment.paylink.domain.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Centralized error handling for failures that never reach the orchestrator.
 * Returns the same JSON shape as a classified failure.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<PaymentLinkResponseDto> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return respond(ClassifiedError.of(ErrorKind.VALIDATION, "Invalid JSON body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<PaymentLinkResponseDto> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // 404, 405, 415... raised by Spring MVC itself
            ErrorResponse springError = (ErrorResponse) ex;
            ErrorKind kind = springError.getStatusCode().is5xxServerError() ? ErrorKind.UNEXPECTED : ErrorKind.VALIDATION;
            return ResponseEntity.status(springError.getStatusCode())
                    .body(PaymentLinkResponseDto.error(ClassifiedError.of(kind, getMessageOrCause(ex))));
        }
        log.error("Unhandled error", ex);
        return respond(ClassifiedError.of(ErrorKind.UNEXPECTED, getMessageOrCause(ex)));
    }

    private static ResponseEntity<PaymentLinkResponseDto> respond(ClassifiedError error) {
        return ResponseEntity.status(error.getKind().getResponseStatus()).body(PaymentLinkResponseDto.error(error));
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
