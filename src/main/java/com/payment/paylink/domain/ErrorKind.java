package com.payment.paylink.domain;

import org.springframework.http.HttpStatus;

/**
 * Failure classes a payment link request can end in, with the HTTP status each
 * is exposed as.
 */
public enum ErrorKind {
    /** Caller input is malformed. Never retried, not a system fault. */
    VALIDATION(HttpStatus.BAD_REQUEST),
    /** Deployment misconfiguration, e.g. missing secret key. */
    PROVIDER_CONFIG(HttpStatus.INTERNAL_SERVER_ERROR),
    /** Processor could not be reached. */
    PROVIDER_NETWORK(HttpStatus.BAD_GATEWAY),
    /** Processor rejected the call or answered with something unusable. */
    PROVIDER_API(HttpStatus.BAD_GATEWAY),
    UNEXPECTED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus responseStatus;

    ErrorKind(HttpStatus responseStatus) {
        this.responseStatus = responseStatus;
    }

    public HttpStatus getResponseStatus() {
        return responseStatus;
    }
}
