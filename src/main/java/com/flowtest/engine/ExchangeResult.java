package com.flowtest.engine;

import java.time.Duration;

/**
 * Outcome of one HTTP exchange: either a response or an error kind, plus the time spent.
 *
 * @param response     The response, {@code null} when the exchange failed.
 * @param elapsed      Time from issuing the request until the body was read or the failure surfaced.
 * @param errorKind    Kind of failure, {@code null} on success.
 * @param errorMessage Description of the underlying cause, {@code null} on success.
 */
public record ExchangeResult(HttpResponseSnapshot response, Duration elapsed, RequestErrorKind errorKind, String errorMessage) {

    public static ExchangeResult success(HttpResponseSnapshot response, Duration elapsed) {
        return new ExchangeResult(response, elapsed, null, null);
    }

    public static ExchangeResult failure(RequestErrorKind kind, String message, Duration elapsed) {
        return new ExchangeResult(null, elapsed, kind, message);
    }

    public boolean failed() {
        return errorKind != null;
    }
}
