package com.flowtest.engine;

import org.springframework.http.HttpHeaders;

/**
 * A fully buffered HTTP response.
 *
 * @param status  Status code.
 * @param headers Response headers; lookups by name are case-insensitive.
 * @param body    Body decoded as text, empty when the response had none.
 */
public record HttpResponseSnapshot(int status, HttpHeaders headers, String body) {

    public HttpResponseSnapshot {
        headers = headers == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
        body = body == null ? "" : body;
    }
}
