package com.flowtest.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Map;

/**
 * A request ready to be sent, with all placeholders already resolved.
 *
 * @param method  HTTP method name.
 * @param url     Absolute URL.
 * @param headers Request headers.
 * @param body    {@code null} for no body, an object or array to send as JSON, or a text node to send verbatim.
 * @param timeout Upper bound on the whole exchange.
 */
public record HttpCall(String method, String url, Map<String, String> headers, JsonNode body, Duration timeout) {

    public HttpCall {
        headers = headers == null ? Map.of() : headers;
    }
}
