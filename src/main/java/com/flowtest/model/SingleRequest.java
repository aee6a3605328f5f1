package com.flowtest.model;

import java.time.Duration;

/**
 * An ad hoc request issued outside of a collection.
 *
 * @param method         HTTP method.
 * @param url            Absolute URL or path relative to {@code baseUrl}.
 * @param baseUrl        Base URL for relative paths.
 * @param expectedStatus Status code the response must carry.
 * @param body           Request body; sent as JSON when it parses as JSON, otherwise as raw text. May be {@code null}.
 * @param headers        Request headers as a JSON object string. May be {@code null}.
 * @param extract        Variables to extract as a JSON object string of name to path. May be {@code null}.
 * @param timeout        Request timeout, or {@code null} for the configured default.
 */
public record SingleRequest(
        String method,
        String url,
        String baseUrl,
        int expectedStatus,
        String body,
        String headers,
        String extract,
        Duration timeout) {
}
