package com.flowtest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One diagnostic produced while running a flow or a single request.
 *
 * @param type           Always {@code flow} for issues raised by the flow engine.
 * @param location       Collection source and 1-based step index, the collection source alone for
 *                       setup problems, or {@code cli} for ad hoc requests.
 * @param message        Human-readable description of the problem.
 * @param step           Name of the step that failed, or {@code setup}.
 * @param responseStatus Observed status code, when a response was received.
 * @param responseBody   Observed response body, truncated, when a response was received.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Issue(
        String type,
        String location,
        String message,
        String step,
        @JsonProperty("response_status") Integer responseStatus,
        @JsonProperty("response_body") String responseBody) {

    public static final String TYPE_FLOW = "flow";
    public static final String SETUP_STEP = "setup";

    public static Issue of(String location, String step, String message) {
        return new Issue(TYPE_FLOW, location, message, step, null, null);
    }

    public static Issue withResponse(String location, String step, String message, int status, String body) {
        return new Issue(TYPE_FLOW, location, message, step, status, body);
    }

    public static Issue setup(String location, String message) {
        return of(location, SETUP_STEP, message);
    }
}
