package com.flowtest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import lombok.Data;

/**
 * What a step's response has to look like for the step to pass.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Expectation {

    public static final int DEFAULT_STATUS = 200;

    /**
     * Expected HTTP status code.
     */
    private int status = DEFAULT_STATUS;

    /**
     * Expected body. An object is matched as a subset of the response object; anything else is
     * matched by substring containment. {@code null} when the body is not checked.
     */
    private JsonNode body;

    /**
     * Response headers that must be present with exactly these values.
     */
    private Map<String, String> headers;

    /**
     * Upper bound on the response time, in seconds.
     */
    @JsonProperty("max_response_time")
    private Double maxResponseTime;
}
