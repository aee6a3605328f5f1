package com.flowtest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * A single HTTP call within a {@link FlowCollection}, together with the expectations its
 * response must meet and the values to extract from it for later steps.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowStep {

    private String name;

    /**
     * HTTP method, may contain placeholders. Defaults to GET when absent.
     */
    private String method;

    /**
     * Absolute URL or a path relative to the flow's base URL. May contain placeholders.
     */
    private String url;

    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * The request body. Objects and arrays are sent as JSON; any scalar is sent as raw text
     * after placeholder substitution.
     */
    private JsonNode body;

    /**
     * Request timeout in seconds. The configured default applies when absent.
     */
    private Double timeout;

    private Expectation expect;

    /**
     * Maps a variable name to the path of the value to pull out of the response body.
     */
    private Map<String, String> extract;
}
