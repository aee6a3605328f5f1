package com.flowtest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * A named, ordered set of HTTP test steps plus the variables that seed a flow run.
 * <p>
 * Instances are produced by the {@link com.flowtest.service.api.CollectionLoader} from a YAML or
 * JSON document and are treated as read-only once a flow has started.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowCollection {

    /**
     * Display name of the flow, used in the success summary.
     */
    private String name;

    private String description;

    /**
     * Seed variables, available to every step as {@code {{name}}} placeholders.
     */
    private Map<String, JsonNode> variables = new LinkedHashMap<>();

    /**
     * Headers sent with every step. A step header with the same name takes precedence.
     */
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * The steps, in execution order.
     */
    private List<FlowStep> steps;
}
