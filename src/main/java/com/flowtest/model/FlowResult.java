package com.flowtest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * The uniform outcome of a flow run or a single request.
 *
 * @param success   {@code true} exactly when no issue was recorded.
 * @param issues    Issues in the order they were raised; the first one marks where execution stopped.
 * @param summary   A one-line summary, present on successful flow runs.
 * @param extracted Values extracted from responses, present when at least one value was extracted
 *                  (by a flow) or extraction ran (for a single request).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowResult(boolean success, List<Issue> issues, String summary, Map<String, JsonNode> extracted) {

    public FlowResult {
        issues = List.copyOf(issues);
    }

    public static FlowResult passed(String summary) {
        return new FlowResult(true, List.of(), summary, null);
    }

    public static FlowResult of(List<Issue> issues, String summary, Map<String, JsonNode> extracted) {
        return new FlowResult(issues.isEmpty(), issues, summary, extracted);
    }

    public static FlowResult failed(Issue issue) {
        return new FlowResult(false, List.of(issue), null, null);
    }
}
