package com.flowtest.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowtest.engine.Templates;
import com.flowtest.model.FlowResult;
import com.flowtest.model.Issue;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link FlowResult} for the terminal, either as colored text or as pretty-printed JSON.
 */
@Component
public class ResultFormatter {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String format(FlowResult result, boolean json, boolean verbose) {
        return json ? toJson(result) : toText(result, verbose);
    }

    public String toJson(FlowResult result) {
        try {
            return jsonMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Result cannot be written as JSON", e);
        }
    }

    /**
     * A pass banner with the summary, or a fail banner followed by every issue. Response bodies
     * and extracted values are only shown when {@code verbose} is set.
     */
    public String toText(FlowResult result, boolean verbose) {
        StringBuilder sb = new StringBuilder();
        if (result.success()) {
            sb.append(ANSI_GREEN).append("Integration test passed!").append(ANSI_RESET);
            if (result.summary() != null) {
                sb.append("\n   ").append(result.summary());
            }
            if (verbose && result.extracted() != null) {
                sb.append("\n\n").append(ANSI_CYAN).append("Extracted variables:").append(ANSI_RESET);
                result.extracted().forEach((name, value) ->
                        sb.append("\n   ").append(name).append(": ").append(Templates.render(value)));
            }
            return sb.toString();
        }

        sb.append(ANSI_RED).append("Integration test failed!").append(ANSI_RESET);
        sb.append("\n\nFound ").append(result.issues().size()).append(" issue(s):");
        for (Issue issue : result.issues()) {
            sb.append("\n\n   ").append(ANSI_YELLOW).append("Location: ").append(ANSI_RESET).append(issue.location());
            sb.append("\n   Step: ").append(issue.step());
            sb.append("\n   Message: ").append(issue.message());
            if (issue.responseStatus() != null) {
                sb.append("\n   Response status: ").append(issue.responseStatus());
            }
            if (verbose && issue.responseBody() != null) {
                sb.append("\n   Response body: ").append(issue.responseBody());
            }
        }
        return sb.toString();
    }
}
