package com.flowtest.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowtest.config.FlowProperties;
import com.flowtest.engine.ExchangeResult;
import com.flowtest.engine.HttpCall;
import com.flowtest.engine.HttpResponseSnapshot;
import com.flowtest.engine.HttpSession;
import com.flowtest.engine.JsonPathExtractor;
import com.flowtest.engine.RequestUrls;
import com.flowtest.engine.Templates;
import com.flowtest.engine.VariableStore;
import com.flowtest.exception.FlowTestException;
import com.flowtest.model.Expectation;
import com.flowtest.model.FlowCollection;
import com.flowtest.model.FlowResult;
import com.flowtest.model.FlowStep;
import com.flowtest.model.Issue;
import com.flowtest.model.SingleRequest;
import com.flowtest.service.api.CollectionLoader;
import com.flowtest.service.api.FlowEngine;
import com.flowtest.service.api.RequestExecutor;
import com.flowtest.service.api.ResponseValidator;
import com.flowtest.service.api.ResultLogService;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedCaseInsensitiveMap;

/**
 * Runs flow collections step by step, threading extracted values into later steps.
 * <p>
 * Each run owns its {@link VariableStore} and {@link HttpSession}. A step is sent, its response
 * validated, and only a step that passes has its {@code extract} entries merged into the
 * variables. The first step that fails ends the run; the steps after it are never sent.
 */
@Service
@Slf4j
public class FlowEngineImpl implements FlowEngine {

    static final String DEFAULT_FLOW_NAME = "Unnamed Flow";
    static final String DEFAULT_METHOD = "GET";
    static final String CLI_LOCATION = "cli";

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final CollectionLoader collectionLoader;
    private final RequestExecutor requestExecutor;
    private final ResponseValidator responseValidator;
    private final ResultLogService resultLog;
    private final FlowProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public FlowEngineImpl(CollectionLoader collectionLoader,
                          RequestExecutor requestExecutor,
                          ResponseValidator responseValidator,
                          ResultLogService resultLog,
                          FlowProperties properties) {
        this.collectionLoader = collectionLoader;
        this.requestExecutor = requestExecutor;
        this.responseValidator = responseValidator;
        this.resultLog = resultLog;
        this.properties = properties;
    }

    @Override
    public FlowResult runFlow(String collectionPath, String baseUrl) {
        FlowCollection collection;
        try {
            collection = collectionLoader.load(Path.of(collectionPath));
        } catch (FlowTestException e) {
            log.warn("Could not set up flow from {}: {}", collectionPath, e.getMessage());
            return record(FlowResult.failed(Issue.setup(collectionPath, e.getMessage())));
        } catch (Exception e) {
            log.error("Unexpected error while loading {}", collectionPath, e);
            return record(FlowResult.failed(Issue.setup(collectionPath, "Unexpected error: " + e.getMessage())));
        }
        return runFlow(collection, collectionPath, baseUrl);
    }

    @Override
    public FlowResult runFlow(FlowCollection collection, String source, String baseUrl) {
        List<Issue> issues = new ArrayList<>();
        Map<String, JsonNode> extracted = new LinkedHashMap<>();
        String summary = null;
        try {
            List<FlowStep> steps = collection.getSteps() == null ? List.of() : collection.getSteps();
            if (steps.isEmpty()) {
                log.warn("Collection {} declares no steps", source);
                issues.add(Issue.setup(source, "No test steps found in collection"));
                return record(FlowResult.of(issues, null, null));
            }

            String name = collection.getName() != null ? collection.getName() : DEFAULT_FLOW_NAME;
            VariableStore variables = VariableStore.seed(collection.getVariables(), baseUrl);
            HttpSession session = requestExecutor.newSession();
            log.info("Running flow '{}' with {} steps against {}", name, steps.size(), baseUrl);

            for (int index = 0; index < steps.size(); index++) {
                StepContext context = new StepContext(collection, steps.get(index), index, source, baseUrl);
                if (!runStep(context, variables, session, issues, extracted)) {
                    log.warn("Flow '{}' halted at step {} of {}", name, index + 1, steps.size());
                    break;
                }
            }

            if (issues.isEmpty()) {
                summary = String.format("Successfully executed %d steps in flow '%s'", steps.size(), name);
                log.info(summary);
            }
        } catch (Exception e) {
            log.error("Unexpected error while running flow from {}", source, e);
            issues.add(Issue.setup(source, "Unexpected error: " + e.getMessage()));
        }
        return record(FlowResult.of(issues, summary, extracted.isEmpty() ? null : extracted));
    }

    /**
     * Runs one step. Returns {@code false} when the step recorded an issue and the flow must stop.
     * Values extracted by a passing step go into both the variables and {@code extractedSoFar}.
     */
    private boolean runStep(StepContext context, VariableStore variables, HttpSession session, List<Issue> issues,
                            Map<String, JsonNode> extractedSoFar) {
        FlowStep step = context.step();
        String stepName = context.stepName();
        String location = context.location();
        try {
            String method = Templates.substitute(step.getMethod() != null ? step.getMethod() : DEFAULT_METHOD, variables);
            String url = Templates.substitute(step.getUrl() != null ? step.getUrl() : "", variables);
            Duration timeout = step.getTimeout() != null ? toDuration(step.getTimeout()) : properties.getDefaultTimeout();
            HttpCall call = new HttpCall(method, RequestUrls.resolve(url, context.baseUrl()),
                    mergeHeaders(context.collection().getHeaders(), step.getHeaders(), variables),
                    resolveBody(step.getBody(), variables), timeout);

            ExchangeResult exchange = requestExecutor.execute(session, call);
            if (exchange.failed()) {
                String message = describeFailure(exchange, timeout);
                log.warn("Step '{}' ({} {}): {}", stepName, call.method(), call.url(), message);
                issues.add(Issue.of(location, stepName, message));
                return false;
            }

            HttpResponseSnapshot response = exchange.response();
            Expectation expectation = step.getExpect() != null ? step.getExpect() : new Expectation();
            List<String> violations = responseValidator.validate(response, exchange.elapsed(), expectation);
            if (!violations.isEmpty()) {
                String body = truncate(response.body());
                for (String violation : violations) {
                    log.warn("Step '{}' failed: {}", stepName, violation);
                    issues.add(Issue.withResponse(location, stepName, violation, response.status(), body));
                }
                return false;
            }

            if (step.getExtract() != null && !step.getExtract().isEmpty()) {
                Map<String, JsonNode> extracted = JsonPathExtractor.extractAll(response.body(), step.getExtract());
                variables.putAll(extracted);
                extractedSoFar.putAll(extracted);
                log.debug("Step '{}' extracted {}", stepName, extracted);
            }
            log.info("Step '{}' passed: {} {} -> {} in {} ms", stepName, call.method(), call.url(),
                    response.status(), exchange.elapsed().toMillis());
            return true;
        } catch (Exception e) {
            log.error("Step '{}' failed unexpectedly", stepName, e);
            issues.add(Issue.of(location, stepName, "Step execution failed: " + e.getMessage()));
            return false;
        }
    }

    @Override
    public FlowResult runSingle(SingleRequest request) {
        List<Issue> issues = new ArrayList<>();
        Map<String, JsonNode> extracted = null;
        String stepName = request.method() + " " + request.url();
        try {
            Map<String, String> headers = new LinkedCaseInsensitiveMap<>();
            try {
                headers.putAll(parseStringMap(request.headers()));
            } catch (JsonProcessingException e) {
                issues.add(Issue.setup(CLI_LOCATION, "Invalid headers JSON: " + e.getOriginalMessage()));
                return record(FlowResult.of(issues, null, null));
            }

            JsonNode body = parseRawBody(request.body(), headers);
            Duration timeout = request.timeout() != null ? request.timeout() : properties.getDefaultTimeout();
            HttpCall call = new HttpCall(request.method(), RequestUrls.resolve(request.url(), request.baseUrl()),
                    headers, body, timeout);
            ExchangeResult exchange = requestExecutor.execute(requestExecutor.newSession(), call);

            if (exchange.failed()) {
                issues.add(Issue.of(CLI_LOCATION, stepName, describeFailure(exchange, timeout)));
            } else {
                HttpResponseSnapshot response = exchange.response();
                if (response.status() != request.expectedStatus()) {
                    issues.add(Issue.withResponse(CLI_LOCATION, stepName,
                            String.format("Expected status %d, got %d", request.expectedStatus(), response.status()),
                            response.status(), truncate(response.body())));
                } else if (request.extract() != null && !request.extract().isBlank()) {
                    try {
                        extracted = JsonPathExtractor.extractAll(response.body(), objectMapper.readValue(request.extract(), STRING_MAP));
                    } catch (JsonProcessingException e) {
                        issues.add(Issue.of(CLI_LOCATION, stepName, "Invalid extract JSON: " + e.getOriginalMessage()));
                    }
                }
                log.info("{} -> {} in {} ms", stepName, response.status(), exchange.elapsed().toMillis());
            }
        } catch (Exception e) {
            log.error("Unexpected error while running {}", stepName, e);
            issues.add(Issue.of(CLI_LOCATION, stepName, "Unexpected error: " + e.getMessage()));
        }
        return record(FlowResult.of(issues, null, extracted));
    }

    private FlowResult record(FlowResult result) {
        try {
            resultLog.append(result);
        } catch (RuntimeException e) {
            log.error("Result log rejected the result", e);
        }
        return result;
    }

    /**
     * Collection headers first, then step headers, which win on a name clash regardless of case.
     */
    private Map<String, String> mergeHeaders(Map<String, String> defaults, Map<String, String> stepHeaders,
                                             VariableStore variables) {
        Map<String, String> merged = new LinkedCaseInsensitiveMap<>();
        for (Map<String, String> source : List.of(
                defaults != null ? defaults : Map.<String, String>of(),
                stepHeaders != null ? stepHeaders : Map.<String, String>of())) {
            source.forEach((name, value) -> {
                if (value != null) {
                    merged.put(name, Templates.substitute(value, variables));
                }
            });
        }
        return merged;
    }

    /**
     * Objects and arrays are sent as they are; any scalar becomes text with placeholders substituted.
     */
    private JsonNode resolveBody(JsonNode body, VariableStore variables) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return null;
        }
        if (body.isContainerNode()) {
            return body;
        }
        return TextNode.valueOf(Templates.substitute(Templates.render(body), variables));
    }

    /**
     * Any valid JSON document is sent as JSON, with an {@code application/json} content type unless
     * one is given; JSON {@code null} sends no body. Anything else is sent as text.
     */
    private JsonNode parseRawBody(String body, Map<String, String> headers) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            JsonNode parsed = objectMapper.readTree(body);
            if (parsed != null && !parsed.isMissingNode()) {
                if (parsed.isNull()) {
                    return null;
                }
                if (parsed.isContainerNode()) {
                    return parsed;
                }
                headers.putIfAbsent(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                return TextNode.valueOf(objectMapper.writeValueAsString(parsed));
            }
        } catch (JsonProcessingException e) {
            log.debug("Body is not JSON, sending it as text");
        }
        return TextNode.valueOf(body);
    }

    private Map<String, String> parseStringMap(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        Map<String, String> parsed = objectMapper.readValue(json, STRING_MAP);
        return parsed != null ? parsed : Map.of();
    }

    private String describeFailure(ExchangeResult exchange, Duration timeout) {
        String detail = switch (exchange.errorKind()) {
            case TIMEOUT -> "timed out after " + formatSeconds(timeout) + "s";
            case CONNECTION_FAILURE -> "connection failure: " + exchange.errorMessage();
            case MALFORMED_RESPONSE -> "malformed response: " + exchange.errorMessage();
            case INVALID_REQUEST -> "invalid request: " + exchange.errorMessage();
        };
        return "Request failed: " + detail;
    }

    private String truncate(String body) {
        int limit = properties.getResponseBodyLimit();
        return body.length() > limit ? body.substring(0, limit) + "..." : body;
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    private static String formatSeconds(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis(), 3).stripTrailingZeros().toPlainString();
    }

    private record StepContext(FlowCollection collection, FlowStep step, int index, String source, String baseUrl) {

        String stepName() {
            return step.getName() != null ? step.getName() : "Step " + (index + 1);
        }

        String location() {
            return source + ":" + (index + 1);
        }
    }
}
