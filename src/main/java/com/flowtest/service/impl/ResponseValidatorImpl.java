package com.flowtest.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowtest.engine.HttpResponseSnapshot;
import com.flowtest.engine.Templates;
import com.flowtest.model.Expectation;
import com.flowtest.service.api.ResponseValidator;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Checks responses against step expectations.
 * <p>
 * An expected body that is a JSON object is matched as a subset of a JSON object response.
 * Every other combination falls back to substring containment of the expected value's text in
 * the raw response body, so an expected {@code 42} is also satisfied by a body of {@code 420}.
 */
@Service
public class ResponseValidatorImpl implements ResponseValidator {

    /**
     * Treats numbers as equal when their values are, so {@code 1} matches {@code 1.0}.
     */
    private static final Comparator<JsonNode> VALUE_COMPARATOR = (expected, actual) -> {
        if (expected.equals(actual)) {
            return 0;
        }
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue());
        }
        return 1;
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<String> validate(HttpResponseSnapshot response, Duration elapsed, Expectation expectation) {
        List<String> violations = new ArrayList<>();

        if (response.status() != expectation.getStatus()) {
            violations.add(String.format("Expected status %d, got %d", expectation.getStatus(), response.status()));
        }
        if (expectation.getBody() != null) {
            checkBody(expectation.getBody(), response.body(), violations);
        }
        if (expectation.getHeaders() != null) {
            checkHeaders(expectation.getHeaders(), response, violations);
        }
        if (expectation.getMaxResponseTime() != null) {
            checkResponseTime(elapsed, expectation.getMaxResponseTime(), violations);
        }
        return violations;
    }

    private void checkBody(JsonNode expected, String rawBody, List<String> violations) {
        JsonNode actual = parseJson(rawBody);
        if (expected.isObject() && actual != null && actual.isObject()) {
            for (Map.Entry<String, JsonNode> field : expected.properties()) {
                String key = field.getKey();
                if (!actual.has(key)) {
                    violations.add(String.format("Missing expected key '%s' in response", key));
                } else if (!field.getValue().equals(VALUE_COMPARATOR, actual.get(key))) {
                    violations.add(String.format("Expected %s='%s', got '%s'",
                            key, Templates.render(field.getValue()), Templates.render(actual.get(key))));
                }
            }
        } else {
            String expectedText = Templates.render(expected);
            if (!rawBody.contains(expectedText)) {
                violations.add(String.format("Expected body content '%s' not found in response", expectedText));
            }
        }
    }

    private void checkHeaders(Map<String, String> expected, HttpResponseSnapshot response, List<String> violations) {
        expected.forEach((name, value) -> {
            List<String> values = response.headers().get(name);
            if (values == null || values.isEmpty()) {
                violations.add(String.format("Missing expected header '%s'", name));
                return;
            }
            String actual = String.join(", ", values);
            if (!actual.equals(value)) {
                violations.add(String.format("Expected header %s='%s', got '%s'", name, value, actual));
            }
        });
    }

    private void checkResponseTime(Duration elapsed, double maxSeconds, List<String> violations) {
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        if (seconds > maxSeconds) {
            violations.add(String.format(Locale.ROOT, "Response time %.2fs exceeds limit %ss",
                    seconds, BigDecimal.valueOf(maxSeconds).stripTrailingZeros().toPlainString()));
        }
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
