package com.flowtest.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls values out of a response body by path.
 * <p>
 * A path is either a dot-separated address such as {@code user.roles.0.name}, where all-digit
 * segments index arrays and every other segment names an object key, or, when it starts with
 * {@code $}, a JsonPath expression evaluated as is. A lookup that cannot be satisfied yields
 * JSON null; it never throws.
 * <p>
 * Bodies that are not JSON are exposed as {@code {"text": <raw body>}}.
 */
@Slf4j
public final class JsonPathExtractor {

    public static final String RAW_TEXT_KEY = "text";

    private static final Pattern INDEX = Pattern.compile("\\d+");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonPathExtractor() {
    }

    /**
     * Extracts every {@code name -> path} entry of {@code paths} from {@code body}. Entries whose
     * path does not resolve are bound to JSON null.
     */
    public static Map<String, JsonNode> extractAll(String body, Map<String, String> paths) {
        Object document = document(body);
        Map<String, JsonNode> extracted = new LinkedHashMap<>();
        paths.forEach((name, path) -> extracted.put(name, extract(document, path)));
        return extracted;
    }

    /**
     * Parses a response body into the plain Java structure JsonPath walks over.
     */
    public static Object document(String body) {
        String text = body == null ? "" : body;
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put(RAW_TEXT_KEY, text);
            return wrapped;
        }
    }

    public static JsonNode extract(Object document, String path) {
        if (document == null || path == null) {
            return NullNode.getInstance();
        }
        String expression = path.startsWith("$") ? path : toJsonPath(path);
        try {
            Object value = JsonPath.parse(document).read(expression);
            return value == null ? NullNode.getInstance() : MAPPER.valueToTree(value);
        } catch (JsonPathException | IllegalArgumentException e) {
            log.debug("Path '{}' did not resolve: {}", path, e.getMessage());
            return NullNode.getInstance();
        }
    }

    /**
     * Translates a dot path into bracket-notation JsonPath, e.g. {@code a.0.b} to {@code $['a'][0]['b']}.
     */
    static String toJsonPath(String dotPath) {
        StringBuilder sb = new StringBuilder("$");
        for (String segment : dotPath.split("\\.", -1)) {
            if (INDEX.matcher(segment).matches()) {
                sb.append('[').append(segment).append(']');
            } else {
                sb.append("['")
                        .append(segment.replace("\\", "\\\\").replace("'", "\\'"))
                        .append("']");
            }
        }
        return sb.toString();
    }
}
