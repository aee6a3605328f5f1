package com.flowtest.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{name}}} placeholders with values from a {@link VariableStore}.
 * <p>
 * Substitution is a single left-to-right scan: a substituted value is never scanned again, and a
 * placeholder whose name is unknown is left exactly as written.
 */
public final class Templates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^{}]+)}}");

    private Templates() {
    }

    public static String substitute(String text, VariableStore variables) {
        return substitute(text, variables.asMap());
    }

    public static String substitute(String text, Map<String, JsonNode> variables) {
        if (text == null || text.isEmpty() || variables.isEmpty()) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = Optional.ofNullable(variables.get(name))
                    .map(Templates::render)
                    .orElse(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Substitutes into a textual node; any other node is returned unchanged.
     */
    public static JsonNode substitute(JsonNode node, VariableStore variables) {
        if (node == null || !node.isTextual()) {
            return node;
        }
        return TextNode.valueOf(substitute(node.textValue(), variables));
    }

    /**
     * The text a value contributes when it is placed into a string: strings verbatim, JSON null
     * as {@code null}, numbers and booleans in their JSON form, containers as compact JSON.
     */
    public static String render(JsonNode value) {
        if (value == null) {
            return "null";
        }
        return switch (value.getNodeType()) {
            case STRING -> value.textValue();
            case NUMBER, BOOLEAN, BINARY -> value.asText();
            case OBJECT, ARRAY, POJO -> value.toString();
            case NULL, MISSING -> "null";
        };
    }
}
