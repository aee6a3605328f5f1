package com.flowtest.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The variables threaded through the steps of one flow run.
 * <p>
 * Entries are added or overwritten, never removed. A store belongs to exactly one flow
 * invocation and is not shared between threads.
 */
public final class VariableStore {

    public static final String BASE_URL = "base_url";

    private final Map<String, JsonNode> values = new LinkedHashMap<>();

    /**
     * Creates a store holding the collection's declared variables plus the reserved
     * {@value #BASE_URL} entry, which always reflects the base URL of the run.
     */
    public static VariableStore seed(Map<String, JsonNode> declared, String baseUrl) {
        VariableStore store = new VariableStore();
        if (declared != null) {
            store.putAll(declared);
        }
        store.put(BASE_URL, baseUrl == null ? NullNode.getInstance() : TextNode.valueOf(baseUrl));
        return store;
    }

    /**
     * Binds {@code name} to {@code value}; a {@code null} value is stored as an explicit JSON null.
     */
    public void put(String name, JsonNode value) {
        values.put(name, value == null ? NullNode.getInstance() : value);
    }

    public void putAll(Map<String, JsonNode> entries) {
        entries.forEach(this::put);
    }

    public Optional<JsonNode> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public Map<String, JsonNode> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
