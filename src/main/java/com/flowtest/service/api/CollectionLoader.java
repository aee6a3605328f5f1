package com.flowtest.service.api;

import com.flowtest.exception.FlowTestException;
import com.flowtest.model.FlowCollection;
import java.nio.file.Path;

/**
 * Reads flow collections from disk.
 */
public interface CollectionLoader {

    /**
     * Loads a collection from a YAML ({@code .yaml}, {@code .yml}) or JSON file.
     *
     * @param path The collection file.
     * @return The parsed collection; an empty document yields a collection without steps.
     * @throws FlowTestException if the file does not exist or cannot be parsed.
     */
    FlowCollection load(Path path);
}
