package com.flowtest.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flowtest.exception.FlowTestException;
import com.flowtest.model.FlowCollection;
import com.flowtest.service.api.CollectionLoader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads collections with Jackson, picking the YAML or JSON parser from the file suffix.
 */
@Service
@Slf4j
public class CollectionLoaderImpl implements CollectionLoader {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public FlowCollection load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FlowTestException("Collection file not found: " + path);
        }
        boolean yaml = isYaml(path);
        ObjectMapper mapper = yaml ? yamlMapper : jsonMapper;
        try (Reader reader = Files.newBufferedReader(path)) {
            JsonNode root = mapper.readTree(reader);
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.warn("Collection {} is empty", path);
                return new FlowCollection();
            }
            FlowCollection collection = mapper.treeToValue(root, FlowCollection.class);
            log.debug("Loaded collection '{}' from {} with {} steps", collection.getName(), path,
                    collection.getSteps() == null ? 0 : collection.getSteps().size());
            return collection;
        } catch (JsonProcessingException e) {
            throw new FlowTestException((yaml ? "YAML" : "JSON") + " parsing error: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FlowTestException("Failed to read collection file: " + path, e);
        }
    }

    private boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
