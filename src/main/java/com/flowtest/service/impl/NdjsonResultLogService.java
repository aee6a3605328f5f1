package com.flowtest.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowtest.config.FlowProperties;
import com.flowtest.model.FlowResult;
import com.flowtest.service.api.ResultLogService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A {@link ResultLogService} that appends one JSON document per line to a file.
 * <p>
 * Each line holds the fields of the {@link FlowResult} preceded by a {@code timestamp} and a
 * {@code tool} tag. The file and its parent directories are created on the first write, and
 * existing lines are never rewritten. Writes are synchronized so that concurrent runs in the
 * same process do not interleave lines.
 */
@Service
@Slf4j
public class NdjsonResultLogService implements ResultLogService {

    private final FlowProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public NdjsonResultLogService(FlowProperties properties) {
        this.properties = properties;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Does nothing when {@code flow.results.enabled} is {@code false}. An I/O failure is logged
     * and otherwise ignored, so that a read-only working directory does not change the outcome
     * of a flow.
     */
    @Override
    public synchronized void append(FlowResult result) {
        FlowProperties.Results settings = properties.getResults();
        if (!settings.isEnabled()) {
            return;
        }
        Path logFile = Paths.get(settings.getPath());
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectNode entry = objectMapper.createObjectNode();
            entry.put("timestamp", LocalDateTime.now().toString());
            entry.put("tool", settings.getTool());
            entry.setAll((ObjectNode) objectMapper.valueToTree(result));
            Files.writeString(logFile, objectMapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append result to {}", logFile.toAbsolutePath(), e);
        }
    }
}
