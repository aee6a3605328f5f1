package com.flowtest.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Settings bound from the {@code flow.*} namespace of the application configuration.
 */
@Data
@ConfigurationProperties(prefix = "flow")
public class FlowProperties {

    /**
     * Request timeout for steps that do not declare their own.
     */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * Maximum number of response body characters copied into an issue.
     */
    private int responseBodyLimit = 500;

    private final Results results = new Results();

    private final Http http = new Http();

    @Data
    public static class Results {

        /**
         * Whether every run is appended to the result log.
         */
        private boolean enabled = true;

        private String path = "logs/qa_results.ndjson";

        /**
         * Value of the {@code tool} field of each log entry.
         */
        private String tool = "int_tests";
    }

    @Data
    public static class Http {

        /**
         * Largest response body that is buffered in memory.
         */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(16);

        private String userAgent = "flow-test-agent";
    }
}
