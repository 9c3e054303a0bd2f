package com.whereq.augur.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Augur.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "augur")
@Data
public class AugurProperties {

    private String serviceName = "intelligence-module";

    private String serviceVersion = "dev";

    private ApiConfig api = new ApiConfig();

    private WorkerConfig worker = new WorkerConfig();

    private QueueConfig queue = new QueueConfig();

    private StoreConfig store = new StoreConfig();

    private BrokerConfig broker = new BrokerConfig();

    private IntakeConfig intake = new IntakeConfig();

    @Data
    public static class ApiConfig {
        /**
         * Path prefix of the job endpoints. Health stays at the root.
         */
        private String prefix = "/api/intelligence";
    }

    @Data
    public static class WorkerConfig {
        /**
         * Start the worker pool with the application.
         */
        private boolean enabled = true;

        /**
         * Number of concurrent workers.
         */
        private int count = 4;

        /**
         * How long one dequeue call blocks before the loop re-checks for shutdown.
         */
        private Duration dequeueTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound of a single plugin execution.
         */
        private Duration pluginTimeout = Duration.ofSeconds(60);

        /**
         * Plugin threads per worker. Headroom for plugins that outlive their timeout.
         */
        private int pluginThreadsPerWorker = 2;

        /**
         * Initial pause after a store or queue failure inside the loop.
         */
        private Duration errorBackoff = Duration.ofSeconds(1);

        /**
         * Cap of the pause after repeated loop failures.
         */
        private Duration maxErrorBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class QueueConfig {
        /**
         * Key prefix shared by queue and store keys.
         */
        private String keyPrefix = "intelligence";

        /**
         * Time a delivered reference stays invisible before it is handed out again.
         * Also the lease of a claimed job.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(5);

        /**
         * Submissions are rejected once the queue holds this many references.
         */
        private long maxSize = 10_000;
    }

    @Data
    public static class StoreConfig {
        /**
         * Retention of job records.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * Bound applied when a worker blocks on a store call.
         */
        private Duration operationTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class BrokerConfig {
        /**
         * Base URL of the NGSI-LD context broker.
         */
        private String url = "http://orion-ld-service:1026";

        /**
         * JSON-LD context embedded in written entities.
         */
        private String contextUrl = "https://nekazari.artotxiki.com/ngsi-ld-context.json";

        /**
         * Timeout of one HTTP attempt.
         */
        private Duration requestTimeout = Duration.ofSeconds(10);

        /**
         * Retries after the first attempt.
         */
        private int maxRetries = 3;

        private Duration initialBackoff = Duration.ofMillis(500);

        private Duration maxBackoff = Duration.ofSeconds(10);

        /**
         * Longest time a publication can take: every attempt timing out plus every pause at its cap.
         */
        public Duration worstCasePublishDuration() {
            Duration attempts = requestTimeout.multipliedBy(maxRetries + 1L);
            Duration pauses = maxBackoff.multipliedBy(maxRetries);
            return attempts.plus(pauses);
        }
    }

    @Data
    public static class IntakeConfig {
        private String defaultPlugin = "simple_predictor";

        private int defaultHorizon = 24;

        private int maxHorizon = 168;

        /**
         * Reject unknown plugin names at submission instead of failing the job in the worker.
         */
        private boolean rejectUnknownPlugins = false;

        /**
         * Retries of store and queue calls before answering 503.
         */
        private int storeRetries = 3;

        private Duration storeBackoff = Duration.ofMillis(200);
    }
}
