package com.whereq.easel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Easel.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "easel")
@Data
public class EaselProperties {

    private EngineConfig engine = new EngineConfig();

    private LimitsConfig limits = new LimitsConfig();

    private TimeoutsConfig timeouts = new TimeoutsConfig();

    private TopicsConfig topics = new TopicsConfig();

    private JobsConfig jobs = new JobsConfig();

    /**
     * How long shutdown waits for in-flight jobs.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    @Data
    public static class EngineConfig {
        /**
         * Base HTTP URL of the execution engine. The event channel URL is derived from it.
         */
        private String baseUrl = "http://localhost:8188";

        /**
         * Optional bearer token sent with every request and the event channel handshake.
         */
        private String apiKey;

        /**
         * Largest response body buffered in memory (artifact downloads).
         */
        private int maxInMemorySize = 64 * 1024 * 1024;
    }

    @Data
    public static class LimitsConfig {
        /**
         * Jobs executing at the same time across all topics.
         */
        private int maxWorkers = 2;

        /**
         * Workers per topic. Values below 1 are treated as 1.
         */
        private int perTopic = 1;

        /**
         * Accepted-but-not-started jobs allowed per requester. 0 or negative disables the cap.
         */
        private int perUserPending = 3;
    }

    @Data
    public static class TimeoutsConfig {
        /**
         * Event channel connect timeout and HTTP response timeout.
         */
        private Duration ws = Duration.ofSeconds(120);

        /**
         * Total time from submission to the completion event.
         */
        private Duration run = Duration.ofSeconds(300);
    }

    @Data
    public static class TopicsConfig {
        /**
         * Directory holding one sub-directory per topic.
         */
        private String dir = "data/topics";
    }

    @Data
    public static class JobsConfig {
        /**
         * How long finished job records stay queryable.
         */
        private Duration retention = Duration.ofHours(1);

        /**
         * Images beyond this count are ignored.
         */
        private int maxInputImages = 10;
    }
}
