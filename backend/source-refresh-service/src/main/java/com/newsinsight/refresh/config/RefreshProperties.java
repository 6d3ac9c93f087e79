package com.newsinsight.refresh.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for refresh and status-check rounds.
 *
 * Bound from the {@code refresh.*} keys in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "refresh")
@Validated
@Data
public class RefreshProperties {

    /**
     * Upper bound on concurrent collector calls within one round.
     * Each status-check worker holds one pooled connection for the whole round,
     * so the datasource pool must stay larger than this.
     */
    @Min(1)
    @Max(8)
    private int maxWorkers = 8;

    private ExecutorSettings executor = new ExecutorSettings();

    private Http http = new Http();

    private Sources sources = new Sources();

    @Data
    public static class ExecutorSettings {
        /**
         * Threads that coordinate rounds (one per running round)
         */
        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        private int queueCapacity = 10;

        private int awaitTerminationSeconds = 60;
    }

    @Data
    public static class Http {
        private int connectTimeoutMs = 10000;

        private int readTimeoutMs = 30000;

        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    }

    @Data
    public static class Sources {
        /**
         * Seed {@link #defaults} into an empty news_sources table on startup
         */
        private boolean seedEnabled = true;

        private List<SourceEntry> defaults = new ArrayList<>();
    }

    @Data
    public static class SourceEntry {
        private String name;

        private String url;

        /**
         * Collector type: rss, web
         */
        private String type = "rss";

        private String category;

        private boolean enabled = true;

        /**
         * Passed through to the collector unmodified
         */
        private Map<String, Object> customConfig = new HashMap<>();
    }
}
