package com.company.silencing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Silencing configuration.
 * Maps to the 'silencing' prefix in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "silencing")
public class SilenceProperties {

    private GcConfig gc = new GcConfig();
    private SyncConfig sync = new SyncConfig();
    private ManagerConfig manager = new ManagerConfig();
    private CacheConfig cache = new CacheConfig();
    private MatcherConfig matcher = new MatcherConfig();
    private QueryConfig query = new QueryConfig();

    @Data
    public static class GcConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private Duration initialDelay = Duration.ofMinutes(1);
        // Keep expired silences this long before hard delete
        private Duration retention = Duration.ofHours(24);
        private int batchSize = 1000;
        private Duration tickTimeout = Duration.ofMinutes(5);
        // Early warning for silences about to end
        private Duration expiringSoonWindow = Duration.ofMinutes(15);
    }

    @Data
    public static class SyncConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
    }

    @Data
    public static class ManagerConfig {
        private boolean autoStart = true;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class CacheConfig {
        // How long a deleted id with no known end time refuses late writes
        private Duration tombstoneTtl = Duration.ofHours(1);
    }

    @Data
    public static class MatcherConfig {
        // 0 = unbounded
        private int regexCacheSize = 1000;
    }

    @Data
    public static class QueryConfig {
        private int defaultLimit = 100;
        private int maxLimit = 1000;
        private int expiringSoonLimit = 1000;
    }
}
