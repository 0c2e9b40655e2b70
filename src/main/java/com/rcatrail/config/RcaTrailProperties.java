package com.rcatrail.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Centralizes topic names, session/metrics defaults and worker pool sizing.
 *
 * Bound from application.yml under the "rcatrail" prefix:
 *   rcatrail:
 *     topics:
 *       batches: rcatrail.batches
 *       anomalies: rcatrail.anomalies
 *       rejected: rcatrail.batches.rejected
 *     session:
 *       inactivity-threshold: 30m
 *     metrics:
 *       top-n: 10
 *       velocity-window-days: 30
 *     anomalies:
 *       sample-size: 10
 *     dedup:
 *       ttl: 24h
 *     workers:
 *       core-pool-size: 4
 *       max-pool-size: 8
 *       queue-capacity: 200
 */
@ConfigurationProperties(prefix = "rcatrail")
@Getter
@Setter
public class RcaTrailProperties {

    private Topics topics = new Topics();
    private Session session = new Session();
    private Metrics metrics = new Metrics();
    private Anomalies anomalies = new Anomalies();
    private Dedup dedup = new Dedup();
    private Workers workers = new Workers();

    @Getter
    @Setter
    public static class Topics {
        private String batches = "rcatrail.batches";
        private String anomalies = "rcatrail.anomalies";
        private String rejected = "rcatrail.batches.rejected";
    }

    @Getter
    @Setter
    public static class Session {
        private Duration inactivityThreshold = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Metrics {
        private int topN = 10;
        private int velocityWindowDays = 30;
    }

    @Getter
    @Setter
    public static class Anomalies {
        private int sampleSize = 10;
    }

    @Getter
    @Setter
    public static class Dedup {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Workers {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 200;
    }
}
