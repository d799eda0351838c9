package com.acme.ringqueue.util;

import java.util.Map;

/**
 * Startup configuration for queues and their metrics reporter.
 */
public record RingQueueSettings(int initialCapacity,
                                boolean metricsEnabled,
                                long metricsIntervalSeconds) {

    public RingQueueSettings {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0, got " + initialCapacity);
        }
        if (metricsIntervalSeconds <= 0) {
            throw new IllegalArgumentException("metricsIntervalSeconds must be > 0, got " + metricsIntervalSeconds);
        }
    }

    public static RingQueueSettings defaults() {
        return new RingQueueSettings(
            RingQueueDefaults.DEFAULT_CAPACITY,
            false,
            RingQueueDefaults.DEFAULT_METRICS_INTERVAL_SECONDS
        );
    }

    public static RingQueueSettings fromEnv() {
        return fromEnv(System.getenv());
    }

    public static RingQueueSettings fromEnv(Map<String, String> env) {
        int capacity = EnvVars.getIntClamped(env,
            RingQueueEnvKeys.RINGQUEUE_INITIAL_CAPACITY,
            RingQueueDefaults.DEFAULT_CAPACITY,
            1,
            RingQueueDefaults.MAX_CAPACITY);
        boolean metrics = EnvVars.getBoolean(env, RingQueueEnvKeys.RINGQUEUE_METRICS_ENABLED, false);
        long interval = EnvVars.getLongClamped(env,
            RingQueueEnvKeys.RINGQUEUE_METRICS_INTERVAL_SECONDS,
            RingQueueDefaults.DEFAULT_METRICS_INTERVAL_SECONDS,
            1L,
            RingQueueDefaults.MAX_METRICS_INTERVAL_SECONDS);
        return new RingQueueSettings(capacity, metrics, interval);
    }
}
