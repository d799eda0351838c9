package com.acme.ringqueue.util;

/**
 * Canonical environment variable names read by {@link RingQueueSettings}.
 */
public final class RingQueueEnvKeys {
    public static final String RINGQUEUE_INITIAL_CAPACITY = "RINGQUEUE_INITIAL_CAPACITY";
    public static final String RINGQUEUE_METRICS_ENABLED = "RINGQUEUE_METRICS_ENABLED";
    public static final String RINGQUEUE_METRICS_INTERVAL_SECONDS = "RINGQUEUE_METRICS_INTERVAL_SECONDS";

    private RingQueueEnvKeys() {
    }
}
