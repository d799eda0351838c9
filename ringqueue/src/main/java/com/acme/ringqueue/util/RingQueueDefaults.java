package com.acme.ringqueue.util;

/**
 * Default capacity and reporting constants.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class RingQueueDefaults {

    // ---- Storage ----
    public static final int DEFAULT_CAPACITY = 50;
    public static final int GROWTH_FACTOR = 2;
    // Some VMs reserve header words in arrays; stay below the hard limit.
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    // ---- Metrics reporter ----
    public static final long DEFAULT_METRICS_INTERVAL_SECONDS = 60L;
    public static final long MAX_METRICS_INTERVAL_SECONDS = 3_600L;

    private RingQueueDefaults() {
    }
}
