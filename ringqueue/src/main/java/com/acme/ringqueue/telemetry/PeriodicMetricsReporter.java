package com.acme.ringqueue.telemetry;

import com.acme.ringqueue.util.JsonCodec;
import com.acme.ringqueue.util.RingQueueSettings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs a JSON line with queue counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicQueueMetrics metrics;
    private final String queueName;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicQueueMetrics metrics, String queueName, RingQueueSettings settings) {
        this(metrics, queueName, settings.metricsIntervalSeconds());
    }

    public PeriodicMetricsReporter(AtomicQueueMetrics metrics, String queueName, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.queueName = queueName == null ? "ring-queue" : queueName;
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ringqueue-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts a reporter when {@link RingQueueSettings#metricsEnabled()} is set.
     * The caller owns the returned reporter and must close it.
     */
    public static Optional<PeriodicMetricsReporter> startIfEnabled(AtomicQueueMetrics metrics,
                                                                   String queueName,
                                                                   RingQueueSettings settings) {
        if (!settings.metricsEnabled()) {
            return Optional.empty();
        }
        PeriodicMetricsReporter reporter = new PeriodicMetricsReporter(metrics, queueName, settings);
        reporter.start();
        LOG.info("Queue metrics reporting every " + reporter.intervalSeconds + "s for " + reporter.queueName);
        return Optional.of(reporter);
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicQueueMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "ringqueue");
        payload.put("queue", queueName);
        payload.put("pushes", s.pushes());
        payload.put("pops", s.pops());
        payload.put("resizes", s.resizes());
        payload.put("depth", s.depth());
        payload.put("maxDepth", s.maxDepth());
        payload.put("lastGrownCapacity", s.lastGrownCapacity());
        return JsonCodec.render(payload);
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.warning("Metrics reporter failure: " + e.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
