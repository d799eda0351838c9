package com.acme.ringqueue.telemetry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counters; one instance may be shared by several queues, in which
 * case depth and capacity reflect the queue that reported last.
 */
public final class AtomicQueueMetrics implements QueueMetrics {
    private final LongAdder pushes = new LongAdder();
    private final LongAdder pops = new LongAdder();
    private final LongAdder resizes = new LongAdder();
    private final AtomicInteger depth = new AtomicInteger();
    private final AtomicInteger maxDepth = new AtomicInteger();
    private final AtomicInteger capacity = new AtomicInteger();

    @Override
    public void onPush(int depth) {
        pushes.increment();
        setDepth(depth);
    }

    @Override
    public void onPop(int depth) {
        pops.increment();
        setDepth(depth);
    }

    @Override
    public void onResize(int oldCapacity, int newCapacity) {
        if (newCapacity <= oldCapacity) return;
        resizes.increment();
        capacity.set(newCapacity);
    }

    private void setDepth(int value) {
        int d = Math.max(0, value);
        depth.set(d);
        maxDepth.accumulateAndGet(d, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(
            pushes.sum(),
            pops.sum(),
            resizes.sum(),
            depth.get(),
            maxDepth.get(),
            capacity.get()
        );
    }

    public record Snapshot(long pushes,
                           long pops,
                           long resizes,
                           int depth,
                           int maxDepth,
                           int lastGrownCapacity) {}
}
