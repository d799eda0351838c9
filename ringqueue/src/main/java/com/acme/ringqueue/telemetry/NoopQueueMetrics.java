package com.acme.ringqueue.telemetry;

public final class NoopQueueMetrics implements QueueMetrics {
    public static final NoopQueueMetrics INSTANCE = new NoopQueueMetrics();

    private NoopQueueMetrics() {
    }

    @Override
    public void onPush(int depth) {
    }

    @Override
    public void onPop(int depth) {
    }

    @Override
    public void onResize(int oldCapacity, int newCapacity) {
    }
}
