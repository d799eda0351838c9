package com.acme.ringqueue.telemetry;

/**
 * Observer for structural events of a queue. Implementations must be cheap:
 * they run inline on every push and pop.
 */
public interface QueueMetrics {
    void onPush(int depth);
    void onPop(int depth);
    void onResize(int oldCapacity, int newCapacity);
}
