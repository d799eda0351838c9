package com.acme.ringqueue.queue;

/**
 * Point-in-time view of a queue's cursors, for diagnostics.
 */
public record QueueSnapshot(
    int count,
    int capacity,
    int front,
    int back,
    int generation
) {}
