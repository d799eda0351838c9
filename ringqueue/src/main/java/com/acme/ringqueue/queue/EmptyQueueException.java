package com.acme.ringqueue.queue;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link RingQueue#front()} and {@link RingQueue#pop()} when the queue
 * holds no elements.
 */
public final class EmptyQueueException extends NoSuchElementException {
    public EmptyQueueException() {
        super("Queue is empty");
    }
}
