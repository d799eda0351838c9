package com.acme.ringqueue.queue;

/**
 * FIFO queue whose capacity is a starting size, not a limit.
 */
public interface GrowableQueue<E> {
    int capacity();
    int size();
    boolean isEmpty();
    void push(E e);
    E front();
    E pop();
}
