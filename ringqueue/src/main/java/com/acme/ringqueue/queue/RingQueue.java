package com.acme.ringqueue.queue;

import com.acme.ringqueue.telemetry.NoopQueueMetrics;
import com.acme.ringqueue.telemetry.QueueMetrics;
import com.acme.ringqueue.util.RingQueueDefaults;
import com.acme.ringqueue.util.RingQueueSettings;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Growable FIFO queue over a circular array.
 *
 * <p>Live elements occupy {@code [front, front + count)} modulo the array
 * length. {@code front == back} holds both when the queue is empty and when it
 * is full, so {@code count} alone decides which. When a push finds the array
 * full, the array is doubled and the elements are unrolled to index 0 before
 * the new element is written. The array never shrinks.</p>
 *
 * <p>Every push and pop bumps a generation counter. Iterators capture it and
 * fail with {@link ConcurrentModificationException} on their next step once it
 * moves.</p>
 *
 * <p><b>Contract:</b> not synchronized. A queue must be owned by one thread at
 * a time; callers sharing it need their own locking.</p>
 */
public final class RingQueue<T> implements GrowableQueue<T>, Iterable<T> {
    private static final Logger LOG = Logger.getLogger(RingQueue.class.getName());

    private final QueueMetrics metrics;
    private Object[] storage;
    private int front;
    private int back;
    private int count;
    private int generation;

    public RingQueue() {
        this(RingQueueDefaults.DEFAULT_CAPACITY);
    }

    public RingQueue(int capacity) {
        this(capacity, NoopQueueMetrics.INSTANCE);
    }

    public RingQueue(int capacity, QueueMetrics metrics) {
        this.storage = new Object[checkCapacity(capacity)];
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RingQueue(Iterable<? extends T> source) {
        this(source, RingQueueDefaults.DEFAULT_CAPACITY);
    }

    /**
     * Creates a queue holding the elements of {@code source} in iteration order.
     * The array grows as needed while the source is consumed.
     *
     * @throws IllegalArgumentException if {@code capacity <= 0}
     * @throws NullPointerException if {@code source} is null
     */
    public RingQueue(Iterable<? extends T> source, int capacity) {
        this(capacity);
        Objects.requireNonNull(source, "source");
        for (T element : source) {
            push(element);
        }
    }

    public static <T> RingQueue<T> fromSettings(RingQueueSettings settings, QueueMetrics metrics) {
        Objects.requireNonNull(settings, "settings");
        return new RingQueue<>(settings.initialCapacity(), metrics);
    }

    private static int checkCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        return capacity;
    }

    @Override
    public int capacity() {
        return storage.length;
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Appends {@code element} at the back. O(1) amortized, O(n) when the array
     * has to grow. {@code null} is stored like any other element.
     */
    @Override
    public void push(T element) {
        if (count == storage.length) {
            resize(grownCapacity(storage.length));
        }
        generation++;
        storage[back] = element;
        back++;
        if (back == storage.length) {
            back = 0;
        }
        count++;
        metrics.onPush(count);
    }

    /**
     * @throws EmptyQueueException if the queue is empty
     */
    @Override
    @SuppressWarnings("unchecked")
    public T front() {
        if (count == 0) {
            throw new EmptyQueueException();
        }
        return (T) storage[front];
    }

    /**
     * Removes and returns the oldest element. The vacated slot is cleared.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    @Override
    @SuppressWarnings("unchecked")
    public T pop() {
        if (count == 0) {
            throw new EmptyQueueException();
        }
        T value = (T) storage[front];
        storage[front] = null;
        front++;
        if (front == storage.length) {
            front = 0;
        }
        count--;
        generation++;
        metrics.onPop(count);
        return value;
    }

    /**
     * Copies the live elements, oldest first, into {@code destination} starting
     * at {@code index}. Slots outside the written range are left as they are.
     *
     * @throws NullPointerException if {@code destination} is null
     * @throws IndexOutOfBoundsException if {@code index} is not a valid index of
     *         {@code destination}; a zero-length destination always fails
     * @throws IllegalArgumentException if fewer than {@link #size()} slots
     *         remain from {@code index}
     * @throws ArrayStoreException if an element does not fit the destination's
     *         component type
     */
    public void copyTo(Object[] destination, int index) {
        Objects.requireNonNull(destination, "destination");
        if (index < 0 || index >= destination.length) {
            throw new IndexOutOfBoundsException(
                "index " + index + " out of range for length " + destination.length);
        }
        if (destination.length - index < count) {
            throw new IllegalArgumentException(
                "destination has " + (destination.length - index) + " slots from index " + index
                    + ", need " + count);
        }
        unroll(destination, index);
    }

    public Object[] toArray() {
        Object[] out = new Object[count];
        unroll(out, 0);
        return out;
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(count, storage.length, front, back, generation);
    }

    int generation() {
        return generation;
    }

    @Override
    public RingIterator iterator() {
        return new RingIterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RingQueue[");
        int pos = front;
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(storage[pos]);
            pos = pos + 1 == storage.length ? 0 : pos + 1;
        }
        return sb.append(']').toString();
    }

    // Writes the live range, oldest first, to dest[offset..offset+count).
    private void unroll(Object[] dest, int offset) {
        if (count == 0) {
            return;
        }
        if (front < back) {
            System.arraycopy(storage, front, dest, offset, count);
        } else {
            int head = storage.length - front;
            System.arraycopy(storage, front, dest, offset, head);
            System.arraycopy(storage, 0, dest, offset + head, back);
        }
    }

    private void resize(int newCapacity) {
        Object[] grown = new Object[newCapacity];
        unroll(grown, 0);
        int oldCapacity = storage.length;
        front = 0;
        back = count == newCapacity ? 0 : count;
        storage = grown;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Grew ring queue from " + oldCapacity + " to " + newCapacity + " slots, count=" + count);
        }
        metrics.onResize(oldCapacity, newCapacity);
    }

    static int grownCapacity(int capacity) {
        if (capacity >= RingQueueDefaults.MAX_CAPACITY) {
            throw new IllegalStateException("Queue capacity exhausted at " + capacity + " slots");
        }
        if (capacity > RingQueueDefaults.MAX_CAPACITY / RingQueueDefaults.GROWTH_FACTOR) {
            return RingQueueDefaults.MAX_CAPACITY;
        }
        return capacity * RingQueueDefaults.GROWTH_FACTOR;
    }

    /**
     * Forward cursor over the live elements, oldest first.
     *
     * <p>The cursor records the queue generation when it is created. Any later
     * push or pop makes {@link #hasNext()}, {@link #next()} and {@link #reset()}
     * throw {@link ConcurrentModificationException}. Termination is decided by
     * the number of elements produced, not by comparing indexes.</p>
     */
    public final class RingIterator implements Iterator<T> {
        private final int expectedGeneration;
        private int pos;
        private int produced;

        RingIterator() {
            this.expectedGeneration = generation;
            this.pos = front;
        }

        @Override
        public boolean hasNext() {
            checkGeneration();
            return produced < count;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            checkGeneration();
            if (produced >= count) {
                throw new NoSuchElementException();
            }
            T value = (T) storage[pos];
            pos++;
            if (pos == storage.length) {
                pos = 0;
            }
            produced++;
            return value;
        }

        /**
         * Restarts traversal from the current front. Does not re-arm the
         * generation check: a cursor invalidated by a mutation stays invalid.
         */
        public void reset() {
            checkGeneration();
            pos = front;
            produced = 0;
        }

        private void checkGeneration() {
            if (generation != expectedGeneration) {
                throw new ConcurrentModificationException("Queue has been modified during iteration");
            }
        }
    }
}
