package com.seriessentinel.core.window;

import java.util.AbstractList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;

/**
 * Bounded, ordered history of the most recent stream values.
 *
 * <p>
 * Backed by a fixed-size ring. {@link #append(double)} is O(1); once the
 * buffer is full the oldest value is evicted first-in-first-out. The buffer
 * also counts every value it has ever accepted, which gives the next value
 * its stream arrival index.
 * </p>
 *
 * <h3>Views</h3>
 * <p>
 * {@link #asSequence()} and {@link #tail(int)} return read-only
 * {@link List} views over the live ring, oldest first and newest last. A view
 * is only valid until the next {@link #append(double)}; callers that need a
 * stable snapshot should use {@link #toArray()}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. It is owned by a single
 * detector and only mutated from its ingest path.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowBuffer {

    private final double[] ring;

    /** Ring slot of the oldest retained value. */
    private int head;
    private int size;

    /** Number of values appended since construction. */
    private long appended;

    /**
     * @param capacity maximum number of retained values; must be at least 1
     * @throws IllegalArgumentException if {@code capacity} is below 1
     */
    public WindowBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.ring = new double[capacity];
    }

    /**
     * Append a value, evicting the oldest one if the buffer is full.
     *
     * @param value the value to record
     */
    public void append(double value) {
        if (size < ring.length) {
            ring[(head + size) % ring.length] = value;
            size++;
        } else {
            ring[head] = value;
            head = (head + 1) % ring.length;
        }
        appended++;
    }

    /**
     * @return read-only view of all retained values, newest last
     */
    public List<Double> asSequence() {
        return new RingView(0, size);
    }

    /**
     * Return the newest {@code n} retained values.
     *
     * @param n number of values; must be in {@code [0, size()]}
     * @return read-only view of the newest {@code n} values, newest last
     * @throws IllegalArgumentException if {@code n} is out of range
     */
    public List<Double> tail(int n) {
        if (n < 0 || n > size) {
            throw new IllegalArgumentException(
                    "tail length must be in [0, " + size + "], got: " + n);
        }
        return new RingView(size - n, n);
    }

    /**
     * @return the most recently appended value
     * @throws NoSuchElementException if the buffer is empty
     */
    public double latest() {
        if (size == 0) {
            throw new NoSuchElementException("WindowBuffer is empty");
        }
        return valueAt(size - 1);
    }

    /**
     * @return a copy of the retained values, oldest first
     */
    public double[] toArray() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = valueAt(i);
        }
        return copy;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == ring.length;
    }

    /**
     * @return total number of values appended, including evicted ones
     */
    public long appendedCount() {
        return appended;
    }

    private double valueAt(int logicalIndex) {
        return ring[(head + logicalIndex) % ring.length];
    }

    @Override
    public String toString() {
        return "WindowBuffer{size=" + size + ", capacity=" + ring.length + ", appended=" + appended + '}';
    }

    /** Read-only window over a contiguous logical range of the ring. */
    private final class RingView extends AbstractList<Double> implements RandomAccess {

        private final int offset;
        private final int length;

        private RingView(int offset, int length) {
            this.offset = offset;
            this.length = length;
        }

        @Override
        public Double get(int index) {
            if (index < 0 || index >= length) {
                throw new IndexOutOfBoundsException("Index: " + index + ", size: " + length);
            }
            return valueAt(offset + index);
        }

        @Override
        public int size() {
            return length;
        }
    }
}
