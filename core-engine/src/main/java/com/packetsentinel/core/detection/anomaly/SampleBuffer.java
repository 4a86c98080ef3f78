package com.packetsentinel.core.detection.anomaly;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded ring of training vectors; the oldest sample is overwritten once
 * the buffer is full.
 *
 * @since 1.0.0
 */
final class SampleBuffer {

    private final double[][] ring;
    private int next;
    private int size;

    SampleBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.ring = new double[capacity][];
    }

    /**
     * @return number of buffered samples after adding {@code sample}
     */
    synchronized int add(double[] sample) {
        ring[next] = sample;
        next = (next + 1) % ring.length;
        if (size < ring.length) {
            size++;
        }
        return size;
    }

    synchronized int size() {
        return size;
    }

    /**
     * @return buffered samples, oldest first
     */
    synchronized List<double[]> snapshot() {
        List<double[]> copy = new ArrayList<>(size);
        int start = size < ring.length ? 0 : next;
        for (int i = 0; i < size; i++) {
            copy.add(ring[(start + i) % ring.length]);
        }
        return copy;
    }
}
