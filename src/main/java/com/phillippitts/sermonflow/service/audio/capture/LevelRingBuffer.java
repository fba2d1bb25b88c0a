package com.phillippitts.sermonflow.service.audio.capture;

import java.util.Arrays;

/**
 * Fixed-size ring of recent level samples. When full, the oldest sample is dropped.
 * Thread-safe.
 */
public final class LevelRingBuffer {

    private final float[] buffer;
    private int writePos = 0;
    private int size = 0;

    public LevelRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buffer = new float[capacity];
    }

    public int capacity() {
        return buffer.length;
    }

    public synchronized void add(float level) {
        buffer[writePos] = level;
        writePos = (writePos + 1) % buffer.length;
        size = Math.min(size + 1, buffer.length);
    }

    public synchronized int size() {
        return size;
    }

    /** Samples from oldest to newest. */
    public synchronized float[] toArray() {
        float[] out = new float[size];
        int start = (writePos - size + buffer.length) % buffer.length;
        int first = Math.min(size, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < size) {
            System.arraycopy(buffer, 0, out, first, size - first);
        }
        return out;
    }

    public synchronized float latest() {
        if (size == 0) {
            return 0f;
        }
        return buffer[(writePos - 1 + buffer.length) % buffer.length];
    }

    public synchronized void clear() {
        Arrays.fill(buffer, 0f);
        writePos = 0;
        size = 0;
    }
}
