package com.phillippitts.sermonflow.service.audio.capture;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull side of the level meter. Holds at most {@code capacity} undelivered samples; a slow consumer
 * loses the oldest ones.
 */
public final class LevelSubscription implements AutoCloseable {

    private final AudioLevelMeter meter;
    private final BlockingQueue<Float> queue;
    private volatile boolean closed;

    LevelSubscription(AudioLevelMeter meter, int capacity) {
        this.meter = meter;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void offer(float level) {
        if (closed) {
            return;
        }
        while (!queue.offer(level)) {
            queue.poll();
        }
    }

    /**
     * Waits up to {@code timeout} for the next sample.
     *
     * @return the sample, or {@code null} on timeout or once closed
     */
    public Float poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return null;
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.clear();
            meter.unsubscribe(this);
        }
    }
}
