package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.ProgressUpdate;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Consumer side of a job's progress stream.
 *
 * <p>Updates are buffered in a bounded queue; when a slow consumer falls behind the oldest update is
 * dropped, which is harmless because progress is cumulative. {@link #cancel()} wakes a blocked
 * {@link #next()} and releases the publisher-side registration.
 */
public final class ProgressSubscription implements AutoCloseable {

    private static final int CAPACITY = 256;
    private static final Optional<ProgressUpdate> END = Optional.empty();

    private final UUID sermonId;
    private final BlockingQueue<Optional<ProgressUpdate>> queue = new LinkedBlockingQueue<>(CAPACITY);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile boolean drained;
    private final Consumer<ProgressSubscription> onCancel;

    public ProgressSubscription(UUID sermonId, Consumer<ProgressSubscription> onCancel) {
        this.sermonId = sermonId;
        this.onCancel = onCancel;
    }

    public UUID sermonId() {
        return sermonId;
    }

    /**
     * Blocks until the next update.
     *
     * @return the update, or {@code null} once the stream has ended or was cancelled
     */
    public ProgressUpdate next() throws InterruptedException {
        if (cancelled.get() || drained) {
            return null;
        }
        Optional<ProgressUpdate> item = queue.take();
        if (item.isEmpty() || cancelled.get()) {
            drained = true;
            return null;
        }
        return item.get();
    }

    void deliver(ProgressUpdate update) {
        if (cancelled.get() || ended.get()) {
            return;
        }
        Optional<ProgressUpdate> item = Optional.of(update);
        while (!queue.offer(item)) {
            queue.poll();
        }
    }

    void end() {
        if (ended.compareAndSet(false, true)) {
            while (!queue.offer(END)) {
                queue.poll();
            }
        }
    }

    /**
     * Stops the stream. Safe to call more than once and from any thread.
     *
     * @return {@code true} for the call that actually cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        queue.clear();
        queue.offer(END);
        onCancel.accept(this);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Whether the producer finished the stream. */
    public boolean isEnded() {
        return ended.get();
    }

    @Override
    public void close() {
        cancel();
    }
}
