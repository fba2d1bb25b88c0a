package com.phillippitts.sermonflow.service.audio.capture;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans out instantaneous input levels (normalized RMS in [0,1]) to subscribers.
 */
public final class AudioLevelMeter {

    private static final int DEFAULT_SUBSCRIPTION_CAPACITY = 64;

    private final List<LevelSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile float current;

    public LevelSubscription subscribe() {
        return subscribe(DEFAULT_SUBSCRIPTION_CAPACITY);
    }

    public LevelSubscription subscribe(int capacity) {
        LevelSubscription s = new LevelSubscription(this, capacity);
        subscriptions.add(s);
        return s;
    }

    public void publish(float level) {
        current = level;
        for (LevelSubscription s : subscriptions) {
            s.offer(level);
        }
    }

    public float current() {
        return current;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    void unsubscribe(LevelSubscription s) {
        subscriptions.remove(s);
    }

    /** Resets the current level; called when a session ends. */
    void reset() {
        current = 0f;
    }

    /**
     * RMS of a PCM16LE buffer, scaled so full-scale is 1.0.
     */
    public static float normalizedRms(byte[] pcm, int length) {
        int samples = length / 2;
        if (samples == 0) {
            return 0f;
        }
        double sum = 0;
        for (int i = 0; i < samples; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1];
            double v = ((hi << 8) | lo) / 32768.0;
            sum += v * v;
        }
        return (float) Math.min(1.0, Math.sqrt(sum / samples));
    }
}
