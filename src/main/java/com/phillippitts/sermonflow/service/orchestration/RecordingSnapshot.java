package com.phillippitts.sermonflow.service.orchestration;

/**
 * Point-in-time view of an active recording.
 *
 * @param elapsedSeconds whole seconds recorded, excluding paused time
 * @param paused whether capture is paused
 * @param currentLevel most recent normalized input level (0..1)
 * @param recentLevels bounded history of levels, oldest first
 * @param completedChunks chunk files closed so far
 */
public record RecordingSnapshot(int elapsedSeconds, boolean paused, float currentLevel, float[] recentLevels,
                                int completedChunks) {

    public static final RecordingSnapshot IDLE = new RecordingSnapshot(0, false, 0f, new float[0], 0);

    public RecordingSnapshot {
        recentLevels = recentLevels == null ? new float[0] : recentLevels.clone();
    }

    @Override
    public float[] recentLevels() {
        return recentLevels.clone();
    }
}
