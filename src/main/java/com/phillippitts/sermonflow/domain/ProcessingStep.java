package com.phillippitts.sermonflow.domain;

import java.util.Objects;

/**
 * Sub-step of the processing phase. Each stage owns a disjoint slice of the overall progress bar:
 * uploading [0, 0.2), transcribing [0.2, 0.7), then fixed points for moderating, analyzing and saving.
 *
 * @param fraction   progress within the stage, only meaningful for uploading and transcribing
 * @param chunkIndex 1-based chunk being transcribed, 0 for other stages
 */
public record ProcessingStep(Stage stage, double fraction, int chunkIndex, int chunkTotal) {

    public enum Stage {
        UPLOADING,
        TRANSCRIBING,
        MODERATING,
        ANALYZING,
        SAVING
    }

    public ProcessingStep {
        Objects.requireNonNull(stage, "stage");
        fraction = Double.isNaN(fraction) ? 0.0 : Math.max(0.0, Math.min(1.0, fraction));
    }

    public static ProcessingStep uploading(double fraction) {
        return new ProcessingStep(Stage.UPLOADING, fraction, 0, 0);
    }

    public static ProcessingStep transcribing(double fraction, int chunkIndex, int chunkTotal) {
        return new ProcessingStep(Stage.TRANSCRIBING, fraction, chunkIndex, chunkTotal);
    }

    public static ProcessingStep moderating() {
        return new ProcessingStep(Stage.MODERATING, 0.0, 0, 0);
    }

    public static ProcessingStep analyzing() {
        return new ProcessingStep(Stage.ANALYZING, 0.0, 0, 0);
    }

    public static ProcessingStep saving() {
        return new ProcessingStep(Stage.SAVING, 0.0, 0, 0);
    }

    /** Position of this step on the 0..1 progress bar. */
    public double overallProgress() {
        return switch (stage) {
            case UPLOADING -> fraction * 0.2;
            case TRANSCRIBING -> 0.2 + fraction * 0.5;
            case MODERATING -> 0.75;
            case ANALYZING -> 0.85;
            case SAVING -> 0.95;
        };
    }

    public String displayName() {
        return switch (stage) {
            case UPLOADING -> "Uploading audio...";
            case TRANSCRIBING -> chunkTotal > 1
                    ? "Transcribing (chunk " + chunkIndex + " of " + chunkTotal + ")..."
                    : "Transcribing audio...";
            case MODERATING -> "Reviewing content...";
            case ANALYZING -> "Generating study guide...";
            case SAVING -> "Saving...";
        };
    }
}
