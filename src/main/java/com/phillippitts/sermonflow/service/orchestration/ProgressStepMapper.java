package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.domain.ProcessingStep;

/**
 * Translates the job queue's composite progress fraction into the step shown to the user.
 *
 * <p>Ranges:
 * <pre>
 * [0.00, 0.20)  Uploading(fraction / 0.20)
 * [0.20, 0.70)  Transcribing((fraction - 0.20) / 0.50, chunk, total)
 * [0.70, 0.75)  Moderating
 * [0.75, 0.95)  Analyzing
 * [0.95, 1.00]  Saving
 * </pre>
 */
public final class ProgressStepMapper {

    static final double UPLOAD_END = 0.20;
    static final double TRANSCRIPTION_END = 0.70;
    static final double MODERATION_END = 0.75;
    static final double ANALYSIS_END = 0.95;

    private ProgressStepMapper() {
    }

    /**
     * Maps a composite fraction to a processing step.
     *
     * @param fraction composite progress, clamped to [0, 1]
     * @param chunkTotal number of chunks in the sermon, at least 1
     * @return the matching step
     */
    public static ProcessingStep toStep(double fraction, int chunkTotal) {
        double f = Math.max(0.0, Math.min(1.0, fraction));
        int total = Math.max(1, chunkTotal);
        if (f < UPLOAD_END) {
            return ProcessingStep.uploading(f / UPLOAD_END);
        }
        if (f < TRANSCRIPTION_END) {
            double tf = (f - UPLOAD_END) / (TRANSCRIPTION_END - UPLOAD_END);
            int chunkIndex = Math.min((int) Math.floor(tf * total) + 1, total);
            return ProcessingStep.transcribing(tf, chunkIndex, total);
        }
        if (f < MODERATION_END) {
            return ProcessingStep.moderating();
        }
        if (f < ANALYSIS_END) {
            return ProcessingStep.analyzing();
        }
        return ProcessingStep.saving();
    }
}
