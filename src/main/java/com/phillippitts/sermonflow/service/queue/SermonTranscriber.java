package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.Transcript;

import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Transcription back end used by {@link LocalProcessingJobQueue}.
 */
@FunctionalInterface
public interface SermonTranscriber {

    /**
     * @param chunks     uploaded chunks in index order
     * @param onProgress fraction of the transcription completed, 0..1
     * @throws RuntimeException on failure; the message becomes the stage error
     */
    Transcript transcribe(Sermon sermon, List<AudioChunk> chunks, DoubleConsumer onProgress);
}
