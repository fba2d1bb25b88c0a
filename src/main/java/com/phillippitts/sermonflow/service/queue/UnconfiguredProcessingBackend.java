package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;

import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Placeholder back end registered when no transcriber or generator bean is provided. Every job fails
 * with a message naming the missing bean, which surfaces as a stage failure.
 */
public class UnconfiguredProcessingBackend implements SermonTranscriber, StudyGuideGenerator {

    @Override
    public Transcript transcribe(Sermon sermon, List<AudioChunk> chunks, DoubleConsumer onProgress) {
        throw new IllegalStateException("No SermonTranscriber bean is configured");
    }

    @Override
    public StudyGuide generate(Sermon sermon, Transcript transcript) {
        throw new IllegalStateException("No StudyGuideGenerator bean is configured");
    }
}
