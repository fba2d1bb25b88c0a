package com.phillippitts.sermonflow.service.repository;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Local persistence of sermons, their chunks and processing results.
 *
 * <p>The flow orchestrator only reads results ({@link #fetchTranscript}, {@link #fetchStudyGuide}); the
 * sync service and job queue do the writing. Both fetches legitimately return empty while processing is
 * incomplete.
 */
public interface SermonRepository {

    Optional<Transcript> fetchTranscript(UUID sermonId);

    Optional<StudyGuide> fetchStudyGuide(UUID sermonId);

    Optional<Sermon> fetchSermon(UUID sermonId);

    /** Chunks ordered by index. */
    List<AudioChunk> fetchChunks(UUID sermonId);

    void saveSermon(Sermon sermon);

    /** Replaces the sermon's chunk list. */
    void saveChunks(UUID sermonId, List<AudioChunk> chunks);

    /** Inserts or replaces one chunk, matched by index. */
    void saveChunk(AudioChunk chunk);

    void saveTranscript(Transcript transcript);

    void saveStudyGuide(StudyGuide studyGuide);
}
