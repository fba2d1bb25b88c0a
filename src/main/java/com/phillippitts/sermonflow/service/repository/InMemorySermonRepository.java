package com.phillippitts.sermonflow.service.repository;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local repository. Results live as long as the application.
 */
@Repository
public class InMemorySermonRepository implements SermonRepository {

    private final Map<UUID, Sermon> sermons = new ConcurrentHashMap<>();
    private final Map<UUID, List<AudioChunk>> chunks = new ConcurrentHashMap<>();
    private final Map<UUID, Transcript> transcripts = new ConcurrentHashMap<>();
    private final Map<UUID, StudyGuide> studyGuides = new ConcurrentHashMap<>();

    @Override
    public Optional<Transcript> fetchTranscript(UUID sermonId) {
        return Optional.ofNullable(transcripts.get(sermonId));
    }

    @Override
    public Optional<StudyGuide> fetchStudyGuide(UUID sermonId) {
        return Optional.ofNullable(studyGuides.get(sermonId));
    }

    @Override
    public Optional<Sermon> fetchSermon(UUID sermonId) {
        return Optional.ofNullable(sermons.get(sermonId));
    }

    @Override
    public List<AudioChunk> fetchChunks(UUID sermonId) {
        List<AudioChunk> list = chunks.get(sermonId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public void saveSermon(Sermon sermon) {
        sermons.put(sermon.id(), Objects.requireNonNull(sermon));
    }

    @Override
    public void saveChunks(UUID sermonId, List<AudioChunk> list) {
        List<AudioChunk> sorted = new ArrayList<>(list);
        sorted.sort(Comparator.comparingInt(AudioChunk::chunkIndex));
        chunks.put(sermonId, List.copyOf(sorted));
    }

    @Override
    public void saveChunk(AudioChunk chunk) {
        chunks.compute(chunk.sermonId(), (id, existing) -> {
            List<AudioChunk> list = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            list.removeIf(c -> c.chunkIndex() == chunk.chunkIndex());
            list.add(chunk);
            list.sort(Comparator.comparingInt(AudioChunk::chunkIndex));
            return List.copyOf(list);
        });
    }

    @Override
    public void saveTranscript(Transcript transcript) {
        transcripts.put(transcript.sermonId(), transcript);
    }

    @Override
    public void saveStudyGuide(StudyGuide studyGuide) {
        studyGuides.put(studyGuide.sermonId(), studyGuide);
    }
}
