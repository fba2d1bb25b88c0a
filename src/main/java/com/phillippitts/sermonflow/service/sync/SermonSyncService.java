package com.phillippitts.sermonflow.service.sync;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists sermons and moves chunk audio to remote storage.
 */
public interface SermonSyncService {

    /** Saves the sermon and its chunk records. */
    void createSermon(Sermon sermon, List<AudioChunk> chunks);

    /**
     * Uploads one chunk's audio and records its remote location.
     *
     * @return remote reference (object key)
     */
    String uploadChunk(AudioChunk chunk, byte[] data);

    /** Whether the chunk already has a remote copy. */
    boolean isUploaded(AudioChunk chunk);

    Optional<Sermon> loadSermon(UUID sermonId);
}
