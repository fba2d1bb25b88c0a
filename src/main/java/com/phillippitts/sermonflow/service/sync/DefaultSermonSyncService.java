package com.phillippitts.sermonflow.service.sync;

import com.phillippitts.sermonflow.config.properties.ObjectStoreProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import com.phillippitts.sermonflow.service.storage.ObjectStoreClient;
import com.phillippitts.sermonflow.service.validation.AudioContainerType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository-backed sync. Remote keys follow {@code <userId>/<sermonId>/chunk_NNN.<ext>}.
 */
@Service
public class DefaultSermonSyncService implements SermonSyncService {

    private static final Logger LOG = LogManager.getLogger(DefaultSermonSyncService.class);

    private final SermonRepository repository;
    private final ObjectStoreClient objectStore;
    private final String bucket;

    public DefaultSermonSyncService(SermonRepository repository, ObjectStoreClient objectStore,
                                    ObjectStoreProperties objectStoreProperties) {
        this.repository = repository;
        this.objectStore = objectStore;
        this.bucket = objectStoreProperties.getBucket();
    }

    @Override
    public void createSermon(Sermon sermon, List<AudioChunk> chunks) {
        repository.saveSermon(sermon);
        repository.saveChunks(sermon.id(), chunks);
        LOG.info("Persisted sermon {} with {} chunk(s), {}s", sermon.id(), chunks.size(), sermon.durationSeconds());
    }

    @Override
    public String uploadChunk(AudioChunk chunk, byte[] data) {
        Sermon sermon = repository.fetchSermon(chunk.sermonId())
                .orElseThrow(() -> new IllegalStateException("Sermon " + chunk.sermonId() + " is not persisted"));
        String key = remoteKey(sermon.userId(), chunk);
        objectStore.putObject(bucket, key, new ByteArrayInputStream(data), data.length,
                AudioContainerType.mimeTypeForExtension(chunk.fileExtension()));
        repository.saveChunk(chunk.withRemotePath(key));
        LOG.debug("Uploaded chunk {} of sermon {} ({} bytes)", chunk.chunkIndex(), chunk.sermonId(), data.length);
        return key;
    }

    @Override
    public boolean isUploaded(AudioChunk chunk) {
        return chunk.remotePath() != null && objectStore.exists(bucket, chunk.remotePath());
    }

    @Override
    public Optional<Sermon> loadSermon(UUID sermonId) {
        return repository.fetchSermon(sermonId);
    }

    static String remoteKey(UUID userId, AudioChunk chunk) {
        String ext = chunk.fileExtension().isEmpty() ? "audio" : chunk.fileExtension();
        return String.format("%s/%s/chunk_%03d.%s", userId, chunk.sermonId(), chunk.chunkIndex(), ext);
    }
}
