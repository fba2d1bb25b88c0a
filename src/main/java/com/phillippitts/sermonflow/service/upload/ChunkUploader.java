package com.phillippitts.sermonflow.service.upload;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.exception.ChunkNotFoundException;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.sync.SermonSyncService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.DoubleConsumer;

/**
 * Uploads a sermon's chunks one at a time in index order.
 *
 * <p>After each chunk the fraction {@code (i+1)/total} is reported. Chunks that already have a remote copy
 * are skipped but still counted, so replaying an upload after a failure only sends what is missing.
 * Failed uploads are not retried here.
 */
@Component
public class ChunkUploader {

    private static final Logger LOG = LogManager.getLogger(ChunkUploader.class);

    private final SermonSyncService syncService;
    private final ProcessingMetrics metrics;

    public ChunkUploader(SermonSyncService syncService, ProcessingMetrics metrics) {
        this.syncService = syncService;
        this.metrics = metrics;
    }

    /**
     * @param onProgress receives the aggregate fraction after each chunk
     * @return the chunks with remote paths set
     * @throws ChunkNotFoundException if a chunk has no local file
     * @throws UncheckedIOException if a chunk file cannot be read
     * @throws CancellationException if the calling thread is interrupted between chunks
     */
    public List<AudioChunk> upload(List<AudioChunk> chunks, DoubleConsumer onProgress) {
        List<AudioChunk> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingInt(AudioChunk::chunkIndex));
        int total = ordered.size();
        List<AudioChunk> uploaded = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Upload canceled before chunk " + i);
            }
            AudioChunk chunk = ordered.get(i);
            if (chunk.localPath() == null || !Files.isRegularFile(chunk.localPath())) {
                throw new ChunkNotFoundException(chunk.chunkIndex());
            }
            if (syncService.isUploaded(chunk)) {
                LOG.debug("Chunk {} already uploaded; skipping", chunk.chunkIndex());
                uploaded.add(chunk);
            } else {
                uploaded.add(uploadOne(chunk));
            }
            onProgress.accept((double) (i + 1) / total);
        }
        LOG.info("Uploaded {} chunk(s)", total);
        return uploaded;
    }

    private AudioChunk uploadOne(AudioChunk chunk) {
        byte[] data;
        try {
            data = Files.readAllBytes(chunk.localPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read chunk " + chunk.chunkIndex(), e);
        }
        long start = System.nanoTime();
        String remoteRef = syncService.uploadChunk(chunk, data);
        metrics.recordUploadLatency(System.nanoTime() - start);
        return chunk.withRemotePath(remoteRef);
    }
}
