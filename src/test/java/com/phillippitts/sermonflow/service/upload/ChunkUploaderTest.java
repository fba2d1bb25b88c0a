package com.phillippitts.sermonflow.service.upload;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.exception.ChunkNotFoundException;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.sync.SermonSyncService;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ChunkUploader}.
 */
class ChunkUploaderTest {

    @TempDir
    Path tmp;

    private final UUID sermonId = UUID.randomUUID();
    private SermonSyncService sync;
    private SimpleMeterRegistry registry;
    private ChunkUploader uploader;

    @BeforeEach
    void setUp() {
        sync = mock(SermonSyncService.class);
        registry = new SimpleMeterRegistry();
        uploader = new ChunkUploader(sync, new ProcessingMetrics(registry));
    }

    private AudioChunk chunk(int index) throws IOException {
        Path file = Files.write(tmp.resolve(String.format("chunk_%03d.wav", index)), new byte[] {(byte) index});
        return AudioChunk.pending(sermonId, index, index * 60.0, 60.0, file);
    }

    @Test
    void shouldUploadInIndexOrderAndReportProgress() throws IOException {
        // Arrange
        AudioChunk c0 = chunk(0);
        AudioChunk c1 = chunk(1);
        AudioChunk c2 = chunk(2);
        List<Integer> order = new ArrayList<>();
        when(sync.uploadChunk(any(), any())).thenAnswer(inv -> {
            AudioChunk c = inv.getArgument(0);
            order.add(c.chunkIndex());
            return "key/" + c.chunkIndex();
        });
        List<Double> progress = new ArrayList<>();

        // Act
        List<AudioChunk> uploaded = uploader.upload(List.of(c2, c0, c1), progress::add);

        // Assert
        assertThat(order).containsExactly(0, 1, 2);
        assertThat(progress).containsExactly(1.0 / 3, 2.0 / 3, 1.0);
        assertThat(uploaded).extracting(AudioChunk::remotePath).containsExactly("key/0", "key/1", "key/2");
        assertThat(uploaded).noneMatch(AudioChunk::uploadPending);
        Timer latency = registry.find("sermonflow.upload.latency").timer();
        assertThat(latency).isNotNull();
        assertThat(latency.count()).isEqualTo(3);
    }

    @Test
    void shouldSkipChunksAlreadyUploaded() throws IOException {
        // Arrange
        AudioChunk done = chunk(0).withRemotePath("key/0");
        AudioChunk pending = chunk(1);
        when(sync.isUploaded(done)).thenReturn(true);
        when(sync.uploadChunk(any(), any())).thenReturn("key/1");
        List<Double> progress = new ArrayList<>();

        // Act
        List<AudioChunk> uploaded = uploader.upload(List.of(done, pending), progress::add);

        // Assert
        verify(sync, never()).uploadChunk(eq(done), any());
        assertThat(uploaded.get(0)).isSameAs(done);
        assertThat(uploaded.get(1).remotePath()).isEqualTo("key/1");
        assertThat(progress).containsExactly(0.5, 1.0);
    }

    @Test
    void shouldFailWhenLocalFileIsMissing() throws IOException {
        // Arrange
        AudioChunk present = chunk(0);
        AudioChunk missing = AudioChunk.pending(sermonId, 1, 60.0, 60.0, tmp.resolve("chunk_001.wav"));
        when(sync.uploadChunk(any(), any())).thenReturn("key/0");

        // Act + Assert
        assertThatThrownBy(() -> uploader.upload(List.of(present, missing), p -> { }))
                .isInstanceOfSatisfying(ChunkNotFoundException.class,
                        e -> assertThat(e.getChunkIndex()).isEqualTo(1));
    }

    @Test
    void shouldPropagateStoreFailure() throws IOException {
        AudioChunk c0 = chunk(0);
        when(sync.uploadChunk(any(), any())).thenThrow(new IllegalStateException("network down"));

        assertThatThrownBy(() -> uploader.upload(List.of(c0), p -> { }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("network down");
    }

    @Test
    void shouldStopWhenThreadIsInterrupted() throws IOException {
        AudioChunk c0 = chunk(0);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> uploader.upload(List.of(c0), p -> { }))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
        verify(sync, never()).uploadChunk(any(), any());
    }
}
