package com.phillippitts.sermonflow.service.audio.analysis;

import com.phillippitts.sermonflow.config.properties.ImportProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.exception.ChunkNotFoundException;
import com.phillippitts.sermonflow.exception.RecordingFailedException;
import com.phillippitts.sermonflow.testutil.TestAudioFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChunkAssembler}.
 */
class ChunkAssemblerTest {

    @TempDir
    Path tmp;

    private final UUID sermonId = UUID.randomUUID();

    @Test
    void shouldLayOutChunksBackToBack() throws IOException {
        // Arrange
        ChunkAssembler assembler = new ChunkAssembler(
                new DefaultMediaDurationProbe(ImportProperties.defaults()),
                new WaveformSummarizer());
        List<Path> files = List.of(
                TestAudioFiles.wav(tmp.resolve("chunk_000.wav"), 2.0),
                TestAudioFiles.wav(tmp.resolve("chunk_001.wav"), 1.5),
                TestAudioFiles.wav(tmp.resolve("chunk_002.wav"), 0.5));

        // Act
        List<AudioChunk> chunks = assembler.assemble(sermonId, files);

        // Assert
        assertThat(chunks).extracting(AudioChunk::chunkIndex).containsExactly(0, 1, 2);
        assertThat(chunks).extracting(AudioChunk::startOffsetSeconds).containsExactly(0.0, 2.0, 3.5);
        assertThat(AudioChunk.totalDuration(chunks)).isCloseTo(4.0, within(1e-9));
        assertThat(chunks).allSatisfy(c -> {
            assertThat(c.sermonId()).isEqualTo(sermonId);
            assertThat(c.uploadPending()).isTrue();
            assertThat(c.waveform()).hasSize(WaveformSummarizer.DEFAULT_SAMPLE_COUNT);
        });
        assertThat(chunks.get(2).localPath()).isEqualTo(files.get(2));
    }

    @Test
    void shouldFailOnMissingChunkFile() throws IOException {
        // Arrange
        ChunkAssembler assembler = new ChunkAssembler(file -> 1.0, new WaveformSummarizer());
        List<Path> files = List.of(
                TestAudioFiles.wav(tmp.resolve("chunk_000.wav"), 1.0),
                tmp.resolve("chunk_001.wav"));

        // Act + Assert
        assertThatThrownBy(() -> assembler.assemble(sermonId, files))
                .isInstanceOfSatisfying(ChunkNotFoundException.class,
                        e -> assertThat(e.getChunkIndex()).isEqualTo(1));
    }

    @Test
    void shouldReportUnreadableDurationAsRecordingFailure() throws IOException {
        // Arrange
        ChunkAssembler assembler = new ChunkAssembler(file -> {
            throw new IOException("corrupt header");
        }, new WaveformSummarizer());
        Path file = TestAudioFiles.wav(tmp.resolve("chunk_000.wav"), 1.0);

        // Act + Assert
        assertThatThrownBy(() -> assembler.assemble(sermonId, List.of(file)))
                .isInstanceOf(RecordingFailedException.class)
                .hasMessageContaining("corrupt header");
    }

    @Test
    void shouldKeepEmptyWaveformForCompressedChunks() throws IOException {
        // Arrange
        ChunkAssembler assembler = new ChunkAssembler(file -> 90.0, new WaveformSummarizer());
        Path mp3 = Files.write(tmp.resolve("chunk_000.mp3"), new byte[] {'I', 'D', '3', 4, 0, 0, 0, 0, 0, 0, 0, 0});

        // Act
        List<AudioChunk> chunks = assembler.assemble(sermonId, List.of(mp3));

        // Assert
        assertThat(chunks).singleElement().satisfies(c -> {
            assertThat(c.durationSeconds()).isEqualTo(90.0);
            assertThat(c.waveform()).isEmpty();
        });
    }

    @Test
    void summarizeShouldOnlyFillMissingWaveforms() throws IOException {
        // Arrange
        ChunkAssembler assembler = new ChunkAssembler(file -> 1.0, new WaveformSummarizer());
        Path file = TestAudioFiles.wav(tmp.resolve("chunk_000.wav"), 1.0);
        AudioChunk bare = AudioChunk.pending(sermonId, 0, 0.0, 1.0, file);
        AudioChunk summarized = bare.withWaveform(List.of(0.1f, 0.2f));

        // Act
        List<AudioChunk> fromBare = assembler.summarize(List.of(bare));
        List<AudioChunk> fromSummarized = assembler.summarize(List.of(summarized));

        // Assert
        assertThat(fromBare.get(0).waveform()).hasSize(WaveformSummarizer.DEFAULT_SAMPLE_COUNT);
        assertThat(fromSummarized.get(0).waveform()).containsExactly(0.1f, 0.2f);
    }

    @Test
    void summarizeShouldRejectChunkWithoutLocalFile() {
        ChunkAssembler assembler = new ChunkAssembler(file -> 1.0, new WaveformSummarizer());
        AudioChunk gone = AudioChunk.pending(sermonId, 0, 0.0, 1.0, tmp.resolve("gone.wav"));

        assertThatThrownBy(() -> assembler.summarize(List.of(gone)))
                .isInstanceOf(ChunkNotFoundException.class);
    }
}
