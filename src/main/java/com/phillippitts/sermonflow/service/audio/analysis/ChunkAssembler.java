package com.phillippitts.sermonflow.service.audio.analysis;

import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.exception.ChunkNotFoundException;
import com.phillippitts.sermonflow.exception.RecordingFailedException;
import com.phillippitts.sermonflow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns chunk files into {@link AudioChunk} records: measures each duration, lays the chunks out back to
 * back and attaches a waveform summary.
 */
@Component
public class ChunkAssembler {

    private static final Logger LOG = LogManager.getLogger(ChunkAssembler.class);

    private final MediaDurationProbe durationProbe;
    private final WaveformSummarizer waveformSummarizer;

    public ChunkAssembler(MediaDurationProbe durationProbe, WaveformSummarizer waveformSummarizer) {
        this.durationProbe = durationProbe;
        this.waveformSummarizer = waveformSummarizer;
    }

    /**
     * @param chunkFiles chunk files in index order
     * @return contiguous chunk records, index {@code i} starting at the sum of durations before it
     */
    public List<AudioChunk> assemble(UUID sermonId, List<Path> chunkFiles) {
        List<AudioChunk> chunks = new ArrayList<>(chunkFiles.size());
        double offset = 0;
        for (int i = 0; i < chunkFiles.size(); i++) {
            Path file = chunkFiles.get(i);
            if (file == null || !Files.isRegularFile(file)) {
                throw new ChunkNotFoundException(i);
            }
            double duration;
            try {
                duration = durationProbe.durationSeconds(file);
            } catch (IOException e) {
                throw new RecordingFailedException("Could not read chunk " + i + ": " + e.getMessage(), e);
            }
            chunks.add(AudioChunk.pending(sermonId, i, offset, duration, file).withWaveform(waveform(file)));
            offset += duration;
        }
        AudioChunk.requireContiguous(chunks);
        return chunks;
    }

    /**
     * Adds waveform summaries to chunks whose durations are already known (imports).
     */
    public List<AudioChunk> summarize(List<AudioChunk> chunks) {
        List<AudioChunk> out = new ArrayList<>(chunks.size());
        for (AudioChunk c : chunks) {
            if (c.localPath() == null || !Files.isRegularFile(c.localPath())) {
                throw new ChunkNotFoundException(c.chunkIndex());
            }
            out.add(c.waveform().isEmpty() ? c.withWaveform(waveform(c.localPath())) : c);
        }
        AudioChunk.requireContiguous(out);
        return out;
    }

    private List<Float> waveform(Path file) {
        try {
            return waveformSummarizer.summarize(file);
        } catch (IOException e) {
            LOG.warn("Waveform summary failed for {}: {}", LogSanitizer.fileName(file), e.getMessage());
            return List.of();
        }
    }
}
