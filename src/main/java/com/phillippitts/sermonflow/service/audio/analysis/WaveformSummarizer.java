package com.phillippitts.sermonflow.service.audio.analysis;

import com.phillippitts.sermonflow.service.audio.WavHeaderReader;
import com.phillippitts.sermonflow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a PCM16 WAV file to a fixed number of peak values in [0,1] for waveform display.
 * Compressed containers yield an empty summary.
 */
@Component
public class WaveformSummarizer {

    private static final Logger LOG = LogManager.getLogger(WaveformSummarizer.class);

    public static final int DEFAULT_SAMPLE_COUNT = 100;

    public List<Float> summarize(Path audioFile) throws IOException {
        return summarize(audioFile, DEFAULT_SAMPLE_COUNT);
    }

    public List<Float> summarize(Path audioFile, int sampleCount) throws IOException {
        Optional<WavHeaderReader.WavInfo> header = WavHeaderReader.read(audioFile);
        if (header.isEmpty() || !header.get().isPcm16()) {
            LOG.debug("No waveform for {} (not PCM16 WAV)", LogSanitizer.fileName(audioFile));
            return List.of();
        }
        WavHeaderReader.WavInfo info = header.get();
        int frameSize = Math.max(2, info.blockAlign());
        long frames = info.dataSize() / frameSize;
        if (frames == 0) {
            return List.of();
        }
        int buckets = (int) Math.min(sampleCount, frames);
        float[] peaks = new float[buckets];

        try (InputStream in = new BufferedInputStream(Files.newInputStream(audioFile))) {
            in.skipNBytes(info.dataOffset());
            byte[] frame = new byte[frameSize];
            for (long f = 0; f < frames; f++) {
                in.readNBytes(frame, 0, frameSize);
                int bucket = (int) (f * buckets / frames);
                // first channel is enough for a display summary
                int sample = (short) ((frame[0] & 0xFF) | (frame[1] << 8));
                float v = Math.abs(sample) / 32768f;
                if (v > peaks[bucket]) {
                    peaks[bucket] = v;
                }
            }
        }
        List<Float> out = new ArrayList<>(buckets);
        for (float p : peaks) {
            out.add(Math.min(1f, p));
        }
        return out;
    }
}
