package com.phillippitts.sermonflow.service.audio.analysis;

import com.phillippitts.sermonflow.config.properties.ImportProperties;
import com.phillippitts.sermonflow.service.audio.WavHeaderReader;
import com.phillippitts.sermonflow.util.LogSanitizer;
import com.phillippitts.sermonflow.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * WAV durations come from the header; everything else is asked of ffprobe.
 *
 * <p>ffprobe is invoked as
 * {@code ffprobe -v error -show_entries format=duration -of json <file>} and its JSON output parsed
 * with org.json.
 */
@Component
public class DefaultMediaDurationProbe implements MediaDurationProbe {

    private static final Logger LOG = LogManager.getLogger(DefaultMediaDurationProbe.class);

    private final String ffprobePath;

    public DefaultMediaDurationProbe(ImportProperties props) {
        this.ffprobePath = props.getFfprobePath();
    }

    @Override
    public double durationSeconds(Path audioFile) throws IOException {
        if (!Files.isRegularFile(audioFile)) {
            throw new IOException("Not a file: " + LogSanitizer.fileName(audioFile));
        }
        Optional<WavHeaderReader.WavInfo> wav = WavHeaderReader.read(audioFile);
        if (wav.isPresent()) {
            return wav.get().durationSeconds();
        }
        return probeWithFfprobe(audioFile);
    }

    List<String> command(Path audioFile) {
        return List.of(ffprobePath, "-v", "error", "-show_entries", "format=duration", "-of", "json",
                audioFile.toAbsolutePath().toString());
    }

    private double probeWithFfprobe(Path audioFile) throws IOException {
        LOG.debug("Probing duration with ffprobe: {}", LogSanitizer.fileName(audioFile));
        ProcessBuilder pb = new ProcessBuilder(command(audioFile));
        pb.redirectErrorStream(true);
        Process process = pb.start();
        try {
            byte[] out = process.getInputStream().readAllBytes();
            if (!process.waitFor(ProcessTimeouts.FFPROBE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("ffprobe timed out after " + ProcessTimeouts.FFPROBE_TIMEOUT.toSeconds() + "s");
            }
            String output = new String(out, StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                LOG.warn("ffprobe failed for {} (exit {}): {}", LogSanitizer.fileName(audioFile),
                        process.exitValue(), LogSanitizer.truncate(output, 200));
                throw new IOException("ffprobe failed with exit code " + process.exitValue());
            }
            return parseDuration(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("ffprobe interrupted", e);
        } finally {
            if (process.isAlive()) {
                process.destroy();
                try {
                    if (!process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                        process.destroyForcibly();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    process.destroyForcibly();
                }
            }
        }
    }

    /**
     * Extracts {@code format.duration} from ffprobe's JSON output.
     */
    static double parseDuration(String json) throws IOException {
        try {
            JSONObject format = new JSONObject(json).getJSONObject("format");
            double seconds = Double.parseDouble(format.get("duration").toString());
            if (Double.isNaN(seconds) || seconds < 0) {
                throw new IOException("ffprobe reported an invalid duration: " + seconds);
            }
            return seconds;
        } catch (JSONException | NumberFormatException e) {
            throw new IOException("Failed to parse duration from ffprobe output", e);
        }
    }
}
