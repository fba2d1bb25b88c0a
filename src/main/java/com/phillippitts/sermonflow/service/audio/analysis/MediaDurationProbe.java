package com.phillippitts.sermonflow.service.audio.analysis;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the playback duration of an audio file from its metadata.
 */
public interface MediaDurationProbe {

    /**
     * @return duration in seconds
     * @throws IOException when the file cannot be read or its duration cannot be determined
     */
    double durationSeconds(Path audioFile) throws IOException;
}
