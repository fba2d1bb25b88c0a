package com.phillippitts.sermonflow.util;

import java.time.Duration;

/**
 * Timeouts for threads and subprocesses owned by this service.
 *
 * @see com.phillippitts.sermonflow.service.audio.capture.JavaSoundAudioCaptureService
 * @see com.phillippitts.sermonflow.service.audio.analysis.DefaultMediaDurationProbe
 */
public final class ProcessTimeouts {

    /** Capture thread must finish writing the last chunk within this window on stop. */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofSeconds(2);

    /** Best-effort join during application shutdown. */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** ffprobe reads container metadata only; anything slower is treated as a failure. */
    public static final Duration FFPROBE_TIMEOUT = Duration.ofSeconds(15);

    /** Grace period after {@link Process#destroy()} before forcing termination. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Poll interval of the metering loop; bounds how long a closed subscription takes to notice. */
    public static final Duration LEVEL_POLL_INTERVAL = Duration.ofMillis(250);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
