package com.phillippitts.sermonflow.service.events;

import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.exception.SermonFlowException;
import com.phillippitts.sermonflow.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.sermonflow.service.orchestration.event.FlowPhaseChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log of user-facing failures. Throttled per error kind to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}, sermon={}. Check the microphone device and permissions.",
                    e.reason(), e.sermonId());
        }
    }

    @EventListener
    void onPhaseChanged(FlowPhaseChangedEvent e) {
        if (!e.current().is(FlowPhase.Kind.ERROR)) {
            return;
        }
        SermonFlowException error = e.current().error();
        String key = "flow-" + error.getKind();
        if (shouldLog(key)) {
            LOG.warn("Sermon flow entered error phase: kind={}, retryable={}, sermon={}, message={}",
                    error.getKind(), error.isRetryable(), e.sermonId(), error.getMessage());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
