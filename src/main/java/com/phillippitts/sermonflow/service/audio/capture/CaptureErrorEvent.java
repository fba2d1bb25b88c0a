package com.phillippitts.sermonflow.service.audio.capture;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when capture fails after the session started (device lost, disk full).
 *
 * Payload contains a short reason code and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(UUID sessionId, UUID sermonId, String reason, Instant at) { }
