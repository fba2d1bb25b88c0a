package com.phillippitts.sermonflow.service.audio.capture;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * A chunk file reached its full duration and was closed.
 */
public record ChunkCompletedEvent(UUID sessionId, UUID sermonId, int chunkIndex, Path path,
                                  double durationSeconds, Instant at) { }
