package com.phillippitts.sermonflow.service.orchestration.event;

import com.phillippitts.sermonflow.domain.FlowPhase;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted on every flow phase transition.
 *
 * @param sermonId sermon of the current cycle, or {@code null} when no sermon is active
 * @param previous phase before the transition
 * @param current phase after the transition
 * @param timestamp when the transition happened
 */
public record FlowPhaseChangedEvent(
        UUID sermonId,
        FlowPhase previous,
        FlowPhase current,
        Instant timestamp
) {}
