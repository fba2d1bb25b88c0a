package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.service.orchestration.event.FlowPhaseChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of the current {@link FlowPhase}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * INPUT → RECORDING | IMPORTING
 * RECORDING | IMPORTING → PROCESSING
 * PROCESSING → VIEWING | ERROR
 * ERROR → INPUT (dismiss) | PROCESSING (retry)
 * any → INPUT (reset, cancel)
 * </pre>
 *
 * <p>Legality of a transition is decided by the orchestrator; this class records the phase and
 * announces every change as a {@link FlowPhaseChangedEvent}. Progress updates inside
 * {@code PROCESSING} are transitions too but are only logged at debug level.
 */
public final class FlowStateMachine {

    private static final Logger LOG = LogManager.getLogger(FlowStateMachine.class);

    private final Lock lock = new ReentrantLock();
    private final ApplicationEventPublisher publisher;
    private FlowPhase phase = FlowPhase.input();

    public FlowStateMachine(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Returns the current phase.
     */
    public FlowPhase current() {
        lock.lock();
        try {
            return phase;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to {@code next} and publishes the change.
     *
     * @param sermonId sermon of the current cycle, may be {@code null}
     * @param next new phase
     * @return the phase that was replaced
     */
    public FlowPhase transition(UUID sermonId, FlowPhase next) {
        Objects.requireNonNull(next, "next");
        FlowPhase previous;
        lock.lock();
        try {
            previous = phase;
            phase = next;
        } finally {
            lock.unlock();
        }
        if (previous.kind() == next.kind()) {
            LOG.debug("Flow phase {} -> {}", previous, next);
        } else {
            LOG.info("Flow phase {} -> {} (sermon={})", previous, next, sermonId);
        }
        publisher.publishEvent(new FlowPhaseChangedEvent(sermonId, previous, next, Instant.now()));
        return previous;
    }

    /**
     * Checks whether the current phase is of the given kind.
     */
    public boolean is(FlowPhase.Kind kind) {
        return current().is(kind);
    }
}
