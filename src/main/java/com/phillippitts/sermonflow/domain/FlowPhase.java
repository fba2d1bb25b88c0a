package com.phillippitts.sermonflow.domain;

import com.phillippitts.sermonflow.exception.SermonFlowException;

import java.util.Locale;
import java.util.Objects;

/**
 * The single current phase of the sermon flow.
 *
 * <p>{@code step} is set only for {@link Kind#PROCESSING}; {@code error} only for {@link Kind#ERROR}.
 */
public record FlowPhase(Kind kind, ProcessingStep step, SermonFlowException error) {

    public enum Kind {
        INPUT,
        RECORDING,
        IMPORTING,
        PROCESSING,
        VIEWING,
        ERROR
    }

    private static final FlowPhase INPUT = new FlowPhase(Kind.INPUT, null, null);
    private static final FlowPhase RECORDING = new FlowPhase(Kind.RECORDING, null, null);
    private static final FlowPhase IMPORTING = new FlowPhase(Kind.IMPORTING, null, null);
    private static final FlowPhase VIEWING = new FlowPhase(Kind.VIEWING, null, null);

    public FlowPhase {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.PROCESSING) != (step != null)) {
            throw new IllegalArgumentException("step must be present exactly for PROCESSING");
        }
        if ((kind == Kind.ERROR) != (error != null)) {
            throw new IllegalArgumentException("error must be present exactly for ERROR");
        }
    }

    public static FlowPhase input() {
        return INPUT;
    }

    public static FlowPhase recording() {
        return RECORDING;
    }

    public static FlowPhase importing() {
        return IMPORTING;
    }

    public static FlowPhase processing(ProcessingStep step) {
        return new FlowPhase(Kind.PROCESSING, step, null);
    }

    public static FlowPhase viewing() {
        return VIEWING;
    }

    public static FlowPhase error(SermonFlowException error) {
        return new FlowPhase(Kind.ERROR, null, error);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PROCESSING -> "PROCESSING(" + step.stage() + " " + String.format(Locale.ROOT, "%.2f", step.fraction()) + ")";
            case ERROR -> "ERROR(" + error.getKind() + ")";
            default -> kind.name();
        };
    }
}
