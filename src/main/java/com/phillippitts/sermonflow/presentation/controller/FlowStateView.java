package com.phillippitts.sermonflow.presentation.controller;

import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.domain.ProcessingStep;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.SermonStatus;
import com.phillippitts.sermonflow.exception.SermonFlowException;
import com.phillippitts.sermonflow.service.orchestration.RecordingSnapshot;
import com.phillippitts.sermonflow.service.orchestration.SermonFlowOrchestrator;

import java.time.Duration;

/**
 * JSON view of the orchestrator's observable state.
 *
 * @param phase current phase kind
 * @param step processing step, present only while processing
 * @param progress highest overall progress of the current cycle (0..1)
 * @param estimatedProcessingSeconds rough processing time for the current audio, if any
 * @param error blocking error, or the study guide failure of a degraded sermon
 * @param sermon current sermon, if any
 * @param status derived sermon status, if any
 * @param chunkCount chunks of the current cycle
 * @param recording recording snapshot, present only while recording
 */
public record FlowStateView(
        FlowPhase.Kind phase,
        StepView step,
        double progress,
        Long estimatedProcessingSeconds,
        ErrorView error,
        Sermon sermon,
        SermonStatus status,
        int chunkCount,
        RecordingSnapshot recording
) {

    public record StepView(ProcessingStep.Stage stage, String displayName, double fraction, double overallProgress) {

        static StepView of(ProcessingStep step) {
            return new StepView(step.stage(), step.displayName(), step.fraction(), step.overallProgress());
        }
    }

    public record ErrorView(String kind, String message, boolean retryable) {

        static ErrorView of(SermonFlowException ex) {
            return new ErrorView(ex.getKind().name(), ex.getMessage(), ex.isRetryable());
        }
    }

    static FlowStateView of(SermonFlowOrchestrator orchestrator) {
        FlowPhase phase = orchestrator.currentPhase();
        return new FlowStateView(
                phase.kind(),
                phase.step() != null ? StepView.of(phase.step()) : null,
                orchestrator.processingProgress(),
                orchestrator.estimatedProcessingTime().map(Duration::toSeconds).orElse(null),
                orchestrator.currentError().map(ErrorView::of).orElse(null),
                orchestrator.currentSermon().orElse(null),
                orchestrator.currentStatus().orElse(null),
                orchestrator.currentChunks().size(),
                phase.is(FlowPhase.Kind.RECORDING) ? orchestrator.recordingSnapshot() : null);
    }
}
