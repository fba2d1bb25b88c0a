package com.phillippitts.sermonflow.presentation.controller;

import com.phillippitts.sermonflow.service.orchestration.SermonFlowOrchestrator;
import com.phillippitts.sermonflow.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.UUID;

/**
 * HTTP surface of the sermon flow. Every intent returns the resulting observable state; failures that the
 * orchestrator captures into the error phase are part of that state, the rest go through
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/sermon-flow")
class SermonFlowController {

    private static final Logger LOG = LogManager.getLogger(SermonFlowController.class);

    private final SermonFlowOrchestrator orchestrator;

    SermonFlowController(SermonFlowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    ResponseEntity<FlowStateView> state() {
        return ok();
    }

    @PostMapping("/recording")
    ResponseEntity<FlowStateView> startRecording(@Valid @RequestBody(required = false)
                                                 SermonFlowRequests.StartRecording request) {
        String title = request != null ? request.title() : null;
        String speaker = request != null ? request.speakerName() : null;
        LOG.info("Start recording requested: title='{}'", LogSanitizer.text(title));
        orchestrator.startRecording(title, speaker);
        return ok();
    }

    @PostMapping("/recording/pause")
    ResponseEntity<FlowStateView> pauseRecording() {
        orchestrator.pauseRecording();
        return ok();
    }

    @PostMapping("/recording/resume")
    ResponseEntity<FlowStateView> resumeRecording() {
        orchestrator.resumeRecording();
        return ok();
    }

    @PostMapping("/recording/stop")
    ResponseEntity<FlowStateView> stopRecording() {
        orchestrator.stopRecording();
        return ok();
    }

    @DeleteMapping("/recording")
    ResponseEntity<FlowStateView> cancelRecording() {
        orchestrator.cancelRecording();
        return ok();
    }

    @PostMapping("/import")
    ResponseEntity<FlowStateView> importAudio(@Valid @RequestBody SermonFlowRequests.ImportAudio request) {
        Path source = Path.of(request.path());
        LOG.info("Import requested: {}", LogSanitizer.fileName(source));
        orchestrator.importAudio(source, request.title(), request.speakerName());
        return ok();
    }

    @PostMapping("/retry")
    ResponseEntity<FlowStateView> retry() {
        orchestrator.retry();
        return ok();
    }

    @PostMapping("/error/dismiss")
    ResponseEntity<FlowStateView> dismissError() {
        orchestrator.dismissError();
        return ok();
    }

    @PostMapping("/reset")
    ResponseEntity<FlowStateView> reset() {
        orchestrator.reset();
        return ok();
    }

    @PostMapping("/background")
    ResponseEntity<FlowStateView> enterBackground() {
        orchestrator.enterBackground();
        return ok();
    }

    @PostMapping("/foreground")
    ResponseEntity<FlowStateView> resumeFromBackground() {
        orchestrator.resumeFromBackground();
        return ok();
    }

    @PostMapping("/sermons/{id}/load")
    ResponseEntity<FlowStateView> loadSermon(@PathVariable("id") UUID id) {
        orchestrator.loadExistingSermon(id);
        return ok();
    }

    private ResponseEntity<FlowStateView> ok() {
        return ResponseEntity.ok(FlowStateView.of(orchestrator));
    }
}
