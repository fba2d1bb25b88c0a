package com.phillippitts.sermonflow.config.orchestration;

import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.service.audio.analysis.ChunkAssembler;
import com.phillippitts.sermonflow.service.audio.capture.AudioCaptureService;
import com.phillippitts.sermonflow.service.auth.AuthService;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.orchestration.DefaultSermonFlowOrchestrator;
import com.phillippitts.sermonflow.service.orchestration.FlowStateMachine;
import com.phillippitts.sermonflow.service.orchestration.SermonFlowOrchestratorBuilder;
import com.phillippitts.sermonflow.service.permission.MicrophonePermissionService;
import com.phillippitts.sermonflow.service.queue.ProcessingJobQueue;
import com.phillippitts.sermonflow.service.queue.SermonTranscriber;
import com.phillippitts.sermonflow.service.queue.StudyGuideGenerator;
import com.phillippitts.sermonflow.service.queue.UnconfiguredProcessingBackend;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import com.phillippitts.sermonflow.service.sync.SermonSyncService;
import com.phillippitts.sermonflow.service.upload.ChunkUploader;
import com.phillippitts.sermonflow.service.validation.ImportValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the sermon flow orchestrator explicitly through its builder.
 *
 * <p>Transcription and study guide back ends are pluggable: when the application context defines no
 * {@link SermonTranscriber} or {@link StudyGuideGenerator}, the matching half of an
 * {@link UnconfiguredProcessingBackend} is registered, so jobs fail with a clear reason instead of the
 * context failing to start. Each bean exposes a single interface so injection stays unambiguous.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean(SermonTranscriber.class)
    public SermonTranscriber sermonTranscriber() {
        return new UnconfiguredProcessingBackend()::transcribe;
    }

    @Bean
    @ConditionalOnMissingBean(StudyGuideGenerator.class)
    public StudyGuideGenerator studyGuideGenerator() {
        return new UnconfiguredProcessingBackend()::generate;
    }

    /**
     * Phase holder shared by the orchestrator; publishes phase change events.
     */
    @Bean
    public FlowStateMachine flowStateMachine(ApplicationEventPublisher publisher) {
        return new FlowStateMachine(publisher);
    }

    @Bean
    public DefaultSermonFlowOrchestrator sermonFlowOrchestrator(
            AudioCaptureService captureService,
            MicrophonePermissionService permissionService,
            AuthService authService,
            ImportValidator importValidator,
            ChunkAssembler chunkAssembler,
            ChunkUploader chunkUploader,
            SermonSyncService syncService,
            ProcessingJobQueue jobQueue,
            SermonRepository repository,
            ApplicationEventPublisher publisher,
            ProcessingMetrics metrics,
            RecordingProperties recordingProperties,
            ProcessingProperties processingProperties,
            @Qualifier("processingExecutor") Executor processingExecutor,
            @Qualifier("meteringExecutor") Executor meteringExecutor,
            @Qualifier("flowScheduler") ScheduledExecutorService flowScheduler,
            FlowStateMachine flowStateMachine) {
        return SermonFlowOrchestratorBuilder.builder()
                .captureService(captureService)
                .permissionService(permissionService)
                .authService(authService)
                .importValidator(importValidator)
                .chunkAssembler(chunkAssembler)
                .chunkUploader(chunkUploader)
                .syncService(syncService)
                .jobQueue(jobQueue)
                .repository(repository)
                .publisher(publisher)
                .metrics(metrics)
                .recordingProperties(recordingProperties)
                .processingProperties(processingProperties)
                .processingExecutor(processingExecutor)
                .meteringExecutor(meteringExecutor)
                .scheduler(flowScheduler)
                .stateMachine(flowStateMachine)
                .build();
    }
}
