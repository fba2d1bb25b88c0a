package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.service.audio.analysis.ChunkAssembler;
import com.phillippitts.sermonflow.service.audio.capture.AudioCaptureService;
import com.phillippitts.sermonflow.service.auth.AuthService;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.permission.MicrophonePermissionService;
import com.phillippitts.sermonflow.service.queue.ProcessingJobQueue;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import com.phillippitts.sermonflow.service.sync.SermonSyncService;
import com.phillippitts.sermonflow.service.upload.ChunkUploader;
import com.phillippitts.sermonflow.service.validation.ImportValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builder for {@link DefaultSermonFlowOrchestrator}.
 *
 * <p>The orchestrator has many collaborators; the builder keeps construction readable and lets tests
 * leave out the optional ones.
 *
 * <p>Example usage:
 * <pre>{@code
 * SermonFlowOrchestrator orchestrator = SermonFlowOrchestratorBuilder.builder()
 *     .captureService(captureService)
 *     .permissionService(permissionService)
 *     .authService(authService)
 *     // ... remaining collaborators
 *     .build();
 * }</pre>
 */
public final class SermonFlowOrchestratorBuilder {

    private AudioCaptureService captureService;
    private MicrophonePermissionService permissionService;
    private AuthService authService;
    private ImportValidator importValidator;
    private ChunkAssembler chunkAssembler;
    private ChunkUploader chunkUploader;
    private SermonSyncService syncService;
    private ProcessingJobQueue jobQueue;
    private SermonRepository repository;
    private ApplicationEventPublisher publisher;
    private ProcessingMetrics metrics;
    private RecordingProperties recordingProperties;
    private ProcessingProperties processingProperties;
    private Executor processingExecutor;
    private Executor meteringExecutor;
    private ScheduledExecutorService scheduler;
    private FlowStateMachine stateMachine;

    private SermonFlowOrchestratorBuilder() {
    }

    /**
     * Creates a new builder instance.
     *
     * @return new builder
     */
    public static SermonFlowOrchestratorBuilder builder() {
        return new SermonFlowOrchestratorBuilder();
    }

    /**
     * Sets the microphone capture service.
     *
     * @param captureService capture service writing chunk files
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder captureService(AudioCaptureService captureService) {
        this.captureService = captureService;
        return this;
    }

    /**
     * Sets the microphone permission check.
     *
     * @param permissionService permission collaborator
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder permissionService(MicrophonePermissionService permissionService) {
        this.permissionService = permissionService;
        return this;
    }

    /**
     * Sets the auth collaborator.
     *
     * @param authService source of the signed-in user
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder authService(AuthService authService) {
        this.authService = authService;
        return this;
    }

    /**
     * Sets the import validator.
     *
     * @param importValidator validates and copies imported files
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder importValidator(ImportValidator importValidator) {
        this.importValidator = importValidator;
        return this;
    }

    /**
     * Sets the chunk assembler.
     *
     * @param chunkAssembler builds chunk records from recorded files
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder chunkAssembler(ChunkAssembler chunkAssembler) {
        this.chunkAssembler = chunkAssembler;
        return this;
    }

    /**
     * Sets the chunk uploader.
     *
     * @param chunkUploader sequential uploader
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder chunkUploader(ChunkUploader chunkUploader) {
        this.chunkUploader = chunkUploader;
        return this;
    }

    /**
     * Sets the sync collaborator.
     *
     * @param syncService persists sermons and loads them back
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder syncService(SermonSyncService syncService) {
        this.syncService = syncService;
        return this;
    }

    /**
     * Sets the processing job queue.
     *
     * @param jobQueue queue and progress stream
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder jobQueue(ProcessingJobQueue jobQueue) {
        this.jobQueue = jobQueue;
        return this;
    }

    /**
     * Sets the repository results are read from.
     *
     * @param repository sermon repository
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder repository(SermonRepository repository) {
        this.repository = repository;
        return this;
    }

    /**
     * Sets the application event publisher.
     *
     * @param publisher Spring event publisher
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * Sets the processing metrics (optional).
     *
     * @param metrics Micrometer instrumentation
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder metrics(ProcessingMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Sets the recording properties.
     *
     * @param recordingProperties chunk duration, minimum duration, level history size
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder recordingProperties(RecordingProperties recordingProperties) {
        this.recordingProperties = recordingProperties;
        return this;
    }

    /**
     * Sets the processing properties.
     *
     * @param processingProperties processing timeout
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder processingProperties(ProcessingProperties processingProperties) {
        this.processingProperties = processingProperties;
        return this;
    }

    /**
     * Sets the executor running the processing sequence.
     *
     * @param processingExecutor executor for upload and progress consumption
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder processingExecutor(Executor processingExecutor) {
        this.processingExecutor = processingExecutor;
        return this;
    }

    /**
     * Sets the executor collecting audio levels.
     *
     * @param meteringExecutor executor for the metering loop
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder meteringExecutor(Executor meteringExecutor) {
        this.meteringExecutor = meteringExecutor;
        return this;
    }

    /**
     * Sets the scheduler for the duration timer and the processing timeout.
     *
     * @param scheduler scheduled executor
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Sets the flow state machine (optional, one is created from the publisher otherwise).
     *
     * @param stateMachine phase holder
     * @return this builder
     */
    public SermonFlowOrchestratorBuilder stateMachine(FlowStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return configured orchestrator
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultSermonFlowOrchestrator build() {
        Objects.requireNonNull(captureService, "captureService is required");
        Objects.requireNonNull(permissionService, "permissionService is required");
        Objects.requireNonNull(authService, "authService is required");
        Objects.requireNonNull(importValidator, "importValidator is required");
        Objects.requireNonNull(chunkAssembler, "chunkAssembler is required");
        Objects.requireNonNull(chunkUploader, "chunkUploader is required");
        Objects.requireNonNull(syncService, "syncService is required");
        Objects.requireNonNull(jobQueue, "jobQueue is required");
        Objects.requireNonNull(repository, "repository is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(recordingProperties, "recordingProperties is required");
        Objects.requireNonNull(processingProperties, "processingProperties is required");
        Objects.requireNonNull(processingExecutor, "processingExecutor is required");
        Objects.requireNonNull(meteringExecutor, "meteringExecutor is required");
        Objects.requireNonNull(scheduler, "scheduler is required");

        // Tests may leave metrics and the state machine out
        ProcessingMetrics effectiveMetrics = metrics != null
                ? metrics
                : new ProcessingMetrics(new SimpleMeterRegistry());
        FlowStateMachine effectiveStateMachine = stateMachine != null
                ? stateMachine
                : new FlowStateMachine(publisher);

        return new DefaultSermonFlowOrchestrator(
                captureService,
                permissionService,
                authService,
                importValidator,
                chunkAssembler,
                chunkUploader,
                syncService,
                jobQueue,
                repository,
                effectiveMetrics,
                recordingProperties,
                processingProperties,
                processingExecutor,
                meteringExecutor,
                scheduler,
                effectiveStateMachine
        );
    }
}
