package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.domain.ProcessingJob;
import com.phillippitts.sermonflow.domain.ProcessingStatus;
import com.phillippitts.sermonflow.domain.ProcessingStep;
import com.phillippitts.sermonflow.domain.ProgressUpdate;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.SermonStatus;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.exception.MicrophonePermissionDeniedException;
import com.phillippitts.sermonflow.exception.NotAuthenticatedException;
import com.phillippitts.sermonflow.exception.ProcessingTimeoutException;
import com.phillippitts.sermonflow.exception.RecordingFailedException;
import com.phillippitts.sermonflow.exception.RecordingTooShortException;
import com.phillippitts.sermonflow.exception.SermonFlowException;
import com.phillippitts.sermonflow.exception.StudyGuideGenerationFailedException;
import com.phillippitts.sermonflow.exception.TranscriptionFailedException;
import com.phillippitts.sermonflow.service.audio.analysis.ChunkAssembler;
import com.phillippitts.sermonflow.service.audio.capture.AudioCaptureService;
import com.phillippitts.sermonflow.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.sermonflow.service.audio.capture.ChunkCompletedEvent;
import com.phillippitts.sermonflow.service.audio.capture.LevelRingBuffer;
import com.phillippitts.sermonflow.service.audio.capture.LevelSubscription;
import com.phillippitts.sermonflow.service.auth.AuthService;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.permission.MicrophonePermissionService;
import com.phillippitts.sermonflow.service.queue.ProcessingJobQueue;
import com.phillippitts.sermonflow.service.queue.ProgressSubscription;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import com.phillippitts.sermonflow.service.sync.SermonSyncService;
import com.phillippitts.sermonflow.service.upload.ChunkUploader;
import com.phillippitts.sermonflow.service.validation.AudioContainerType;
import com.phillippitts.sermonflow.service.validation.ImportValidator;
import com.phillippitts.sermonflow.service.validation.ValidatedAudio;
import com.phillippitts.sermonflow.util.LogSanitizer;
import com.phillippitts.sermonflow.util.ProcessTimeouts;
import com.phillippitts.sermonflow.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Default {@link SermonFlowOrchestrator}.
 *
 * <p>This orchestrator coordinates the complete sermon pipeline:
 * <ol>
 *   <li><b>Capture or import:</b> records chunked audio from the microphone, or validates and copies a file</li>
 *   <li><b>Assemble:</b> computes durations, offsets and waveform summaries per chunk</li>
 *   <li><b>Persist:</b> saves the sermon (duration = sum of chunk durations) and its chunk records</li>
 *   <li><b>Upload:</b> sends chunks to remote storage one at a time, in index order</li>
 *   <li><b>Enqueue and follow:</b> schedules the processing job and consumes its progress stream,
 *       racing it against the processing timeout</li>
 *   <li><b>Settle:</b> loads transcript and study guide and moves to viewing, or to the error phase</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> every mutating entry point takes a single {@link ReentrantLock}, so the phase,
 * the current sermon and its chunks have one writer at a time. Steps 2 to 6 run on the processing
 * executor as a <i>cycle</i>; each cycle checks that it is still the current one before writing state,
 * so a reset or a newer cycle silently retires an older one.
 *
 * <p><b>Background tasks:</b> the duration timer and the processing timeout run on the scheduler; the
 * metering loop runs on the metering executor and ends when its level subscription is closed.
 *
 * @see SermonFlowOrchestratorBuilder
 */
public final class DefaultSermonFlowOrchestrator implements SermonFlowOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSermonFlowOrchestrator.class);

    private final AudioCaptureService captureService;
    private final MicrophonePermissionService permissionService;
    private final AuthService authService;
    private final ImportValidator importValidator;
    private final ChunkAssembler chunkAssembler;
    private final ChunkUploader chunkUploader;
    private final SermonSyncService syncService;
    private final ProcessingJobQueue jobQueue;
    private final SermonRepository repository;
    private final ProcessingMetrics metrics;
    private final RecordingProperties recordingProps;
    private final ProcessingProperties processingProps;
    private final Executor processingExecutor;
    private final Executor meteringExecutor;
    private final ScheduledExecutorService scheduler;
    private final FlowStateMachine stateMachine;

    private final ReentrantLock lock = new ReentrantLock();
    private final LevelRingBuffer levels;
    private final AtomicInteger completedChunks = new AtomicInteger();

    // Guarded by lock
    private Sermon sermon;
    private boolean sermonPersisted;
    private List<AudioChunk> chunks = List.of();
    private Transcript transcript;
    private StudyGuide studyGuide;
    private SermonFlowException degradedError;
    private UUID captureSessionId;
    private boolean paused;
    private int elapsedSeconds;
    private ScheduledFuture<?> durationTimer;
    private LevelSubscription levelSubscription;
    private Cycle cycle;
    private double progress;

    DefaultSermonFlowOrchestrator(AudioCaptureService captureService,
                                  MicrophonePermissionService permissionService,
                                  AuthService authService,
                                  ImportValidator importValidator,
                                  ChunkAssembler chunkAssembler,
                                  ChunkUploader chunkUploader,
                                  SermonSyncService syncService,
                                  ProcessingJobQueue jobQueue,
                                  SermonRepository repository,
                                  ProcessingMetrics metrics,
                                  RecordingProperties recordingProps,
                                  ProcessingProperties processingProps,
                                  Executor processingExecutor,
                                  Executor meteringExecutor,
                                  ScheduledExecutorService scheduler,
                                  FlowStateMachine stateMachine) {
        this.captureService = captureService;
        this.permissionService = permissionService;
        this.authService = authService;
        this.importValidator = importValidator;
        this.chunkAssembler = chunkAssembler;
        this.chunkUploader = chunkUploader;
        this.syncService = syncService;
        this.jobQueue = jobQueue;
        this.repository = repository;
        this.metrics = metrics;
        this.recordingProps = recordingProps;
        this.processingProps = processingProps;
        this.processingExecutor = processingExecutor;
        this.meteringExecutor = meteringExecutor;
        this.scheduler = scheduler;
        this.stateMachine = stateMachine;
        this.levels = new LevelRingBuffer(recordingProps.getLevelHistorySize());
    }

    // ---------------------------------------------------------------------------------------------
    // Observable state
    // ---------------------------------------------------------------------------------------------

    @Override
    public FlowPhase currentPhase() {
        return stateMachine.current();
    }

    @Override
    public Optional<SermonFlowException> currentError() {
        lock.lock();
        try {
            FlowPhase phase = stateMachine.current();
            if (phase.is(FlowPhase.Kind.ERROR)) {
                return Optional.of(phase.error());
            }
            return phase.is(FlowPhase.Kind.VIEWING) ? Optional.ofNullable(degradedError) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Sermon> currentSermon() {
        lock.lock();
        try {
            return Optional.ofNullable(sermon);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AudioChunk> currentChunks() {
        lock.lock();
        try {
            return chunks;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Transcript> currentTranscript() {
        lock.lock();
        try {
            return Optional.ofNullable(transcript);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StudyGuide> currentStudyGuide() {
        lock.lock();
        try {
            return Optional.ofNullable(studyGuide);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SermonStatus> currentStatus() {
        Sermon s;
        boolean persisted;
        lock.lock();
        try {
            s = sermon;
            persisted = sermonPersisted;
        } finally {
            lock.unlock();
        }
        if (s == null) {
            return Optional.empty();
        }
        Sermon latest = persisted ? syncService.loadSermon(s.id()).orElse(s) : s;
        return Optional.of(latest.status());
    }

    @Override
    public RecordingSnapshot recordingSnapshot() {
        lock.lock();
        try {
            if (captureSessionId == null) {
                return RecordingSnapshot.IDLE;
            }
            return new RecordingSnapshot(elapsedSeconds, paused, levels.latest(), levels.toArray(),
                    completedChunks.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double processingProgress() {
        lock.lock();
        try {
            return progress;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Duration> estimatedProcessingTime() {
        List<AudioChunk> current = currentChunks();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TimeUtils.estimatedProcessingTime(AudioChunk.totalDuration(current)));
    }

    // ---------------------------------------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------------------------------------

    @Override
    public FlowPhase startRecording(String title, String speakerName) {
        lock.lock();
        try {
            requirePhase(FlowPhase.Kind.INPUT, "start a recording");
            refreshSessionQuietly();

            Optional<UUID> userId = authService.currentUserId();
            if (userId.isEmpty()) {
                return failNow(null, new NotAuthenticatedException());
            }
            if (!permissionService.requestMicrophonePermission()) {
                return failNow(null, new MicrophonePermissionDeniedException());
            }

            Sermon created = Sermon.create(userId.get(), title, speakerName, AudioContainerType.WAV.getMimeType());
            UUID sessionId;
            try {
                sessionId = captureService.startSession(created.id(), recordingProps.getChunkDurationSeconds(),
                        this::onChunkCompleted);
            } catch (SermonFlowException e) {
                return failNow(created.id(), e);
            } catch (IllegalStateException e) {
                return failNow(created.id(), new RecordingFailedException(e.getMessage(), e));
            }

            clearCycleState();
            sermon = created;
            captureSessionId = sessionId;
            paused = false;
            elapsedSeconds = 0;
            completedChunks.set(0);
            levels.clear();
            metrics.incrementStarted("recording");
            FlowPhase result = transition(FlowPhase.recording());

            startDurationTimer();
            startMetering();
            LOG.info("Recording started for sermon {} '{}' (session={})",
                    created.id(), LogSanitizer.text(created.title()), sessionId);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase pauseRecording() {
        lock.lock();
        try {
            if (!stateMachine.is(FlowPhase.Kind.RECORDING) || paused) {
                return stateMachine.current();
            }
            captureService.pauseSession(captureSessionId);
            paused = true;
            LOG.info("Recording paused at {}s", elapsedSeconds);
            return stateMachine.current();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase resumeRecording() {
        lock.lock();
        try {
            if (!stateMachine.is(FlowPhase.Kind.RECORDING) || !paused) {
                return stateMachine.current();
            }
            captureService.resumeSession(captureSessionId);
            paused = false;
            LOG.info("Recording resumed at {}s", elapsedSeconds);
            return stateMachine.current();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase stopRecording() {
        Cycle started;
        FlowPhase result;
        lock.lock();
        try {
            requirePhase(FlowPhase.Kind.RECORDING, "stop a recording");
            int minimum = recordingProps.getMinimumDurationSeconds();
            if (elapsedSeconds < minimum) {
                LOG.info("Stop rejected: {}s recorded, {}s required", elapsedSeconds, minimum);
                throw new RecordingTooShortException(elapsedSeconds, minimum);
            }

            List<Path> paths;
            try {
                paths = captureService.stopSession(captureSessionId);
            } catch (RecordingTooShortException e) {
                throw e;
            } catch (SermonFlowException e) {
                stopRecordingTasks();
                captureSessionId = null;
                UUID failedId = sermon.id();
                sermon = null;
                return failNow(failedId, e);
            }

            stopRecordingTasks();
            captureSessionId = null;
            paused = false;
            UUID sermonId = sermon.id();
            LOG.info("Recording stopped for sermon {} after {}s with {} chunk(s)",
                    sermonId, elapsedSeconds, paths.size());
            started = beginCycle(Cycle.Mode.FULL, () -> chunkAssembler.assemble(sermonId, paths));
            result = transition(FlowPhase.processing(ProcessingStep.uploading(0.0)));
        } finally {
            lock.unlock();
        }
        launch(started);
        return result;
    }

    @Override
    public FlowPhase cancelRecording() {
        lock.lock();
        try {
            requirePhase(FlowPhase.Kind.RECORDING, "cancel a recording");
            stopRecordingTasks();
            cancelCaptureQuietly(captureSessionId);
            LOG.info("Recording canceled for sermon {}; audio discarded", sermon != null ? sermon.id() : null);
            clearCycleState();
            return transition(FlowPhase.input());
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Import
    // ---------------------------------------------------------------------------------------------

    @Override
    public FlowPhase importAudio(Path source, String title, String speakerName) {
        Objects.requireNonNull(source, "source");
        Cycle started;
        FlowPhase result;
        lock.lock();
        try {
            requirePhase(FlowPhase.Kind.INPUT, "import audio");
            refreshSessionQuietly();

            Optional<UUID> userId = authService.currentUserId();
            if (userId.isEmpty()) {
                return failNow(null, new NotAuthenticatedException());
            }
            transition(FlowPhase.importing());
            LOG.info("Importing {}", LogSanitizer.fileName(source));

            ValidatedAudio audio;
            try {
                audio = importValidator.validate(source);
            } catch (SermonFlowException e) {
                return failNow(null, e);
            }

            String effectiveTitle = title == null || title.isBlank() ? audio.baseName() : title;
            Sermon created = Sermon.create(userId.get(), effectiveTitle, speakerName, audio.type().getMimeType());
            AudioChunk imported;
            try {
                imported = importValidator.copyIntoSermon(audio, created.id());
            } catch (SermonFlowException e) {
                return failNow(created.id(), e);
            }

            clearCycleState();
            sermon = created;
            chunks = List.of(imported);
            metrics.incrementStarted("import");
            List<AudioChunk> single = List.of(imported);
            started = beginCycle(Cycle.Mode.FULL, () -> chunkAssembler.summarize(single));
            result = transition(FlowPhase.processing(ProcessingStep.uploading(0.0)));
        } finally {
            lock.unlock();
        }
        launch(started);
        return result;
    }

    // ---------------------------------------------------------------------------------------------
    // Error handling and navigation
    // ---------------------------------------------------------------------------------------------

    @Override
    public FlowPhase retry() {
        Cycle started;
        FlowPhase result;
        lock.lock();
        try {
            FlowPhase phase = stateMachine.current();
            if (!phase.is(FlowPhase.Kind.ERROR)) {
                throw new IllegalStateException("Cannot retry in phase " + phase);
            }
            if (!phase.error().isRetryable()) {
                throw new IllegalStateException("Error " + phase.error().getKind() + " is not retryable");
            }
            if (sermon == null || chunks.isEmpty()) {
                throw new IllegalStateException("No chunks to retry");
            }
            List<AudioChunk> existing = chunks;
            LOG.info("Retrying sermon {} from upload with {} chunk(s)", sermon.id(), existing.size());
            metrics.incrementStarted("retry");
            started = beginCycle(Cycle.Mode.FULL, () -> existing);
            result = transition(FlowPhase.processing(ProcessingStep.uploading(0.0)));
        } finally {
            lock.unlock();
        }
        launch(started);
        return result;
    }

    @Override
    public FlowPhase dismissError() {
        lock.lock();
        try {
            requirePhase(FlowPhase.Kind.ERROR, "dismiss an error");
            clearCycleState();
            return transition(FlowPhase.input());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase reset() {
        lock.lock();
        try {
            stopAll();
            clearCycleState();
            return transition(FlowPhase.input());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase loadExistingSermon(UUID sermonId) {
        Objects.requireNonNull(sermonId, "sermonId");
        Cycle started = null;
        FlowPhase result;
        lock.lock();
        try {
            if (stateMachine.is(FlowPhase.Kind.RECORDING) || stateMachine.is(FlowPhase.Kind.IMPORTING)) {
                throw new IllegalStateException("Cannot load a sermon in phase " + stateMachine.current());
            }
            Sermon loaded = syncService.loadSermon(sermonId)
                    .orElseThrow(() -> new NoSuchElementException("Unknown sermon " + sermonId));

            cancelCycle();
            clearCycleState();
            sermon = loaded;
            sermonPersisted = true;
            chunks = List.copyOf(repository.fetchChunks(sermonId));

            ProcessingJob job = ProcessingJob.of(loaded);
            if (job.isComplete()) {
                transcript = repository.fetchTranscript(sermonId).orElse(null);
                studyGuide = repository.fetchStudyGuide(sermonId).orElse(null);
                progress = 1.0;
                result = transition(FlowPhase.viewing());
            } else if (job.transcriptionFailed()) {
                result = failNow(sermonId, new TranscriptionFailedException(
                        reasonOr(loaded.transcriptionError(), "Transcription failed")));
            } else if (job.studyGuideFailed()) {
                transcript = repository.fetchTranscript(sermonId).orElse(null);
                result = failNow(sermonId, new StudyGuideGenerationFailedException(
                        reasonOr(loaded.studyGuideError(), "Study guide generation failed")));
            } else if (loaded.status() == SermonStatus.PENDING && chunks.stream().anyMatch(AudioChunk::uploadPending)) {
                result = failNow(sermonId, TranscriptionFailedException.retryable("Upload did not complete", null));
            } else {
                ProcessingStep step = loaded.transcriptionStatus() == ProcessingStatus.SUCCEEDED
                        ? ProcessingStep.analyzing()
                        : ProcessingStep.transcribing(0.0, 1, Math.max(1, chunks.size()));
                progress = step.overallProgress();
                boolean running = loaded.transcriptionStatus() == ProcessingStatus.RUNNING
                        || loaded.studyGuideStatus() == ProcessingStatus.RUNNING;
                List<AudioChunk> loadedChunks = chunks;
                started = beginCycle(running ? Cycle.Mode.RESUME : Cycle.Mode.REQUEUE, () -> loadedChunks);
                result = transition(FlowPhase.processing(step));
            }
            LOG.info("Loaded sermon {} with status {}", sermonId, loaded.status());
        } finally {
            lock.unlock();
        }
        if (started != null) {
            launch(started);
        }
        return result;
    }

    @Override
    public FlowPhase enterBackground() {
        lock.lock();
        try {
            if (stateMachine.is(FlowPhase.Kind.PROCESSING) && cycle != null) {
                cycle.background();
                LOG.info("Processing of sermon {} moved to background", cycle.sermonId);
            }
            return stateMachine.current();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FlowPhase resumeFromBackground() {
        UUID sermonId;
        lock.lock();
        try {
            if (sermon == null || cycle == null || !cycle.isBackgrounded()) {
                return stateMachine.current();
            }
            if (cycle.reattach()) {
                LOG.info("Processing of sermon {} back in foreground", cycle.sermonId);
                return stateMachine.current();
            }
            sermonId = sermon.id();
        } finally {
            lock.unlock();
        }
        return loadExistingSermon(sermonId);
    }

    /**
     * Reacts to a device failure during capture by discarding the session.
     */
    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        // Published on the capture thread, which stopSession may be joining while holding the lock
        processingExecutor.execute(() -> handleCaptureError(event));
    }

    void handleCaptureError(CaptureErrorEvent event) {
        lock.lock();
        try {
            if (!stateMachine.is(FlowPhase.Kind.RECORDING) || !event.sessionId().equals(captureSessionId)) {
                LOG.debug("Ignoring capture error for inactive session {}", event.sessionId());
                return;
            }
            stopRecordingTasks();
            cancelCaptureQuietly(captureSessionId);
            UUID failedId = sermon != null ? sermon.id() : null;
            clearCycleState();
            failNow(failedId, new RecordingFailedException(event.reason()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every running task on shutdown without changing the phase.
     */
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            stopAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances the recording clock by one second unless paused. Driven by the duration timer.
     */
    void onDurationTick() {
        lock.lock();
        try {
            if (captureSessionId != null && !paused && stateMachine.is(FlowPhase.Kind.RECORDING)) {
                elapsedSeconds++;
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Processing cycle
    // ---------------------------------------------------------------------------------------------

    private Cycle beginCycle(Cycle.Mode mode, Supplier<List<AudioChunk>> source) {
        cancelCycle();
        Cycle c = new Cycle(sermon.id(), mode, source);
        cycle = c;
        if (mode == Cycle.Mode.FULL) {
            progress = 0.0;
            transcript = null;
            studyGuide = null;
        }
        degradedError = null;
        return c;
    }

    private void launch(Cycle c) {
        processingExecutor.execute(() -> runCycle(c));
    }

    private void runCycle(Cycle c) {
        c.bindWorker(Thread.currentThread());
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("sermonId", c.sermonId.toString())) {
            if (c.mode != Cycle.Mode.FULL) {
                ProgressSubscription sub = jobQueue.progressStream(c.sermonId);
                boolean following = c.attach(sub);
                if (c.mode == Cycle.Mode.REQUEUE) {
                    jobQueue.enqueue(c.sermonId);
                    LOG.info("Re-enqueued uploaded sermon {}", c.sermonId);
                }
                if (following) {
                    awaitOutcome(c, sub, Math.max(1, c.source.get().size()), true);
                }
                return;
            }

            List<AudioChunk> prepared = c.source.get();
            if (!update(c, () -> chunks = List.copyOf(prepared))) {
                return;
            }
            persistIfNeeded(c, prepared);

            long uploadStart = System.nanoTime();
            List<AudioChunk> uploaded = chunkUploader.upload(prepared,
                    f -> showStep(c, ProcessingStep.uploading(f)));
            if (!update(c, () -> chunks = List.copyOf(uploaded))) {
                return;
            }
            LOG.info("Uploaded {} chunk(s) in {}ms", uploaded.size(), TimeUtils.elapsedMillis(uploadStart));

            ProgressSubscription sub = jobQueue.progressStream(c.sermonId);
            boolean following = c.attach(sub);
            jobQueue.enqueue(c.sermonId);
            if (!following) {
                LOG.info("Sermon {} enqueued while in background", c.sermonId);
                return;
            }
            awaitOutcome(c, sub, uploaded.size(), false);
        } catch (CancellationException e) {
            LOG.debug("Processing cycle for sermon {} cancelled", c.sermonId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Processing cycle for sermon {} interrupted", c.sermonId);
        } catch (SermonFlowException e) {
            fail(c, e);
        } catch (RuntimeException e) {
            if (c.isCancelled()) {
                LOG.debug("Processing cycle for sermon {} ended after cancel: {}", c.sermonId, e.toString());
            } else {
                LOG.error("Processing of sermon {} failed", c.sermonId, e);
                fail(c, TranscriptionFailedException.retryable(messageOf(e), e));
            }
        } finally {
            c.unbindWorker();
        }
    }

    private void persistIfNeeded(Cycle c, List<AudioChunk> prepared) {
        Sermon toSave;
        lock.lock();
        try {
            if (!isCurrent(c)) {
                throw new CancellationException("Cycle retired");
            }
            if (sermonPersisted) {
                return;
            }
            toSave = sermon.withDuration(TimeUtils.wholeSeconds(AudioChunk.totalDuration(prepared)));
        } finally {
            lock.unlock();
        }
        syncService.createSermon(toSave, prepared);
        update(c, () -> {
            sermon = toSave;
            sermonPersisted = true;
        });
        LOG.info("Persisted sermon {} ({}s, {} chunk(s))", toSave.id(), toSave.durationSeconds(), prepared.size());
    }

    private void awaitOutcome(Cycle c, ProgressSubscription sub, int chunkTotal, boolean checkStatusFirst)
            throws InterruptedException {
        long timeoutMillis = processingProps.getTimeout().toMillis();
        c.attachTimeout(scheduler.schedule(() -> onTimeout(c), timeoutMillis, TimeUnit.MILLISECONDS));

        ProcessingJob terminal = null;
        if (checkStatusFirst) {
            terminal = jobQueue.status(c.sermonId).filter(ProcessingJob::isTerminal).orElse(null);
        } else {
            showStep(c, ProcessingStep.transcribing(0.0, 1, chunkTotal));
        }
        if (terminal != null && !claim(c)) {
            return;
        }

        ProgressUpdate update;
        while (terminal == null && (update = sub.next()) != null) {
            LOG.debug("Progress {} for sermon {}", update.progress(), c.sermonId);
            if (update.job().isTerminal()) {
                // settled first; a timeout firing from here on is a no-op
                if (!claim(c)) {
                    return;
                }
                terminal = update.job();
            } else {
                showStep(c, ProgressStepMapper.toStep(update.progress(), chunkTotal));
            }
        }

        if (terminal == null && !claim(c)) {
            return;
        }
        c.release();
        if (terminal == null) {
            terminal = jobQueue.status(c.sermonId).filter(ProcessingJob::isTerminal).orElse(null);
        }
        if (terminal == null) {
            fail(c, TranscriptionFailedException.retryable("Progress stream ended before the job finished", null));
            return;
        }
        settleJob(c, terminal);
    }

    private static boolean claim(Cycle c) {
        return !c.isDetached() && c.settle();
    }

    private void onTimeout(Cycle c) {
        if (!c.settle()) {
            return;
        }
        c.release();
        LOG.warn("Processing of sermon {} timed out after {}", c.sermonId, processingProps.getTimeout());
        fail(c, new ProcessingTimeoutException());
    }

    private void settleJob(Cycle c, ProcessingJob job) {
        if (job.transcriptionFailed()) {
            fail(c, new TranscriptionFailedException(reasonOr(job.transcriptionError(), "Transcription failed")));
            return;
        }
        Sermon latest = syncService.loadSermon(c.sermonId).orElse(null);
        Transcript t = repository.fetchTranscript(c.sermonId).orElse(null);
        StudyGuide g = job.isComplete() ? repository.fetchStudyGuide(c.sermonId).orElse(null) : null;
        boolean degraded = !job.isComplete();
        boolean applied = update(c, () -> {
            if (latest != null) {
                sermon = latest;
            }
            transcript = t;
            studyGuide = g;
            degradedError = degraded
                    ? new StudyGuideGenerationFailedException(
                            reasonOr(job.studyGuideError(), "Study guide generation failed"))
                    : null;
            progress = 1.0;
            transition(FlowPhase.viewing());
        });
        if (applied) {
            metrics.incrementCompleted(degraded);
            if (degraded) {
                LOG.warn("Sermon {} is viewable without a study guide: {}", c.sermonId, job.studyGuideError());
            } else {
                LOG.info("Sermon {} processed", c.sermonId);
            }
        }
    }

    private void showStep(Cycle c, ProcessingStep step) {
        lock.lock();
        try {
            if (!isCurrent(c) || c.isSettled() || c.isBackgrounded()) {
                return;
            }
            progress = Math.max(progress, step.overallProgress());
            transition(FlowPhase.processing(step));
        } finally {
            lock.unlock();
        }
    }

    private void fail(Cycle c, SermonFlowException error) {
        lock.lock();
        try {
            if (!isCurrent(c)) {
                LOG.debug("Dropping {} from a retired cycle", error.getKind());
                return;
            }
            c.release();
            failNow(c.sermonId, error);
        } finally {
            lock.unlock();
        }
    }

    private boolean update(Cycle c, Runnable mutation) {
        lock.lock();
        try {
            if (!isCurrent(c)) {
                return false;
            }
            mutation.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrent(Cycle c) {
        return cycle == c && !c.isCancelled();
    }

    private void cancelCycle() {
        if (cycle != null) {
            cycle.cancel();
            cycle = null;
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers (call with lock held)
    // ---------------------------------------------------------------------------------------------

    private FlowPhase transition(FlowPhase next) {
        stateMachine.transition(sermon != null ? sermon.id() : null, next);
        return next;
    }

    private FlowPhase failNow(UUID sermonId, SermonFlowException error) {
        LOG.warn("Sermon flow failed with {}: {}", error.getKind(), error.getMessage());
        metrics.incrementFailure(error.getKind());
        FlowPhase next = FlowPhase.error(error);
        stateMachine.transition(sermonId, next);
        return next;
    }

    private void requirePhase(FlowPhase.Kind kind, String action) {
        FlowPhase phase = stateMachine.current();
        if (!phase.is(kind)) {
            throw new IllegalStateException("Cannot " + action + " in phase " + phase);
        }
    }

    private void clearCycleState() {
        cancelCycle();
        sermon = null;
        sermonPersisted = false;
        chunks = List.of();
        transcript = null;
        studyGuide = null;
        degradedError = null;
        captureSessionId = null;
        paused = false;
        elapsedSeconds = 0;
        progress = 0.0;
        completedChunks.set(0);
    }

    private void stopAll() {
        cancelCycle();
        stopRecordingTasks();
        if (captureSessionId != null) {
            cancelCaptureQuietly(captureSessionId);
            captureSessionId = null;
        }
    }

    private void startDurationTimer() {
        durationTimer = scheduler.scheduleAtFixedRate(this::onDurationTick, 1, 1, TimeUnit.SECONDS);
    }

    private void startMetering() {
        LevelSubscription sub = captureService.levelMeter().subscribe();
        levelSubscription = sub;
        meteringExecutor.execute(() -> collectLevels(sub, levels));
    }

    private void stopRecordingTasks() {
        if (durationTimer != null) {
            durationTimer.cancel(false);
            durationTimer = null;
        }
        if (levelSubscription != null) {
            levelSubscription.close();
            levelSubscription = null;
        }
    }

    private static void collectLevels(LevelSubscription sub, LevelRingBuffer target) {
        try {
            while (!sub.isClosed()) {
                Float level = sub.poll(ProcessTimeouts.LEVEL_POLL_INTERVAL);
                if (level != null) {
                    target.add(level);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Metering interrupted");
        }
    }

    private void onChunkCompleted(ChunkCompletedEvent event) {
        // Runs on the capture thread; must not take the lock
        completedChunks.set(event.chunkIndex() + 1);
        LOG.info("Chunk {} of sermon {} completed ({}s)", event.chunkIndex(), event.sermonId(),
                String.format("%.1f", event.durationSeconds()));
    }

    private void cancelCaptureQuietly(UUID sessionId) {
        if (sessionId == null) {
            return;
        }
        try {
            captureService.cancelSession(sessionId);
        } catch (IllegalStateException e) {
            LOG.debug("Capture session {} already closed: {}", sessionId, e.getMessage());
        }
    }

    private void refreshSessionQuietly() {
        try {
            authService.refreshSession();
        } catch (RuntimeException e) {
            LOG.warn("Session refresh failed, continuing: {}", e.getMessage());
        }
    }

    private static String reasonOr(String reason, String fallback) {
        return reason == null || reason.isBlank() ? fallback : reason;
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * One run of the processing sequence. Owns the progress subscription and the timeout of that run.
     */
    private static final class Cycle {

        enum Mode {
            /** Persist, upload, enqueue, follow. */
            FULL,
            /** Follow an already-enqueued job. */
            RESUME,
            /** Subscribe, then enqueue an uploaded job that may never have been queued. */
            REQUEUE
        }

        final UUID sermonId;
        final Mode mode;
        final Supplier<List<AudioChunk>> source;
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private volatile boolean cancelled;
        private boolean backgrounded;
        private boolean attachAttempted;
        private ProgressSubscription subscription;
        private ScheduledFuture<?> timeout;
        private Thread worker;

        Cycle(UUID sermonId, Mode mode, Supplier<List<AudioChunk>> source) {
            this.sermonId = sermonId;
            this.mode = mode;
            this.source = source;
        }

        synchronized void bindWorker(Thread thread) {
            worker = thread;
        }

        synchronized void unbindWorker() {
            worker = null;
        }

        /**
         * @return false if the subscription was released at once because the cycle is detached
         */
        synchronized boolean attach(ProgressSubscription sub) {
            attachAttempted = true;
            if (cancelled || backgrounded) {
                sub.cancel();
                return false;
            }
            subscription = sub;
            return true;
        }

        synchronized void attachTimeout(ScheduledFuture<?> future) {
            if (cancelled || backgrounded || settled.get()) {
                future.cancel(false);
                return;
            }
            timeout = future;
        }

        synchronized void background() {
            backgrounded = true;
            release();
        }

        /**
         * Clears the background flag if the cycle has not reached its subscription yet.
         */
        synchronized boolean reattach() {
            if (cancelled || attachAttempted) {
                return false;
            }
            backgrounded = false;
            return true;
        }

        synchronized void cancel() {
            cancelled = true;
            release();
            if (worker != null && worker != Thread.currentThread()) {
                worker.interrupt();
            }
        }

        synchronized void release() {
            if (subscription != null) {
                subscription.cancel();
            }
            if (timeout != null) {
                timeout.cancel(false);
            }
        }

        boolean settle() {
            return settled.compareAndSet(false, true);
        }

        boolean isSettled() {
            return settled.get();
        }

        boolean isCancelled() {
            return cancelled;
        }

        synchronized boolean isBackgrounded() {
            return backgrounded;
        }

        synchronized boolean isDetached() {
            return cancelled || backgrounded;
        }
    }
}
