package com.phillippitts.sermonflow.service.orchestration;

import com.phillippitts.sermonflow.config.properties.ImportProperties;
import com.phillippitts.sermonflow.config.properties.ObjectStoreProperties;
import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.config.properties.StorageProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.FlowPhase;
import com.phillippitts.sermonflow.domain.ProcessingJob;
import com.phillippitts.sermonflow.domain.ProcessingStatus;
import com.phillippitts.sermonflow.domain.ProcessingStep;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.SermonStatus;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.exception.ErrorKind;
import com.phillippitts.sermonflow.exception.RecordingTooShortException;
import com.phillippitts.sermonflow.service.audio.analysis.ChunkAssembler;
import com.phillippitts.sermonflow.service.audio.analysis.DefaultMediaDurationProbe;
import com.phillippitts.sermonflow.service.audio.analysis.WaveformSummarizer;
import com.phillippitts.sermonflow.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.sermonflow.service.metrics.ProcessingMetrics;
import com.phillippitts.sermonflow.service.orchestration.event.FlowPhaseChangedEvent;
import com.phillippitts.sermonflow.service.queue.LocalProcessingJobQueue;
import com.phillippitts.sermonflow.service.queue.ProcessingJobQueue;
import com.phillippitts.sermonflow.service.queue.ProgressPublisher;
import com.phillippitts.sermonflow.service.queue.SermonTranscriber;
import com.phillippitts.sermonflow.service.queue.StudyGuideGenerator;
import com.phillippitts.sermonflow.service.repository.InMemorySermonRepository;
import com.phillippitts.sermonflow.service.storage.FileSystemObjectStoreClient;
import com.phillippitts.sermonflow.service.storage.ObjectStoreClient;
import com.phillippitts.sermonflow.service.storage.ObjectStoreException;
import com.phillippitts.sermonflow.service.sync.DefaultSermonSyncService;
import com.phillippitts.sermonflow.service.upload.ChunkUploader;
import com.phillippitts.sermonflow.service.validation.ImportValidator;
import com.phillippitts.sermonflow.testutil.Await;
import com.phillippitts.sermonflow.testutil.EventCapturingPublisher;
import com.phillippitts.sermonflow.testutil.FakeAudioCaptureService;
import com.phillippitts.sermonflow.testutil.FakeAuthService;
import com.phillippitts.sermonflow.testutil.FakeProcessingJobQueue;
import com.phillippitts.sermonflow.testutil.SyncExecutor;
import com.phillippitts.sermonflow.testutil.TestAudioFiles;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives the orchestrator against real assembly, sync, upload and job queue components on temp
 * directories. Only capture, auth and the processing back ends are doubles.
 */
class DefaultSermonFlowOrchestratorTest {

    @TempDir
    Path tmp;

    private StorageProperties storage;
    private InMemorySermonRepository repository;
    private FlakyObjectStore objectStore;
    private DefaultSermonSyncService syncService;
    private SimpleMeterRegistry meterRegistry;
    private ProcessingMetrics metrics;
    private ChunkAssembler assembler;
    private ImportValidator importValidator;
    private ChunkUploader uploader;
    private FakeAudioCaptureService capture;
    private FakeAuthService auth;
    private AtomicBoolean microphoneAllowed;
    private EventCapturingPublisher publisher;

    private volatile SermonTranscriber transcriber;
    private volatile StudyGuideGenerator generator;

    private ExecutorService processingExecutor;
    private ExecutorService meteringExecutor;
    private ScheduledExecutorService scheduler;
    private DefaultSermonFlowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        storage = new StorageProperties(tmp.resolve("local"));
        repository = new InMemorySermonRepository();
        objectStore = new FlakyObjectStore(new FileSystemObjectStoreClient(tmp.resolve("remote")));
        ObjectStoreProperties objectStoreProps = new ObjectStoreProperties(null, "sermon-audio",
                tmp.resolve("remote"), null, null, null, null, null);
        syncService = new DefaultSermonSyncService(repository, objectStore, objectStoreProps);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ProcessingMetrics(meterRegistry);

        DefaultMediaDurationProbe probe = new DefaultMediaDurationProbe(ImportProperties.defaults());
        assembler = new ChunkAssembler(probe, new WaveformSummarizer());
        importValidator = new ImportValidator(new ImportProperties(1L, null, null), storage, probe);
        uploader = new ChunkUploader(syncService, metrics);

        capture = new FakeAudioCaptureService();
        auth = FakeAuthService.signedIn();
        microphoneAllowed = new AtomicBoolean(true);
        publisher = new EventCapturingPublisher();

        transcriber = (sermon, chunks, onProgress) -> {
            onProgress.accept(0.5);
            onProgress.accept(1.0);
            return new Transcript(sermon.id(), "Grace and peace to you.", "en", "test-model", Instant.now());
        };
        generator = (sermon, transcript) -> new StudyGuide(sermon.id(), "On grace", List.of("Grace is free"),
                List.of("Ephesians 2:8"), List.of("What is grace?"), "test-model", Instant.now());

        processingExecutor = Executors.newSingleThreadExecutor();
        meteringExecutor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
        processingExecutor.shutdownNow();
        meteringExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    private DefaultSermonFlowOrchestrator orchestrator(ProcessingJobQueue queue, ProcessingProperties processing) {
        orchestrator = SermonFlowOrchestratorBuilder.builder()
                .captureService(capture)
                .permissionService(microphoneAllowed::get)
                .authService(auth)
                .importValidator(importValidator)
                .chunkAssembler(assembler)
                .chunkUploader(uploader)
                .syncService(syncService)
                .jobQueue(queue)
                .repository(repository)
                .publisher(publisher)
                .metrics(metrics)
                .recordingProperties(new RecordingProperties(600, 30, 100, 50, null))
                .processingProperties(processing)
                .processingExecutor(processingExecutor)
                .meteringExecutor(meteringExecutor)
                .scheduler(scheduler)
                .build();
        return orchestrator;
    }

    private DefaultSermonFlowOrchestrator withLocalQueue() {
        LocalProcessingJobQueue queue = new LocalProcessingJobQueue(repository,
                (s, c, p) -> transcriber.transcribe(s, c, p),
                (s, t) -> generator.generate(s, t),
                new ProgressPublisher(), new SyncExecutor(), ProcessingProperties.defaults());
        return orchestrator(queue, ProcessingProperties.defaults());
    }

    private void recordFor(int seconds) {
        for (int i = 0; i < seconds; i++) {
            orchestrator.onDurationTick();
        }
    }

    private Path wav(String name, double seconds) throws IOException {
        return TestAudioFiles.wav(tmp.resolve("capture").resolve(name), seconds);
    }

    private FlowPhase.Kind phaseKind() {
        return orchestrator.currentPhase().kind();
    }

    // ---------------------------------------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldEnterRecordingWhenSignedInWithMicrophone() {
        // Arrange
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.startRecording("Sunday Service", "Pastor Ann");

        // Assert
        assertThat(phase.is(FlowPhase.Kind.RECORDING)).isTrue();
        assertThat(orchestrator.currentSermon()).get()
                .extracting(Sermon::title, Sermon::speakerName)
                .containsExactly("Sunday Service", "Pastor Ann");
        assertThat(capture.calls()).containsExactly("start");
        assertThat(auth.refreshCount()).isEqualTo(1);
    }

    @Test
    void shouldFailWithNotAuthenticatedWhenSignedOut() {
        // Arrange
        auth = FakeAuthService.signedOut();
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.startRecording(null, null);

        // Assert
        assertThat(phase.is(FlowPhase.Kind.ERROR)).isTrue();
        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.NOT_AUTHENTICATED);
        assertThat(capture.calls()).isEmpty();
        assertThat(orchestrator.currentSermon()).isEmpty();
    }

    @Test
    void shouldFailWhenMicrophonePermissionDenied() {
        // Arrange
        microphoneAllowed.set(false);
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.startRecording("Title", null);

        // Assert
        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.MICROPHONE_PERMISSION_DENIED);
        assertThat(capture.calls()).isEmpty();
    }

    @Test
    void shouldRejectStartOutsideInputPhase() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("First", null);

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.startRecording("Second", null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.RECORDING);
    }

    @Test
    void shouldRejectStopBeforeMinimumDurationAndKeepRecording() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("Short", null);
        recordFor(10);

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.stopRecording())
                .isInstanceOfSatisfying(RecordingTooShortException.class, e -> {
                    assertThat(e.getActualSeconds()).isBetween(10, 29);
                    assertThat(e.getMinimumSeconds()).isEqualTo(30);
                });
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.RECORDING);
        assertThat(capture.calls()).doesNotContain("stop");
    }

    @Test
    void shouldNotCountPausedTime() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("Paused", null);
        recordFor(3);

        // Act
        orchestrator.pauseRecording();
        int atPause = orchestrator.recordingSnapshot().elapsedSeconds();
        recordFor(5);

        // Assert
        RecordingSnapshot snapshot = orchestrator.recordingSnapshot();
        assertThat(snapshot.paused()).isTrue();
        assertThat(snapshot.elapsedSeconds()).isEqualTo(atPause);
        assertThat(capture.calls()).containsExactly("start", "pause");

        orchestrator.resumeRecording();
        recordFor(2);
        assertThat(orchestrator.recordingSnapshot().elapsedSeconds()).isGreaterThanOrEqualTo(atPause + 2);
        assertThat(capture.calls()).containsExactly("start", "pause", "resume");
    }

    @Test
    void pauseTwiceIsANoOp() {
        withLocalQueue();
        orchestrator.startRecording("Paused", null);

        orchestrator.pauseRecording();
        orchestrator.pauseRecording();

        assertThat(capture.calls()).containsExactly("start", "pause");
    }

    @Test
    void shouldCollectInputLevelsWhileRecording() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("Levels", null);

        // Act
        Await.until(() -> capture.levelMeter().subscriberCount() == 1);
        capture.levelMeter().publish(0.4f);

        // Assert
        Await.until(() -> orchestrator.recordingSnapshot().currentLevel() == 0.4f);
        assertThat(orchestrator.recordingSnapshot().recentLevels()).contains(0.4f);
    }

    @Test
    void shouldCountCompletedChunks() throws IOException {
        withLocalQueue();
        orchestrator.startRecording("Long", null);

        capture.completeChunk(0, wav("chunk_000.wav", 1.0), 600.0);
        capture.completeChunk(1, wav("chunk_001.wav", 1.0), 600.0);

        assertThat(orchestrator.recordingSnapshot().completedChunks()).isEqualTo(2);
    }

    @Test
    void shouldDiscardEverythingOnCancel() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("Canceled", null);
        recordFor(40);

        // Act
        FlowPhase phase = orchestrator.cancelRecording();

        // Assert
        assertThat(phase).isEqualTo(FlowPhase.input());
        assertThat(orchestrator.currentSermon()).isEmpty();
        assertThat(orchestrator.recordingSnapshot()).isSameAs(RecordingSnapshot.IDLE);
        assertThat(capture.calls()).containsExactly("start", "cancel");
        assertThat(capture.levelMeter().subscriberCount()).isZero();
    }

    @Test
    void shouldProcessRecordingThroughToViewing() throws IOException {
        // Arrange
        capture.withChunkFiles(List.of(wav("chunk_000.wav", 2.0), wav("chunk_001.wav", 1.5)));
        withLocalQueue();
        orchestrator.startRecording("The Good Shepherd", "Pastor Ann");
        recordFor(30);

        // Act
        FlowPhase stopped = orchestrator.stopRecording();

        // Assert
        assertThat(stopped.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);

        Sermon sermon = orchestrator.currentSermon().orElseThrow();
        assertThat(sermon.durationSeconds()).isEqualTo(3);
        assertThat(orchestrator.currentStatus()).contains(SermonStatus.READY);
        assertThat(orchestrator.currentTranscript()).get()
                .extracting(Transcript::content).isEqualTo("Grace and peace to you.");
        assertThat(orchestrator.currentStudyGuide()).isPresent();
        assertThat(orchestrator.currentError()).isEmpty();
        assertThat(orchestrator.processingProgress()).isEqualTo(1.0);

        List<AudioChunk> chunks = repository.fetchChunks(sermon.id());
        assertThat(chunks).hasSize(2);
        assertThat(chunks).noneMatch(AudioChunk::uploadPending);
        assertThat(chunks.get(1).startOffsetSeconds()).isEqualTo(2.0);
        assertThat(chunks.get(0).waveform()).isNotEmpty();
        assertThat(tmp.resolve("remote").resolve("sermon-audio").resolve(chunks.get(0).remotePath()))
                .isRegularFile();

        Counter completed = meterRegistry.find("sermonflow.cycles.completed").tag("degraded", "false").counter();
        assertThat(completed).isNotNull();
        assertThat(completed.count()).isEqualTo(1.0);
    }

    @Test
    void shouldReportNonDecreasingProgressWhileProcessing() throws IOException {
        // Arrange
        capture.withChunkFiles(List.of(wav("chunk_000.wav", 1.0)));
        withLocalQueue();
        orchestrator.startRecording("Progress", null);
        recordFor(30);

        // Act
        orchestrator.stopRecording();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);

        // Assert
        List<Double> progress = publisher.eventsOf(FlowPhaseChangedEvent.class).stream()
                .map(FlowPhaseChangedEvent::current)
                .filter(p -> p.is(FlowPhase.Kind.PROCESSING))
                .map(p -> p.step().overallProgress())
                .toList();
        assertThat(progress).isNotEmpty();
        assertThat(progress).isSorted();
    }

    @Test
    void shouldFailWhenCaptureReportsError() {
        // Arrange
        withLocalQueue();
        orchestrator.startRecording("Unplugged", null);
        UUID sermonId = orchestrator.currentSermon().orElseThrow().id();

        // Act
        orchestrator.handleCaptureError(new CaptureErrorEvent(capture.activeSession(), sermonId,
                "CHUNK_WRITE_FAILED", Instant.now()));

        // Assert
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.ERROR);
        assertThat(orchestrator.currentError()).get()
                .satisfies(e -> assertThat(e.getKind()).isEqualTo(ErrorKind.RECORDING_FAILED));
        assertThat(capture.calls()).containsExactly("start", "cancel");
    }

    @Test
    void shouldIgnoreCaptureErrorFromStaleSession() {
        withLocalQueue();
        orchestrator.startRecording("Still going", null);

        orchestrator.handleCaptureError(new CaptureErrorEvent(UUID.randomUUID(), UUID.randomUUID(),
                "CAPTURE_ERROR", Instant.now()));

        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.RECORDING);
    }

    // ---------------------------------------------------------------------------------------------
    // Import
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldImportWavAndUseFileNameAsTitle() throws IOException {
        // Arrange
        Path source = TestAudioFiles.wav(tmp.resolve("Easter Sunday.wav"), 2.0);
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.importAudio(source, "  ", "Pastor Ann");

        // Assert
        assertThat(phase.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        Sermon sermon = orchestrator.currentSermon().orElseThrow();
        assertThat(sermon.title()).isEqualTo("Easter Sunday");
        assertThat(sermon.audioMimeType()).isEqualTo("audio/wav");
        assertThat(sermon.durationSeconds()).isEqualTo(2);
        assertThat(orchestrator.currentChunks()).hasSize(1);
        assertThat(storage.sermonDirectory(sermon.id()).resolve("chunk_000.wav")).isRegularFile();
        assertThat(source).isRegularFile();
    }

    @Test
    void shouldRejectOversizedImportWithoutCreatingAnything() throws IOException {
        // Arrange
        Path source = TestAudioFiles.sparse(tmp.resolve("huge.mp3"), 2L * 1024 * 1024);
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.importAudio(source, "Huge", null);

        // Assert
        assertThat(phase.is(FlowPhase.Kind.ERROR)).isTrue();
        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.FILE_TOO_LARGE);
        assertThat(orchestrator.currentSermon()).isEmpty();
        assertThat(storage.getSermonsDirectory()).doesNotExist();
    }

    @Test
    void shouldRejectUnsupportedImport() throws IOException {
        Path source = Files.writeString(tmp.resolve("notes.txt"), "not audio at all");
        withLocalQueue();

        FlowPhase phase = orchestrator.importAudio(source, null, null);

        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.UNSUPPORTED_AUDIO_FORMAT);
        assertThat(phase.error().isRetryable()).isFalse();
    }

    // ---------------------------------------------------------------------------------------------
    // Processing outcomes
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldStayViewableWhenOnlyStudyGuideFails() throws IOException {
        // Arrange
        generator = (sermon, transcript) -> {
            throw new IllegalStateException("model overloaded");
        };
        Path source = TestAudioFiles.wav(tmp.resolve("Advent.wav"), 1.0);
        withLocalQueue();

        // Act
        orchestrator.importAudio(source, null, null);

        // Assert
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        assertThat(orchestrator.currentTranscript()).isPresent();
        assertThat(orchestrator.currentStudyGuide()).isEmpty();
        assertThat(orchestrator.currentStatus()).contains(SermonStatus.DEGRADED);
        assertThat(orchestrator.currentError()).get().satisfies(e -> {
            assertThat(e.getKind()).isEqualTo(ErrorKind.STUDY_GUIDE_GENERATION_FAILED);
            assertThat(e.getMessage()).contains("model overloaded");
        });
    }

    @Test
    void shouldFailWhenTranscriptionFails() throws IOException {
        // Arrange
        transcriber = (sermon, chunks, onProgress) -> {
            throw new IllegalStateException("audio unintelligible");
        };
        Path source = TestAudioFiles.wav(tmp.resolve("Noise.wav"), 1.0);
        withLocalQueue();

        // Act
        orchestrator.importAudio(source, null, null);

        // Assert
        Await.until(() -> phaseKind() == FlowPhase.Kind.ERROR);
        FlowPhase phase = orchestrator.currentPhase();
        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.TRANSCRIPTION_FAILED);
        assertThat(phase.error().isRetryable()).isFalse();
        assertThat(phase.error().getMessage()).contains("audio unintelligible");
        assertThatThrownBy(() -> orchestrator.retry()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRetryFromUploadWithSameChunks() throws IOException {
        // Arrange
        objectStore.failNextPuts(1);
        capture.withChunkFiles(List.of(wav("chunk_000.wav", 1.0), wav("chunk_001.wav", 1.0)));
        withLocalQueue();
        orchestrator.startRecording("Flaky network", null);
        recordFor(30);
        orchestrator.stopRecording();
        Await.until(() -> phaseKind() == FlowPhase.Kind.ERROR);
        UUID sermonId = orchestrator.currentSermon().orElseThrow().id();
        assertThat(orchestrator.currentPhase().error().isRetryable()).isTrue();

        // Act
        FlowPhase phase = orchestrator.retry();

        // Assert
        assertThat(phase.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        assertThat(orchestrator.currentSermon()).get().extracting(Sermon::id).isEqualTo(sermonId);
        assertThat(capture.calls()).containsOnlyOnce("stop");
        assertThat(repository.fetchChunks(sermonId)).hasSize(2).noneMatch(AudioChunk::uploadPending);
    }

    @Test
    void shouldTimeOutAndReleaseSubscription() throws IOException {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, new ProcessingProperties(Duration.ofMillis(300), null));
        Path source = TestAudioFiles.wav(tmp.resolve("Slow.wav"), 1.0);

        // Act
        orchestrator.importAudio(source, null, null);

        // Assert
        Await.until(() -> phaseKind() == FlowPhase.Kind.ERROR);
        UUID sermonId = orchestrator.currentSermon().orElseThrow().id();
        assertThat(orchestrator.currentPhase().error().getKind()).isEqualTo(ErrorKind.PROCESSING_TIMEOUT);
        assertThat(orchestrator.currentPhase().error().isRetryable()).isTrue();
        assertThat(queue.enqueued()).containsExactly(sermonId);
        assertThat(queue.publisher().subscriberCount(sermonId)).isZero();
    }

    @Test
    void shouldKeepCompletedResultWhenTimeoutFiresAfterTerminalUpdate() throws IOException {
        // Arrange: the timeout fires the moment a saving step would be shown
        DelayCapturingScheduler timeouts = new DelayCapturingScheduler();
        scheduler.shutdownNow();
        scheduler = timeouts;
        publisher = new EventCapturingPublisher() {
            @Override
            public void publishEvent(Object event) {
                super.publishEvent(event);
                if (event instanceof FlowPhaseChangedEvent) {
                    ProcessingStep step = ((FlowPhaseChangedEvent) event).current().step();
                    if (step != null && step.stage() == ProcessingStep.Stage.SAVING) {
                        timeouts.fireDelayed();
                    }
                }
            }
        };
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Race.wav"), 1.0), null, null);
        Await.until(() -> !queue.enqueued().isEmpty());
        UUID sermonId = queue.enqueued().get(0);
        Await.until(() -> queue.publisher().subscriberCount(sermonId) == 1);
        Sermon done = repository.fetchSermon(sermonId).orElseThrow()
                .withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.SUCCEEDED, null);
        repository.saveSermon(done);
        repository.saveTranscript(new Transcript(sermonId, "Done in time", "en", "m", Instant.now()));

        // Act
        queue.publisher().publish(ProcessingJob.of(done), 1.0);

        // Assert
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        timeouts.fireDelayed();
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.VIEWING);
        assertThat(orchestrator.currentTranscript()).get().extracting(Transcript::content).isEqualTo("Done in time");
        assertThat(meterRegistry.find("sermonflow.cycles.failed").counter()).isNull();
    }

    @Test
    void shouldFailRetryablyWhenStreamEndsWithoutTerminalJob() throws IOException {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Cut.wav"), 1.0), null, null);
        Await.until(() -> !queue.enqueued().isEmpty());
        UUID sermonId = queue.enqueued().get(0);

        // Act
        queue.publisher().complete(sermonId);

        // Assert
        Await.until(() -> phaseKind() == FlowPhase.Kind.ERROR);
        assertThat(orchestrator.currentPhase().error().getKind()).isEqualTo(ErrorKind.TRANSCRIPTION_FAILED);
        assertThat(orchestrator.currentPhase().error().isRetryable()).isTrue();
    }

    @Test
    void shouldReturnToInputOnResetDuringProcessing() throws IOException {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Reset.wav"), 1.0), null, null);
        Await.until(() -> !queue.enqueued().isEmpty());
        UUID sermonId = queue.enqueued().get(0);

        // Act
        FlowPhase phase = orchestrator.reset();

        // Assert
        assertThat(phase).isEqualTo(FlowPhase.input());
        assertThat(orchestrator.currentSermon()).isEmpty();
        Await.until(() -> queue.publisher().subscriberCount(sermonId) == 0);
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.INPUT);
    }

    @Test
    void shouldDismissErrorBackToInput() {
        auth = FakeAuthService.signedOut();
        withLocalQueue();
        orchestrator.startRecording(null, null);

        FlowPhase phase = orchestrator.dismissError();

        assertThat(phase).isEqualTo(FlowPhase.input());
        assertThat(orchestrator.currentError()).isEmpty();
    }

    // ---------------------------------------------------------------------------------------------
    // Loading and background
    // ---------------------------------------------------------------------------------------------

    @Test
    void shouldLoadCompletedSermonIntoViewing() {
        // Arrange
        Sermon sermon = Sermon.create(UUID.randomUUID(), "Archived", null, "audio/wav")
                .withDuration(1800)
                .withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.SUCCEEDED, null);
        repository.saveSermon(sermon);
        repository.saveTranscript(new Transcript(sermon.id(), "Text", "en", "m", Instant.now()));
        repository.saveStudyGuide(new StudyGuide(sermon.id(), "Summary", null, null, null, "m", Instant.now()));
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.loadExistingSermon(sermon.id());

        // Assert
        assertThat(phase).isEqualTo(FlowPhase.viewing());
        assertThat(orchestrator.currentTranscript()).isPresent();
        assertThat(orchestrator.currentStudyGuide()).isPresent();
        assertThat(orchestrator.processingProgress()).isEqualTo(1.0);
    }

    @Test
    void shouldLoadDegradedSermonAsRetryableError() {
        Sermon sermon = Sermon.create(UUID.randomUUID(), "Half done", null, "audio/wav")
                .withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.FAILED, "quota exceeded");
        repository.saveSermon(sermon);
        repository.saveTranscript(new Transcript(sermon.id(), "Text", "en", "m", Instant.now()));
        withLocalQueue();

        FlowPhase phase = orchestrator.loadExistingSermon(sermon.id());

        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.STUDY_GUIDE_GENERATION_FAILED);
        assertThat(phase.error().isRetryable()).isTrue();
        assertThat(orchestrator.currentTranscript()).isPresent();
    }

    @Test
    void shouldRejectUnknownSermon() {
        withLocalQueue();

        assertThatThrownBy(() -> orchestrator.loadExistingSermon(UUID.randomUUID()))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldResumeFollowingRunningJobAfterLoad() {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        Sermon running = Sermon.create(UUID.randomUUID(), "In flight", null, "audio/wav")
                .withTranscription(ProcessingStatus.RUNNING, null);
        repository.saveSermon(running);
        repository.saveChunks(running.id(), List.of(
                AudioChunk.pending(running.id(), 0, 0.0, 60.0, tmp.resolve("gone.wav")).withRemotePath("k")));
        queue.setStatus(ProcessingJob.of(running));

        // Act
        FlowPhase phase = orchestrator.loadExistingSermon(running.id());
        Await.until(() -> queue.publisher().subscriberCount(running.id()) == 1);
        Sermon done = running.withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.SUCCEEDED, null);
        repository.saveSermon(done);
        repository.saveTranscript(new Transcript(done.id(), "Finished", "en", "m", Instant.now()));
        queue.publisher().publish(ProcessingJob.of(done), 1.0);
        queue.publisher().complete(done.id());

        // Assert
        assertThat(phase.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        assertThat(orchestrator.currentTranscript()).get().extracting(Transcript::content).isEqualTo("Finished");
        assertThat(queue.enqueued()).isEmpty();
    }

    @Test
    void shouldEnqueueUploadedPendingSermonOnLoad() {
        // Arrange
        Sermon uploaded = Sermon.create(UUID.randomUUID(), "Never queued", null, "audio/wav");
        repository.saveSermon(uploaded);
        repository.saveChunks(uploaded.id(), List.of(
                AudioChunk.pending(uploaded.id(), 0, 0.0, 60.0, tmp.resolve("gone.wav")).withRemotePath("k")));
        withLocalQueue();

        // Act
        FlowPhase phase = orchestrator.loadExistingSermon(uploaded.id());

        // Assert
        assertThat(phase.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);
        assertThat(orchestrator.currentTranscript()).get()
                .extracting(Transcript::content).isEqualTo("Grace and peace to you.");
        assertThat(orchestrator.currentStudyGuide()).isPresent();
        assertThat(repository.fetchSermon(uploaded.id())).get()
                .extracting(Sermon::status).isEqualTo(SermonStatus.READY);
    }

    @Test
    void shouldEnqueueAndFollowUploadedPendingSermonOnLoad() {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        Sermon uploaded = Sermon.create(UUID.randomUUID(), "Never queued", null, "audio/wav");
        repository.saveSermon(uploaded);
        repository.saveChunks(uploaded.id(), List.of(
                AudioChunk.pending(uploaded.id(), 0, 0.0, 60.0, tmp.resolve("gone.wav")).withRemotePath("k")));

        // Act
        orchestrator.loadExistingSermon(uploaded.id());

        // Assert
        Await.until(() -> !queue.enqueued().isEmpty());
        assertThat(queue.enqueued()).containsExactly(uploaded.id());
        Await.until(() -> queue.publisher().subscriberCount(uploaded.id()) == 1);
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.PROCESSING);
    }

    @Test
    void shouldTreatUnfinishedUploadAsRetryableOnLoad() {
        Sermon pending = Sermon.create(UUID.randomUUID(), "Interrupted", null, "audio/wav");
        repository.saveSermon(pending);
        repository.saveChunks(pending.id(), List.of(
                AudioChunk.pending(pending.id(), 0, 0.0, 60.0, tmp.resolve("chunk_000.wav"))));
        withLocalQueue();

        FlowPhase phase = orchestrator.loadExistingSermon(pending.id());

        assertThat(phase.error().getKind()).isEqualTo(ErrorKind.TRANSCRIPTION_FAILED);
        assertThat(phase.error().isRetryable()).isTrue();
    }

    @Test
    void shouldKeepPhaseInBackgroundAndReloadOnResume() throws IOException {
        // Arrange
        FakeProcessingJobQueue queue = new FakeProcessingJobQueue();
        orchestrator(queue, ProcessingProperties.defaults());
        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Background.wav"), 1.0), null, null);
        Await.until(() -> !queue.enqueued().isEmpty());
        UUID sermonId = queue.enqueued().get(0);
        Await.until(() -> queue.publisher().subscriberCount(sermonId) == 1);

        // Act
        FlowPhase backgrounded = orchestrator.enterBackground();

        // Assert
        assertThat(backgrounded.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> queue.publisher().subscriberCount(sermonId) == 0);
        assertThat(phaseKind()).isEqualTo(FlowPhase.Kind.PROCESSING);

        FlowPhase resumed = orchestrator.resumeFromBackground();
        assertThat(resumed.is(FlowPhase.Kind.PROCESSING)).isTrue();
        Await.until(() -> queue.publisher().subscriberCount(sermonId) == 1);
    }

    @Test
    void shouldExposeChunksAsUnmodifiableSnapshot() throws IOException {
        // Arrange
        withLocalQueue();
        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Snapshot.wav"), 1.0), null, null);
        Await.until(() -> phaseKind() == FlowPhase.Kind.VIEWING);

        // Act
        List<AudioChunk> chunks = orchestrator.currentChunks();

        // Assert
        assertThatThrownBy(chunks::clear).isInstanceOf(UnsupportedOperationException.class);
        assertThat(orchestrator.currentChunks()).hasSize(1);
    }

    @Test
    void shouldEstimateProcessingTimeFromChunks() throws IOException {
        withLocalQueue();
        assertThat(orchestrator.estimatedProcessingTime()).isEmpty();

        orchestrator.importAudio(TestAudioFiles.wav(tmp.resolve("Short.wav"), 1.0), null, null);

        assertThat(orchestrator.estimatedProcessingTime()).contains(Duration.ofMinutes(1));
    }

    /**
     * Scheduler that parks one-shot tasks for a day and lets the test run them on demand.
     */
    private static final class DelayCapturingScheduler extends ScheduledThreadPoolExecutor {

        private final List<Runnable> delayed = new CopyOnWriteArrayList<>();

        DelayCapturingScheduler() {
            super(1);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            delayed.add(command);
            return super.schedule(command, 1, TimeUnit.DAYS);
        }

        void fireDelayed() {
            delayed.forEach(Runnable::run);
        }
    }

    /**
     * Object store that fails a configurable number of puts before delegating.
     */
    private static final class FlakyObjectStore implements ObjectStoreClient {

        private final ObjectStoreClient delegate;
        private final AtomicInteger failuresLeft = new AtomicInteger();

        FlakyObjectStore(ObjectStoreClient delegate) {
            this.delegate = delegate;
        }

        void failNextPuts(int count) {
            failuresLeft.set(count);
        }

        @Override
        public void putObject(String bucket, String key, InputStream data, long contentLength, String contentType) {
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new ObjectStoreException("Simulated network failure");
            }
            delegate.putObject(bucket, key, data, contentLength, contentType);
        }

        @Override
        public boolean exists(String bucket, String key) {
            return delegate.exists(bucket, key);
        }
    }
}
