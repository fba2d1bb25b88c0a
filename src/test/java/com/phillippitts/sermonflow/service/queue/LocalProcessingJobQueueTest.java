package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.ProcessingJob;
import com.phillippitts.sermonflow.domain.ProcessingStatus;
import com.phillippitts.sermonflow.domain.ProgressUpdate;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.service.repository.InMemorySermonRepository;
import com.phillippitts.sermonflow.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LocalProcessingJobQueue}.
 */
class LocalProcessingJobQueueTest {

    private InMemorySermonRepository repository;
    private ProgressPublisher publisher;
    private AtomicInteger transcriptions;
    private AtomicInteger generations;
    private SermonTranscriber transcriber;
    private StudyGuideGenerator generator;

    @BeforeEach
    void setUp() {
        repository = new InMemorySermonRepository();
        publisher = new ProgressPublisher();
        transcriptions = new AtomicInteger();
        generations = new AtomicInteger();
        transcriber = (sermon, chunks, onProgress) -> {
            transcriptions.incrementAndGet();
            onProgress.accept(0.5);
            return new Transcript(sermon.id(), "In the beginning.", "en", "test-model", Instant.now());
        };
        generator = (sermon, transcript) -> {
            generations.incrementAndGet();
            return new StudyGuide(sermon.id(), "Creation", List.of("God creates"), List.of("Genesis 1:1"),
                    List.of("What does it mean to create?"), "test-model", Instant.now());
        };
    }

    private LocalProcessingJobQueue queue(Executor executor, int maxConcurrent) {
        return new LocalProcessingJobQueue(repository, (s, c, p) -> transcriber.transcribe(s, c, p),
                (s, t) -> generator.generate(s, t), publisher, executor,
                new ProcessingProperties(null, maxConcurrent));
    }

    private Sermon persisted(Sermon sermon) {
        repository.saveSermon(sermon);
        repository.saveChunks(sermon.id(),
                List.of(AudioChunk.pending(sermon.id(), 0, 0.0, 60.0, Path.of("chunk_000.wav"))));
        return sermon;
    }

    private static List<ProgressUpdate> drain(ProgressSubscription s) throws InterruptedException {
        List<ProgressUpdate> updates = new ArrayList<>();
        ProgressUpdate u;
        while ((u = s.next()) != null) {
            updates.add(u);
        }
        return updates;
    }

    @Test
    void shouldRunBothStagesOnCompositeScale() throws InterruptedException {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Genesis", null, "audio/wav"));
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);
        ProgressSubscription stream = queue.progressStream(sermon.id());

        // Act
        queue.enqueue(sermon.id());

        // Assert
        List<ProgressUpdate> updates = drain(stream);
        assertThat(updates).extracting(u -> Math.round(u.progress() * 100) / 100.0)
                .containsExactly(0.20, 0.45, 0.70, 0.75, 0.95, 1.0);
        assertThat(updates.get(updates.size() - 1).job().isComplete()).isTrue();
        assertThat(repository.fetchTranscript(sermon.id())).isPresent();
        assertThat(repository.fetchStudyGuide(sermon.id())).isPresent();
        assertThat(queue.status(sermon.id())).get().extracting(ProcessingJob::isComplete).isEqualTo(true);
        assertThat(queue.runningCount()).isZero();
    }

    @Test
    void shouldRecordTranscriptionFailureAndSkipStudyGuide() throws InterruptedException {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Exodus", null, "audio/wav"));
        transcriber = (s, c, p) -> {
            throw new IllegalStateException("speech service unavailable");
        };
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);
        ProgressSubscription stream = queue.progressStream(sermon.id());

        // Act
        queue.enqueue(sermon.id());

        // Assert
        List<ProgressUpdate> updates = drain(stream);
        ProcessingJob last = updates.get(updates.size() - 1).job();
        assertThat(last.transcriptionFailed()).isTrue();
        assertThat(last.transcriptionError()).isEqualTo("speech service unavailable");
        assertThat(last.isTerminal()).isTrue();
        assertThat(updates).extracting(ProgressUpdate::progress).allMatch(p -> p <= 0.20);
        assertThat(generations).hasValue(0);
    }

    @Test
    void shouldKeepTranscriptWhenStudyGuideFails() throws InterruptedException {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Psalms", null, "audio/wav"));
        generator = (s, t) -> {
            throw new IllegalStateException("model overloaded");
        };
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);
        ProgressSubscription stream = queue.progressStream(sermon.id());

        // Act
        queue.enqueue(sermon.id());

        // Assert
        List<ProgressUpdate> updates = drain(stream);
        ProcessingJob last = updates.get(updates.size() - 1).job();
        Sermon stored = repository.fetchSermon(sermon.id()).orElseThrow();
        assertThat(last.studyGuideFailed()).isTrue();
        assertThat(updates.get(updates.size() - 1).progress()).isEqualTo(0.75);
        assertThat(stored.transcriptionStatus()).isEqualTo(ProcessingStatus.SUCCEEDED);
        assertThat(stored.studyGuideStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(stored.studyGuideError()).isEqualTo("model overloaded");
        assertThat(repository.fetchTranscript(sermon.id())).isPresent();
    }

    @Test
    void shouldRegenerateOnlyFailedStudyGuide() throws InterruptedException {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Romans", null, "audio/wav")
                .withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.FAILED, "model overloaded"));
        repository.saveTranscript(new Transcript(sermon.id(), "Therefore.", "en", "test-model", Instant.now()));
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);
        ProgressSubscription stream = queue.progressStream(sermon.id());

        // Act
        queue.enqueue(sermon.id());

        // Assert
        List<ProgressUpdate> updates = drain(stream);
        assertThat(transcriptions).hasValue(0);
        assertThat(generations).hasValue(1);
        assertThat(updates).extracting(ProgressUpdate::progress).containsExactly(0.75, 0.95, 1.0);
        assertThat(repository.fetchSermon(sermon.id()).orElseThrow().studyGuideError()).isNull();
    }

    @Test
    void shouldFailStudyGuideWhenTranscriptIsMissing() {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Jude", null, "audio/wav")
                .withTranscription(ProcessingStatus.SUCCEEDED, null));
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);

        // Act
        queue.enqueue(sermon.id());

        // Assert
        Sermon stored = repository.fetchSermon(sermon.id()).orElseThrow();
        assertThat(stored.studyGuideStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(stored.studyGuideError()).isEqualTo("Transcript not available");
        assertThat(generations).hasValue(0);
    }

    @Test
    void shouldEndStreamImmediatelyForCompletedSermon() throws InterruptedException {
        // Arrange
        Sermon sermon = persisted(Sermon.create(UUID.randomUUID(), "Ruth", null, "audio/wav")
                .withTranscription(ProcessingStatus.SUCCEEDED, null)
                .withStudyGuide(ProcessingStatus.SUCCEEDED, null));
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);
        ProgressSubscription stream = queue.progressStream(sermon.id());

        // Act
        queue.enqueue(sermon.id());

        // Assert
        assertThat(drain(stream)).extracting(ProgressUpdate::progress).containsExactly(1.0);
        assertThat(transcriptions).hasValue(0);
    }

    @Test
    void shouldRejectUnknownSermon() {
        LocalProcessingJobQueue queue = queue(new SyncExecutor(), 2);

        assertThatThrownBy(() -> queue.enqueue(UUID.randomUUID()))
                .isInstanceOf(NoSuchElementException.class);
        assertThat(queue.status(UUID.randomUUID())).isEmpty();
    }

    @Test
    void shouldLimitConcurrentJobsAndIgnoreDuplicates() {
        // Arrange
        Deque<Runnable> submitted = new ArrayDeque<>();
        LocalProcessingJobQueue queue = queue(submitted::addLast, 1);
        Sermon first = persisted(Sermon.create(UUID.randomUUID(), "First", null, "audio/wav"));
        Sermon second = persisted(Sermon.create(UUID.randomUUID(), "Second", null, "audio/wav"));

        // Act
        queue.enqueue(first.id());
        queue.enqueue(second.id());
        queue.enqueue(second.id());

        // Assert
        assertThat(queue.runningCount()).isEqualTo(1);
        assertThat(queue.pendingCount()).isEqualTo(1);
        assertThat(submitted).hasSize(1);

        submitted.pollFirst().run();

        assertThat(queue.pendingCount()).isZero();
        assertThat(queue.runningCount()).isEqualTo(1);
        assertThat(submitted).hasSize(1);

        submitted.pollFirst().run();

        assertThat(queue.runningCount()).isZero();
        assertThat(transcriptions).hasValue(2);
    }
}
