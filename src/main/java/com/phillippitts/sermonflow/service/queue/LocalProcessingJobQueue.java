package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.domain.ProcessingJob;
import com.phillippitts.sermonflow.domain.ProcessingStatus;
import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * In-process job queue. Jobs run FIFO, at most {@code maxConcurrentJobs} at a time.
 *
 * <p>A job runs whichever stages still need work (pending or failed), so enqueueing a sermon whose
 * study guide failed regenerates only the study guide. Progress follows the composite scale:
 * transcription covers 0.20 to 0.70, review 0.70 to 0.75, study guide 0.75 to 0.95, saving to 1.0.
 */
@Service
public class LocalProcessingJobQueue implements ProcessingJobQueue {

    private static final Logger LOG = LogManager.getLogger(LocalProcessingJobQueue.class);

    static final double TRANSCRIPTION_START = 0.20;
    static final double TRANSCRIPTION_SPAN = 0.50;
    static final double REVIEWING = 0.70;
    static final double ANALYZING = 0.75;
    static final double SAVING = 0.95;

    private final SermonRepository repository;
    private final SermonTranscriber transcriber;
    private final StudyGuideGenerator generator;
    private final ProgressPublisher publisher;
    private final Executor executor;
    private final int maxConcurrentJobs;

    private final Object lock = new Object();
    private final Deque<UUID> pending = new ArrayDeque<>();
    private final Set<UUID> running = new HashSet<>();

    public LocalProcessingJobQueue(SermonRepository repository,
                                   SermonTranscriber transcriber,
                                   StudyGuideGenerator generator,
                                   ProgressPublisher publisher,
                                   @Qualifier("jobExecutor") Executor executor,
                                   ProcessingProperties props) {
        this.repository = repository;
        this.transcriber = transcriber;
        this.generator = generator;
        this.publisher = publisher;
        this.executor = executor;
        this.maxConcurrentJobs = props.getMaxConcurrentJobs();
    }

    @Override
    public void enqueue(UUID sermonId) {
        Sermon sermon = repository.fetchSermon(sermonId)
                .orElseThrow(() -> new NoSuchElementException("Unknown sermon " + sermonId));
        synchronized (lock) {
            if (pending.contains(sermonId) || running.contains(sermonId)) {
                LOG.debug("Sermon {} already queued", sermonId);
                return;
            }
            if (!sermon.transcriptionStatus().needsWork() && !sermon.studyGuideStatus().needsWork()) {
                LOG.debug("Sermon {} has nothing to process", sermonId);
                ProcessingJob job = ProcessingJob.of(sermon);
                if (job.isComplete()) {
                    publisher.publish(job, 1.0);
                    publisher.complete(sermonId);
                }
                return;
            }
            pending.addLast(sermonId);
            LOG.info("Enqueued sermon {} ({} pending, {} running)", sermonId, pending.size(), running.size());
        }
        drain();
    }

    @Override
    public Optional<ProcessingJob> status(UUID sermonId) {
        return repository.fetchSermon(sermonId).map(ProcessingJob::of);
    }

    @Override
    public ProgressSubscription progressStream(UUID sermonId) {
        return publisher.subscribe(sermonId);
    }

    /** Number of jobs waiting to start. */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int runningCount() {
        synchronized (lock) {
            return running.size();
        }
    }

    private void drain() {
        List<UUID> toStart = new ArrayList<>();
        synchronized (lock) {
            while (running.size() < maxConcurrentJobs && !pending.isEmpty()) {
                UUID id = pending.pollFirst();
                running.add(id);
                toStart.add(id);
            }
        }
        for (UUID id : toStart) {
            executor.execute(() -> runJob(id));
        }
    }

    private void runJob(UUID sermonId) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("sermonId", sermonId.toString())) {
            process(sermonId);
        } catch (RuntimeException e) {
            LOG.error("Job for sermon {} failed unexpectedly", sermonId, e);
            publisher.complete(sermonId);
        } finally {
            synchronized (lock) {
                running.remove(sermonId);
            }
            drain();
        }
    }

    private void process(UUID sermonId) {
        Sermon sermon = repository.fetchSermon(sermonId)
                .orElseThrow(() -> new NoSuchElementException("Unknown sermon " + sermonId));
        List<AudioChunk> chunks = repository.fetchChunks(sermonId);

        if (sermon.transcriptionStatus().needsWork()) {
            sermon = save(sermon.withTranscription(ProcessingStatus.RUNNING, null));
            publisher.publish(ProcessingJob.of(sermon), TRANSCRIPTION_START);
            try {
                final Sermon current = sermon;
                Transcript transcript = transcriber.transcribe(sermon, chunks, p -> publisher.publish(
                        ProcessingJob.of(current), TRANSCRIPTION_START + clamp(p) * TRANSCRIPTION_SPAN));
                repository.saveTranscript(transcript);
                sermon = save(sermon.withTranscription(ProcessingStatus.SUCCEEDED, null));
                publisher.publish(ProcessingJob.of(sermon), REVIEWING);
                LOG.info("Transcription succeeded for sermon {}", sermonId);
            } catch (RuntimeException e) {
                LOG.warn("Transcription failed for sermon {}: {}", sermonId, e.getMessage());
                sermon = save(sermon.withTranscription(ProcessingStatus.FAILED, messageOf(e)));
                finish(sermon);
                return;
            }
        }

        if (sermon.studyGuideStatus().needsWork()) {
            Transcript transcript = repository.fetchTranscript(sermonId).orElse(null);
            if (transcript == null) {
                sermon = save(sermon.withStudyGuide(ProcessingStatus.FAILED, "Transcript not available"));
                finish(sermon);
                return;
            }
            sermon = save(sermon.withStudyGuide(ProcessingStatus.RUNNING, null));
            publisher.publish(ProcessingJob.of(sermon), ANALYZING);
            try {
                StudyGuide guide = generator.generate(sermon, transcript);
                publisher.publish(ProcessingJob.of(sermon), SAVING);
                repository.saveStudyGuide(guide);
                sermon = save(sermon.withStudyGuide(ProcessingStatus.SUCCEEDED, null));
                LOG.info("Study guide generated for sermon {}", sermonId);
            } catch (RuntimeException e) {
                LOG.warn("Study guide generation failed for sermon {}: {}", sermonId, e.getMessage());
                sermon = save(sermon.withStudyGuide(ProcessingStatus.FAILED, messageOf(e)));
            }
        }
        finish(sermon);
    }

    private void finish(Sermon sermon) {
        ProcessingJob job = ProcessingJob.of(sermon);
        publisher.publish(job, job.isComplete() ? 1.0 : 0.0);
        publisher.complete(sermon.id());
    }

    private Sermon save(Sermon sermon) {
        repository.saveSermon(sermon);
        return sermon;
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static double clamp(double p) {
        return Double.isNaN(p) ? 0.0 : Math.max(0.0, Math.min(1.0, p));
    }
}
