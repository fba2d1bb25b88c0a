package com.phillippitts.sermonflow.service.audio.capture;

import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.config.properties.StorageProperties;
import com.phillippitts.sermonflow.exception.MicrophonePermissionDeniedException;
import com.phillippitts.sermonflow.exception.RecordingFailedException;
import com.phillippitts.sermonflow.exception.RecordingTooShortException;
import com.phillippitts.sermonflow.service.audio.CaptureFormat;
import com.phillippitts.sermonflow.util.ProcessTimeouts;
import com.phillippitts.sermonflow.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Java Sound based microphone capture writing PCM16LE mono 16 kHz WAV chunk files.
 * Thread-safe for a single active session.
 *
 * <p>The line is opened on the caller's thread so permission and device errors surface from
 * {@link #startSession}. A daemon thread then reads the line, splits the stream at chunk boundaries and
 * feeds the level meter. Elapsed time is derived from bytes written, so paused time never counts.
 */
@Service
public class JavaSoundAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureService.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final RecordingProperties props;
    private final StorageProperties storage;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final AudioLevelMeter meter = new AudioLevelMeter();

    private final Object lock = new Object();
    private Session current;

    @Autowired
    public JavaSoundAudioCaptureService(RecordingProperties props,
                                        StorageProperties storage,
                                        ApplicationEventPublisher publisher) {
        this(props, storage, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureService(RecordingProperties props,
                                 StorageProperties storage,
                                 ApplicationEventPublisher publisher,
                                 DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.storage = Objects.requireNonNull(storage);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio capture initialized: OS={}, device='{}', available-mixers={}, chunk={}s, min-duration={}s",
                System.getProperty("os.name"), device, AudioSystem.getMixerInfo().length,
                props.getChunkDurationSeconds(), props.getMinimumDurationSeconds());
    }

    @PreDestroy
    public void shutdown() {
        Thread captureThread = null;
        synchronized (lock) {
            if (current != null && current.active.get()) {
                LOG.info("Shutting down with active session {}; keeping chunks written so far", current.id);
                current.active.set(false);
                captureThread = current.thread;
                current = null;
            }
        }
        // Join thread outside lock to avoid deadlock
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public UUID startSession(UUID sermonId, int chunkDurationSeconds, Consumer<ChunkCompletedEvent> onChunkCompleted) {
        Objects.requireNonNull(sermonId, "sermonId");
        Objects.requireNonNull(onChunkCompleted, "onChunkCompleted");
        if (chunkDurationSeconds <= 0) {
            throw new IllegalArgumentException("chunkDurationSeconds must be > 0");
        }
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture session is already active");
            }
            Path dir = storage.sermonDirectory(sermonId);
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new RecordingFailedException("Could not create recording directory", e);
            }

            TargetDataLine line = openLine(dir);
            Session s = new Session(UUID.randomUUID(), sermonId, dir, CaptureFormat.bytesFor(chunkDurationSeconds),
                    onChunkCompleted, line);
            try {
                s.writer = ChunkFileWriter.open(dir.resolve(ChunkFileWriter.fileName(0)), 0);
            } catch (IOException e) {
                closeLine(line);
                deleteRecursively(dir);
                throw new RecordingFailedException("Could not create chunk file", e);
            }
            s.active.set(true);
            current = s;

            Thread t = new Thread(() -> doCapture(s), "audio-capture");
            t.setDaemon(true);
            s.thread = t;
            t.start();
            LOG.info("Capture session {} started for sermon {} ({}s chunks)", s.id, sermonId, chunkDurationSeconds);
            return s.id;
        }
    }

    private TargetDataLine openLine(Path dir) {
        try {
            return provider.open(CaptureFormat.toJavaSound(), Optional.ofNullable(props.getDeviceName()));
        } catch (LineUnavailableException | IllegalArgumentException e) {
            deleteRecursively(dir);
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            throw new RecordingFailedException("Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            deleteRecursively(dir);
            LOG.warn("Microphone access denied: {}", e.getMessage());
            throw new MicrophonePermissionDeniedException();
        }
    }

    @Override
    public void pauseSession(UUID sessionId) {
        synchronized (lock) {
            if (isCurrent(sessionId)) {
                current.paused = true;
            }
        }
    }

    @Override
    public void resumeSession(UUID sessionId) {
        synchronized (lock) {
            if (isCurrent(sessionId)) {
                current.paused = false;
            }
        }
    }

    @Override
    public boolean isPaused(UUID sessionId) {
        synchronized (lock) {
            return isCurrent(sessionId) && current.paused;
        }
    }

    @Override
    public double capturedSeconds(UUID sessionId) {
        synchronized (lock) {
            return isCurrent(sessionId) ? CaptureFormat.secondsFor(current.totalBytes) : 0.0;
        }
    }

    @Override
    public List<Path> stopSession(UUID sessionId) {
        Session s;
        synchronized (lock) {
            ensureSession(sessionId);
            s = current;
            double captured = CaptureFormat.secondsFor(s.totalBytes);
            if (s.failure == null && captured < props.getMinimumDurationSeconds()) {
                throw new RecordingTooShortException(TimeUtils.wholeSeconds(captured),
                        props.getMinimumDurationSeconds());
            }
            s.active.set(false);
        }
        // Join thread outside lock so the last chunk is closed before reading the list
        joinThread(s.thread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        synchronized (lock) {
            current = null;
            meter.reset();
            if (s.failure != null) {
                throw new RecordingFailedException(s.failure.getMessage(), s.failure);
            }
            LOG.info("Capture session {} stopped: {} chunk(s), {}s", s.id, s.completed.size(),
                    String.format("%.1f", CaptureFormat.secondsFor(s.totalBytes)));
            return List.copyOf(s.completed);
        }
    }

    @Override
    public void cancelSession(UUID sessionId) {
        Session s;
        synchronized (lock) {
            ensureSession(sessionId);
            s = current;
            s.canceled = true;
            s.active.set(false);
            current = null;
            meter.reset();
        }
        joinThread(s.thread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        if (s.thread == null || !s.thread.isAlive()) {
            deleteRecursively(s.directory);
        }
        LOG.info("Capture session {} canceled; audio discarded", s.id);
    }

    @Override
    public AudioLevelMeter levelMeter() {
        return meter;
    }

    private void doCapture(Session s) {
        int readBytes = Math.max(CaptureFormat.BLOCK_ALIGN,
                (props.getReadMillis() * CaptureFormat.BYTE_RATE / 1000) / CaptureFormat.BLOCK_ALIGN
                        * CaptureFormat.BLOCK_ALIGN);
        byte[] buf = new byte[readBytes];
        boolean lineRunning = false;
        try {
            while (s.active.get()) {
                if (s.paused) {
                    if (lineRunning) {
                        s.line.stop();
                        lineRunning = false;
                    }
                    Thread.sleep(20);
                    continue;
                }
                if (!lineRunning) {
                    s.line.start();
                    lineRunning = true;
                }
                int n = s.line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                writeAudio(s, buf, n);
                meter.publish(AudioLevelMeter.normalizedRms(buf, n));
            }
            if (!s.canceled) {
                finishLastChunk(s);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Capture thread interrupted; session {} ends early", s.id);
            s.failure = new IOException("Capture interrupted", e);
        } catch (IOException e) {
            LOG.warn("Writing chunk failed for session {}: {}", s.id, e.getMessage());
            s.failure = e;
            publisher.publishEvent(new CaptureErrorEvent(s.id, s.sermonId, "CHUNK_WRITE_FAILED", Instant.now()));
        } catch (RuntimeException e) {
            LOG.warn("Capture failed for session {}: {}", s.id, e.toString());
            s.failure = new IOException(e.getMessage(), e);
            publisher.publishEvent(new CaptureErrorEvent(s.id, s.sermonId, "CAPTURE_ERROR", Instant.now()));
        } finally {
            closeWriter(s);
            closeLine(s.line);
            if (s.canceled) {
                deleteRecursively(s.directory);
            }
        }
    }

    private void writeAudio(Session s, byte[] buf, int n) throws IOException {
        int offset = 0;
        while (offset < n) {
            long room = s.bytesPerChunk - s.writer.dataBytes();
            int take = (int) Math.min(room, n - offset);
            s.writer.write(buf, offset, take);
            offset += take;
            synchronized (lock) {
                s.totalBytes += take;
            }
            if (s.writer.dataBytes() >= s.bytesPerChunk) {
                rotate(s);
            }
        }
    }

    private void rotate(Session s) throws IOException {
        ChunkFileWriter done = s.writer;
        done.close();
        s.completed.add(done.path());
        int next = done.index() + 1;
        s.writer = ChunkFileWriter.open(s.directory.resolve(ChunkFileWriter.fileName(next)), next);
        LOG.debug("Chunk {} completed for session {}", done.index(), s.id);
        ChunkCompletedEvent event = new ChunkCompletedEvent(s.id, s.sermonId, done.index(), done.path(),
                CaptureFormat.secondsFor(done.dataBytes()), Instant.now());
        try {
            s.onChunkCompleted.accept(event);
        } catch (RuntimeException e) {
            LOG.warn("Chunk listener failed for chunk {}: {}", done.index(), e.toString());
        }
    }

    private void finishLastChunk(Session s) throws IOException {
        ChunkFileWriter last = s.writer;
        s.writer = null;
        last.close();
        if (last.dataBytes() > 0 || s.completed.isEmpty()) {
            s.completed.add(last.path());
        } else {
            Files.deleteIfExists(last.path());
        }
    }

    private void closeWriter(Session s) {
        if (s.writer == null) {
            return;
        }
        try {
            s.writer.close();
        } catch (IOException e) {
            LOG.debug("Closing chunk {} failed: {}", s.writer.index(), e.getMessage());
        }
    }

    private static void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing capture line failed: {}", e.toString());
        }
    }

    private boolean isCurrent(UUID id) {
        return current != null && current.id.equals(id) && current.active.get();
    }

    private void ensureSession(UUID id) {
        if (current == null || !current.id.equals(id)) {
            throw new IllegalStateException("Session not found or not active");
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || thread == Thread.currentThread() || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.warn("Could not delete {}: {}", p.getFileName(), e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", dir.getFileName(), e.getMessage());
        }
    }

    private static final class Session {
        final UUID id;
        final UUID sermonId;
        final Path directory;
        final long bytesPerChunk;
        final Consumer<ChunkCompletedEvent> onChunkCompleted;
        final TargetDataLine line;
        final AtomicBoolean active = new AtomicBoolean(false);
        final List<Path> completed = new CopyOnWriteArrayList<>();
        volatile boolean paused;
        volatile boolean canceled;
        volatile Thread thread;
        volatile ChunkFileWriter writer;
        volatile IOException failure;
        long totalBytes;

        Session(UUID id, UUID sermonId, Path directory, long bytesPerChunk,
                Consumer<ChunkCompletedEvent> onChunkCompleted, TargetDataLine line) {
            this.id = id;
            this.sermonId = sermonId;
            this.directory = directory;
            this.bytesPerChunk = bytesPerChunk;
            this.onChunkCompleted = onChunkCompleted;
            this.line = line;
        }
    }
}
