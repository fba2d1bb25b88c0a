package com.phillippitts.sermonflow.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A recorded or imported sermon and the state of its two processing stages.
 *
 * <p>Immutable; every mutation returns a copy with a fresh {@code updatedAt}.
 */
public record Sermon(
        UUID id,
        UUID userId,
        String title,
        String speakerName,
        Instant recordedAt,
        int durationSeconds,
        String audioMimeType,
        ProcessingStatus transcriptionStatus,
        String transcriptionError,
        ProcessingStatus studyGuideStatus,
        String studyGuideError,
        Instant createdAt,
        Instant updatedAt) {

    public static final String DEFAULT_TITLE = "Untitled Sermon";

    public Sermon {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(transcriptionStatus, "transcriptionStatus");
        Objects.requireNonNull(studyGuideStatus, "studyGuideStatus");
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0");
        }
    }

    /**
     * Creates a new sermon with both stages pending.
     */
    public static Sermon create(UUID userId, String title, String speakerName, String audioMimeType) {
        Instant now = Instant.now();
        return new Sermon(UUID.randomUUID(), userId, title, blankToNull(speakerName), now, 0, audioMimeType,
                ProcessingStatus.PENDING, null, ProcessingStatus.PENDING, null, now, now);
    }

    public SermonStatus status() {
        return SermonStatus.from(transcriptionStatus, studyGuideStatus);
    }

    public Sermon withDuration(int seconds) {
        return new Sermon(id, userId, title, speakerName, recordedAt, seconds, audioMimeType,
                transcriptionStatus, transcriptionError, studyGuideStatus, studyGuideError, createdAt, Instant.now());
    }

    public Sermon withTranscription(ProcessingStatus status, String error) {
        return new Sermon(id, userId, title, speakerName, recordedAt, durationSeconds, audioMimeType,
                status, error, studyGuideStatus, studyGuideError, createdAt, Instant.now());
    }

    public Sermon withStudyGuide(ProcessingStatus status, String error) {
        return new Sermon(id, userId, title, speakerName, recordedAt, durationSeconds, audioMimeType,
                transcriptionStatus, transcriptionError, status, error, createdAt, Instant.now());
    }

    /** Duration as {@code m:ss} or {@code h:mm:ss}. */
    public String formattedDuration() {
        int hours = durationSeconds / 3600;
        int minutes = (durationSeconds % 3600) / 60;
        int seconds = durationSeconds % 60;
        return hours > 0
                ? String.format("%d:%02d:%02d", hours, minutes, seconds)
                : String.format("%d:%02d", minutes, seconds);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
