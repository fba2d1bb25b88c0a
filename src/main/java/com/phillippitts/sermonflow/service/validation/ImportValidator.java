package com.phillippitts.sermonflow.service.validation;

import com.phillippitts.sermonflow.config.properties.ImportProperties;
import com.phillippitts.sermonflow.config.properties.StorageProperties;
import com.phillippitts.sermonflow.domain.AudioChunk;
import com.phillippitts.sermonflow.exception.FileTooLargeException;
import com.phillippitts.sermonflow.exception.ImportFailedException;
import com.phillippitts.sermonflow.exception.UnsupportedAudioFormatException;
import com.phillippitts.sermonflow.service.audio.analysis.MediaDurationProbe;
import com.phillippitts.sermonflow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Validates an external audio file and copies it into a sermon's local directory as chunk 0.
 *
 * <p>Checks run in order: existence, size, container type. Nothing is written until all pass, so a
 * rejected file leaves no trace. The container is identified from magic bytes first and the platform
 * content type second.
 */
@Component
public class ImportValidator {

    private static final Logger LOG = LogManager.getLogger(ImportValidator.class);
    private static final int MAGIC_LENGTH = 12;

    private final ImportProperties props;
    private final StorageProperties storage;
    private final MediaDurationProbe durationProbe;

    public ImportValidator(ImportProperties props, StorageProperties storage, MediaDurationProbe durationProbe) {
        this.props = props;
        this.storage = storage;
        this.durationProbe = durationProbe;
    }

    /**
     * @throws ImportFailedException if the file does not exist or cannot be read
     * @throws FileTooLargeException if the file exceeds the size limit
     * @throws UnsupportedAudioFormatException if the container is not allowed
     */
    public ValidatedAudio validate(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new ImportFailedException("File not found");
        }
        long size;
        try {
            size = Files.size(source);
        } catch (IOException e) {
            throw new ImportFailedException("Could not read file size", e);
        }
        if (size > props.getMaxSizeBytes()) {
            LOG.info("Rejected import {}: {} bytes exceeds {} MB", LogSanitizer.fileName(source), size,
                    props.getMaxSizeMb());
            throw new FileTooLargeException(props.getMaxSizeMb());
        }

        String extension = extensionOf(source);
        AudioContainerType type = detect(source, extension);
        if (type == null || !props.getAllowedTypes().contains(type)) {
            String identifier = type != null ? type.getMimeType() : typeIdentifier(source, extension);
            LOG.info("Rejected import {}: unsupported type {}", LogSanitizer.fileName(source), identifier);
            throw new UnsupportedAudioFormatException(identifier);
        }
        return new ValidatedAudio(source, size, type, extension);
    }

    /**
     * Copies a validated file to {@code <root>/Sermons/<sermonId>/chunk_000.<ext>} and reads its duration.
     *
     * @return chunk 0 at offset 0 spanning the whole file
     * @throws ImportFailedException if the copy or the duration probe fails
     */
    public AudioChunk copyIntoSermon(ValidatedAudio audio, UUID sermonId) {
        Path dir = storage.sermonDirectory(sermonId);
        Path target = dir.resolve("chunk_000." + audio.type().extensionFor(audio.extension()));
        try {
            Files.createDirectories(dir);
            Files.copy(audio.source(), target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ImportFailedException("Could not copy file: " + e.getMessage(), e);
        }
        double duration;
        try {
            duration = durationProbe.durationSeconds(target);
        } catch (IOException e) {
            throw new ImportFailedException("Could not read audio duration: " + e.getMessage(), e);
        }
        LOG.info("Imported {} as sermon {} ({} bytes, {}s)", LogSanitizer.fileName(audio.source()), sermonId,
                audio.sizeBytes(), String.format("%.1f", duration));
        return AudioChunk.pending(sermonId, 0, 0.0, duration, target);
    }

    AudioContainerType detect(Path source, String extension) {
        byte[] magic = new byte[MAGIC_LENGTH];
        int n;
        try (InputStream in = Files.newInputStream(source)) {
            n = in.readNBytes(magic, 0, MAGIC_LENGTH);
        } catch (IOException e) {
            throw new ImportFailedException("Could not read file", e);
        }
        if (n >= 12 && ascii(magic, 0, "RIFF") && ascii(magic, 8, "WAVE")) {
            return AudioContainerType.WAV;
        }
        if (n >= 8 && ascii(magic, 4, "ftyp")) {
            return AudioContainerType.MPEG4_AUDIO;
        }
        if (n >= 3 && ascii(magic, 0, "ID3")) {
            return AudioContainerType.MP3;
        }
        if (n >= 2 && (magic[0] & 0xFF) == 0xFF && (magic[1] & 0xE0) == 0xE0) {
            return AudioContainerType.MP3;
        }
        String contentType = probeContentType(source);
        if ((contentType != null && contentType.startsWith("audio/"))
                || AudioContainerType.isGenericAudioExtension(extension)) {
            return AudioContainerType.GENERIC_AUDIO;
        }
        return null;
    }

    private static String typeIdentifier(Path source, String extension) {
        String contentType = probeContentType(source);
        if (contentType != null) {
            return contentType;
        }
        return extension.isEmpty() ? "unknown" : "." + extension;
    }

    private static String probeContentType(Path source) {
        try {
            return Files.probeContentType(source);
        } catch (IOException e) {
            LOG.debug("Content type probe failed for {}: {}", LogSanitizer.fileName(source), e.getMessage());
            return null;
        }
    }

    private static boolean ascii(byte[] a, int off, String s) {
        for (int i = 0; i < s.length(); i++) {
            if (a[off + i] != (byte) s.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static String extensionOf(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
