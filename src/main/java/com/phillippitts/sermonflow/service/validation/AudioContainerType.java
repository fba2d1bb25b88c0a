package com.phillippitts.sermonflow.service.validation;

import java.util.Locale;
import java.util.Set;

/**
 * Audio containers accepted for import.
 */
public enum AudioContainerType {
    MP3("audio/mpeg", "mp3"),
    MPEG4_AUDIO("audio/mp4", "m4a"),
    WAV("audio/wav", "wav"),
    /** Any other file the platform identifies as audio. */
    GENERIC_AUDIO("audio/*", null);

    private static final Set<String> GENERIC_EXTENSIONS =
            Set.of("aac", "aif", "aiff", "caf", "flac", "oga", "ogg", "opus", "wma");

    private final String mimeType;
    private final String defaultExtension;

    AudioContainerType(String mimeType, String defaultExtension) {
        this.mimeType = mimeType;
        this.defaultExtension = defaultExtension;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * Extension used for the local copy; generic audio keeps the source extension.
     */
    public String extensionFor(String sourceExtension) {
        if (defaultExtension != null) {
            return defaultExtension;
        }
        return (sourceExtension == null || sourceExtension.isBlank()) ? "audio" : sourceExtension;
    }

    static boolean isGenericAudioExtension(String extension) {
        return extension != null && GENERIC_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /** Content type used when storing a chunk with the given file extension. */
    public static String mimeTypeForExtension(String extension) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "mp3" -> MP3.mimeType;
            case "m4a", "mp4", "aac" -> MPEG4_AUDIO.mimeType;
            case "wav" -> WAV.mimeType;
            default -> "application/octet-stream";
        };
    }
}
