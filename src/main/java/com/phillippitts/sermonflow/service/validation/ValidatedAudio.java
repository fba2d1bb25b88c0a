package com.phillippitts.sermonflow.service.validation;

import java.nio.file.Path;

/**
 * An import source that passed size and type checks.
 */
public record ValidatedAudio(Path source, long sizeBytes, AudioContainerType type, String extension) {

    /** File name without extension, used as the default sermon title. */
    public String baseName() {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
