package com.phillippitts.sermonflow.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Local storage layout. Chunk files live under {@code <root>/Sermons/<sermonId>/}.
 */
@ConfigurationProperties(prefix = "sermon.storage")
public class StorageProperties {

    private static final String SERMONS_DIR = "Sermons";

    private final Path root;

    @ConstructorBinding
    public StorageProperties(Path root) {
        this.root = root == null ? Path.of(System.getProperty("user.home"), ".sermon-flow") : root;
    }

    public Path getRoot() { return root; }

    public Path getSermonsDirectory() {
        return root.resolve(SERMONS_DIR);
    }

    public Path sermonDirectory(UUID sermonId) {
        return getSermonsDirectory().resolve(sermonId.toString());
    }
}
