package com.phillippitts.sermonflow.service.health;

import com.phillippitts.sermonflow.config.properties.StorageProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the local sermon storage directory.
 *
 * <ul>
 *   <li>UP: directory exists (or can be created) and is writable, with usable space reported</li>
 *   <li>DOWN: directory cannot be created or is not writable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class StorageHealthIndicator implements HealthIndicator {

    private final Path sermonsDirectory;

    public StorageHealthIndicator(StorageProperties storage) {
        this.sermonsDirectory = storage.getSermonsDirectory();
    }

    @Override
    public Health health() {
        try {
            Files.createDirectories(sermonsDirectory);
        } catch (IOException e) {
            return Health.down(e)
                    .withDetail("directory", sermonsDirectory.toString())
                    .build();
        }
        if (!Files.isWritable(sermonsDirectory)) {
            return Health.down()
                    .withDetail("directory", sermonsDirectory.toString())
                    .withDetail("status", "not writable")
                    .build();
        }
        return Health.up()
                .withDetail("directory", sermonsDirectory.toString())
                .withDetail("usableSpaceMb", sermonsDirectory.toFile().getUsableSpace() / (1024 * 1024))
                .build();
    }
}
