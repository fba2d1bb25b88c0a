package com.phillippitts.sermonflow.service.storage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store backed by a local directory: {@code <root>/<bucket>/<key>}. Writes go to a temp file
 * and are moved into place, so readers never see a partial object.
 */
public class FileSystemObjectStoreClient implements ObjectStoreClient {

    private static final Logger LOG = LogManager.getLogger(FileSystemObjectStoreClient.class);

    private final Path root;

    public FileSystemObjectStoreClient(Path root) {
        this.root = root.toAbsolutePath().normalize();
        LOG.info("Filesystem object store at {}", this.root);
    }

    @Override
    public void putObject(String bucket, String key, InputStream data, long contentLength, String contentType) {
        Path target = resolve(bucket, key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                long copied = Files.copy(data, tmp, StandardCopyOption.REPLACE_EXISTING);
                if (copied != contentLength) {
                    throw new ObjectStoreException("Short upload for " + key + ": " + copied + " of "
                            + contentLength + " bytes");
                }
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            LOG.debug("Stored object bucket={}, key={}, bytes={}, type={}", bucket, key, contentLength, contentType);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to store object: bucket=" + bucket + ", key=" + key, e);
        }
    }

    @Override
    public boolean exists(String bucket, String key) {
        return Files.isRegularFile(resolve(bucket, key));
    }

    Path resolve(String bucket, String key) {
        Path p = root.resolve(bucket).resolve(key).normalize();
        if (!p.startsWith(root.resolve(bucket))) {
            throw new ObjectStoreException("Key escapes bucket: " + key);
        }
        return p;
    }
}
