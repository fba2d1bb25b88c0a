package com.phillippitts.sermonflow.service.storage;

import java.io.InputStream;

/**
 * Remote object storage for uploaded audio chunks.
 */
public interface ObjectStoreClient {

    /**
     * Stores an object, replacing any existing object under the same key.
     *
     * @param contentLength size of {@code data} in bytes
     * @throws ObjectStoreException if the upload fails
     */
    void putObject(String bucket, String key, InputStream data, long contentLength, String contentType);

    /**
     * @return whether an object exists under {@code key}
     * @throws ObjectStoreException if the store cannot be queried
     */
    boolean exists(String bucket, String key);
}
