package com.phillippitts.sermonflow.config.storage;

import com.phillippitts.sermonflow.config.properties.ObjectStoreProperties;
import com.phillippitts.sermonflow.service.storage.FileSystemObjectStoreClient;
import com.phillippitts.sermonflow.service.storage.ObjectStoreClient;
import com.phillippitts.sermonflow.service.storage.S3ObjectStoreClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the remote chunk store.
 *
 * <p>{@code sermon.object-store.type=filesystem} (default) keeps "remote" copies under
 * {@code sermon.object-store.root}; {@code s3} uploads to Amazon S3 or an S3-compatible endpoint.
 */
@Configuration
public class ObjectStoreConfig {

    private static final Logger LOG = LogManager.getLogger(ObjectStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "sermon.object-store", name = "type", havingValue = "filesystem",
            matchIfMissing = true)
    public ObjectStoreClient fileSystemObjectStoreClient(ObjectStoreProperties properties) {
        LOG.info("Using filesystem object store at {}", properties.getRoot());
        return new FileSystemObjectStoreClient(properties.getRoot());
    }

    @Bean
    @ConditionalOnProperty(prefix = "sermon.object-store", name = "type", havingValue = "s3")
    public ObjectStoreClient s3ObjectStoreClient(ObjectStoreProperties properties) {
        LOG.info("Using S3 object store, bucket={} region={} endpoint={}",
                properties.getBucket(), properties.getRegion(),
                properties.getEndpoint() != null ? properties.getEndpoint() : "default");
        return new S3ObjectStoreClient(properties);
    }
}
