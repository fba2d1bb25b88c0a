package com.phillippitts.sermonflow.service.storage;

import com.phillippitts.sermonflow.config.properties.ObjectStoreProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;
import java.net.URI;

/**
 * Amazon S3 (or S3-compatible, e.g. MinIO) object store using AWS SDK v2.
 *
 * <p>The SDK retries transient failures itself. Static credentials are used when configured, the default
 * provider chain otherwise.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

    private static final Logger LOG = LogManager.getLogger(S3ObjectStoreClient.class);

    private final S3Client s3Client;

    public S3ObjectStoreClient(ObjectStoreProperties properties) {
        this(buildClient(properties));
        LOG.info("S3 object store initialized: endpoint={}, bucket={}, pathStyleAccess={}",
                properties.getEndpoint() != null ? properties.getEndpoint() : "aws", properties.getBucket(),
                properties.isPathStyleAccess());
    }

    // Package-private for tests
    S3ObjectStoreClient(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    private static S3Client buildClient(ObjectStoreProperties properties) {
        AwsCredentialsProvider credentials = properties.getAccessKey() != null && properties.getSecretKey() != null
                ? StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(properties.getAccessKey(), properties.getSecretKey()))
                : DefaultCredentialsProvider.create();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentials)
                .forcePathStyle(properties.isPathStyleAccess());
        if (properties.getEndpoint() != null) {
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        }
        return builder.build();
    }

    @Override
    public void putObject(String bucket, String key, InputStream data, long contentLength, String contentType) {
        LOG.debug("Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
                bucket, key, contentLength, contentType);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .contentLength(contentLength)
                    .build();
            s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));
            LOG.info("Uploaded object: bucket={}, key={}", bucket, key);
        } catch (S3Exception e) {
            String message = String.format("Failed to upload object: bucket=%s, key=%s, statusCode=%s",
                    bucket, key, e.statusCode());
            LOG.error(message, e);
            throw new ObjectStoreException(message, e);
        } catch (RuntimeException e) {
            String message = String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
            LOG.error(message, e);
            throw new ObjectStoreException(message, e);
        }
    }

    @Override
    public boolean exists(String bucket, String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new ObjectStoreException("Failed to query object: bucket=" + bucket + ", key=" + key, e);
        }
    }
}
