package com.phillippitts.sermonflow.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Remote chunk storage. {@code type=filesystem} (default) writes under {@code root}; {@code type=s3}
 * talks to Amazon S3 or an S3-compatible endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "sermon.object-store")
public class ObjectStoreProperties {

    public enum Type { FILESYSTEM, S3 }

    private final Type type;
    @NotBlank
    private final String bucket;
    private final Path root;
    private final String endpoint;
    private final String region;
    private final String accessKey;
    private final String secretKey;
    private final boolean pathStyleAccess;

    @ConstructorBinding
    public ObjectStoreProperties(Type type, String bucket, Path root, String endpoint, String region,
                                 String accessKey, String secretKey, Boolean pathStyleAccess) {
        this.type = type == null ? Type.FILESYSTEM : type;
        this.bucket = (bucket == null || bucket.isBlank()) ? "sermon-audio" : bucket;
        this.root = root == null ? Path.of(System.getProperty("user.home"), ".sermon-flow", "remote") : root;
        this.endpoint = blankToNull(endpoint);
        this.region = (region == null || region.isBlank()) ? "us-east-1" : region;
        this.accessKey = blankToNull(accessKey);
        this.secretKey = blankToNull(secretKey);
        this.pathStyleAccess = pathStyleAccess != null && pathStyleAccess;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public Type getType() { return type; }
    public String getBucket() { return bucket; }
    public Path getRoot() { return root; }
    public String getEndpoint() { return endpoint; }
    public String getRegion() { return region; }
    public String getAccessKey() { return accessKey; }
    public String getSecretKey() { return secretKey; }
    public boolean isPathStyleAccess() { return pathStyleAccess; }
}
