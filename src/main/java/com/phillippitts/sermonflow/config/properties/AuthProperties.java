package com.phillippitts.sermonflow.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.Optional;
import java.util.UUID;

/**
 * Signed-in user for this installation. No user id means recording and import are refused.
 */
@ConfigurationProperties(prefix = "sermon.auth")
public class AuthProperties {

    private final UUID userId;

    @ConstructorBinding
    public AuthProperties(UUID userId) {
        this.userId = userId;
    }

    public Optional<UUID> getUserId() {
        return Optional.ofNullable(userId);
    }
}
