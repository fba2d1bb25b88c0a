package com.phillippitts.sermonflow.service.auth;

import com.phillippitts.sermonflow.config.properties.AuthProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Single-user installation: the user id comes from {@code sermon.auth.user-id}.
 */
@Service
public class ConfiguredUserAuthService implements AuthService {

    private static final Logger LOG = LogManager.getLogger(ConfiguredUserAuthService.class);

    private final AuthProperties props;

    public ConfiguredUserAuthService(AuthProperties props) {
        this.props = props;
        if (props.getUserId().isEmpty()) {
            LOG.warn("sermon.auth.user-id is not set; recording and import will be refused");
        }
    }

    @Override
    public Optional<UUID> currentUserId() {
        return props.getUserId();
    }

    @Override
    public void refreshSession() {
        // Configured identity never expires
        LOG.debug("Session refresh requested for {}", props.getUserId().map(UUID::toString).orElse("<none>"));
    }
}
