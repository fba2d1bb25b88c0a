package com.phillippitts.sermonflow.service.auth;

import java.util.Optional;
import java.util.UUID;

/**
 * Identity of the signed-in user.
 */
public interface AuthService {

    Optional<UUID> currentUserId();

    /**
     * Refreshes the session before a recording or import. Best effort: failures are logged by callers
     * and otherwise ignored.
     */
    void refreshSession();
}
