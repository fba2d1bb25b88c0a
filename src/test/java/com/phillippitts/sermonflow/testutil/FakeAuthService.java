package com.phillippitts.sermonflow.testutil;

import com.phillippitts.sermonflow.service.auth.AuthService;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Auth double with a settable user. {@code null} means signed out.
 */
public class FakeAuthService implements AuthService {

    private volatile UUID userId;
    private final AtomicInteger refreshCount = new AtomicInteger();

    public FakeAuthService(UUID userId) {
        this.userId = userId;
    }

    public static FakeAuthService signedIn() {
        return new FakeAuthService(UUID.randomUUID());
    }

    public static FakeAuthService signedOut() {
        return new FakeAuthService(null);
    }

    @Override
    public Optional<UUID> currentUserId() {
        return Optional.ofNullable(userId);
    }

    @Override
    public void refreshSession() {
        refreshCount.incrementAndGet();
    }

    public int refreshCount() {
        return refreshCount.get();
    }
}
