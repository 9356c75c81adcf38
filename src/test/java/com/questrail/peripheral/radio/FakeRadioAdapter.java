package com.questrail.peripheral.radio;

import com.questrail.peripheral.api.AuthorizationState;
import com.questrail.peripheral.config.SessionConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeRadioAdapter
 * -----------------------------------------------------------------------------
 * Test-only {@link RadioAdapter} that opens {@link FakeRadioSession}s and keeps
 * every one it opened, so tests can inject events into old sessions too.
 */
public final class FakeRadioAdapter implements RadioAdapter {

    private final List<FakeRadioSession> sessions = new ArrayList<>();
    private final List<SessionConfiguration> configurations = new ArrayList<>();
    private volatile AuthorizationState authorization = AuthorizationState.ALLOWED_ALWAYS;

    @Override
    public synchronized RadioSession open(SessionConfiguration configuration, RadioSessionListener listener) {
        Objects.requireNonNull(configuration, "configuration");
        FakeRadioSession session = new FakeRadioSession(listener);
        sessions.add(session);
        configurations.add(configuration);
        return session;
    }

    @Override
    public AuthorizationState authorization() {
        return authorization;
    }

    public void setAuthorization(AuthorizationState authorization) {
        this.authorization = Objects.requireNonNull(authorization, "authorization");
    }

    public synchronized FakeRadioSession session() {
        if (sessions.isEmpty()) {
            throw new IllegalStateException("No session opened");
        }
        return sessions.get(sessions.size() - 1);
    }

    public synchronized List<FakeRadioSession> sessions() {
        return Collections.unmodifiableList(new ArrayList<>(sessions));
    }

    public synchronized List<SessionConfiguration> configurations() {
        return Collections.unmodifiableList(new ArrayList<>(configurations));
    }
}
