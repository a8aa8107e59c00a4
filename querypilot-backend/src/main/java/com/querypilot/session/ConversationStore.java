package com.querypilot.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-session conversation history with idle expiry.
 */
@Slf4j
public class ConversationStore implements AutoCloseable {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final int maxHistory;
    private final Duration idleTimeout;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public ConversationStore(int maxHistory, Duration idleTimeout, Duration cleanupInterval, Clock clock) {
        this.maxHistory = maxHistory;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });
        long period = Math.max(cleanupInterval.toMillis(), 1);
        scheduler.scheduleAtFixedRate(this::cleanupExpiredSessions, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Existing live session, or a fresh one under the same id.
     */
    public Session getOrCreate(String sessionId) {
        Instant now = clock.instant();
        return sessions.compute(sessionId, (id, existing) -> {
            if (existing == null || isExpired(existing, now)) {
                return new Session(id, maxHistory, now);
            }
            existing.touch(now);
            return existing;
        });
    }

    public Optional<Session> find(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session, clock.instant())) {
            sessions.remove(sessionId, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * History for display, oldest first; empty for unknown or expired sessions.
     */
    public List<ConversationTurn> history(String sessionId) {
        return find(sessionId).map(Session::history).orElse(List.of());
    }

    public boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public int activeSessions() {
        return sessions.size();
    }

    void cleanupExpiredSessions() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.info("Expired idle sessions (removed={}, remaining={})", removed, sessions.size());
        }
    }

    private boolean isExpired(Session session, Instant now) {
        return session.getLastActivity().plus(idleTimeout).isBefore(now);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
