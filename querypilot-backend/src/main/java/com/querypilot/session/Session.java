package com.querypilot.session;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, ordered history of one conversation. The oldest turn is evicted first.
 */
public class Session {

    private final String id;
    private final int maxHistory;
    private final Instant createdAt;
    private final Deque<ConversationTurn> history = new ArrayDeque<>();
    private Instant lastActivity;

    public Session(String id, int maxHistory, Instant now) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.id = id;
        this.maxHistory = maxHistory;
        this.createdAt = now;
        this.lastActivity = now;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public synchronized void touch(Instant now) {
        lastActivity = now;
    }

    public synchronized void append(ConversationTurn turn, Instant now) {
        history.addLast(turn);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
        lastActivity = now;
    }

    /**
     * Snapshot of the history, oldest first.
     */
    public synchronized List<ConversationTurn> history() {
        return List.copyOf(history);
    }

    /**
     * The last {@code n} turns, oldest first.
     */
    public synchronized List<ConversationTurn> recent(int n) {
        List<ConversationTurn> all = new ArrayList<>(history);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public synchronized int size() {
        return history.size();
    }
}
