package com.openforge.mnemosyne.session;

import com.openforge.mnemosyne.host.RequestOrigin;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one tracked session.
 *
 * History only grows; summarization marks progress through the durable
 * counter instead of truncating it. {@link #triggerLock()} guards the
 * check-launch-reset sequence shared by the count and time triggers.
 */
public final class SessionState {

    private final String sessionId;
    private final List<ChatTurn> history = new ArrayList<>();
    private final ReentrantLock triggerLock = new ReentrantLock();

    private volatile double lastSummaryTime;
    @Nullable
    private volatile RequestOrigin origin;

    SessionState(String sessionId, List<ChatTurn> seed, double lastSummaryTime, @Nullable RequestOrigin origin) {
        this.sessionId       = sessionId;
        this.lastSummaryTime = lastSummaryTime;
        this.origin          = origin;
        this.history.addAll(seed);
    }

    public String sessionId() {
        return sessionId;
    }

    synchronized void append(ChatTurn turn) {
        history.add(turn);
    }

    public synchronized List<ChatTurn> history() {
        return List.copyOf(history);
    }

    public synchronized int historySize() {
        return history.size();
    }

    public double lastSummaryTime() {
        return lastSummaryTime;
    }

    void lastSummaryTime(double epochSeconds) {
        this.lastSummaryTime = epochSeconds;
    }

    @Nullable
    public RequestOrigin origin() {
        return origin;
    }

    void origin(RequestOrigin origin) {
        this.origin = origin;
    }

    public ReentrantLock triggerLock() {
        return triggerLock;
    }

    SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, history(), lastSummaryTime, origin);
    }
}
