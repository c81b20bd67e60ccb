package com.openforge.mnemosyne.session;

import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.prompt.ContextMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single owner of per-session conversation state.
 *
 * History lives only in memory. Message counts and last-summary times are
 * written through to {@link MessageCounterStore}. When the durable store
 * fails the in-memory side still proceeds; write paths report the failure
 * through their boolean result.
 */
@Slf4j
@Service
public class SessionStateService {

    private final ConcurrentHashMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final MessageCounterStore counterStore;
    private final Clock clock;

    public SessionStateService(MessageCounterStore counterStore, Clock clock) {
        this.counterStore = counterStore;
        this.clock        = clock;
    }

    public boolean isReady() {
        return counterStore.isAvailable();
    }

    // ── Session lifecycle ────────────────────────────────────────────────────

    /**
     * Starts tracking a session if it is not tracked yet.
     *
     * A new session is seeded with {@code initialHistory} and picks up its
     * last summary time from the durable store, or starts the clock now.
     * For an already tracked session only the origin is refreshed.
     *
     * @return true if this call created the session
     */
    public boolean ensureSession(String sessionId,
                                 @Nullable List<ContextMessage> initialHistory,
                                 @Nullable RequestOrigin origin) {
        SessionState existing = sessions.get(sessionId);
        if (existing != null) {
            if (origin != null) existing.origin(origin);
            return false;
        }

        OptionalDouble stored = counterStore.getLastSummaryTime(sessionId);
        double lastSummary = stored.orElseGet(this::nowEpochSeconds);
        SessionState created = new SessionState(sessionId, seed(initialHistory), lastSummary, origin);

        SessionState raced = sessions.putIfAbsent(sessionId, created);
        if (raced != null) {
            if (origin != null) raced.origin(origin);
            return false;
        }
        if (stored.isEmpty()) {
            counterStore.updateLastSummaryTime(sessionId, lastSummary);
        }
        log.debug("[Session] Tracking session {} (seeded {} turns, last summary {})",
                sessionId, created.historySize(), lastSummary);
        return true;
    }

    /**
     * Appends a turn, creating the session on first sight. Counters are not
     * touched; callers increment separately.
     */
    public void addMessage(String sessionId, TurnRole role, String content, @Nullable RequestOrigin origin) {
        if (!sessions.containsKey(sessionId) && origin == null) {
            log.warn("[Session] Session {} created without a request origin; " +
                     "persona lookup for background summaries will not work", sessionId);
        }
        ensureSession(sessionId, List.of(), origin);
        sessions.get(sessionId).append(new ChatTurn(role, content, LocalDateTime.now(clock).toString()));
    }

    // ── Counters ─────────────────────────────────────────────────────────────

    public boolean incrementCount(String sessionId) {
        return counterStore.incrementCount(sessionId);
    }

    public boolean resetCount(String sessionId) {
        return counterStore.resetCount(sessionId);
    }

    public int getCount(String sessionId) {
        return counterStore.getCount(sessionId);
    }

    /**
     * Forces the stored count down to {@code historyLen} when the history is
     * shorter than the count says (it was truncated elsewhere). Never raises it.
     *
     * @return false only when the durable store failed
     */
    public boolean adjustCountIfNecessary(String sessionId, int historyLen) {
        OptionalInt stored = counterStore.readCount(sessionId);
        if (stored.isEmpty()) return false;
        if (historyLen < stored.getAsInt()) {
            log.warn("[Session] History of session {} has {} turns but counter says {}; reconciling",
                    sessionId, historyLen, stored.getAsInt());
            return counterStore.setCount(sessionId, historyLen);
        }
        return true;
    }

    public boolean updateSummaryTime(String sessionId) {
        double now = nowEpochSeconds();
        SessionState state = sessions.get(sessionId);
        if (state != null) state.lastSummaryTime(now);
        return counterStore.updateLastSummaryTime(sessionId, now);
    }

    // ── Read accessors ───────────────────────────────────────────────────────

    public List<ChatTurn> getHistory(String sessionId) {
        SessionState state = sessions.get(sessionId);
        return state == null ? List.of() : state.history();
    }

    public Optional<SessionSnapshot> getFullContext(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(SessionState::snapshot);
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Set<String> trackedSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    public double nowEpochSeconds() {
        return clock.millis() / 1000.0;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<ChatTurn> seed(@Nullable List<ContextMessage> initialHistory) {
        if (initialHistory == null || initialHistory.isEmpty()) return List.of();
        String now = LocalDateTime.now(clock).toString();
        List<ChatTurn> turns = new ArrayList<>(initialHistory.size());
        for (ContextMessage msg : initialHistory) {
            if (msg == null) continue;
            Optional<TurnRole> role = TurnRole.fromWire(msg.role());
            if (role.isEmpty()) {
                log.debug("[Session] Skipping seed message with role {}", msg.role());
                continue;
            }
            turns.add(new ChatTurn(role.get(), String.valueOf(msg.content()), now));
        }
        return turns;
    }
}
