package com.openforge.mnemosyne.summary;

import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.session.DialogueFormatter;
import com.openforge.mnemosyne.session.SessionState;
import com.openforge.mnemosyne.session.SessionStateService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-based trigger: summarizes sessions that went quiet before reaching
 * the count threshold.
 *
 * Runs on one daemon thread that sleeps {@code check-interval-seconds}
 * between sweeps. Interrupting the thread is the cancellation signal; it is
 * honoured at the sleep points.
 */
@Slf4j
@Component
public class SummaryScheduler {

    static final long STOP_GRACE_MILLIS    = 5_000L;
    static final long ERROR_BACKOFF_MILLIS = 5_000L;

    private final SessionStateService   sessions;
    private final SummarizationPipeline pipeline;
    private final PersonaResolver       personas;
    private final SummaryProperties     props;

    private volatile Thread worker;

    public SummaryScheduler(SessionStateService sessions,
                            SummarizationPipeline pipeline,
                            PersonaResolver personas,
                            SummaryProperties props) {
        this.sessions = sessions;
        this.pipeline = pipeline;
        this.props    = props;
        this.personas = personas;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (worker != null && worker.isAlive()) return;
        Thread t = new Thread(this::runLoop, "mnemosyne-summary-scheduler");
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("[Scheduler] Started (interval={}s, threshold={}s).",
                props.checkIntervalSeconds(),
                props.timeTriggerEnabled() ? props.timeThresholdSeconds() : "disabled");
    }

    @PreDestroy
    public synchronized void stop() {
        Thread t = worker;
        worker = null;
        if (t == null) return;
        t.interrupt();
        try {
            t.join(STOP_GRACE_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("[Scheduler] Did not stop within {} ms.", STOP_GRACE_MILLIS);
        } else {
            log.info("[Scheduler] Stopped.");
        }
    }

    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    private void runLoop() {
        long intervalMillis = Math.max(1L, props.checkIntervalSeconds()) * 1000L;
        while (!Thread.currentThread().isInterrupted()) {
            if (!sleep(intervalMillis)) break;
            try {
                sweepOnce();
            } catch (RuntimeException e) {
                log.error("[Scheduler] Sweep failed; backing off {} ms.", ERROR_BACKOFF_MILLIS, e);
                if (!sleep(ERROR_BACKOFF_MILLIS)) break;
            }
        }
        log.debug("[Scheduler] Loop exited.");
    }

    /** @return false when interrupted */
    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * One pass over every tracked session.
     *
     * @return number of summaries launched
     */
    public int sweepOnce() {
        if (!props.timeTriggerEnabled()) return 0;
        if (!sessions.isReady()) {
            log.debug("[Scheduler] Counter store not ready; sweep skipped.");
            return 0;
        }
        int launched = 0;
        for (String sessionId : sessions.trackedSessionIds()) {
            try {
                if (sweepSession(sessionId)) launched++;
            } catch (RuntimeException e) {
                log.error("[Scheduler] Failed to check session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        if (launched > 0) log.info("[Scheduler] Sweep launched {} summaries.", launched);
        return launched;
    }

    private boolean sweepSession(String sessionId) {
        Optional<SessionState> found = sessions.find(sessionId);
        if (found.isEmpty()) return false;
        SessionState state = found.get();

        ReentrantLock lock = state.triggerLock();
        if (!lock.tryLock()) return false;
        try {
            int count = sessions.getCount(sessionId);
            double elapsed = sessions.nowEpochSeconds() - state.lastSummaryTime();
            if (count <= 0 || elapsed <= props.timeThresholdSeconds()) return false;

            String dialogue = DialogueFormatter.format(state.history(), count);
            RequestOrigin origin = state.origin();
            if (origin == null) {
                log.warn("[Scheduler] Session {} has no request origin; storing summary without persona.", sessionId);
            }
            String personaId = personas.resolve(origin).orElse(null);

            log.info("[Scheduler] Session {} idle {}s with {} pending turns; launching summary.",
                    sessionId, (long) elapsed, count);
            pipeline.launch(sessionId, personaId, dialogue);
            sessions.resetCount(sessionId);
            sessions.updateSummaryTime(sessionId);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
