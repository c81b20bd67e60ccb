package com.openforge.mnemosyne.summary;

import com.openforge.mnemosyne.session.DialogueFormatter;
import com.openforge.mnemosyne.session.SessionState;
import com.openforge.mnemosyne.session.SessionStateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Count-based trigger, evaluated after every assistant turn.
 *
 * The counter is reset as soon as the summary is launched, not when it
 * finishes, so the same span cannot fire twice while the run is in flight.
 * A failed run loses its span; that is logged by the pipeline and not retried.
 */
@Slf4j
@Component
public class SummaryTrigger {

    private final SessionStateService   sessions;
    private final SummarizationPipeline pipeline;
    private final SummaryProperties     props;

    public SummaryTrigger(SessionStateService sessions,
                          SummarizationPipeline pipeline,
                          SummaryProperties props) {
        this.sessions = sessions;
        this.pipeline = pipeline;
        this.props    = props;
    }

    /**
     * @return true if a summary was launched
     */
    public boolean evaluate(String sessionId, @Nullable String personaId) {
        Optional<SessionState> found = sessions.find(sessionId);
        if (found.isEmpty()) {
            log.debug("[Summary] Session {} is not tracked; no trigger check.", sessionId);
            return false;
        }
        SessionState state = found.get();
        ReentrantLock lock = state.triggerLock();
        if (!lock.tryLock()) {
            log.debug("[Summary] Trigger for session {} already running elsewhere; skipping.", sessionId);
            return false;
        }
        try {
            if (!sessions.adjustCountIfNecessary(sessionId, state.historySize())) {
                log.warn("[Summary] Counter reconciliation failed for session {}; trigger skipped.", sessionId);
                return false;
            }
            int count = sessions.getCount(sessionId);
            if (count < props.numPairs()) {
                log.debug("[Summary] Session {} at {}/{} turns.", sessionId, count, props.numPairs());
                return false;
            }

            String dialogue = DialogueFormatter.format(state.history(), props.numPairs());
            log.info("[Summary] Session {} reached {} turns; launching summary.", sessionId, count);
            pipeline.launch(sessionId, personaId, dialogue);
            sessions.resetCount(sessionId);
            sessions.updateSummaryTime(sessionId);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
