package com.openforge.mnemosyne.conversation;

import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.llm.LlmCompletion;
import com.openforge.mnemosyne.prompt.PromptRequest;
import com.openforge.mnemosyne.retrieval.RetrievalPipeline;
import com.openforge.mnemosyne.session.SessionStateService;
import com.openforge.mnemosyne.session.TurnRole;
import com.openforge.mnemosyne.summary.SummaryTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Host-facing entry point. The host calls {@link #beforeLlmRequest} just
 * before forwarding a request to its model and {@link #afterLlmResponse}
 * once the reply arrives. Neither hook throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationMemoryService {

    private final RetrievalPipeline   retrievalPipeline;
    private final SummaryTrigger      summaryTrigger;
    private final SessionStateService sessions;
    private final PersonaResolver     personas;

    /**
     * Records the user turn and injects relevant memories into {@code request}.
     *
     * @return number of memories injected
     */
    public int beforeLlmRequest(RequestOrigin origin, PromptRequest request) {
        if (request == null) return 0;
        try {
            return retrievalPipeline.retrieve(origin, request);
        } catch (RuntimeException e) {
            log.error("[Retrieval] Unexpected failure; request forwarded without memories.", e);
            return 0;
        }
    }

    /**
     * Records the assistant turn and checks the count-based trigger.
     *
     * @return true if a summary was launched
     */
    public boolean afterLlmResponse(RequestOrigin origin, LlmCompletion completion) {
        if (completion == null || !completion.isAssistant()) {
            log.debug("[Session] Ignoring non-assistant completion.");
            return false;
        }
        if (!sessions.isReady()) {
            log.debug("[Session] Counter store not ready; assistant turn not recorded.");
            return false;
        }
        Optional<String> sessionId = personas.sessionId(origin);
        if (sessionId.isEmpty()) {
            log.debug("[Session] No session for origin; assistant turn not recorded.");
            return false;
        }
        try {
            String id = sessionId.get();
            String text = completion.completionText() == null ? "" : completion.completionText();
            sessions.addMessage(id, TurnRole.ASSISTANT, text, origin);
            sessions.incrementCount(id);
            return summaryTrigger.evaluate(id, personas.resolve(origin).orElse(null));
        } catch (RuntimeException e) {
            log.error("[Summary] Unexpected failure handling response for session {}.", sessionId.get(), e);
            return false;
        }
    }
}
