package com.openforge.mnemosyne.conversation;

import com.openforge.mnemosyne.MutableClock;
import com.openforge.mnemosyne.host.HostSessionResolver;
import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.llm.LlmCompletion;
import com.openforge.mnemosyne.prompt.PromptRequest;
import com.openforge.mnemosyne.retrieval.RetrievalPipeline;
import com.openforge.mnemosyne.session.MessageCounterStore;
import com.openforge.mnemosyne.session.SessionStateService;
import com.openforge.mnemosyne.session.TurnRole;
import com.openforge.mnemosyne.summary.SummaryTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConversationMemoryServiceTest {

    private static final RequestOrigin ORIGIN = RequestOrigin.of("discord:dm:42");

    @TempDir
    Path tempDir;

    private MessageCounterStore store;
    private SessionStateService sessions;
    private RetrievalPipeline retrieval;
    private SummaryTrigger trigger;
    private HostSessionResolver host;
    private ConversationMemoryService service;

    @BeforeEach
    void setUp() {
        store = new MessageCounterStore(tempDir.resolve("counters.db").toString());
        store.init();
        sessions = new SessionStateService(store, new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));
        retrieval = mock(RetrievalPipeline.class);
        trigger = mock(SummaryTrigger.class);
        host = mock(HostSessionResolver.class);
        when(host.currentSessionId(ORIGIN)).thenReturn(Optional.of("s1"));
        when(host.personaId(ORIGIN)).thenReturn(Optional.of("tutor"));
        service = new ConversationMemoryService(retrieval, trigger, sessions, new PersonaResolver(host));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldRecordAssistantTurnAndEvaluateTrigger() {
        when(trigger.evaluate("s1", "tutor")).thenReturn(true);

        assertTrue(service.afterLlmResponse(ORIGIN, new LlmCompletion("Sure thing.", LlmCompletion.ROLE_ASSISTANT)));

        var history = sessions.getHistory("s1");
        assertEquals(1, history.size());
        assertEquals(TurnRole.ASSISTANT, history.get(0).role());
        assertEquals("Sure thing.", history.get(0).content());
        assertEquals(1, sessions.getCount("s1"));
        verify(trigger).evaluate("s1", "tutor");
    }

    @Test
    void shouldIgnoreNonAssistantCompletions() {
        assertFalse(service.afterLlmResponse(ORIGIN, new LlmCompletion("tool output", "tool")));
        assertFalse(service.afterLlmResponse(ORIGIN, null));

        assertTrue(sessions.trackedSessionIds().isEmpty());
        verifyNoInteractions(trigger);
    }

    @Test
    void shouldSkipResponseWithoutSession() {
        var stranger = RequestOrigin.of("stranger");
        when(host.currentSessionId(stranger)).thenReturn(Optional.empty());

        assertFalse(service.afterLlmResponse(stranger, new LlmCompletion("hi", LlmCompletion.ROLE_ASSISTANT)));

        verifyNoInteractions(trigger);
    }

    @Test
    void shouldSkipResponseWhenCounterStoreIsDown() {
        store.close();

        assertFalse(service.afterLlmResponse(ORIGIN, new LlmCompletion("hi", LlmCompletion.ROLE_ASSISTANT)));

        assertTrue(sessions.getHistory("s1").isEmpty());
    }

    @Test
    void shouldSwallowTriggerFailure() {
        when(trigger.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertFalse(service.afterLlmResponse(ORIGIN, new LlmCompletion("hi", LlmCompletion.ROLE_ASSISTANT)));
    }

    @Test
    void shouldDelegateRequestsToRetrieval() {
        var request = PromptRequest.of("hello");
        when(retrieval.retrieve(ORIGIN, request)).thenReturn(2);

        assertEquals(2, service.beforeLlmRequest(ORIGIN, request));
        assertEquals(0, service.beforeLlmRequest(ORIGIN, null));
    }

    @Test
    void shouldForwardRequestWhenRetrievalThrows() {
        var request = PromptRequest.of("hello");
        when(retrieval.retrieve(ORIGIN, request)).thenThrow(new IllegalStateException("boom"));

        assertEquals(0, service.beforeLlmRequest(ORIGIN, request));
        assertEquals("hello", request.getPrompt());
    }
}
