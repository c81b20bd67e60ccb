package com.openforge.mnemosyne.summary;

import com.openforge.mnemosyne.MutableClock;
import com.openforge.mnemosyne.TestProperties;
import com.openforge.mnemosyne.host.HostSessionResolver;
import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.session.MessageCounterStore;
import com.openforge.mnemosyne.session.SessionStateService;
import com.openforge.mnemosyne.session.TurnRole;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SummarySchedulerTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MessageCounterStore store;
    private MutableClock clock;
    private SessionStateService sessions;
    private SummarizationPipeline pipeline;
    private HostSessionResolver host;
    private SummaryScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new MessageCounterStore(tempDir.resolve("counters.db").toString());
        store.init();
        clock = new MutableClock(START);
        sessions = new SessionStateService(store, clock);
        pipeline = mock(SummarizationPipeline.class);
        when(pipeline.launch(any(), any(), any())).thenReturn(new CompletableFuture<>());
        host = mock(HostSessionResolver.class);
        when(host.personaId(any())).thenReturn(Optional.of("tutor"));
        when(host.defaultPersona()).thenReturn(Optional.empty());
        scheduler = scheduler(1800);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        store.close();
    }

    private SummaryScheduler scheduler(long thresholdSeconds) {
        return new SummaryScheduler(sessions, pipeline, new PersonaResolver(host),
                TestProperties.summary(10, thresholdSeconds));
    }

    private void turn(String sessionId, TurnRole role, String content) {
        sessions.addMessage(sessionId, role, content, RequestOrigin.of("origin-" + sessionId));
        sessions.incrementCount(sessionId);
    }

    @Test
    void shouldSummarizeIdleSessionWithAllPendingTurns() {
        turn("s1", TurnRole.USER, "I adopted a cat");
        turn("s1", TurnRole.ASSISTANT, "What is its name?");
        clock.advance(Duration.ofSeconds(1801));

        assertEquals(1, scheduler.sweepOnce());

        verify(pipeline).launch("s1", "tutor", "user: I adopted a cat\nassistant: What is its name?");
        assertEquals(0, sessions.getCount("s1"));
        assertEquals(START.getEpochSecond() + 1801, sessions.find("s1").orElseThrow().lastSummaryTime(), 1e-6);
        assertEquals(START.getEpochSecond() + 1801, store.getLastSummaryTime("s1").getAsDouble(), 1e-6);
    }

    @Test
    void shouldOnlyTakeUnsummarizedTurns() {
        turn("s1", TurnRole.USER, "old question");
        turn("s1", TurnRole.ASSISTANT, "old answer");
        sessions.resetCount("s1");
        turn("s1", TurnRole.USER, "new question");
        clock.advance(Duration.ofSeconds(2000));

        scheduler.sweepOnce();

        verify(pipeline).launch("s1", "tutor", "user: new question");
    }

    @Test
    void shouldWaitUntilThresholdIsExceeded() {
        turn("s1", TurnRole.USER, "hello");
        clock.advance(Duration.ofSeconds(1800));

        assertEquals(0, scheduler.sweepOnce());

        verify(pipeline, never()).launch(any(), any(), any());
        assertEquals(1, sessions.getCount("s1"));
    }

    @Test
    void shouldIgnoreSessionsWithoutPendingTurns() {
        sessions.ensureSession("quiet", null, RequestOrigin.of("q"));
        clock.advance(Duration.ofHours(5));

        assertEquals(0, scheduler.sweepOnce());
    }

    @Test
    void shouldDoNothingWhenTimeTriggerDisabled() {
        turn("s1", TurnRole.USER, "hello");
        clock.advance(Duration.ofDays(1));

        assertEquals(0, scheduler(0).sweepOnce());
        verifyNoInteractions(pipeline);
    }

    @Test
    void shouldSkipSweepWhenCounterStoreIsDown() {
        turn("s1", TurnRole.USER, "hello");
        clock.advance(Duration.ofDays(1));
        store.close();

        assertEquals(0, scheduler.sweepOnce());
    }

    @Test
    void shouldIsolateFailingSession() {
        turn("bad", TurnRole.USER, "x");
        turn("good", TurnRole.USER, "y");
        clock.advance(Duration.ofSeconds(3600));
        when(pipeline.launch(eq("bad"), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertEquals(1, scheduler.sweepOnce());

        verify(pipeline).launch("good", "tutor", "user: y");
        assertEquals(0, sessions.getCount("good"));
        assertEquals(1, sessions.getCount("bad"));
    }

    @Test
    void shouldStoreWithoutPersonaWhenOriginMissing() {
        sessions.addMessage("anon", TurnRole.USER, "hi", null);
        sessions.incrementCount("anon");
        when(host.defaultPersona()).thenReturn(Optional.empty());
        clock.advance(Duration.ofSeconds(3600));

        assertEquals(1, scheduler.sweepOnce());

        verify(pipeline).launch("anon", null, "user: hi");
    }

    @Test
    void shouldStartAndStopBackgroundThread() {
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
