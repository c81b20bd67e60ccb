package com.openforge.mnemosyne.summary;

import com.openforge.mnemosyne.MutableClock;
import com.openforge.mnemosyne.TestProperties;
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
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SummaryTriggerTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MessageCounterStore store;
    private MutableClock clock;
    private SessionStateService sessions;
    private SummarizationPipeline pipeline;
    private SummaryTrigger trigger;

    @BeforeEach
    void setUp() {
        store = new MessageCounterStore(tempDir.resolve("counters.db").toString());
        store.init();
        clock = new MutableClock(START);
        sessions = new SessionStateService(store, clock);
        pipeline = mock(SummarizationPipeline.class);
        // never completes: the trigger must not wait on it
        when(pipeline.launch(any(), any(), any())).thenReturn(new CompletableFuture<>());
        trigger = new SummaryTrigger(sessions, pipeline, TestProperties.summary(10, 1800));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    /** Records {@code turns} alternating user/assistant turns and returns their formatted text. */
    private String talk(String sessionId, int turns) {
        StringJoiner formatted = new StringJoiner("\n");
        for (int i = 0; i < turns; i++) {
            TurnRole role = i % 2 == 0 ? TurnRole.USER : TurnRole.ASSISTANT;
            String content = "turn " + i;
            sessions.addMessage(sessionId, role, content, RequestOrigin.of("origin-" + sessionId));
            sessions.incrementCount(sessionId);
            formatted.add(role.wireName() + ": " + content);
        }
        return formatted.toString();
    }

    @Test
    void shouldNotTriggerBelowThreshold() {
        talk("s1", 9);

        assertFalse(trigger.evaluate("s1", "tutor"));

        assertEquals(9, sessions.getCount("s1"));
        verify(pipeline, never()).launch(any(), any(), any());
    }

    @Test
    void shouldLaunchAndResetImmediatelyAtThreshold() {
        String expected = talk("s1", 10);
        clock.advance(Duration.ofSeconds(42));

        assertTrue(trigger.evaluate("s1", "tutor"));

        verify(pipeline).launch("s1", "tutor", expected);
        assertEquals(0, sessions.getCount("s1"));
        assertEquals(START.getEpochSecond() + 42, sessions.find("s1").orElseThrow().lastSummaryTime(), 1e-6);
    }

    @Test
    void shouldSummarizeOnlyTheLastWindowOfTurns() {
        talk("s1", 4);
        sessions.resetCount("s1");
        String window = talk("s1", 10);

        assertTrue(trigger.evaluate("s1", null));

        verify(pipeline).launch(eq("s1"), isNull(), eq(window));
    }

    @Test
    void shouldLaunchExactlyOnceForRepeatedEvaluation() {
        talk("s1", 10);

        assertTrue(trigger.evaluate("s1", null));
        assertFalse(trigger.evaluate("s1", null));

        verify(pipeline, times(1)).launch(any(), any(), any());
    }

    @Test
    void shouldSkipWhileAnotherTriggerHoldsTheSession() throws Exception {
        talk("s1", 10);
        var lock = sessions.find("s1").orElseThrow().triggerLock();
        var locked = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            lock.lock();
            try {
                locked.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
        });
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        try {
            assertFalse(trigger.evaluate("s1", null));
            assertEquals(10, sessions.getCount("s1"));
        } finally {
            release.countDown();
            holder.join(5_000);
        }

        assertTrue(trigger.evaluate("s1", null));
    }

    @Test
    void shouldReconcileCountBeforeComparing() {
        talk("s1", 3);
        store.setCount("s1", 12);

        assertFalse(trigger.evaluate("s1", null));

        assertEquals(3, sessions.getCount("s1"));
        verify(pipeline, never()).launch(any(), any(), any());
    }

    @Test
    void shouldIgnoreUntrackedSession() {
        assertFalse(trigger.evaluate("ghost", null));
        verifyNoInteractions(pipeline);
    }
}
