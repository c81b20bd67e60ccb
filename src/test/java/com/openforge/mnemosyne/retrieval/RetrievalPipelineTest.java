package com.openforge.mnemosyne.retrieval;

import com.openforge.mnemosyne.MutableClock;
import com.openforge.mnemosyne.TestProperties;
import com.openforge.mnemosyne.config.AppConfig;
import com.openforge.mnemosyne.embedding.EmbeddingProvider;
import com.openforge.mnemosyne.host.HostSessionResolver;
import com.openforge.mnemosyne.host.PersonaResolver;
import com.openforge.mnemosyne.host.RequestOrigin;
import com.openforge.mnemosyne.llm.LlmProvider;
import com.openforge.mnemosyne.prompt.ContextMessage;
import com.openforge.mnemosyne.prompt.MemoryMarker;
import com.openforge.mnemosyne.prompt.PromptRequest;
import com.openforge.mnemosyne.session.MessageCounterStore;
import com.openforge.mnemosyne.session.SessionStateService;
import com.openforge.mnemosyne.session.TurnRole;
import com.openforge.mnemosyne.summary.SummarizationPipeline;
import com.openforge.mnemosyne.vector.MemorySchema;
import com.openforge.mnemosyne.vector.SearchHit;
import com.openforge.mnemosyne.vector.VectorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RetrievalPipelineTest {

    private static final RequestOrigin ORIGIN = RequestOrigin.of("tg:private:1");
    private static final List<Float> QUERY_VECTOR = List.of(0.5f, 0.5f);
    private static final MemoryMarker MARKER = MemoryMarker.defaults();

    @TempDir
    Path tempDir;

    private MessageCounterStore store;
    private SessionStateService sessions;
    private VectorStore vectorStore;
    private EmbeddingProvider embedding;
    private HostSessionResolver host;

    @BeforeEach
    void setUp() {
        store = new MessageCounterStore(tempDir.resolve("counters.db").toString());
        store.init();
        sessions = new SessionStateService(store, new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));
        vectorStore = mock(VectorStore.class);
        embedding = mock(EmbeddingProvider.class);
        host = mock(HostSessionResolver.class);

        when(vectorStore.isConnected()).thenReturn(true);
        when(embedding.isAvailable()).thenReturn(true);
        when(embedding.getEmbeddings(any())).thenReturn(List.of(QUERY_VECTOR));
        when(host.currentSessionId(ORIGIN)).thenReturn(Optional.of("s1"));
        when(host.personaId(any())).thenReturn(Optional.empty());
        when(host.defaultPersona()).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private RetrievalPipeline pipeline(RetrievalProperties props) {
        return new RetrievalPipeline(vectorStore, embedding, sessions, new PersonaResolver(host), props,
                TestProperties.vector(false), TestProperties.summary(),
                new MutableClock(Instant.EPOCH), Runnable::run);
    }

    private static SearchHit hit(long id, String content, long createTime) {
        Map<String, Object> entity = new HashMap<>();
        entity.put(MemorySchema.PRIMARY_FIELD, id);
        entity.put(MemorySchema.CONTENT_FIELD, content);
        entity.put(MemorySchema.CREATE_TIME_FIELD, createTime);
        entity.put(MemorySchema.SESSION_FIELD, "s1");
        entity.put(MemorySchema.PERSONALITY_FIELD, "default_persona");
        return new SearchHit(id, 0.1f, entity);
    }

    private void searchReturns(List<SearchHit> hits) {
        when(vectorStore.search(anyString(), anyList(), anyString(), any(), anyInt(), anyString(), anyList()))
                .thenReturn(Optional.of(List.of(hits)));
    }

    @Test
    void shouldInjectThreeMemoriesIntoUserPromptOnce() {
        searchReturns(List.of(
                hit(1, "likes green tea", 1_700_000_000L),
                hit(2, "lives in Lisbon", 1_700_003_600L),
                hit(3, "has a cat named Miso", 0L)));
        var request = new PromptRequest("what should I drink?", "sys", List.of());

        assertEquals(3, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request));

        String expectedBlock = MemoryMarker.DEFAULT_PREFIX + "\n"
                + "- [2023-11-14 22:13] likes green tea\n"
                + "- [2023-11-14 23:13] lives in Lisbon\n"
                + "- [unknown time] has a cat named Miso\n"
                + MemoryMarker.DEFAULT_SUFFIX;
        assertEquals(expectedBlock + "\nwhat should I drink?", request.getPrompt());
        assertEquals(1, MARKER.count(request.getPrompt()));
        assertEquals("sys", request.getSystemPrompt());
    }

    @Test
    void shouldRecordUserTurnAndCountIt() {
        searchReturns(List.of());
        var request = new PromptRequest("hello there", null, List.of(ContextMessage.user("earlier")));

        pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request);

        var history = sessions.getHistory("s1");
        assertEquals(2, history.size());
        assertEquals(TurnRole.USER, history.get(1).role());
        assertEquals("hello there", history.get(1).content());
        assertEquals(1, sessions.getCount("s1"));
        assertEquals("hello there", request.getPrompt());
    }

    @Test
    void shouldCountBlankPromptWithoutSearching() {
        var request = PromptRequest.of("   ");

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request));

        assertEquals(1, sessions.getCount("s1"));
        var history = sessions.getHistory("s1");
        assertEquals(1, history.size());
        assertEquals(TurnRole.USER, history.get(0).role());
        verify(embedding, never()).getEmbeddings(any());
        verify(vectorStore, never()).search(anyString(), anyList(), anyString(), any(), anyInt(), anyString(), anyList());
    }

    @Test
    void shouldSearchOnlyTheCurrentSession() {
        searchReturns(List.of());

        pipeline(TestProperties.retrieval()).retrieve(ORIGIN, PromptRequest.of("q"));

        verify(vectorStore).search(eq(TestProperties.COLLECTION), eq(List.of(QUERY_VECTOR)),
                eq(MemorySchema.VECTOR_FIELD), any(), eq(5), eq("session_id == \"s1\""),
                eq(MemorySchema.DEFAULT_OUTPUT_FIELDS));
    }

    @Test
    void shouldAddPersonaFilterWhenEnabled() {
        searchReturns(List.of());
        when(host.personaId(ORIGIN)).thenReturn(Optional.of("tutor"));

        pipeline(TestProperties.retrieval("user_prompt", true, 0, 10)).retrieve(ORIGIN, PromptRequest.of("q"));

        verify(vectorStore).search(any(), any(), any(), any(), anyInt(),
                eq("session_id == \"s1\" and personality_id == \"tutor\""), any());
    }

    @Test
    void shouldFallBackToPlaceholderPersonaWhenFilteringWithoutPersona() {
        searchReturns(List.of());
        when(host.personaId(ORIGIN)).thenReturn(Optional.of("[%None]"));

        pipeline(TestProperties.retrieval("user_prompt", true, 0, 10)).retrieve(ORIGIN, PromptRequest.of("q"));

        verify(vectorStore).search(any(), any(), any(), any(), anyInt(),
                eq("session_id == \"s1\" and personality_id == \"default_persona\""), any());
    }

    @Test
    void shouldAbortWithoutSearchWhenEmbeddingIsEmpty() {
        when(embedding.getEmbeddings(any())).thenReturn(List.of(List.of()));
        var request = PromptRequest.of("anything");

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request));

        verify(vectorStore, never()).search(any(), any(), any(), any(), anyInt(), any(), any());
        assertEquals("anything", request.getPrompt());
    }

    @Test
    void shouldAbortWithoutSearchWhenEmbeddingThrows() {
        when(embedding.getEmbeddings(any())).thenThrow(new EmbeddingProvider.EmbeddingException("429"));

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, PromptRequest.of("q")));

        verify(vectorStore, never()).search(any(), any(), any(), any(), anyInt(), any(), any());
    }

    @Test
    void shouldSkipSilentlyWhenBackendsAreNotReady() {
        when(vectorStore.isConnected()).thenReturn(false);

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, PromptRequest.of("q")));

        assertTrue(sessions.trackedSessionIds().isEmpty());
        verifyNoInteractions(embedding);
    }

    @Test
    void shouldStripEarlierBlocksBeforeInjecting() {
        searchReturns(List.of(hit(1, "fresh", 1_700_000_000L)));
        var old = ContextMessage.user(MARKER.encode("- [x] stale") + "\nold question");
        var request = new PromptRequest("new question", null, List.of(old, ContextMessage.assistant("ok")));

        pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request);

        assertEquals("\nold question", request.getContexts().get(0).content());
        assertEquals(1, MARKER.count(request.getPrompt()));
        assertTrue(request.getPrompt().contains("fresh"));
    }

    @Test
    void shouldAppendToSystemPrompt() {
        searchReturns(List.of(hit(1, "fact", 1_700_000_000L)));
        var request = new PromptRequest("q", "You are kind.", List.of());

        pipeline(TestProperties.retrieval("system_prompt", false, 0, 10)).retrieve(ORIGIN, request);

        assertTrue(request.getSystemPrompt().startsWith("You are kind.\n" + MemoryMarker.DEFAULT_PREFIX));
        assertEquals("q", request.getPrompt());
    }

    @Test
    void shouldInsertSystemMessage() {
        searchReturns(List.of(hit(1, "fact", 1_700_000_000L)));
        var request = new PromptRequest("q", null, List.of(ContextMessage.user("hi")));

        pipeline(TestProperties.retrieval("insert_system_prompt", false, 0, 10)).retrieve(ORIGIN, request);

        var last = request.getContexts().get(request.getContexts().size() - 1);
        assertEquals(ContextMessage.ROLE_SYSTEM, last.role());
        assertTrue(MARKER.contains((String) last.content()));
    }

    @Test
    void shouldSkipMalformedHits() {
        Map<String, Object> noContent = new HashMap<>();
        noContent.put(MemorySchema.CREATE_TIME_FIELD, 1L);
        List<SearchHit> hits = new ArrayList<>();
        hits.add(new SearchHit(9L, 0f, null));
        hits.add(new SearchHit(10L, 0f, noContent));
        hits.add(hit(11, "valid", 1_700_000_000L));
        searchReturns(hits);

        assertEquals(1, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, PromptRequest.of("q")));
    }

    @Test
    void shouldAbortWhenSearchFails() {
        when(vectorStore.search(anyString(), anyList(), anyString(), any(), anyInt(), anyString(), anyList()))
                .thenReturn(Optional.empty());
        var request = PromptRequest.of("q");

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(ORIGIN, request));
        assertEquals("q", request.getPrompt());
    }

    @Test
    void shouldAbortWhenSearchTimesOut() throws Exception {
        var release = new CountDownLatch(1);
        when(vectorStore.search(anyString(), anyList(), anyString(), any(), anyInt(), anyString(), anyList()))
                .thenAnswer(inv -> {
                    release.await(10, TimeUnit.SECONDS);
                    return Optional.of(List.of(List.of(hit(1, "late", 1L))));
                });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            var pipeline = new RetrievalPipeline(vectorStore, embedding, sessions, new PersonaResolver(host),
                    TestProperties.retrieval("user_prompt", false, 0, 1), TestProperties.vector(false),
                    TestProperties.summary(), new MutableClock(Instant.EPOCH), executor);
            var request = PromptRequest.of("q");

            assertEquals(0, pipeline.retrieve(ORIGIN, request));
            assertEquals("q", request.getPrompt());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldSearchWhileSummariesOccupyTheirPool() throws Exception {
        var config = new AppConfig();
        ExecutorService summaryPool = config.memoryTaskExecutor();
        ExecutorService searchPool = config.memorySearchExecutor();
        var entered = new CountDownLatch(4);
        var release = new CountDownLatch(1);
        LlmProvider llm = mock(LlmProvider.class);
        when(llm.chat(any(), any(), any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        });
        searchReturns(List.of(hit(1, "likes green tea", 1_700_000_000L)));
        try {
            var summaries = new SummarizationPipeline(vectorStore, embedding, llm, TestProperties.vector(false),
                    TestProperties.summary(), new MutableClock(Instant.EPOCH), summaryPool);
            for (int i = 0; i < 4; i++) {
                summaries.launch("s" + i, null, "user: hi\nassistant: hello");
            }
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            var pipeline = new RetrievalPipeline(vectorStore, embedding, sessions, new PersonaResolver(host),
                    TestProperties.retrieval("user_prompt", false, 0, 1), TestProperties.vector(false),
                    TestProperties.summary(), new MutableClock(Instant.EPOCH), searchPool);

            assertEquals(1, pipeline.retrieve(ORIGIN, PromptRequest.of("what should I drink?")));
        } finally {
            release.countDown();
            summaryPool.shutdownNow();
            searchPool.shutdownNow();
        }
    }

    @Test
    void shouldSkipWhenHostKnowsNoSession() {
        var stranger = RequestOrigin.of("unknown");
        when(host.currentSessionId(stranger)).thenReturn(Optional.empty());

        assertEquals(0, pipeline(TestProperties.retrieval()).retrieve(stranger, PromptRequest.of("q")));

        verifyNoInteractions(embedding);
    }
}
