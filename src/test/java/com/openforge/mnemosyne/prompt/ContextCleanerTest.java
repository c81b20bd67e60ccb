package com.openforge.mnemosyne.prompt;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextCleanerTest {

    private final MemoryMarker marker = MemoryMarker.defaults();

    private List<ContextMessage> historyWithBlocks(int blocks) {
        List<ContextMessage> history = new ArrayList<>();
        for (int i = 0; i < blocks; i++) {
            history.add(ContextMessage.user(marker.encode("- memory " + i) + "\nquestion " + i));
            history.add(ContextMessage.assistant("answer " + i));
        }
        return history;
    }

    private int countBlocks(List<ContextMessage> contexts) {
        return contexts.stream()
                .filter(m -> m.hasRole(ContextMessage.ROLE_USER) && m.hasTextContent())
                .mapToInt(m -> marker.count((String) m.content()))
                .sum();
    }

    @Test
    void shouldStripAllUserBlocksWhenKeepIsZero() {
        var cleaned = ContextCleaner.stripUserPromptBlocks(historyWithBlocks(3), marker, 0);

        assertEquals(0, countBlocks(cleaned));
        assertEquals("\nquestion 1", cleaned.get(2).content());
        assertEquals("answer 1", cleaned.get(3).content());
    }

    @Test
    void shouldKeepMostRecentBlocksInScanOrder() {
        var cleaned = ContextCleaner.stripUserPromptBlocks(historyWithBlocks(4), marker, 2);

        assertEquals(2, countBlocks(cleaned));
        assertFalse(marker.contains((String) cleaned.get(0).content()));
        assertFalse(marker.contains((String) cleaned.get(2).content()));
        assertTrue(marker.contains((String) cleaned.get(4).content()));
        assertTrue(marker.contains((String) cleaned.get(6).content()));
    }

    @Test
    void shouldInjectExactlyOnceAfterStripping() {
        for (int n = 0; n <= 4; n++) {
            for (int keep = 0; keep <= n; keep++) {
                var request = new PromptRequest("new question", null, historyWithBlocks(n));

                ContextCleaner.clean(request, InjectionMethod.USER_PROMPT, marker, keep);
                request.setPrompt(marker.encode("- fresh") + "\n" + request.getPrompt());

                assertEquals(keep, countBlocks(request.getContexts()), "n=" + n + " keep=" + keep);
                assertEquals(1, marker.count(request.getPrompt()));
            }
        }
    }

    @Test
    void shouldPassNonStringContentThrough() {
        Object parts = List.of(Map.of("type", "image_url"));
        var multimodal = new ContextMessage(ContextMessage.ROLE_USER, parts);
        List<ContextMessage> contexts = List.of(multimodal, ContextMessage.user(marker.encode("x") + "hi"));

        var cleaned = ContextCleaner.stripUserPromptBlocks(contexts, marker, 0);

        assertSame(parts, cleaned.get(0).content());
        assertEquals("hi", cleaned.get(1).content());
    }

    @Test
    void shouldNotMutateInputList() {
        var history = historyWithBlocks(2);
        var snapshot = List.copyOf(history);

        ContextCleaner.stripUserPromptBlocks(history, marker, 0);

        assertEquals(snapshot, history);
    }

    @Test
    void shouldStripSystemPromptBlocks() {
        String system = "You are helpful." + "\n" + marker.encode("a") + "\n" + marker.encode("b");

        assertEquals("You are helpful.\n\n", ContextCleaner.stripSystemPromptBlocks(system, marker, 0));
        assertEquals("You are helpful.\n\n" + marker.encode("b"),
                ContextCleaner.stripSystemPromptBlocks(system, marker, 1));
        assertNull(ContextCleaner.stripSystemPromptBlocks(null, marker, 0));
    }

    @Test
    void shouldDropOldestSystemMessagesBeyondKeep() {
        List<ContextMessage> contexts = List.of(
                ContextMessage.system("s1"),
                ContextMessage.user("u1"),
                ContextMessage.system("s2"),
                ContextMessage.assistant("a1"),
                ContextMessage.system("s3"));

        var cleaned = ContextCleaner.stripSystemMessages(contexts, 1);

        assertEquals(List.of(
                ContextMessage.user("u1"),
                ContextMessage.assistant("a1"),
                ContextMessage.system("s3")), cleaned);
        assertEquals(2, ContextCleaner.stripSystemMessages(contexts, 0).size());
    }

    @Test
    void shouldCleanSystemPromptThroughDispatcher() {
        var request = new PromptRequest("q", "base\n" + marker.encode("old"), List.of());

        ContextCleaner.clean(request, InjectionMethod.SYSTEM_PROMPT, marker, 0);

        assertEquals("base\n", request.getSystemPrompt());
    }
}
