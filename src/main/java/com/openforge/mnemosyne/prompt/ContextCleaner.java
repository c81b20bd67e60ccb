package com.openforge.mnemosyne.prompt;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes memory content injected on earlier turns, one strategy per
 * {@link InjectionMethod}. Input lists are never mutated.
 *
 * A {@code keepLast} of N > 0 lets the N most recent blocks survive so that a
 * short window of memory context stays visible across turns.
 */
public final class ContextCleaner {

    private ContextCleaner() {}

    /** Dispatches to the strategy matching the injection method. */
    public static void clean(PromptRequest request, InjectionMethod method,
                             MemoryMarker marker, int keepLast) {
        switch (method) {
            case SYSTEM_PROMPT -> request.setSystemPrompt(
                    stripSystemPromptBlocks(request.getSystemPrompt(), marker, keepLast));
            case INSERT_SYSTEM_PROMPT -> request.setContexts(
                    stripSystemMessages(request.getContexts(), keepLast));
            default -> request.setContexts(
                    stripUserPromptBlocks(request.getContexts(), marker, keepLast));
        }
    }

    /**
     * Strips marker blocks from user messages. Blocks are numbered in scan
     * order across all user messages; only the last {@code keepLast} survive.
     */
    public static List<ContextMessage> stripUserPromptBlocks(List<ContextMessage> contexts,
                                                             MemoryMarker marker,
                                                             int keepLast) {
        if (contexts == null) return new ArrayList<>();

        int total = 0;
        if (keepLast > 0) {
            for (ContextMessage msg : contexts) {
                if (isUserText(msg)) total += marker.count((String) msg.content());
            }
        }
        int firstKept = keepLast > 0 ? total - keepLast : Integer.MAX_VALUE;

        List<ContextMessage> cleaned = new ArrayList<>(contexts.size());
        int index = 0;
        for (ContextMessage msg : contexts) {
            if (!isUserText(msg)) {
                cleaned.add(msg);
                continue;
            }
            String text = (String) msg.content();
            int blocks = marker.count(text);
            if (blocks == 0) {
                cleaned.add(msg);
                continue;
            }
            cleaned.add(msg.withContent(marker.strip(text, index, i -> i >= firstKept)));
            index += blocks;
        }
        return cleaned;
    }

    /** Same stripping rule applied to a single system prompt string. */
    public static String stripSystemPromptBlocks(String systemPrompt, MemoryMarker marker, int keepLast) {
        if (systemPrompt == null) return null;
        return marker.stripKeepingLast(systemPrompt, keepLast);
    }

    /**
     * Drops the oldest system-role messages so at most {@code keepLast} remain.
     * Relative order of everything else is preserved.
     */
    public static List<ContextMessage> stripSystemMessages(List<ContextMessage> contexts, int keepLast) {
        if (contexts == null) return new ArrayList<>();
        int systemCount = 0;
        for (ContextMessage msg : contexts) {
            if (msg != null && msg.hasRole(ContextMessage.ROLE_SYSTEM)) systemCount++;
        }
        int toDrop = Math.max(0, systemCount - Math.max(0, keepLast));

        List<ContextMessage> cleaned = new ArrayList<>(contexts.size());
        for (ContextMessage msg : contexts) {
            if (toDrop > 0 && msg != null && msg.hasRole(ContextMessage.ROLE_SYSTEM)) {
                toDrop--;
                continue;
            }
            cleaned.add(msg);
        }
        return cleaned;
    }

    private static boolean isUserText(ContextMessage msg) {
        return msg != null && msg.hasRole(ContextMessage.ROLE_USER) && msg.hasTextContent();
    }
}
