package com.openforge.mnemosyne.session;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flattens dialogue turns into the text handed to the summarization LLM.
 *
 * Output is one {@code "role: content"} line per turn, oldest first. System
 * turns are never included.
 */
public final class DialogueFormatter {

    private DialogueFormatter() {}

    /** Formats the last {@code turns} user/assistant messages; {@code turns <= 0} yields "". */
    public static String format(List<ChatTurn> history, int turns) {
        if (history == null || history.isEmpty() || turns <= 0) return "";
        List<ChatTurn> dialogue = history.stream()
                .filter(t -> t.role() != null && t.role().isDialogue())
                .toList();
        int from = Math.max(0, dialogue.size() - turns);
        return dialogue.subList(from, dialogue.size()).stream()
                .map(t -> t.role().wireName() + ": " + t.content())
                .collect(Collectors.joining("\n"));
    }
}
