package com.openforge.mnemosyne.retrieval;

import com.openforge.mnemosyne.prompt.ContextMessage;
import com.openforge.mnemosyne.prompt.InjectionMethod;
import com.openforge.mnemosyne.prompt.MemoryMarker;
import com.openforge.mnemosyne.prompt.PromptRequest;
import com.openforge.mnemosyne.vector.MemorySchema;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders retrieved memories into a marker-wrapped block and splices it into
 * the outgoing request.
 */
public class MemoryInjector {

    static final String UNKNOWN_TIME = "unknown time";

    private final MemoryMarker      marker;
    private final String            entryFormat;
    private final DateTimeFormatter timeFormat;

    public MemoryInjector(MemoryMarker marker, String entryFormat, ZoneId zone) {
        this.marker      = marker;
        this.entryFormat = entryFormat;
        this.timeFormat  = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(zone);
    }

    /** One formatted line per memory, each ending in a newline. */
    public String formatEntries(List<Map<String, Object>> memories) {
        StringBuilder sb = new StringBuilder();
        for (Map<String, Object> memory : memories) {
            Object content = memory.get(MemorySchema.CONTENT_FIELD);
            sb.append(entryFormat
                    .replace("{time}", formatTime(memory.get(MemorySchema.CREATE_TIME_FIELD)))
                    .replace("{content}", content == null ? "" : content.toString()))
              .append('\n');
        }
        return sb.toString();
    }

    public String buildBlock(List<Map<String, Object>> memories) {
        return marker.encode(formatEntries(memories));
    }

    public void inject(PromptRequest request, InjectionMethod method, String block) {
        switch (method) {
            case SYSTEM_PROMPT -> {
                String system = request.getSystemPrompt() == null ? "" : request.getSystemPrompt();
                request.setSystemPrompt(system + "\n" + block);
            }
            case INSERT_SYSTEM_PROMPT -> {
                List<ContextMessage> contexts = request.getContexts() == null
                        ? new ArrayList<>()
                        : new ArrayList<>(request.getContexts());
                contexts.add(ContextMessage.system(block));
                request.setContexts(contexts);
            }
            default -> {
                String prompt = request.getPrompt() == null ? "" : request.getPrompt();
                request.setPrompt(block + "\n" + prompt);
            }
        }
    }

    String formatTime(Object createTime) {
        if (createTime instanceof Number n && n.longValue() > 0) {
            return timeFormat.format(Instant.ofEpochSecond(n.longValue()));
        }
        return UNKNOWN_TIME;
    }
}
