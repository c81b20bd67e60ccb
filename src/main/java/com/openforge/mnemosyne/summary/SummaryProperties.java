package com.openforge.mnemosyne.summary;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Summarization triggers and the LLM call that turns dialogue into a memory.
 *
 * mnemosyne:
 *   summary:
 *     num-pairs: 10                 # turns per count-based summary
 *     check-interval-seconds: 300   # background sweep period
 *     time-threshold-seconds: 1800  # idle time before a quiet session is summarized; <= 0 disables
 *     llm-params: { temperature: 0.3 }
 *     default-persona: default_persona
 *     host-max-context-length: -1   # -1 = unlimited
 */
@ConfigurationProperties(prefix = "mnemosyne.summary")
public record SummaryProperties(
        @DefaultValue("10")               int    numPairs,
        @DefaultValue("300")              long   checkIntervalSeconds,
        @DefaultValue("1800")             long   timeThresholdSeconds,
        @DefaultValue(DEFAULT_PROMPT)     String longMemoryPrompt,
        Map<String, Object>                      llmParams,
        @DefaultValue(DEFAULT_PERSONA)    String defaultPersona,
        @DefaultValue("-1")               int    hostMaxContextLength
) {

    public static final String DEFAULT_PROMPT =
            "Please summarize the following multi-turn dialogue history into a concise, "
            + "objective long-term memory entry containing the key information:";

    public static final String DEFAULT_PERSONA = "default_persona";

    public boolean timeTriggerEnabled() {
        return timeThresholdSeconds > 0;
    }

    public Map<String, Object> effectiveLlmParams() {
        return llmParams == null ? Map.of() : llmParams;
    }
}
