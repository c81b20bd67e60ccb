package com.openforge.mnemosyne.prompt;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Where retrieved memories are spliced into the outbound request.
 */
@Slf4j
public enum InjectionMethod {

    /** Block placed in front of the user's text. */
    USER_PROMPT("user_prompt"),

    /** Block appended to the system prompt. */
    SYSTEM_PROMPT("system_prompt"),

    /** Block added to the context list as its own system message. */
    INSERT_SYSTEM_PROMPT("insert_system_prompt");

    private final String configValue;

    InjectionMethod(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /** Unknown or blank values fall back to {@link #USER_PROMPT}. */
    public static InjectionMethod fromConfig(String value) {
        if (value == null || value.isBlank()) return USER_PROMPT;
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (InjectionMethod m : values()) {
            if (m.configValue.equals(normalized)) return m;
        }
        log.warn("[Retrieval] Unknown memory injection method '{}', falling back to {}",
                value, USER_PROMPT.configValue);
        return USER_PROMPT;
    }
}
