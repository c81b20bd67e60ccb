package com.openforge.mnemosyne.llm;

/** Completion text plus the role the provider attributed it to. */
public record LlmCompletion(String completionText, String role) {

    public static final String ROLE_ASSISTANT = "assistant";

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
