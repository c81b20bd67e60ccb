package com.openforge.mnemosyne.prompt;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * The outbound LLM request as seen by the memory layer.
 *
 * Mutable on purpose: the retrieval pipeline rewrites the prompt, the system
 * prompt or the context list in place before the host forwards the request.
 */
@Getter
@Setter
@ToString
public class PromptRequest {

    private String prompt;
    private String systemPrompt;
    private List<ContextMessage> contexts;

    public PromptRequest(String prompt, String systemPrompt, List<ContextMessage> contexts) {
        this.prompt       = prompt;
        this.systemPrompt = systemPrompt;
        this.contexts     = contexts == null ? new ArrayList<>() : new ArrayList<>(contexts);
    }

    public static PromptRequest of(String prompt) {
        return new PromptRequest(prompt, null, List.of());
    }
}
