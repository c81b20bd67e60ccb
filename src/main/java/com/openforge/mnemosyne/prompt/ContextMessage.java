package com.openforge.mnemosyne.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of the conversation history carried by an outbound LLM request.
 *
 * role variants:
 *   "system"   : instructions, or a memory block inserted as its own message
 *   "user"     : human turn; may carry an injected memory block
 *   "assistant": model reply
 *
 * {@code content} is usually a String, but hosts may hand over multimodal
 * payloads (lists of parts). Those are carried through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextMessage(
        String role,
        Object content
) {

    public static final String ROLE_USER      = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM    = "system";

    public static ContextMessage user(String content) {
        return new ContextMessage(ROLE_USER, content);
    }

    public static ContextMessage assistant(String content) {
        return new ContextMessage(ROLE_ASSISTANT, content);
    }

    public static ContextMessage system(String content) {
        return new ContextMessage(ROLE_SYSTEM, content);
    }

    public boolean hasRole(String expected) {
        return expected.equals(role);
    }

    public boolean hasTextContent() {
        return content instanceof String;
    }

    /** Copy with replaced content, same role. */
    public ContextMessage withContent(Object newContent) {
        return new ContextMessage(role, newContent);
    }
}
