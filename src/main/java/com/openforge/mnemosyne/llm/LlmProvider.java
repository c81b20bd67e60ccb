package com.openforge.mnemosyne.llm;

import java.util.Map;

/**
 * Text completion used to summarize dialogue into memories.
 */
public interface LlmProvider {

    /**
     * @param prompt        user content
     * @param systemContext system instruction; may be blank
     * @param extraParams   request parameters copied verbatim into the call
     *                      (temperature, max_tokens, ...)
     * @throws LlmClient.LlmException when no provider could answer
     */
    LlmCompletion chat(String prompt, String systemContext, Map<String, Object> extraParams);
}
