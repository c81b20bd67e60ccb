package com.openforge.mnemosyne.retrieval;

import com.openforge.mnemosyne.prompt.InjectionMethod;
import com.openforge.mnemosyne.prompt.MemoryMarker;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Memory retrieval and prompt injection.
 *
 * mnemosyne:
 *   retrieval:
 *     top-k: 5
 *     search-timeout-seconds: 10
 *     use-personality-filtering: false
 *     injection-method: user_prompt    # user_prompt | system_prompt | insert_system_prompt
 *     entry-format: "- [{time}] {content}"
 *     contexts-memory-len: 0           # injected blocks kept from earlier turns
 */
@ConfigurationProperties(prefix = "mnemosyne.retrieval")
public record RetrievalProperties(
        @DefaultValue("5")                         int     topK,
        @DefaultValue("10")                        long    searchTimeoutSeconds,
        @DefaultValue("false")                     boolean usePersonalityFiltering,
        @DefaultValue("user_prompt")               String  injectionMethod,
        @DefaultValue(MemoryMarker.DEFAULT_PREFIX) String  memoryPrefix,
        @DefaultValue(MemoryMarker.DEFAULT_SUFFIX) String  memorySuffix,
        @DefaultValue(DEFAULT_ENTRY_FORMAT)        String  entryFormat,
        @DefaultValue("0")                         int     contextsMemoryLen
) {

    public static final String DEFAULT_ENTRY_FORMAT = "- [{time}] {content}";

    public MemoryMarker marker() {
        return MemoryMarker.of(memoryPrefix, memorySuffix);
    }

    public InjectionMethod method() {
        return InjectionMethod.fromConfig(injectionMethod);
    }
}
