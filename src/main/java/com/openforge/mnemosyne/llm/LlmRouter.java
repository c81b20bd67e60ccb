package com.openforge.mnemosyne.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemosyne.llm.model.ChatRequest;
import com.openforge.mnemosyne.llm.model.ChatResponse;
import com.openforge.mnemosyne.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link LlmProvider} that routes each call primary → fallback.
 *
 * Call graph:
 *
 *   chat(prompt, system, params)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry        (only if configured)
 *           └─ fallbackClient.chat(request)
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements LlmProvider {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    @Autowired
    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this(new LlmClient(httpClient, objectMapper, requirePrimary(properties)),
             properties.hasFallback() ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null,
             primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker, primaryLlmRetry, fallbackLlmRetry);
    }

    LlmRouter(LlmClient primaryClient,
              LlmClient fallbackClient,
              CircuitBreaker primaryCb,
              CircuitBreaker fallbackCb,
              Retry primaryRetry,
              Retry fallbackRetry) {
        this.primaryClient  = primaryClient;
        this.fallbackClient = fallbackClient;
        this.primaryCb      = primaryCb;
        this.fallbackCb     = fallbackCb;
        this.primaryRetry   = primaryRetry;
        this.fallbackRetry  = fallbackRetry;
    }

    private static LlmProperties.ProviderConfig requirePrimary(LlmProperties properties) {
        LlmProperties.ProviderConfig primary = properties.primary();
        if (primary == null || primary.baseUrl() == null || primary.baseUrl().isBlank()) {
            throw new IllegalStateException("mnemosyne.llm.primary.base-url must be configured");
        }
        return primary;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public LlmCompletion chat(String prompt, String systemContext, Map<String, Object> extraParams) {
        List<Message> messages = new ArrayList<>(2);
        if (systemContext != null && !systemContext.isBlank()) messages.add(Message.system(systemContext));
        messages.add(Message.user(prompt));

        ChatResponse response = route(messages, extraParams == null ? Map.of() : extraParams);
        Message message = response.firstMessage();
        String role = message.role() == null ? LlmCompletion.ROLE_ASSISTANT : message.role();
        return new LlmCompletion(message.content(), role);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatResponse route(List<Message> messages, Map<String, Object> extraParams) {
        try {
            ChatRequest primaryRequest = ChatRequest.simple(primaryClient.modelName(), messages);
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest, extraParams), "primary");
        } catch (Exception primaryException) {
            if (fallbackClient == null) throw primaryException;
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = ChatRequest.simple(fallbackClient.modelName(), messages);
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest, extraParams), "fallback");
        }
    }

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Programmatic decoration, no AOP proxies.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
