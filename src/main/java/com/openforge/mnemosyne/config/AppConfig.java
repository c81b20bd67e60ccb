package com.openforge.mnemosyne.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.mnemosyne.host.HostSessionResolver;
import com.openforge.mnemosyne.host.OriginSessionResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - memoryTaskExecutor   → bounded pool for fire-and-forget summarization runs
 *  - memorySearchExecutor → separate bounded pool for vector search dispatch
 *  - Java HttpClient    → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *  - Clock              → the single time source; tests swap in their own
 */
@Configuration
public class AppConfig {

    private static final int MEMORY_POOL_SIZE = 4;
    private static final int SEARCH_POOL_SIZE = 8;

    /**
     * Named "memoryTaskExecutor" to stay clear of Spring Boot's auto-configured
     * "applicationTaskExecutor". Threads are daemons: in-flight summaries are
     * not waited for at shutdown.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryTaskExecutor() {
        return Executors.newFixedThreadPool(MEMORY_POOL_SIZE, daemonThreads("mnemosyne-task-"));
    }

    /**
     * Search dispatch gets its own pool: a summary holds its thread for the
     * whole LLM call, and searches must not queue behind those.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memorySearchExecutor() {
        return Executors.newFixedThreadPool(SEARCH_POOL_SIZE, daemonThreads("mnemosyne-search-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, prompt_tokens …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Used when the embedding host does not contribute its own resolver. */
    @Bean
    @ConditionalOnMissingBean(HostSessionResolver.class)
    public HostSessionResolver hostSessionResolver() {
        return new OriginSessionResolver();
    }
}
