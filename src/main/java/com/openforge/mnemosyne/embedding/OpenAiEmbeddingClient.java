package com.openforge.mnemosyne.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Embedding client for OpenAI-compatible /embeddings endpoints.
 *
 * Raw HttpClient + Jackson, like the LLM client. All texts of one call go
 * out in a single batched request.
 */
@Slf4j
public class OpenAiEmbeddingClient implements EmbeddingProvider, ConnectionTestable {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;
    private final String              baseUrl;

    public OpenAiEmbeddingClient(HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
        this.baseUrl      = stripSlash(props.baseUrl() == null || props.baseUrl().isBlank()
                ? DEFAULT_BASE_URL : props.baseUrl());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public List<List<Float>> getEmbeddings(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        for (String t : texts) {
            if (t == null || t.isBlank()) throw new IllegalArgumentException("Cannot embed blank text");
        }

        // Trim to a safe length to avoid exceeding model token limits
        List<String> input = texts.stream()
                .map(t -> t.length() > MAX_INPUT_CHARS ? t.substring(0, MAX_INPUT_CHARS) : t)
                .toList();

        String body = serialize(EmbeddingRequest.of(input, props.model(), props.dimensions()));
        log.debug("[Embed] → POST /embeddings model={} inputs={}", props.model(), input.size());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        }

        return parseResponse(response);
    }

    @Override
    public int getDim() {
        return props.dimensions();
    }

    @Override
    public String modelId() {
        return "openai:" + props.model();
    }

    @Override
    public void testConnection() {
        List<List<Float>> probe = getEmbeddings(List.of("connection test"));
        if (probe.isEmpty() || probe.get(0).isEmpty()) {
            throw new EmbeddingException("Embedding API returned no vector for the probe text");
        }
        if (probe.get(0).size() != props.dimensions()) {
            log.warn("[Embed] Model {} returned dim={} but configured dimensions={}",
                    props.model(), probe.get(0).size(), props.dimensions());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<List<Float>> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            List<List<Float>> vectors = resp.orderedEmbeddings();
            log.debug("[Embed] ← {} vectors dim={}", vectors.size(),
                    vectors.isEmpty() ? 0 : vectors.get(0).size());
            return vectors;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
