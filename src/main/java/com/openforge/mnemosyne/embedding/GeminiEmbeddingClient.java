package com.openforge.mnemosyne.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedding client for the Google Generative Language API.
 *
 * Wire format (POST {base}/models/{model}:batchEmbedContents):
 * {
 *   "requests": [
 *     { "model": "models/text-embedding-004",
 *       "content": { "parts": [ { "text": "..." } ] },
 *       "outputDimensionality": 768 }
 *   ]
 * }
 * → { "embeddings": [ { "values": [0.1, ...] } ] }
 *
 * The body is built as a tree because the API is camelCase while the shared
 * ObjectMapper writes snake_case.
 */
@Slf4j
public class GeminiEmbeddingClient implements EmbeddingProvider, ConnectionTestable {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;
    private final String              baseUrl;

    public GeminiEmbeddingClient(HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
        this.baseUrl      = OpenAiEmbeddingClient.stripSlash(props.baseUrl() == null || props.baseUrl().isBlank()
                ? DEFAULT_BASE_URL : props.baseUrl());
    }

    @Override
    public List<List<Float>> getEmbeddings(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();

        String modelPath = props.model().startsWith("models/") ? props.model() : "models/" + props.model();
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode requests = root.putArray("requests");
        for (String text : texts) {
            ObjectNode req = requests.addObject();
            req.put("model", modelPath);
            req.putObject("content").putArray("parts").addObject().put("text", text);
            req.put("outputDimensionality", props.dimensions());
        }

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/" + modelPath + ":batchEmbedContents"))
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", props.apiKey())
                    .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(root)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize Gemini embedding request", e);
        }

        log.debug("[Embed] → POST {}:batchEmbedContents inputs={}", modelPath, texts.size());
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling Gemini embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling Gemini embedding API", e);
        }

        int status = response.statusCode();
        if (status == 429) throw new EmbeddingException("Gemini embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Gemini embedding API returned HTTP %d: %s".formatted(status, response.body()));

        try {
            JsonNode embeddings = objectMapper.readTree(response.body()).path("embeddings");
            List<List<Float>> vectors = new ArrayList<>();
            for (JsonNode e : embeddings) {
                List<Float> v = new ArrayList<>();
                for (JsonNode x : e.path("values")) v.add(x.floatValue());
                vectors.add(v);
            }
            return vectors;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse Gemini embedding response", e);
        }
    }

    @Override
    public int getDim() {
        return props.dimensions();
    }

    @Override
    public String modelId() {
        return "gemini:" + props.model();
    }

    @Override
    public void testConnection() {
        List<List<Float>> probe = getEmbeddings(List.of("connection test"));
        if (probe.isEmpty() || probe.get(0).isEmpty()) {
            throw new EmbeddingException("Gemini returned no vector for the probe text");
        }
    }
}
