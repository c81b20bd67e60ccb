package com.openforge.mnemosyne.embedding;

import com.openforge.mnemosyne.config.AppConfig;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingConfigTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();

    private EmbeddingProvider create(String service, String apiKey, String model, int dimensions) {
        return EmbeddingConfig.create(httpClient, new AppConfig().objectMapper(),
                new EmbeddingProperties(service, null, apiKey, model, dimensions, 30, false));
    }

    @Test
    void shouldCreateConfiguredProvider() {
        assertInstanceOf(OpenAiEmbeddingClient.class, create("openai", "sk-test", "text-embedding-3-small", 1536));
        assertInstanceOf(GeminiEmbeddingClient.class, create(" Gemini ", "key", "text-embedding-004", 768));
    }

    @Test
    void shouldRejectNonPositiveDimension() {
        var e = assertThrows(IllegalStateException.class,
                () -> create("openai", "sk-test", "text-embedding-3-small", 0));
        assertTrue(e.getMessage().contains("dimensions"));
    }

    @Test
    void shouldNameEveryMissingSetting() {
        var e = assertThrows(IllegalStateException.class, () -> create("openai", " ", "", 1536));
        assertTrue(e.getMessage().contains("model"));
        assertTrue(e.getMessage().contains("api-key"));
    }

    @Test
    void shouldRejectUnknownService() {
        assertThrows(IllegalStateException.class, () -> create("cohere", "k", "embed-v3", 1024));
    }

    @Test
    void shouldDisableProviderThatFailsItsProbe() {
        EmbeddingProvider probed = EmbeddingConfig.probe(new FakeProvider(true));

        assertInstanceOf(DisabledEmbeddingProvider.class, probed);
        assertFalse(probed.isAvailable());
        assertTrue(probed.getEmbeddings(List.of("x")).isEmpty());
    }

    @Test
    void shouldKeepProviderThatPassesItsProbe() {
        FakeProvider provider = new FakeProvider(false);

        assertSame(provider, EmbeddingConfig.probe(provider));
    }

    private static final class FakeProvider implements EmbeddingProvider, ConnectionTestable {

        private final boolean failProbe;

        FakeProvider(boolean failProbe) {
            this.failProbe = failProbe;
        }

        @Override
        public void testConnection() {
            if (failProbe) throw new EmbeddingException("401 Unauthorized");
        }

        @Override
        public List<List<Float>> getEmbeddings(List<String> texts) {
            return texts.stream().map(t -> List.of(1f, 0f)).toList();
        }

        @Override
        public int getDim() {
            return 2;
        }

        @Override
        public String modelId() {
            return "fake:model";
        }
    }
}
