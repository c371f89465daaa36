package com.reprise.service.embedding;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.EmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenAIEmbeddingProvider against a stubbed exchange function.
 */
class OpenAIEmbeddingProviderTest {

    private RepriseProperties.EmbeddingsConfig config;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        config = new RepriseProperties.EmbeddingsConfig();
        config.setBaseUrl("http://embeddings.local");
        config.setApiKey("test-key");
        config.setDimensions(3);
        config.setMaxRetries(0);
        config.setRetryBackoff(Duration.ofMillis(1));
        config.setTimeout(Duration.ofSeconds(2));
    }

    private OpenAIEmbeddingProvider providerReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    lastRequest.set(request);
                    ClientResponse.Builder response = ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                    if (body != null) {
                        response.body(body);
                    }
                    return Mono.just(response.build());
                })
                .build();
        return new OpenAIEmbeddingProvider(webClient, config);
    }

    @Test
    void testParsesEmbedding() {
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.OK,
                "{\"data\":[{\"embedding\":[0.1,0.2,0.3]}]}");

        float[] embedding = provider.embed("capital france");

        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, embedding, 1e-6f);
        assertEquals(1, calls.get());
        assertEquals("http://embeddings.local/v1/embeddings", lastRequest.get().url().toString());
        assertEquals("Bearer test-key", lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testDimensionMismatchRejected() {
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.OK,
                "{\"data\":[{\"embedding\":[0.1,0.2]}]}");

        assertThrows(EmbeddingException.class, () -> provider.embed("capital france"));
    }

    @Test
    void testAnyDimensionAcceptedWhenUnconfigured() {
        config.setDimensions(0);
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.OK,
                "{\"data\":[{\"embedding\":[0.1,0.2]}]}");

        assertEquals(2, provider.embed("capital france").length);
    }

    @Test
    void testEmptyDataRejected() {
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{\"data\":[]}");

        assertThrows(EmbeddingException.class, () -> provider.embed("capital france"));
    }

    @Test
    void testEmptyTextRejectedWithoutCall() {
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.OK, "{}");

        assertThrows(EmbeddingException.class, () -> provider.embed(""));
        assertEquals(0, calls.get());
    }

    @Test
    void testServerErrorsRetried() {
        config.setMaxRetries(2);
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.SERVICE_UNAVAILABLE, null);

        assertThrows(EmbeddingException.class, () -> provider.embed("capital france"));
        assertEquals(3, calls.get());
    }

    @Test
    void testClientErrorsNotRetried() {
        config.setMaxRetries(2);
        OpenAIEmbeddingProvider provider = providerReturning(HttpStatus.UNAUTHORIZED, null);

        assertThrows(EmbeddingException.class, () -> provider.embed("capital france"));
        assertEquals(1, calls.get());
    }
}
