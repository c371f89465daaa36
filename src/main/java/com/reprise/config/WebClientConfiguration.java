package com.reprise.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient for the embedding endpoint. Connect and response timeouts both follow
 * {@code reprise.embeddings.timeout}.
 */
@Configuration
public class WebClientConfiguration {

    // Embedding responses can exceed the 256 KB codec default
    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    private final RepriseProperties properties;

    public WebClientConfiguration(RepriseProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient embeddingWebClient() {
        RepriseProperties.EmbeddingsConfig embeddings = properties.getEmbeddings();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) embeddings.getTimeout().toMillis())
                .responseTimeout(embeddings.getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }
}
