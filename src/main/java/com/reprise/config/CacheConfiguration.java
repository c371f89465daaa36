package com.reprise.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine configuration for the embedding memo.
 */
@Configuration
public class CacheConfiguration {

    private final RepriseProperties properties;

    public CacheConfiguration(RepriseProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Cache<String, float[]> embeddingMemo() {
        return caffeineCacheBuilder().build();
    }

    private Caffeine<Object, Object> caffeineCacheBuilder() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getEmbeddings().getMemoSize())
                .expireAfterWrite(properties.getEmbeddings().getMemoExpireAfterWrite())
                .recordStats();
    }
}
