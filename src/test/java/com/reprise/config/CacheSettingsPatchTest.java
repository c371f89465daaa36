package com.reprise.config;

import com.reprise.model.EvictionPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheSettingsPatch and CacheSettingsHolder.
 */
class CacheSettingsPatchTest {

    @Test
    void testNullFieldsKeepCurrentValues() {
        CacheSettings base = CacheSettings.defaults();

        CacheSettings merged = CacheSettingsPatch.builder()
                .similarityThreshold(0.9)
                .evictionPolicy(EvictionPolicy.LRU)
                .build()
                .applyTo(base);

        assertEquals(0.9, merged.getSimilarityThreshold());
        assertEquals(EvictionPolicy.LRU, merged.getEvictionPolicy());
        assertEquals(base.getMaxEntries(), merged.getMaxEntries());
        assertEquals(base.getDefaultTtl(), merged.getDefaultTtl());
        assertEquals(base.getStopTokens(), merged.getStopTokens());
    }

    @Test
    void testEmptyPatchIsIdentity() {
        CacheSettings base = CacheSettings.defaults();
        assertEquals(base, new CacheSettingsPatch().applyTo(base));
    }

    @Test
    void testHolderPublishesUpdate() {
        CacheSettingsHolder holder = new CacheSettingsHolder(CacheSettings.defaults());

        CacheSettings updated = holder.update(CacheSettingsPatch.builder()
                .enableSemanticCaching(false)
                .defaultTtl(Duration.ofMinutes(10))
                .stopTokens(Set.of("please"))
                .build());

        assertSame(updated, holder.get());
        assertFalse(holder.get().isEnableSemanticCaching());
        assertEquals(Duration.ofMinutes(10), holder.get().getDefaultTtl());
        assertEquals(Set.of("please"), holder.get().getStopTokens());
    }

    @Test
    void testPropertiesMapToSettings() {
        RepriseProperties.CacheConfig config = new RepriseProperties.CacheConfig();
        config.setSimilarityThreshold(0.8);
        config.getHybridWeights().setRecency(0.5);
        config.getHybridWeights().setFrequency(0.25);
        config.getHybridWeights().setRelevance(0.25);

        CacheSettings settings = config.toSettings();

        assertEquals(0.8, settings.getSimilarityThreshold());
        assertEquals(64L * 1024 * 1024, settings.getMaxCacheSize());
        assertEquals(CacheSettings.HybridWeights.of(0.5, 0.25, 0.25), settings.getHybridWeights());
        assertEquals(CacheSettings.DEFAULT_STOP_TOKENS, settings.getStopTokens());
    }
}
