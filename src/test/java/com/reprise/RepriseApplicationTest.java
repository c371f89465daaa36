package com.reprise;

import com.reprise.model.CacheRequest;
import com.reprise.model.CacheResult;
import com.reprise.model.CacheSource;
import com.reprise.model.EntryMetadata;
import com.reprise.model.RequestType;
import com.reprise.service.ResponseCacheManager;
import com.reprise.service.eviction.CacheMaintenanceScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application in single-node mode. The embedding endpoint is unreachable, so
 * writes fall back to exact-only entries.
 */
@SpringBootTest(properties = {
        "reprise.embeddings.base-url=http://127.0.0.1:1",
        "reprise.embeddings.max-retries=0",
        "reprise.embeddings.timeout=500ms"
})
@ActiveProfiles("memory")
class RepriseApplicationTest {

    @Autowired
    private ResponseCacheManager manager;

    @Autowired
    private CacheMaintenanceScheduler scheduler;

    @Test
    void testExactRoundTripWithoutEmbeddings() {
        CacheRequest request = CacheRequest.of("What is the capital of France?", RequestType.QUESTION_ANSWERING);
        EntryMetadata metadata = EntryMetadata.builder().model("gpt-4").responseTimeMs(1500).quality(0.9).build();

        assertTrue(manager.set(request, "The capital of France is Paris.", metadata));

        CacheResult result = manager.get(request, "gpt-4");
        assertTrue(result.isHit());
        assertEquals(CacheSource.EXACT, result.getSource());
        assertEquals("The capital of France is Paris.", result.responseAsString());

        scheduler.runEviction();
        assertEquals(1, manager.getStats().getSemantic().getTotalEntries());
    }
}
