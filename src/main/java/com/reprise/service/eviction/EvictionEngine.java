package com.reprise.service.eviction;

import com.reprise.config.CacheSettings;
import com.reprise.config.CacheSettingsHolder;
import com.reprise.exception.EvictionFailureException;
import com.reprise.model.EvictionCandidate;
import com.reprise.model.EvictionReason;
import com.reprise.model.OptimizationResult;
import com.reprise.service.store.SimilarityCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the store within its byte and entry limits.
 *
 * When either limit is exceeded, victims are removed in policy order until both fall to
 * {@code evictionTarget} of their limit. Removal runs in batches and yields between them;
 * a failed removal is logged and skipped. Only one capacity pass runs at a time; a caller
 * arriving during a pass waits for it and then re-checks the limits.
 */
@Slf4j
public class EvictionEngine {

    private final SimilarityCacheStore store;
    private final EvictionScorer scorer;
    private final CacheSettingsHolder settings;
    private final Clock clock;
    private final ReentrantLock capacityLock = new ReentrantLock();

    public EvictionEngine(SimilarityCacheStore store, EvictionScorer scorer,
                          CacheSettingsHolder settings, Clock clock) {
        this.store = store;
        this.scorer = scorer;
        this.settings = settings;
        this.clock = clock;
    }

    public boolean isOverCapacity() {
        CacheSettings current = settings.get();
        return store.storageUsed() > current.getMaxCacheSize()
                || store.entryCount() > current.getMaxEntries();
    }

    /**
     * Evict until storage and entry count are at or below their targets.
     * No-op when neither limit is exceeded.
     */
    public OptimizationResult enforceCapacity() {
        if (!isOverCapacity()) {
            return OptimizationResult.empty();
        }

        capacityLock.lock();
        try {
            if (!isOverCapacity()) {
                return OptimizationResult.empty();
            }
            return evictToTarget();
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Caller holds {@link #capacityLock}.
     */
    private OptimizationResult evictToTarget() {
        long start = clock.millis();
        CacheSettings current = settings.get();
        long targetBytes = (long) (current.getMaxCacheSize() * current.getEvictionTarget());
        long targetEntries = (long) (current.getMaxEntries() * current.getEvictionTarget());

        long bytes = store.storageUsed();
        long entries = store.entryCount();
        List<EvictionCandidate> victims = scorer.rank(store.evictionCandidates(), current, clock.millis());

        log.info("Cache over capacity ({} bytes, {} entries), evicting to {} bytes, {} entries using {}",
                bytes, entries, targetBytes, targetEntries, current.getEvictionPolicy());

        int batchSize = Math.max(1, current.getEvictionBatchSize());
        int evicted = 0;
        int inBatch = 0;
        long reclaimed = 0;

        for (EvictionCandidate victim : victims) {
            if (bytes <= targetBytes && entries <= targetEntries) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Eviction interrupted after {} entries", evicted);
                break;
            }

            try {
                long freed = store.remove(victim.getId(), EvictionReason.CAPACITY);
                if (freed > 0) {
                    evicted++;
                    entries--;
                    bytes -= victim.getSizeBytes();
                    reclaimed += victim.getSizeBytes();
                }
            } catch (EvictionFailureException e) {
                log.warn("Failed to evict entry, skipping: id={}", e.getEntryId(), e);
            }

            if (++inBatch >= batchSize) {
                inBatch = 0;
                // Writes and other instances move the totals while we work
                bytes = store.storageUsed();
                entries = store.entryCount();
                Thread.yield();
            }
        }

        log.info("Evicted {} entries, reclaimed {} bytes", evicted, reclaimed);

        return OptimizationResult.builder()
                .entriesEvicted(evicted)
                .storageReclaimed(reclaimed)
                .optimizationTime(clock.millis() - start)
                .build();
    }

    /**
     * Remove every expired entry.
     */
    public OptimizationResult sweepExpired() {
        return store.purgeExpired(Math.max(1, settings.get().getEvictionBatchSize()));
    }
}
