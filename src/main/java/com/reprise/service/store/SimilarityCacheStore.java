package com.reprise.service.store;

import com.reprise.config.CacheSettings;
import com.reprise.config.CacheSettingsHolder;
import com.reprise.exception.CacheException;
import com.reprise.exception.CollaboratorUnavailableException;
import com.reprise.exception.EvictionFailureException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheHit;
import com.reprise.model.CacheKey;
import com.reprise.model.EntryMetadata;
import com.reprise.model.EvictionCandidate;
import com.reprise.model.EvictionReason;
import com.reprise.model.OptimizationResult;
import com.reprise.model.dto.CacheStatistics;
import com.reprise.repository.DurableStore;
import com.reprise.repository.DurableStore.ScoredMember;
import com.reprise.service.embedding.EmbeddingProvider;
import com.reprise.service.index.VectorIndex;
import com.reprise.service.index.VectorMatch;
import com.reprise.service.similarity.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry storage with exact and similarity lookup.
 *
 * Durable layout (all keys under {@code reprise:}):
 * <pre>
 *   entry:{id}          serialized entry
 *   hash:{fingerprint}  id of the entry owning the fingerprint
 *   idx:last-accessed   zset id -> last access (epoch millis)
 *   idx:access-count    zset id -> access count
 *   idx:relevance       zset id -> rolling hit similarity
 *   idx:expires-at      zset id -> expiry (epoch millis), entries with a TTL only
 *   idx:size            zset id -> persisted bytes
 *   stat:storage-bytes  counter, sum of idx:size
 * </pre>
 *
 * Writes for one fingerprint are serialized by {@link KeyLocks}. The vector index is
 * updated outside the lock and may lag the durable store; every similarity candidate is
 * re-read and re-scored before it is served.
 */
@Slf4j
public class SimilarityCacheStore implements AutoCloseable {

    static final String PREFIX = "reprise:";
    static final String ENTRY_PREFIX = PREFIX + "entry:";
    static final String HASH_PREFIX = PREFIX + "hash:";
    static final String IDX_LAST_ACCESSED = PREFIX + "idx:last-accessed";
    static final String IDX_ACCESS_COUNT = PREFIX + "idx:access-count";
    static final String IDX_RELEVANCE = PREFIX + "idx:relevance";
    static final String IDX_EXPIRES_AT = PREFIX + "idx:expires-at";
    static final String IDX_SIZE = PREFIX + "idx:size";
    static final String STORAGE_BYTES = PREFIX + "stat:storage-bytes";

    private static final int MAX_RELEVANCE_SAMPLES = 20;

    private static final Comparator<ScoredCandidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(ScoredCandidate::similarity).reversed()
            .thenComparing(c -> c.entry().getLastAccessed(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(c -> c.entry().getAccessCount(), Comparator.reverseOrder())
            .thenComparing(c -> c.entry().getId());

    private final DurableStore store;
    private final VectorIndex index;
    private final EmbeddingProvider embeddings;
    private final EntryCodec codec;
    private final KeyLocks locks;
    private final CacheSettingsHolder settings;
    private final Clock clock;
    private final ExecutorService semanticExecutor;
    private final EvictionListener evictionListener;

    public SimilarityCacheStore(
            DurableStore store,
            VectorIndex index,
            EmbeddingProvider embeddings,
            EntryCodec codec,
            KeyLocks locks,
            CacheSettingsHolder settings,
            Clock clock,
            ExecutorService semanticExecutor,
            EvictionListener evictionListener) {
        this.store = store;
        this.index = index;
        this.embeddings = embeddings;
        this.codec = codec;
        this.locks = locks;
        this.settings = settings;
        this.clock = clock;
        this.semanticExecutor = semanticExecutor;
        this.evictionListener = evictionListener;
    }

    /**
     * Look up a key: exact fingerprint first, then similarity search.
     * Collaborator failures degrade to a miss; this method never throws them.
     *
     * @param key normalized key
     * @return hit with the decompressed response, or empty
     */
    public Optional<CacheHit> get(CacheKey key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }

        CacheSettings current = settings.get();

        try {
            Optional<CacheHit> exact = exactLookup(key, current);
            if (exact.isPresent()) {
                return exact;
            }
        } catch (CacheException e) {
            log.warn("Exact lookup failed, treating as miss: fingerprint={}", key.getFingerprint(), e);
            return Optional.empty();
        }

        if (!current.isEnableSemanticCaching()) {
            return Optional.empty();
        }

        return semanticLookup(key, current);
    }

    /**
     * Whether a servable entry exists for the exact fingerprint. Does not count as an access.
     */
    public boolean contains(CacheKey key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        try {
            Instant now = clock.instant();
            CacheSettings current = settings.get();
            return store.get(HASH_PREFIX + key.getFingerprint())
                    .map(SimilarityCacheStore::utf8)
                    .flatMap(this::loadEntry)
                    .filter(entry -> qualifies(entry, now, current))
                    .isPresent();
        } catch (CacheException e) {
            log.warn("Contains check failed: fingerprint={}", key.getFingerprint(), e);
            return false;
        }
    }

    /**
     * Store a response under a key, replacing any entry with the same fingerprint.
     *
     * An embedding failure stores an exact-only entry. A vector index failure leaves the
     * entry exact-only until it is rewritten.
     *
     * @throws CollaboratorUnavailableException if the durable store fails
     */
    public CacheEntry set(CacheKey key, byte[] response, EntryMetadata metadata) {
        CacheSettings current = settings.get();

        float[] embedding = null;
        if (current.isEnableSemanticCaching()) {
            try {
                embedding = embeddings.embed(key.getNormalized());
            } catch (CacheException e) {
                log.warn("Embedding unavailable, storing exact-only entry: fingerprint={}", key.getFingerprint(), e);
            }
        }

        byte[] payload = response;
        boolean compressed = false;
        if (current.isCompressionEnabled() && response.length > current.getCompressionThreshold()) {
            byte[] gzipped = codec.compress(response);
            if (gzipped.length < response.length) {
                payload = gzipped;
                compressed = true;
            }
        }

        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .id("cache_" + UUID.randomUUID())
                .queryHash(key.getFingerprint())
                .query(key.getQuery())
                .normalizedQuery(key.getNormalized())
                .partition(key.getPartition())
                .queryEmbedding(embedding)
                .response(payload)
                .compressed(compressed)
                .metadata(metadata)
                .createdAt(now)
                .lastAccessed(now)
                .accessCount(0)
                .relevance(0.0)
                .relevanceSamples(0)
                .ttlSeconds(current.getDefaultTtl().getSeconds())
                .build();

        ReentrantLock lock = locks.lockFor(key.getFingerprint());
        lock.lock();
        try {
            Optional<String> existing = store.get(HASH_PREFIX + key.getFingerprint()).map(SimilarityCacheStore::utf8);
            if (existing.isPresent()) {
                removeIndexRecord(existing.get());
                deleteEntry(existing.get(), key.getFingerprint());
                log.debug("Replaced cache entry: fingerprint={}, previous={}", key.getFingerprint(), existing.get());
            }

            persist(entry, 0);
            store.zadd(IDX_ACCESS_COUNT, entry.getId(), 0);
            store.set(HASH_PREFIX + key.getFingerprint(), entry.getId().getBytes(StandardCharsets.UTF_8));
        } finally {
            lock.unlock();
        }

        if (embedding != null) {
            try {
                index.upsert(entry.getId(), embedding);
            } catch (CacheException e) {
                log.warn("Vector index unavailable, entry is exact-only: id={}", entry.getId(), e);
            }
        }

        log.debug("Stored cache entry: id={}, partition={}, size={}B, compressed={}",
                entry.getId(), entry.getPartition(), payload.length, compressed);
        return entry;
    }

    /**
     * Remove an entry and notify the eviction listener.
     *
     * @return bytes freed, 0 if the entry was already gone
     * @throws EvictionFailureException if the durable store fails
     */
    public long remove(String entryId, EvictionReason reason) {
        removeIndexRecord(entryId);

        long freed;
        try {
            Optional<CacheEntry> entry = loadEntry(entryId);
            String fingerprint = entry.map(CacheEntry::getQueryHash).orElse(null);

            ReentrantLock lock = locks.lockFor(fingerprint);
            lock.lock();
            try {
                freed = deleteEntry(entryId, fingerprint);
            } finally {
                lock.unlock();
            }
        } catch (CacheException e) {
            throw new EvictionFailureException(entryId, e);
        }

        if (freed > 0 && evictionListener != null) {
            evictionListener.onEvicted(entryId, reason, freed);
        }
        return freed;
    }

    /**
     * Remove entries whose query contains {@code pattern} (case-insensitive) and whose
     * producing model equals {@code model}. Null arguments match everything.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern, String model) {
        String needle = pattern == null || pattern.isBlank() ? null : pattern.toLowerCase(Locale.ROOT);
        int removed = 0;

        for (String entryId : entryIds()) {
            Optional<CacheEntry> entry = loadEntry(entryId);
            if (entry.isEmpty() || !matches(entry.get(), needle, model)) {
                continue;
            }
            try {
                if (remove(entryId, EvictionReason.INVALIDATED) > 0) {
                    removed++;
                }
            } catch (EvictionFailureException e) {
                log.warn("Failed to invalidate entry: id={}", entryId, e);
            }
        }

        log.info("Invalidated {} cache entries: pattern={}, model={}", removed, pattern, model);
        return removed;
    }

    /**
     * Ids of entries whose TTL has elapsed, oldest expiry first.
     */
    public List<String> findExpired(int limit) {
        long now = clock.millis();
        return store.zrangeByScore(IDX_EXPIRES_AT, 0, now - 1, limit).stream()
                .map(ScoredMember::member)
                .toList();
    }

    /**
     * Remove expired entries in batches. Failed removals are skipped and retried next cycle.
     */
    public OptimizationResult purgeExpired(int batchSize) {
        long start = clock.millis();
        int evicted = 0;
        long reclaimed = 0;

        while (!Thread.currentThread().isInterrupted()) {
            List<String> expired = findExpired(batchSize);
            if (expired.isEmpty()) {
                break;
            }

            int removedInBatch = 0;
            for (String entryId : expired) {
                try {
                    reclaimed += remove(entryId, EvictionReason.EXPIRED);
                    evicted++;
                    removedInBatch++;
                } catch (EvictionFailureException e) {
                    log.warn("Failed to remove expired entry: id={}", entryId, e);
                }
            }

            if (removedInBatch == 0 || expired.size() < batchSize) {
                break;
            }
            Thread.yield();
        }

        if (evicted > 0) {
            log.info("Purged {} expired cache entries ({} bytes)", evicted, reclaimed);
        }

        return OptimizationResult.builder()
                .entriesEvicted(evicted)
                .storageReclaimed(reclaimed)
                .optimizationTime(clock.millis() - start)
                .build();
    }

    /**
     * Purge expired entries, compress large uncompressed payloads and reconcile the
     * storage counter with the size index.
     */
    public OptimizationResult optimize() {
        long start = clock.millis();
        CacheSettings current = settings.get();

        OptimizationResult purged = purgeExpired(current.getEvictionBatchSize());
        long recompressed = current.isCompressionEnabled() ? compressLargePayloads(current) : 0;
        reconcileStorage();

        return OptimizationResult.builder()
                .entriesEvicted(purged.getEntriesEvicted())
                .storageReclaimed(purged.getStorageReclaimed() + recompressed)
                .optimizationTime(clock.millis() - start)
                .build();
    }

    /**
     * Usage statistics of every live entry.
     */
    public List<EvictionCandidate> evictionCandidates() {
        Map<String, Double> lastAccessed = scores(IDX_LAST_ACCESSED);
        Map<String, Double> accessCounts = scores(IDX_ACCESS_COUNT);
        Map<String, Double> relevance = scores(IDX_RELEVANCE);

        List<EvictionCandidate> candidates = new ArrayList<>();
        for (ScoredMember size : store.zrangeWithScores(IDX_SIZE, Integer.MAX_VALUE)) {
            String id = size.member();
            candidates.add(EvictionCandidate.builder()
                    .id(id)
                    .lastAccessedMillis(lastAccessed.getOrDefault(id, 0.0).longValue())
                    .accessCount(accessCounts.getOrDefault(id, 0.0).longValue())
                    .relevance(relevance.getOrDefault(id, 0.0))
                    .sizeBytes((long) size.score())
                    .build());
        }
        return candidates;
    }

    public long storageUsed() {
        return store.counter(STORAGE_BYTES);
    }

    public long entryCount() {
        return store.zcard(IDX_SIZE);
    }

    /**
     * Most accessed queries, highest count first. Entries never served are left out.
     */
    public List<CacheStatistics.TopQuery> topQueries(int limit) {
        List<CacheStatistics.TopQuery> top = new ArrayList<>();
        for (ScoredMember member : store.zrevrangeWithScores(IDX_ACCESS_COUNT, limit)) {
            if (member.score() <= 0) {
                continue;
            }
            loadEntry(member.member()).ifPresent(entry -> top.add(CacheStatistics.TopQuery.builder()
                    .query(entry.getQuery())
                    .accessCount((long) member.score())
                    .build()));
        }
        return top;
    }

    @Override
    public void close() {
        semanticExecutor.shutdownNow();
    }

    private Optional<CacheHit> exactLookup(CacheKey key, CacheSettings current) {
        ReentrantLock lock = locks.lockFor(key.getFingerprint());
        lock.lock();
        try {
            Optional<String> entryId = store.get(HASH_PREFIX + key.getFingerprint()).map(SimilarityCacheStore::utf8);
            if (entryId.isEmpty()) {
                return Optional.empty();
            }

            Optional<CacheEntry> entry = loadEntry(entryId.get());
            if (entry.isEmpty()) {
                log.debug("Dropping dangling fingerprint pointer: {}", key.getFingerprint());
                store.delete(HASH_PREFIX + key.getFingerprint());
                return Optional.empty();
            }

            if (!qualifies(entry.get(), clock.instant(), current)) {
                return Optional.empty();
            }

            CacheEntry accessed = recordAccess(entry.get(), 1.0);
            log.debug("Exact cache hit: id={}", accessed.getId());
            return Optional.of(toHit(accessed, 1.0, true));
        } finally {
            lock.unlock();
        }
    }

    private Optional<CacheHit> semanticLookup(CacheKey key, CacheSettings current) {
        Future<Optional<CacheHit>> search = semanticExecutor.submit(() -> semanticSearch(key, current));
        Duration timeout = current.getSemanticTimeout();

        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return search.get();
            }
            return search.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            search.cancel(true);
            log.warn("Semantic lookup exceeded {}ms, treating as miss", timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Semantic lookup failed, treating as miss: {}", e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            search.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private Optional<CacheHit> semanticSearch(CacheKey key, CacheSettings current) {
        float[] vector = embeddings.embed(key.getNormalized());
        List<VectorMatch> matches = index.query(vector, current.getTopK());
        Instant now = clock.instant();

        List<ScoredCandidate> candidates = new ArrayList<>();
        for (VectorMatch match : matches) {
            Optional<CacheEntry> loaded = loadEntry(match.id());
            if (loaded.isEmpty()) {
                log.debug("Removing stale index record: {}", match.id());
                removeIndexRecord(match.id());
                continue;
            }

            CacheEntry entry = loaded.get();
            if (!key.getPartition().equals(entry.getPartition())
                    || entry.getQueryEmbedding() == null
                    || !qualifies(entry, now, current)
                    || entry.quality() < current.getQualityThreshold()) {
                continue;
            }

            double similarity = CosineSimilarity.similarity(vector, entry.getQueryEmbedding());
            if (similarity >= current.getSimilarityThreshold()) {
                candidates.add(new ScoredCandidate(entry, similarity));
            }
        }

        candidates.sort(CANDIDATE_ORDER);

        for (ScoredCandidate candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            Optional<CacheHit> hit = accessCandidate(candidate, now, current);
            if (hit.isPresent()) {
                log.debug("Semantic cache hit: id={}, similarity={}",
                        candidate.entry().getId(), String.format("%.4f", candidate.similarity()));
                return hit;
            }
        }
        return Optional.empty();
    }

    private Optional<CacheHit> accessCandidate(ScoredCandidate candidate, Instant now, CacheSettings current) {
        ReentrantLock lock = locks.lockFor(candidate.entry().getQueryHash());
        lock.lock();
        try {
            // Lookup timed out while waiting for the lock; the caller already saw a miss.
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            // Entry may have been replaced or evicted since it was scored.
            Optional<CacheEntry> fresh = loadEntry(candidate.entry().getId())
                    .filter(entry -> qualifies(entry, now, current));
            if (fresh.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry accessed = recordAccess(fresh.get(), candidate.similarity());
            return Optional.of(toHit(accessed, candidate.similarity(), false));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Caller holds the entry's fingerprint lock. The access counter is incremented in the
     * durable store so instances sharing it never lose a count; the remaining bookkeeping is
     * last-writer-wins across instances.
     */
    private CacheEntry recordAccess(CacheEntry entry, double similarity) {
        int samples = Math.min(entry.getRelevanceSamples() + 1, MAX_RELEVANCE_SAMPLES);
        double relevance = entry.getRelevance() + (similarity - entry.getRelevance()) / samples;
        long accessCount = (long) store.zincrby(IDX_ACCESS_COUNT, entry.getId(), 1);

        CacheEntry accessed = entry.toBuilder()
                .accessCount(accessCount)
                .lastAccessed(clock.instant())
                .relevance(relevance)
                .relevanceSamples(samples)
                .build();

        long previousSize = store.zscore(IDX_SIZE, entry.getId()).map(Double::longValue).orElse(0L);
        persist(accessed, previousSize);
        return accessed;
    }

    /**
     * Write the entry and its index records. Caller holds the entry's fingerprint lock.
     *
     * @return persisted size in bytes
     */
    private long persist(CacheEntry entry, long previousSize) {
        byte[] encoded = codec.encode(entry);
        String id = entry.getId();

        store.set(ENTRY_PREFIX + id, encoded);
        store.zadd(IDX_LAST_ACCESSED, id, entry.getLastAccessed().toEpochMilli());
        store.zadd(IDX_RELEVANCE, id, entry.getRelevance());
        Optional<Instant> expiry = entry.expiryInstant();
        if (expiry.isPresent()) {
            store.zadd(IDX_EXPIRES_AT, id, expiry.get().toEpochMilli());
        } else {
            store.zrem(IDX_EXPIRES_AT, id);
        }
        store.zadd(IDX_SIZE, id, encoded.length);

        if (encoded.length != previousSize) {
            store.incrBy(STORAGE_BYTES, encoded.length - previousSize);
        }
        return encoded.length;
    }

    /**
     * Delete the entry, its index records and, if it still points here, its fingerprint pointer.
     *
     * @return bytes freed
     */
    private long deleteEntry(String entryId, String fingerprint) {
        long size = store.zscore(IDX_SIZE, entryId).map(Double::longValue).orElse(0L);
        boolean existed = store.delete(ENTRY_PREFIX + entryId);

        store.zrem(IDX_LAST_ACCESSED, entryId);
        store.zrem(IDX_ACCESS_COUNT, entryId);
        store.zrem(IDX_RELEVANCE, entryId);
        store.zrem(IDX_EXPIRES_AT, entryId);
        store.zrem(IDX_SIZE, entryId);
        if (size > 0) {
            store.incrBy(STORAGE_BYTES, -size);
        }

        if (fingerprint != null) {
            String pointerKey = HASH_PREFIX + fingerprint;
            boolean ownsPointer = store.get(pointerKey)
                    .map(SimilarityCacheStore::utf8)
                    .filter(entryId::equals)
                    .isPresent();
            if (ownsPointer) {
                store.delete(pointerKey);
            }
        }

        return existed ? Math.max(size, 1) : 0;
    }

    private void removeIndexRecord(String entryId) {
        try {
            index.remove(entryId);
        } catch (CacheException e) {
            log.warn("Failed to remove vector index record: id={}", entryId, e);
        }
    }

    private Optional<CacheEntry> loadEntry(String entryId) {
        Optional<byte[]> data = store.get(ENTRY_PREFIX + entryId);
        if (data.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(data.get()));
        } catch (CollaboratorUnavailableException e) {
            throw e;
        } catch (CacheException e) {
            log.warn("Unreadable cache entry: id={}", entryId, e);
            return Optional.empty();
        }
    }

    private long compressLargePayloads(CacheSettings current) {
        long reclaimed = 0;
        for (String entryId : entryIds()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                reclaimed += compressEntry(entryId, current);
            } catch (CacheException e) {
                log.warn("Failed to compress entry: id={}", entryId, e);
            }
        }
        if (reclaimed > 0) {
            log.info("Compression pass reclaimed {} bytes", reclaimed);
        }
        return reclaimed;
    }

    private long compressEntry(String entryId, CacheSettings current) {
        Optional<CacheEntry> peek = loadEntry(entryId);
        if (peek.isEmpty() || peek.get().isCompressed()
                || peek.get().getResponse() == null
                || peek.get().getResponse().length <= current.getCompressionThreshold()) {
            return 0;
        }

        ReentrantLock lock = locks.lockFor(peek.get().getQueryHash());
        lock.lock();
        try {
            Optional<CacheEntry> entry = loadEntry(entryId);
            if (entry.isEmpty() || entry.get().isCompressed()) {
                return 0;
            }
            byte[] gzipped = codec.compress(entry.get().getResponse());
            if (gzipped.length >= entry.get().getResponse().length) {
                return 0;
            }

            long previousSize = store.zscore(IDX_SIZE, entryId).map(Double::longValue).orElse(0L);
            long newSize = persist(entry.get().toBuilder()
                    .response(gzipped)
                    .compressed(true)
                    .build(), previousSize);
            return Math.max(0, previousSize - newSize);
        } finally {
            lock.unlock();
        }
    }

    private void reconcileStorage() {
        long actual = store.zrangeWithScores(IDX_SIZE, Integer.MAX_VALUE).stream()
                .mapToLong(member -> (long) member.score())
                .sum();
        long recorded = store.counter(STORAGE_BYTES);
        if (actual != recorded) {
            log.info("Reconciling storage counter: recorded={}, actual={}", recorded, actual);
            store.incrBy(STORAGE_BYTES, actual - recorded);
        }
    }

    private List<String> entryIds() {
        return store.keys(ENTRY_PREFIX).stream()
                .map(key -> key.substring(ENTRY_PREFIX.length()))
                .sorted()
                .toList();
    }

    private Map<String, Double> scores(String indexKey) {
        Map<String, Double> scores = new HashMap<>();
        for (ScoredMember member : store.zrangeWithScores(indexKey, Integer.MAX_VALUE)) {
            scores.put(member.member(), member.score());
        }
        return scores;
    }

    private boolean qualifies(CacheEntry entry, Instant now, CacheSettings current) {
        if (entry.isExpiredAt(now)) {
            return false;
        }
        Duration maxAge = current.getMaxCacheAge();
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative() || entry.getCreatedAt() == null) {
            return true;
        }
        return !now.isAfter(entry.getCreatedAt().plus(maxAge));
    }

    private static boolean matches(CacheEntry entry, String needle, String model) {
        if (needle != null && (entry.getQuery() == null
                || !entry.getQuery().toLowerCase(Locale.ROOT).contains(needle))) {
            return false;
        }
        if (model != null) {
            return entry.getMetadata() != null && model.equals(entry.getMetadata().getModel());
        }
        return true;
    }

    private CacheHit toHit(CacheEntry entry, double similarity, boolean exact) {
        CacheEntry served = entry.toBuilder()
                .response(codec.responseOf(entry))
                .compressed(false)
                .build();
        EntryMetadata metadata = entry.getMetadata();
        return CacheHit.builder()
                .entry(served)
                .similarity(similarity)
                .exact(exact)
                .timeSaved(metadata != null ? metadata.getResponseTimeMs() : 0)
                .costSaved(metadata != null ? metadata.getCost() : 0.0)
                .build();
    }

    private static String utf8(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    private record ScoredCandidate(CacheEntry entry, double similarity) {
    }
}
