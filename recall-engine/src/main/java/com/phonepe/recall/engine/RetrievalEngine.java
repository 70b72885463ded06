/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.recall.engine;

import com.google.common.base.Stopwatch;
import com.google.common.hash.Hashing;
import com.phonepe.recall.cache.QuerySimilarity;
import com.phonepe.recall.cache.SemanticCache;
import com.phonepe.recall.core.config.RetrievalConfig;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;
import com.phonepe.recall.core.model.CacheStats;
import com.phonepe.recall.core.model.FragmentMetadata;
import com.phonepe.recall.core.model.IndexStats;
import com.phonepe.recall.core.model.MemoryCategory;
import com.phonepe.recall.core.model.MemoryFragment;
import com.phonepe.recall.core.model.RankedResult;
import com.phonepe.recall.core.model.RetrievalStats;
import com.phonepe.recall.core.storage.FragmentSnapshot;
import com.phonepe.recall.core.storage.IndexSnapshot;
import com.phonepe.recall.core.storage.SnapshotStore;
import com.phonepe.recall.core.storage.StoredFragment;
import com.phonepe.recall.core.storage.StoredVector;
import com.phonepe.recall.core.utils.JsonUtils;
import com.phonepe.recall.embedding.CharFrequencyEmbeddingModel;
import com.phonepe.recall.embedding.EmbeddingModel;
import com.phonepe.recall.embedding.NormalizingEmbeddingModel;
import com.phonepe.recall.filesystem.FileSystemSnapshotStore;
import com.phonepe.recall.index.IndexEntry;
import com.phonepe.recall.index.VectorIndex;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Persistent semantic memory for a single collection. Ties together the fragment store, the vector index, the
 * query cache and snapshot persistence.
 * Every mutation invalidates the cache and is written through to the {@link SnapshotStore}. Persistence failures are
 * logged and never surface to callers; the in-memory state stays authoritative until the next successful write.
 * All public operations are serialised on a single lock.
 */
@Slf4j
public class RetrievalEngine implements AutoCloseable {
    public static final double DEFAULT_IMPORTANCE = 0.5;
    public static final int DEFAULT_LIMIT = 10;

    private static final AtomicLong ID_SEQUENCE = new AtomicLong();

    @Getter
    private final String collectionId;
    @Getter
    private final RetrievalConfig config;
    private final EmbeddingModel embeddingModel;
    private final SemanticCache cache;
    private final SnapshotStore snapshotStore;
    private final Clock clock;

    private final Map<String, MemoryFragment> fragments = new LinkedHashMap<>();
    private final Map<String, FragmentMetadata> metadata = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private VectorIndex index;

    private long totalRetrievals;
    private long cacheHits;
    private long vectorSearches;
    private double totalRetrievalMillis;
    private boolean closed;

    @Builder
    public RetrievalEngine(@NonNull String collectionId,
                           RetrievalConfig config,
                           EmbeddingModel embeddingModel,
                           @NonNull SnapshotStore snapshotStore,
                           Clock clock) {
        this.collectionId = collectionId;
        this.config = Objects.requireNonNullElseGet(config, RetrievalConfig::defaults).validate();
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
        this.embeddingModel = new NormalizingEmbeddingModel(
                Objects.requireNonNullElseGet(
                        embeddingModel,
                        () -> CharFrequencyEmbeddingModel.builder()
                                .dimension(this.config.getDimension())
                                .build()),
                this.config.getDimension());
        this.cache = SemanticCache.builder()
                .maxSize(this.config.getCacheMaxSize())
                .ttlHours(this.config.getCacheTtlHours())
                .querySimilarity(new QuerySimilarity(this.config.getQueryJaccardWeight(),
                                                     this.config.getQueryCharWeight()))
                .clock(this.clock)
                .build();
        this.snapshotStore = snapshotStore;
        this.index = newIndex();
        load();
    }

    public static RetrievalEngine open(Path baseDir, String collectionId) {
        return open(baseDir, collectionId, RetrievalConfig.defaults());
    }

    /**
     * Open a collection persisted as JSON files under the given directory, creating the directory if needed
     */
    public static RetrievalEngine open(Path baseDir, String collectionId, RetrievalConfig config) {
        return RetrievalEngine.builder()
                .collectionId(collectionId)
                .config(config)
                .snapshotStore(FileSystemSnapshotStore.builder()
                                       .baseDir(baseDir)
                                       .collectionId(collectionId)
                                       .mapper(JsonUtils.createMapper())
                                       .build())
                .build();
    }

    public Optional<String> addMemory(String content, MemoryCategory category) {
        return addMemory(content, category, DEFAULT_IMPORTANCE, List.of());
    }

    public Optional<String> addMemory(String content, String category, double importance, Collection<String> tags) {
        return addMemory(content, MemoryCategory.fromValue(category), importance, tags);
    }

    /**
     * Store a new fragment and index it.
     *
     * @param content    Text of the fragment. May be empty but not null.
     * @param category   Category of the fragment
     * @param importance Between 0 and 1
     * @param tags       Tags, may be null
     * @return Id of the new fragment, or empty if it could not be indexed
     * @throws MemoryValidationException if any parameter is invalid. Nothing is changed in that case.
     */
    public Optional<String> addMemory(String content,
                                      MemoryCategory category,
                                      double importance,
                                      Collection<String> tags) {
        if (content == null) {
            throw new MemoryValidationException(ErrorType.INVALID_CONTENT);
        }
        if (category == null) {
            throw new MemoryValidationException(ErrorType.INVALID_CATEGORY, "null");
        }
        if (Double.isNaN(importance) || importance < 0 || importance > 1) {
            throw new MemoryValidationException(ErrorType.INVALID_IMPORTANCE, importance);
        }
        final var tagList = cleanTags(tags);
        lock.lock();
        try {
            final var id = nextId(content);
            try {
                fragments.put(id, MemoryFragment.builder()
                        .id(id)
                        .content(content)
                        .category(category)
                        .importance(importance)
                        .tags(tagList)
                        .createdAt(LocalDateTime.now(clock))
                        .projectId(collectionId)
                        .build());
                metadata.put(id, FragmentMetadata.created(clock.millis()));
                if (!index.insert(id, content, category, importance, tagList)) {
                    log.error("Memory {} was stored but could not be indexed. Run optimizeIndices() to repair", id);
                    return Optional.empty();
                }
                cache.clear();
            }
            catch (RuntimeException e) {
                log.error("Error adding memory {}: {}", id, e.getMessage(), e);
                return Optional.empty();
            }
            persist();
            log.debug("Added memory {} in category {}", id, category.value());
            return Optional.of(id);
        }
        finally {
            lock.unlock();
        }
    }

    public SearchResponse searchMemories(String query) {
        return searchMemories(query, DEFAULT_LIMIT);
    }

    public SearchResponse searchMemories(String query, int limit) {
        return searchMemories(query, limit, null, null, config.getMinSimilarityDefault(), true);
    }

    /**
     * Find fragments similar to the query. Candidates are scored on cosine similarity, then re-ranked on a weighted
     * combination of similarity and importance.
     *
     * @param query         Query text
     * @param limit         Maximum number of results, must be positive
     * @param category      If set, only fragments of this category are returned
     * @param tags          If set and not empty, only fragments having at least one of these tags are returned
     * @param minSimilarity Fragments less similar than this are not returned
     * @param useCache      Whether to consult and populate the query cache. Cached results are only reused for the
     *                      same limit, filters and minimum similarity. Empty results are never cached.
     * @return Ranked results along with where they came from
     */
    public SearchResponse searchMemories(String query,
                                         int limit,
                                         MemoryCategory category,
                                         Collection<String> tags,
                                         double minSimilarity,
                                         boolean useCache) {
        if (limit < 1) {
            throw new MemoryValidationException(ErrorType.INVALID_ARGUMENT, "limit must be positive");
        }
        final var text = Objects.requireNonNullElse(query, "");
        final var scope = cacheScope(limit, category, tags, minSimilarity);
        final var stopwatch = Stopwatch.createStarted();
        lock.lock();
        try {
            totalRetrievals++;
            if (useCache) {
                final var cached = cache.get(scope, text, config.getCacheSimilarityThreshold());
                if (cached.isPresent()) {
                    cacheHits++;
                    return response(text, cached.get(), ResultSource.CACHE, stopwatch);
                }
            }
            vectorSearches++;
            final var now = LocalDateTime.now(clock);
            final var candidateLimit = (int) Math.min(Integer.MAX_VALUE, 2L * limit);
            final var results = new ArrayList<RankedResult>();
            for (final var scored : index.search(text, candidateLimit, category, tags, minSimilarity)) {
                final var fragment = fragments.get(scored.getId());
                if (fragment == null) {
                    log.warn("Index returned unknown memory {}", scored.getId());
                    continue;
                }
                results.add(hydrate(fragment, scored.getSimilarity(), now));
            }
            results.sort(Comparator.comparingDouble(this::rankScore).reversed());
            final var ranked = List.copyOf(results.subList(0, Math.min(limit, results.size())));
            if (useCache && !ranked.isEmpty()) {
                cache.put(scope, text, ranked);
            }
            return response(text, ranked, ResultSource.VECTOR_SEARCH, stopwatch);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Search without a tag filter, returning just the results
     */
    public List<RankedResult> searchMemoryResults(String query,
                                                  int limit,
                                                  MemoryCategory category,
                                                  double minSimilarity) {
        return searchMemories(query, limit, category, null, minSimilarity, true).getResults();
    }

    /**
     * Look up a fragment by id. Counts as an access.
     */
    public Optional<RankedResult> getMemory(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(fragments.get(id))
                    .map(fragment -> hydrate(fragment, null, LocalDateTime.now(clock)));
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a fragment was removed
     */
    public boolean removeMemory(String id) {
        lock.lock();
        try {
            if (fragments.remove(id) == null) {
                return false;
            }
            metadata.remove(id);
            index.remove(id);
            cache.clear();
            persist();
            log.debug("Removed memory {}", id);
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Most important fragments, ties broken by insertion order
     *
     * @param limit    Maximum number of results, must be positive
     * @param category If set, only fragments of this category are returned
     */
    public List<RankedResult> getTopMemories(int limit, MemoryCategory category) {
        if (limit < 1) {
            throw new MemoryValidationException(ErrorType.INVALID_ARGUMENT, "limit must be positive");
        }
        lock.lock();
        try {
            final var now = LocalDateTime.now(clock);
            return index.topImportant(limit, category)
                    .stream()
                    .map(fragments::get)
                    .filter(Objects::nonNull)
                    .map(fragment -> hydrate(fragment, null, now))
                    .toList();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Housekeeping: drops expired cache entries, rebuilds the index if it has drifted from the fragment store and
     * prunes stale access bookkeeping.
     */
    public OptimizationReport optimizeIndices() {
        lock.lock();
        try {
            final var expired = cache.clearExpired();
            final var rebuilt = !isConsistent();
            if (rebuilt) {
                log.warn("Index for {} has {} entries for {} memories. Rebuilding",
                         collectionId, index.size(), fragments.size());
                rebuildIndex();
            }
            final var pruned = pruneMetadata();
            if (rebuilt || pruned > 0) {
                persist();
            }
            log.info("Optimised {}: {} expired cache entries, {} metadata entries pruned, rebuilt: {}",
                     collectionId, expired, pruned, rebuilt);
            return OptimizationReport.builder()
                    .expiredCacheEntries(expired)
                    .rebuilt(rebuilt)
                    .prunedMetadata(pruned)
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Re-embed every fragment into a fresh index
     */
    public void rebuild() {
        lock.lock();
        try {
            rebuildIndex();
            persist();
        }
        finally {
            lock.unlock();
        }
    }

    public BenchmarkReport benchmarkPerformance() {
        return benchmarkPerformance(PerformanceBenchmark.DEFAULT_NUM_QUERIES);
    }

    public BenchmarkReport benchmarkPerformance(int numQueries) {
        return new PerformanceBenchmark(this).run(numQueries);
    }

    public PerformanceSummary performanceSummary() {
        lock.lock();
        try {
            final var indexStats = index.stats();
            final var cacheStats = cache.stats();
            return PerformanceSummary.builder()
                    .retrievalStats(retrievalStats())
                    .indexStats(indexStats)
                    .cacheStats(cacheStats)
                    .memoryCount(fragments.size())
                    .indexHealth(IndexHealthAssessor.assess(indexStats, cacheStats, fragments.size()))
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    public IndexStats indexStats() {
        lock.lock();
        try {
            return index.stats();
        }
        finally {
            lock.unlock();
        }
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public RetrievalStats retrievalStats() {
        lock.lock();
        try {
            return RetrievalStats.builder()
                    .totalRetrievals(totalRetrievals)
                    .cacheHits(cacheHits)
                    .vectorSearches(vectorSearches)
                    .averageRetrievalTimeMillis(totalRetrievals == 0 ? 0.0 : totalRetrievalMillis / totalRetrievals)
                    .totalMemories(fragments.size())
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return fragments.size();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Flush state to the snapshot store. Safe to call more than once.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            persist();
            embeddingModel.close();
            closed = true;
            log.info("Closed collection {} with {} memories", collectionId, fragments.size());
        }
        finally {
            lock.unlock();
        }
    }

    private SearchResponse response(String query,
                                    List<RankedResult> results,
                                    ResultSource source,
                                    Stopwatch stopwatch) {
        final var elapsedMillis = stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1_000_000.0;
        totalRetrievalMillis += elapsedMillis;
        return SearchResponse.builder()
                .query(query)
                .results(results)
                .totalFound(results.size())
                .processingTimeMillis(elapsedMillis)
                .source(source)
                .build();
    }

    private RankedResult hydrate(MemoryFragment fragment, Double similarity, LocalDateTime now) {
        final var accessCount = metadata.computeIfAbsent(fragment.getId(),
                                                         id -> FragmentMetadata.created(clock.millis()))
                .recordAccess(now);
        return RankedResult.builder()
                .id(fragment.getId())
                .content(fragment.getContent())
                .category(fragment.getCategory())
                .importance(fragment.getImportance())
                .similarity(similarity)
                .tags(fragment.getTags())
                .createdAt(fragment.getCreatedAt())
                .accessCount(accessCount)
                .build();
    }

    private double rankScore(RankedResult result) {
        final var similarity = result.getSimilarity() == null ? 0.0 : result.getSimilarity();
        return similarity * config.getRankSimilarityWeight()
                + result.getImportance() * config.getRankImportanceWeight();
    }

    private VectorIndex newIndex() {
        return VectorIndex.builder()
                .embeddingModel(embeddingModel)
                .dimension(config.getDimension())
                .clock(clock)
                .build();
    }

    private boolean isConsistent() {
        return fragments.size() == index.size() && fragments.keySet().stream().allMatch(index::contains);
    }

    private void rebuildIndex() {
        final var fresh = newIndex();
        for (final var fragment : fragments.values()) {
            if (!fresh.insert(fragment.getId(),
                              fragment.getContent(),
                              fragment.getCategory(),
                              fragment.getImportance(),
                              fragment.getTags())) {
                log.error("Could not re-index memory {}", fragment.getId());
            }
        }
        index = fresh;
        cache.clear();
        log.info("Rebuilt index for {} with {} entries", collectionId, fresh.size());
    }

    /**
     * Drops bookkeeping for fragments that no longer exist, and for fragments never accessed within the retention
     * period. The fragments themselves are kept.
     */
    private int pruneMetadata() {
        final var cutoffMillis = clock.millis() - TimeUnit.DAYS.toMillis(config.getMetadataRetentionDays());
        final var before = metadata.size();
        metadata.entrySet().removeIf(entry -> !fragments.containsKey(entry.getKey())
                || (entry.getValue().getAccessCount() == 0 && entry.getValue().getCreationTime() < cutoffMillis));
        return before - metadata.size();
    }

    private void load() {
        final var now = LocalDateTime.now(clock);
        final var storedFragments = readSnapshot(snapshotStore::loadFragments, "memories");
        storedFragments.ifPresent(snapshot -> {
            Objects.requireNonNullElse(snapshot.getMemories(), Map.<String, StoredFragment>of())
                    .forEach((id, stored) -> {
                        try {
                            fragments.put(id, stored.toFragment(id, collectionId, now));
                        }
                        catch (RuntimeException e) {
                            log.error("Skipping unreadable memory {}: {}", id, e.getMessage());
                        }
                    });
            Objects.requireNonNullElse(snapshot.getMetadata(), Map.<String, FragmentMetadata>of())
                    .forEach((id, meta) -> {
                        if (meta != null) {
                            metadata.put(id, new FragmentMetadata(meta.getAccessCount(),
                                                                  meta.getLastAccess(),
                                                                  meta.getCreationTime()));
                        }
                    });
            restoreRetrievalStats(snapshot.getPerformanceStats());
        });
        final var storedIndex = readSnapshot(snapshotStore::loadIndex, "vector index");
        var needsRebuild = false;
        if (storedIndex.isPresent()) {
            final var vectors = Objects.requireNonNullElse(storedIndex.get().getIndices(),
                                                           Map.<String, StoredVector>of());
            for (final var id : fragments.keySet()) {
                final var stored = vectors.get(id);
                if (stored == null || !restoreVector(id, stored)) {
                    needsRebuild = true;
                }
            }
            if (vectors.keySet().stream().anyMatch(id -> !fragments.containsKey(id))) {
                needsRebuild = true;
            }
            index.restoreStats(storedIndex.get().getStats());
        }
        else {
            needsRebuild = !fragments.isEmpty();
        }
        if (needsRebuild) {
            log.warn("Stored index for {} does not match its {} memories. Rebuilding", collectionId, fragments.size());
            rebuildIndex();
            persist();
        }
        log.info("Loaded collection {} with {} memories", collectionId, fragments.size());
    }

    private boolean restoreVector(String id, StoredVector stored) {
        try {
            return index.restore(IndexEntry.fromStored(id, stored));
        }
        catch (RuntimeException e) {
            log.warn("Ignoring unreadable stored vector for {}: {}", id, e.getMessage());
            return false;
        }
    }

    private <T> Optional<T> readSnapshot(Supplier<Optional<T>> reader, String what) {
        try {
            return reader.get();
        }
        catch (RuntimeException e) {
            log.error("Could not load {} for {}. Starting without them: {}", what, collectionId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private void restoreRetrievalStats(RetrievalStats stats) {
        if (stats == null) {
            return;
        }
        totalRetrievals = Math.max(0, stats.getTotalRetrievals());
        cacheHits = Math.max(0, stats.getCacheHits());
        vectorSearches = Math.max(0, stats.getVectorSearches());
        totalRetrievalMillis = stats.getAverageRetrievalTimeMillis() * totalRetrievals;
    }

    private void persist() {
        final var now = LocalDateTime.now(clock);
        try {
            final var fragmentSnapshot = FragmentSnapshot.builder();
            fragments.forEach((id, fragment) -> fragmentSnapshot.memory(id, StoredFragment.from(fragment)));
            metadata.forEach((id, meta) -> fragmentSnapshot.metadataEntry(
                    id, new FragmentMetadata(meta.getAccessCount(), meta.getLastAccess(), meta.getCreationTime())));
            final var indexSnapshot = IndexSnapshot.builder();
            index.entries().forEach(entry -> indexSnapshot.index(entry.getId(), entry.toStored()));
            snapshotStore.save(fragmentSnapshot.performanceStats(retrievalStats()).lastSaved(now).build(),
                               indexSnapshot.stats(index.stats()).lastSaved(now).build());
        }
        catch (RuntimeException e) {
            log.error("Failed to persist collection {}. In-memory state is retained: {}",
                      collectionId, e.getMessage(), e);
        }
    }

    /**
     * Everything besides the query text that decides what a search returns
     */
    private static String cacheScope(int limit,
                                     MemoryCategory category,
                                     Collection<String> tags,
                                     double minSimilarity) {
        return "limit=%d|category=%s|tags=%s|minSimilarity=%s".formatted(
                limit,
                category == null ? "*" : category.value(),
                tags == null ? List.of() : tags.stream().filter(Objects::nonNull).distinct().sorted().toList(),
                minSimilarity);
    }

    private static List<String> cleanTags(Collection<String> tags) {
        if (tags == null) {
            return List.of();
        }
        final Set<String> cleaned = new LinkedHashSet<>();
        tags.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(tag -> !tag.isEmpty())
                .forEach(cleaned::add);
        return List.copyOf(cleaned);
    }

    private String nextId(String content) {
        final var hash = Hashing.murmur3_32_fixed().hashString(content, StandardCharsets.UTF_8).toString();
        return "mem_%d_%d_%s".formatted(clock.millis(), ID_SEQUENCE.incrementAndGet(), hash);
    }
}
