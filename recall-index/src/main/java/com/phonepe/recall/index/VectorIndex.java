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

package com.phonepe.recall.index;

import com.google.common.base.Stopwatch;
import com.phonepe.recall.core.model.IndexStats;
import com.phonepe.recall.core.model.MemoryCategory;
import com.phonepe.recall.embedding.EmbeddingModel;
import com.phonepe.recall.embedding.VectorMath;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory vector index. Besides the id to vector mapping it maintains secondary indices from category and tag to
 * ids and an ordering of ids by descending importance.
 * Iteration order everywhere is insertion order, which is what breaks ties between equal scores. Every operation
 * holds a single lock for its full duration.
 */
@Slf4j
public class VectorIndex {
    private final EmbeddingModel embeddingModel;
    @Getter
    private final int dimension;
    private final Clock clock;

    private final Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private final Map<MemoryCategory, Set<String>> categoryIndex = new EnumMap<>(MemoryCategory.class);
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private List<String> importanceOrder = List.of();

    private final ReentrantLock lock = new ReentrantLock();

    private long searchCount;
    private long totalSearchNanos;
    private long indexUpdates;

    @Builder
    public VectorIndex(@NonNull EmbeddingModel embeddingModel, int dimension, Clock clock) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive. Provided: " + dimension);
        }
        this.embeddingModel = embeddingModel;
        this.dimension = dimension;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
    }

    /**
     * Embed the text and index it under the given id. An existing entry with the same id is replaced and keeps its
     * position in insertion order.
     *
     * @return false if the text could not be embedded or the embedding has the wrong dimension
     */
    public boolean insert(String id,
                          String text,
                          MemoryCategory category,
                          double importance,
                          Collection<String> tags) {
        final float[] vector;
        try {
            vector = embeddingModel.getEmbedding(text);
        }
        catch (Exception e) {
            log.error("Failed to embed text for memory {}", id, e);
            return false;
        }
        if (vector == null || vector.length != dimension) {
            log.error("Embedding for memory {} has dimension {}, expected {}",
                      id, vector == null ? 0 : vector.length, dimension);
            return false;
        }
        lock.lock();
        try {
            put(IndexEntry.builder()
                        .id(id)
                        .vector(VectorMath.normalize(vector))
                        .category(category)
                        .importance(importance)
                        .tags(tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags)))
                        .createdAt(LocalDateTime.now(clock))
                        .build());
            indexUpdates++;
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Install an already computed entry, used when loading persisted state
     *
     * @return false if the vector does not match the dimension of this index
     */
    public boolean restore(@NonNull IndexEntry entry) {
        if (entry.getVector().length != dimension) {
            log.warn("Ignoring stored vector for {} with dimension {}, expected {}",
                     entry.getId(), entry.getVector().length, dimension);
            return false;
        }
        lock.lock();
        try {
            put(entry);
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Find entries similar to the query text.
     *
     * @param queryText      Text to search for
     * @param limit          Maximum number of results
     * @param categoryFilter If set, only entries of this category are considered
     * @param tagFilter      If set and not empty, only entries having at least one of these tags are considered
     * @param minSimilarity  Entries less similar than this are dropped
     * @return Ids ordered by descending similarity
     */
    public List<ScoredId> search(String queryText,
                                 int limit,
                                 MemoryCategory categoryFilter,
                                 Collection<String> tagFilter,
                                 double minSimilarity) {
        if (limit <= 0) {
            return List.of();
        }
        final var stopwatch = Stopwatch.createStarted();
        final float[] queryVector;
        try {
            queryVector = embeddingModel.getEmbedding(queryText);
        }
        catch (Exception e) {
            log.error("Failed to embed query", e);
            return List.of();
        }
        lock.lock();
        try {
            final var candidates = candidates(categoryFilter, tagFilter);
            final var matches = new ArrayList<ScoredId>();
            for (final var entry : entries.values()) {
                if (candidates != null && !candidates.contains(entry.getId())) {
                    continue;
                }
                final var similarity = clamp(VectorMath.cosineSimilarity(queryVector, entry.getVector()));
                if (similarity >= minSimilarity) {
                    matches.add(new ScoredId(entry.getId(), similarity));
                }
            }
            //List.sort is stable, so equal scores stay in insertion order
            matches.sort(Comparator.comparingDouble(ScoredId::getSimilarity).reversed());
            searchCount++;
            totalSearchNanos += stopwatch.elapsed(TimeUnit.NANOSECONDS);
            return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Ids of the most important entries
     *
     * @param limit          Maximum number of ids
     * @param categoryFilter If set, only entries of this category are returned
     * @return Ids by descending importance, ties in insertion order
     */
    public List<String> topImportant(int limit, MemoryCategory categoryFilter) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            return importanceOrder.stream()
                    .filter(id -> categoryFilter == null || entries.get(id).getCategory() == categoryFilter)
                    .limit(limit)
                    .toList();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Remove an entry and all references to it
     *
     * @return false if no entry exists with this id
     */
    public boolean remove(String id) {
        lock.lock();
        try {
            final var existing = entries.remove(id);
            if (existing == null) {
                return false;
            }
            unlinkSecondary(existing);
            importanceOrder = importanceOrder.stream()
                    .filter(other -> !other.equals(id))
                    .toList();
            indexUpdates++;
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    public Optional<IndexEntry> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id));
        }
        finally {
            lock.unlock();
        }
    }

    public boolean contains(String id) {
        lock.lock();
        try {
            return entries.containsKey(id);
        }
        finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return All entries in insertion order
     */
    public List<IndexEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        }
        finally {
            lock.unlock();
        }
    }

    public IndexStats stats() {
        lock.lock();
        try {
            return IndexStats.builder()
                    .totalVectors(entries.size())
                    .categories(categoryIndex.size())
                    .tags(tagIndex.size())
                    .dimension(dimension)
                    .searchCount(searchCount)
                    .averageSearchTimeMillis(searchCount == 0
                                             ? 0.0
                                             : totalSearchNanos / (double) searchCount / 1_000_000.0)
                    .indexUpdates(indexUpdates)
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Carry over counters from persisted stats so that averages survive restarts
     */
    public void restoreStats(IndexStats stats) {
        if (stats == null) {
            return;
        }
        lock.lock();
        try {
            searchCount = Math.max(0, stats.getSearchCount());
            totalSearchNanos = (long) (stats.getAverageSearchTimeMillis() * 1_000_000.0 * searchCount);
            indexUpdates = Math.max(0, stats.getIndexUpdates());
        }
        finally {
            lock.unlock();
        }
    }

    private void put(IndexEntry entry) {
        final var previous = entries.put(entry.getId(), entry);
        if (previous != null) {
            unlinkSecondary(previous);
        }
        categoryIndex.computeIfAbsent(entry.getCategory(), category -> new LinkedHashSet<>()).add(entry.getId());
        entry.getTags().forEach(tag -> tagIndex.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(entry.getId()));
        importanceOrder = entries.values()
                .stream()
                .sorted(Comparator.comparingDouble(IndexEntry::getImportance).reversed())
                .map(IndexEntry::getId)
                .toList();
    }

    private void unlinkSecondary(IndexEntry entry) {
        final var inCategory = categoryIndex.get(entry.getCategory());
        if (inCategory != null) {
            inCategory.remove(entry.getId());
            if (inCategory.isEmpty()) {
                categoryIndex.remove(entry.getCategory());
            }
        }
        entry.getTags().forEach(tag -> {
            final var tagged = tagIndex.get(tag);
            if (tagged != null) {
                tagged.remove(entry.getId());
                if (tagged.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        });
    }

    /**
     * @return Candidate ids, or null if every entry is a candidate
     */
    private Set<String> candidates(MemoryCategory categoryFilter, Collection<String> tagFilter) {
        final var hasTags = tagFilter != null && !tagFilter.isEmpty();
        if (categoryFilter == null && !hasTags) {
            return null;
        }
        Set<String> tagged = null;
        if (hasTags) {
            tagged = new LinkedHashSet<>();
            for (final var tag : tagFilter) {
                tagged.addAll(tagIndex.getOrDefault(tag, Set.of()));
            }
        }
        if (categoryFilter == null) {
            return tagged;
        }
        final var inCategory = new LinkedHashSet<>(categoryIndex.getOrDefault(categoryFilter, Set.of()));
        if (tagged != null) {
            inCategory.retainAll(tagged);
        }
        return inCategory;
    }

    private static double clamp(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
