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

package com.phonepe.recall.cache;

import com.google.common.hash.Hashing;
import com.phonepe.recall.core.model.CacheStats;
import com.phonepe.recall.core.model.RankedResult;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, time boxed cache of ranked results keyed by scope and query. A lookup first tries the normalized query and
 * then falls back to any live entry of the same scope whose query text is similar enough. The scope stands for
 * whatever else shaped the results (filters, limits); entries never match across scopes.
 * Entries are kept in least-recently-used order; a hit moves the entry to the most-recently-used end and a put at
 * capacity evicts from the other end.
 */
@Slf4j
public class SemanticCache {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    public static final String DEFAULT_SCOPE = "";

    @Getter
    private final int maxSize;
    private final Duration ttl;
    private final QuerySimilarity querySimilarity;
    private final Clock clock;

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;
    private long evictions;
    private long totalQueries;

    @Builder
    public SemanticCache(int maxSize, double ttlHours, QuerySimilarity querySimilarity, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive. Provided: " + maxSize);
        }
        if (ttlHours <= 0) {
            throw new IllegalArgumentException("TTL must be positive. Provided: " + ttlHours);
        }
        this.maxSize = maxSize;
        this.ttl = Duration.ofMillis((long) (ttlHours * Duration.ofHours(1).toMillis()));
        this.querySimilarity = Objects.requireNonNullElseGet(querySimilarity, QuerySimilarity::new);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
    }

    public Optional<List<RankedResult>> get(String queryText) {
        return get(queryText, DEFAULT_SIMILARITY_THRESHOLD);
    }

    public Optional<List<RankedResult>> get(String queryText, double similarityThreshold) {
        return get(DEFAULT_SCOPE, queryText, similarityThreshold);
    }

    /**
     * Look up results for the query
     *
     * @param scope               Scope the results were stored under
     * @param queryText           Query to look up
     * @param similarityThreshold Minimum query similarity for an entry stored under a different query to match
     * @return Cached results, empty on miss
     */
    public Optional<List<RankedResult>> get(String scope, String queryText, double similarityThreshold) {
        final var cacheScope = Objects.requireNonNullElse(scope, DEFAULT_SCOPE);
        final var text = Objects.requireNonNullElse(queryText, "");
        lock.lock();
        try {
            final var now = clock.instant();
            final var key = hash(cacheScope, text);
            final var exact = entries.get(key);
            if (exact != null) {
                if (!exact.isExpired(now, ttl)) {
                    return Optional.of(hit(exact, now));
                }
                entries.remove(key);
            }
            final var similar = entries.values()
                    .stream()
                    .filter(entry -> entry.getScope().equals(cacheScope))
                    .filter(entry -> !entry.isExpired(now, ttl))
                    .filter(entry -> querySimilarity.similarity(text, entry.getQueryText()) >= similarityThreshold)
                    .findFirst();
            if (similar.isPresent()) {
                log.debug("Serving '{}' from entry cached for '{}'", text, similar.get().getQueryText());
                return Optional.of(hit(similar.get(), now));
            }
            misses++;
            return Optional.empty();
        }
        finally {
            lock.unlock();
        }
    }

    public void put(String queryText, List<RankedResult> results) {
        put(DEFAULT_SCOPE, queryText, results);
    }

    /**
     * Store results for the query, replacing any entry for the same scope and normalized query. The least recently
     * used entry is evicted if the cache is full.
     */
    public void put(String scope, String queryText, List<RankedResult> results) {
        final var cacheScope = Objects.requireNonNullElse(scope, DEFAULT_SCOPE);
        final var text = Objects.requireNonNullElse(queryText, "");
        lock.lock();
        try {
            final var key = hash(cacheScope, text);
            if (entries.remove(key) == null && entries.size() >= maxSize) {
                final var eldest = entries.keySet().iterator().next();
                entries.remove(eldest);
                evictions++;
            }
            entries.put(key, new CacheEntry(key, cacheScope, text, List.copyOf(results), clock.instant()));
            totalQueries++;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Drop all entries that have outlived the TTL
     *
     * @return Number of entries removed
     */
    public int clearExpired() {
        lock.lock();
        try {
            final var now = clock.instant();
            final var before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now, ttl));
            final var removed = before - entries.size();
            if (removed > 0) {
                log.debug("Removed {} expired cache entries", removed);
            }
            return removed;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Drop everything. Must be called whenever the underlying data changes.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
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
     * @return Snapshot of the entries from least to most recently used
     */
    public List<CacheEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        }
        finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.builder()
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .totalQueries(totalQueries)
                    .hitRate(hits / (double) Math.max(1, hits + misses))
                    .cacheSize(entries.size())
                    .maxSize(maxSize)
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    static String hash(String scope, String queryText) {
        return Hashing.sha256()
                .newHasher()
                .putString(scope, StandardCharsets.UTF_8)
                .putChar('\0')
                .putString(queryText.strip().toLowerCase(Locale.ROOT), StandardCharsets.UTF_8)
                .hash()
                .toString();
    }

    private List<RankedResult> hit(CacheEntry entry, Instant now) {
        entry.recordAccess(now);
        //Re-insert to move to the most recently used end
        entries.remove(entry.getQueryHash());
        entries.put(entry.getQueryHash(), entry);
        hits++;
        return entry.getResults();
    }
}
