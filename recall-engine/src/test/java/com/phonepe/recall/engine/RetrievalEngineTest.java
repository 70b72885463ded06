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

import com.phonepe.recall.core.config.RetrievalConfig;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;
import com.phonepe.recall.core.errors.SnapshotStoreException;
import com.phonepe.recall.core.model.MemoryCategory;
import com.phonepe.recall.core.model.RankedResult;
import com.phonepe.recall.core.storage.InMemorySnapshotStore;
import com.phonepe.recall.core.storage.SnapshotStore;
import com.phonepe.recall.embedding.CharFrequencyEmbeddingModel;
import com.phonepe.recall.embedding.EmbeddingModel;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrievalEngineTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private RetrievalEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemorySnapshotStore();
        engine = RetrievalEngine.builder()
                .collectionId("test")
                .snapshotStore(store)
                .clock(clock)
                .build();
    }

    @Test
    void testAddAndSearch() {
        final var pythonId = engine.addMemory("Python programming basics",
                                              MemoryCategory.LEARNING, 0.8, List.of("python"))
                .orElseThrow();
        engine.addMemory("Web accessibility guidelines", MemoryCategory.PATTERN, 0.6, List.of());

        final var response = engine.searchMemories("Python coding", 5);
        assertEquals(ResultSource.VECTOR_SEARCH, response.getSource());
        assertEquals("Python coding", response.getQuery());
        assertEquals(2, response.getTotalFound());
        final var top = response.getResults().get(0);
        assertEquals(pythonId, top.getId());
        assertEquals("Python programming basics", top.getContent());
        assertEquals(MemoryCategory.LEARNING, top.getCategory());
        assertEquals(List.of("python"), top.getTags());
        assertEquals(1, top.getAccessCount());
        assertTrue(top.getSimilarity() > 0.9 && top.getSimilarity() <= 1.0);
        assertTrue(response.getProcessingTimeMillis() >= 0.0);
    }

    @Test
    void testRepeatedSearchIsServedFromCacheUntilDataChanges() {
        engine.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of("python"));

        final var first = engine.searchMemories("Python coding");
        final var second = engine.searchMemories("python coding ");
        assertEquals(ResultSource.VECTOR_SEARCH, first.getSource());
        assertEquals(ResultSource.CACHE, second.getSource());
        assertEquals(first.getResults(), second.getResults());

        engine.addMemory("Python packaging with poetry", MemoryCategory.LEARNING, 0.5, List.of());
        final var third = engine.searchMemories("Python coding");
        assertEquals(ResultSource.VECTOR_SEARCH, third.getSource());
        assertEquals(2, third.getTotalFound());

        final var stats = engine.retrievalStats();
        assertEquals(3, stats.getTotalRetrievals());
        assertEquals(1, stats.getCacheHits());
        assertEquals(2, stats.getVectorSearches());
        assertEquals(2, stats.getTotalMemories());
    }

    @Test
    void testCachedResultsAreNotReusedAcrossFilters() {
        engine.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of("python"));
        engine.addMemory("Python coding patterns", MemoryCategory.PATTERN, 0.6, List.of("web"));

        final var unfiltered = engine.searchMemories("Python coding");
        assertEquals(2, unfiltered.getTotalFound());

        final var patterns = engine.searchMemoryResults("Python coding", 10, MemoryCategory.PATTERN, 0.3);
        assertFalse(patterns.isEmpty());
        assertTrue(patterns.stream().allMatch(result -> result.getCategory() == MemoryCategory.PATTERN));

        final var tagged = engine.searchMemories("Python coding", 10, null, List.of("web"), 0.3, true);
        assertEquals(ResultSource.VECTOR_SEARCH, tagged.getSource());
        assertFalse(tagged.getResults().isEmpty());
        assertTrue(tagged.getResults().stream().allMatch(result -> result.getTags().contains("web")));

        final var limited = engine.searchMemories("Python coding", 1);
        assertEquals(ResultSource.VECTOR_SEARCH, limited.getSource());
        assertEquals(1, limited.getTotalFound());

        final var strict = engine.searchMemories("Python coding", 10, null, null, 1.01, true);
        assertEquals(ResultSource.VECTOR_SEARCH, strict.getSource());
        assertTrue(strict.getResults().isEmpty());

        //Same filters again are served from the cache
        final var taggedAgain = engine.searchMemories("python coding", 10, null, List.of("web"), 0.3, true);
        assertEquals(ResultSource.CACHE, taggedAgain.getSource());
        assertEquals(tagged.getResults(), taggedAgain.getResults());
    }

    @Test
    void testSearchWithoutCacheNeverTouchesCache() {
        engine.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of());
        engine.searchMemories("Python coding", 5, null, null, 0.3, false);
        final var again = engine.searchMemories("Python coding", 5, null, null, 0.3, false);
        assertEquals(ResultSource.VECTOR_SEARCH, again.getSource());
        assertEquals(0, engine.cacheStats().getCacheSize());
    }

    @Test
    void testFilters() {
        final var db = engine.addMemory("Use PostgreSQL for persistence",
                                        MemoryCategory.DECISION, 0.9, List.of("db", "infra"))
                .orElseThrow();
        final var ui = engine.addMemory("Adopt a component library",
                                        MemoryCategory.DECISION, 0.7, List.of("ui"))
                .orElseThrow();
        final var bug = engine.addMemory("Connection pool exhausted under load",
                                         MemoryCategory.ISSUE, 0.8, List.of("db"))
                .orElseThrow();

        assertEquals(List.of(db, ui),
                     ids(engine.searchMemories("database", 10, MemoryCategory.DECISION, null, 0.0, false)));
        assertEquals(List.of(db, bug),
                     ids(engine.searchMemories("database", 10, null, List.of("db"), 0.0, false)));
        assertEquals(List.of(bug),
                     ids(engine.searchMemories("database", 10, MemoryCategory.ISSUE, List.of("db"), 0.0, false)));
        assertTrue(engine.searchMemories("database", 10, MemoryCategory.LEARNING, null, 0.0, false)
                           .getResults()
                           .isEmpty());
        assertTrue(engine.searchMemories("database", 10, null, null, 1.01, false).getResults().isEmpty());
        assertEquals(1, engine.searchMemories("database", 1, null, null, 0.0, false).getTotalFound());
    }

    @Test
    void testImportanceBreaksSimilarityTies() {
        final var low = engine.addMemory("Deploy with blue green releases", MemoryCategory.PATTERN, 0.2, List.of())
                .orElseThrow();
        final var high = engine.addMemory("Deploy with blue green releases", MemoryCategory.PATTERN, 0.9, List.of())
                .orElseThrow();
        final var equal = engine.addMemory("Deploy with blue green releases", MemoryCategory.PATTERN, 0.2, List.of())
                .orElseThrow();
        assertEquals(List.of(high, low, equal),
                     ids(engine.searchMemories("blue green deploy", 10, null, null, 0.0, false)));
    }

    @Test
    void testUncachedSearchesAreStable() {
        engine.addMemory("Use PostgreSQL for persistence", MemoryCategory.DECISION, 0.5, List.of());
        engine.addMemory("Login fails on Safari", MemoryCategory.ISSUE, 0.5, List.of());
        engine.addMemory("Cache hot queries", MemoryCategory.PATTERN, 0.5, List.of());
        final var first = engine.searchMemories("database queries", 10, null, null, 0.0, false);
        final var second = engine.searchMemories("database queries", 10, null, null, 0.0, false);
        assertEquals(ids(first), ids(second));
        assertEquals(3, first.getTotalFound());
    }

    @Test
    void testValidationLeavesStateUntouched() {
        assertEquals(ErrorType.INVALID_CONTENT,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.addMemory(null, MemoryCategory.ISSUE)).getErrorType());
        assertEquals(ErrorType.INVALID_CATEGORY,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.addMemory("text", (MemoryCategory) null)).getErrorType());
        assertEquals(ErrorType.INVALID_CATEGORY,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.addMemory("text", "opinion", 0.5, List.of())).getErrorType());
        assertEquals(ErrorType.INVALID_IMPORTANCE,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.addMemory("text", MemoryCategory.ISSUE, 1.5, List.of()))
                             .getErrorType());
        assertEquals(ErrorType.INVALID_IMPORTANCE,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.addMemory("text", MemoryCategory.ISSUE, Double.NaN, List.of()))
                             .getErrorType());
        assertEquals(ErrorType.INVALID_ARGUMENT,
                     assertThrows(MemoryValidationException.class,
                                  () -> engine.searchMemories("text", 0)).getErrorType());
        assertThrows(MemoryValidationException.class, () -> engine.getTopMemories(0, null));

        assertEquals(0, engine.size());
        assertEquals(0, store.getSaveCount());
        assertEquals(0, engine.retrievalStats().getTotalRetrievals());
    }

    @Test
    void testAddMemoryDetails() {
        final var first = engine.addMemory("", MemoryCategory.CONTEXT).orElseThrow();
        final var second = engine.addMemory("", MemoryCategory.CONTEXT).orElseThrow();
        assertTrue(first.matches("mem_\\d+_\\d+_[0-9a-f]{8}"));
        assertFalse(first.equals(second));

        final var tagged = engine.addMemory("Tagged", "Learning", 1.0, Arrays.asList("a", null, " a ", "b", ""))
                .orElseThrow();
        final var memory = engine.getMemory(tagged).orElseThrow();
        assertEquals(List.of("a", "b"), memory.getTags());
        assertEquals(MemoryCategory.LEARNING, memory.getCategory());
        assertEquals(1.0, memory.getImportance());
        assertEquals(3, store.getSaveCount());
        assertEquals("test", store.loadFragments().orElseThrow().getMemories().get(tagged).getProjectId());
    }

    @Test
    void testGetMemoryCountsAccess() {
        final var id = engine.addMemory("Login fails on Safari", MemoryCategory.ISSUE).orElseThrow();
        final var first = engine.getMemory(id).orElseThrow();
        assertNull(first.getSimilarity());
        assertEquals(0.5, first.getImportance());
        assertEquals(1, first.getAccessCount());
        assertEquals(2, engine.getMemory(id).orElseThrow().getAccessCount());
        assertTrue(engine.getMemory("mem_unknown").isEmpty());
    }

    @Test
    void testRemoveMemory() {
        final var keep = engine.addMemory("Keep audit logs for a year", MemoryCategory.REQUIREMENT).orElseThrow();
        final var drop = engine.addMemory("Support dark mode", MemoryCategory.REQUIREMENT).orElseThrow();
        engine.searchMemories("audit logs");

        assertTrue(engine.removeMemory(drop));
        assertFalse(engine.removeMemory(drop));
        assertEquals(1, engine.size());
        assertEquals(1, engine.indexStats().getTotalVectors());
        assertEquals(0, engine.cacheStats().getCacheSize());
        assertTrue(engine.getMemory(drop).isEmpty());
        assertEquals(List.of(keep), ids(engine.searchMemories("audit logs")));
        assertFalse(store.loadFragments().orElseThrow().getMemories().containsKey(drop));
        assertFalse(store.loadIndex().orElseThrow().getIndices().containsKey(drop));
    }

    @Test
    void testTopMemories() {
        final var low = engine.addMemory("Low", MemoryCategory.LEARNING, 0.1, List.of()).orElseThrow();
        final var high = engine.addMemory("High", MemoryCategory.DECISION, 0.9, List.of()).orElseThrow();
        final var midFirst = engine.addMemory("Mid one", MemoryCategory.LEARNING, 0.5, List.of()).orElseThrow();
        final var midSecond = engine.addMemory("Mid two", MemoryCategory.DECISION, 0.5, List.of()).orElseThrow();

        assertEquals(List.of(high, midFirst, midSecond, low), topIds(engine.getTopMemories(10, null)));
        assertEquals(List.of(high, midFirst), topIds(engine.getTopMemories(2, null)));
        assertEquals(List.of(midFirst, low), topIds(engine.getTopMemories(10, MemoryCategory.LEARNING)));
    }

    @Test
    @SneakyThrows
    void testStatePersistsAcrossRestarts() {
        final List<String> expected;
        final RankedResult expectedTop;
        try (final var first = RetrievalEngine.open(tempDir, "project")) {
            first.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of("python"));
            first.addMemory("Use PostgreSQL for persistence", MemoryCategory.DECISION, 0.9, List.of("db"));
            first.addMemory("Login fails on Safari", MemoryCategory.ISSUE, 0.4, List.of());
            final var response = first.searchMemories("Python coding", 5, null, null, 0.3, false);
            expected = ids(response);
            expectedTop = response.getResults().get(0);
        }
        assertTrue(Files.exists(tempDir.resolve("project_memories.json")));
        assertTrue(Files.exists(tempDir.resolve("project_vector_index.json")));

        try (final var second = RetrievalEngine.open(tempDir, "project")) {
            assertEquals(3, second.size());
            final var response = second.searchMemories("Python coding", 5, null, null, 0.3, false);
            assertEquals(expected, ids(response));
            final var top = response.getResults().get(0);
            assertEquals(expectedTop.getSimilarity(), top.getSimilarity());
            assertEquals(expectedTop.getCreatedAt(), top.getCreatedAt());
            assertEquals(2, top.getAccessCount());
            assertEquals(2, second.retrievalStats().getTotalRetrievals());
            assertEquals(3, second.indexStats().getIndexUpdates());
        }
    }

    @Test
    @SneakyThrows
    void testMissingIndexIsRebuilt() {
        final String id;
        try (final var first = RetrievalEngine.open(tempDir, "project")) {
            id = first.addMemory("Cache hot queries", MemoryCategory.PATTERN, 0.7, List.of("perf")).orElseThrow();
        }
        Files.delete(tempDir.resolve("project_vector_index.json"));

        try (final var second = RetrievalEngine.open(tempDir, "project")) {
            assertEquals(1, second.indexStats().getTotalVectors());
            assertTrue(Files.exists(tempDir.resolve("project_vector_index.json")));
            assertEquals(List.of(id), ids(second.searchMemories("hot queries", 5, null, List.of("perf"), 0.0, false)));
        }
    }

    @Test
    @SneakyThrows
    void testCorruptSnapshotStartsEmpty() {
        Files.writeString(tempDir.resolve("project_memories.json"), "{ this is not json");
        try (final var recovered = RetrievalEngine.open(tempDir, "project")) {
            assertEquals(0, recovered.size());
            assertTrue(recovered.addMemory("Fresh start", MemoryCategory.CONTEXT).isPresent());
        }
        try (final var reopened = RetrievalEngine.open(tempDir, "project")) {
            assertEquals(1, reopened.size());
        }
    }

    @Test
    @SneakyThrows
    void testTruncatedSnapshotIsNotOverwritten() {
        try (final var first = RetrievalEngine.open(tempDir, "c")) {
            first.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of("python"));
            first.addMemory("Use PostgreSQL for persistence", MemoryCategory.DECISION, 0.9, List.of("db"));
        }
        final var memoriesFile = tempDir.resolve("c_memories.json");
        final var saved = Files.readAllBytes(memoriesFile);
        final var truncated = Arrays.copyOf(saved, saved.length - 2);
        Files.write(memoriesFile, truncated);

        try (final var reopened = RetrievalEngine.open(tempDir, "c")) {
            assertEquals(0, reopened.size());
        }
        final List<Path> kept;
        try (final var files = Files.list(tempDir)) {
            kept = files.filter(file -> file.getFileName().toString().startsWith("c_memories.json.corrupt-"))
                    .toList();
        }
        assertEquals(1, kept.size());
        assertArrayEquals(truncated, Files.readAllBytes(kept.get(0)));
    }

    @Test
    void testPersistenceFailureDoesNotFailOperations() {
        final var failing = mock(SnapshotStore.class);
        when(failing.loadFragments()).thenReturn(Optional.empty());
        when(failing.loadIndex()).thenReturn(Optional.empty());
        doThrow(new SnapshotStoreException(ErrorType.SNAPSHOT_WRITE_FAILURE,
                                           new IOException("disk full"), "somewhere", "disk full"))
                .when(failing)
                .save(any(), any());
        try (final var unlucky = RetrievalEngine.builder()
                .collectionId("unlucky")
                .snapshotStore(failing)
                .build()) {
            final var id = unlucky.addMemory("Still here", MemoryCategory.CONTEXT).orElseThrow();
            assertEquals(List.of(id), ids(unlucky.searchMemories("Still here")));
            assertTrue(unlucky.removeMemory(id));
        }
    }

    @Test
    void testIndexingFailureIsReported() {
        final var fallback = new CharFrequencyEmbeddingModel();
        final EmbeddingModel flaky = text -> {
            if (text.contains("poison")) {
                throw new IllegalStateException("cannot embed");
            }
            return fallback.getEmbedding(text);
        };
        final var fragile = RetrievalEngine.builder()
                .collectionId("fragile")
                .embeddingModel(flaky)
                .snapshotStore(new InMemorySnapshotStore())
                .build();
        assertTrue(fragile.addMemory("fine", MemoryCategory.CONTEXT).isPresent());
        assertTrue(fragile.addMemory("poison pill", MemoryCategory.CONTEXT).isEmpty());
        assertEquals(1, fragile.indexStats().getTotalVectors());

        final var report = fragile.optimizeIndices();
        assertTrue(report.isRebuilt());
    }

    @Test
    void testOptimizeIndices() {
        final var untouched = engine.addMemory("Use PostgreSQL for persistence",
                                               MemoryCategory.DECISION, 0.9, List.of())
                .orElseThrow();
        engine.addMemory("Index foreign keys", MemoryCategory.LEARNING, 0.5, List.of());
        assertEquals(1, engine.searchMemoryResults("database", 5, MemoryCategory.LEARNING, 0.3).size());
        assertEquals(1, engine.cacheStats().getCacheSize());

        final var fresh = engine.optimizeIndices();
        assertEquals(0, fresh.getExpiredCacheEntries());
        assertEquals(0, fresh.getPrunedMetadata());
        assertFalse(fresh.isRebuilt());

        clock.advance(Duration.ofDays(31));
        final var later = engine.optimizeIndices();
        assertEquals(1, later.getExpiredCacheEntries());
        assertEquals(1, later.getPrunedMetadata());
        assertFalse(later.isRebuilt());
        assertEquals(2, engine.size());
        assertEquals(1, engine.getMemory(untouched).orElseThrow().getAccessCount());
    }

    @Test
    void testRebuild() {
        engine.addMemory("Use PostgreSQL for persistence", MemoryCategory.DECISION, 0.9, List.of("db"));
        engine.addMemory("Login fails on Safari", MemoryCategory.ISSUE, 0.4, List.of());
        final var before = ids(engine.searchMemories("database", 5, null, null, 0.0, false));
        engine.searchMemories("database");

        engine.rebuild();
        assertEquals(2, engine.indexStats().getTotalVectors());
        assertEquals(0, engine.cacheStats().getCacheSize());
        assertEquals(before, ids(engine.searchMemories("database", 5, null, null, 0.0, false)));
    }

    @Test
    void testCloseFlushes() {
        engine.addMemory("Something", MemoryCategory.CONTEXT);
        final var saves = store.getSaveCount();
        engine.close();
        engine.close();
        assertEquals(saves + 1, store.getSaveCount());
    }

    @Test
    void testCustomDimension() {
        final var smallStore = new InMemorySnapshotStore();
        final var small = RetrievalEngine.builder()
                .collectionId("small")
                .config(RetrievalConfig.builder().dimension(16).build())
                .snapshotStore(smallStore)
                .build();
        small.addMemory("abc", MemoryCategory.CONTEXT);
        assertEquals(16, small.indexStats().getDimension());
        assertEquals(16, smallStore.loadIndex()
                .orElseThrow()
                .getIndices()
                .values()
                .iterator()
                .next()
                .getVector().length);
    }

    @Test
    void testPerformanceSummary() {
        engine.addMemory("Python programming basics", MemoryCategory.LEARNING, 0.8, List.of());
        engine.searchMemories("Python");
        engine.searchMemories("Python");
        final var summary = engine.performanceSummary();
        assertEquals(1, summary.getMemoryCount());
        assertEquals(2, summary.getRetrievalStats().getTotalRetrievals());
        assertEquals(0.5, summary.getCacheStats().getHitRate(), 1e-9);
        assertEquals(1.0, summary.getIndexHealth().getVectorIndexHealth(), 1e-9);
        assertEquals(0.5, summary.getIndexHealth().getCacheHealth(), 1e-9);
        assertEquals(1, summary.getIndexStats().getSearchCount());
    }

    @Test
    @SneakyThrows
    void testConcurrentOperationsKeepIndexAndStoreInStep() {
        final var added = new ConcurrentLinkedQueue<String>();
        final var removed = new AtomicInteger();
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 200; i++) {
                final var n = i;
                futures.add(executor.submit(() -> {
                    switch (n % 4) {
                        case 0, 1 -> engine.addMemory("Concurrent memory " + n,
                                                      MemoryCategory.values()[n % MemoryCategory.values().length],
                                                      (n % 10) / 10.0,
                                                      List.of("tag" + n % 3))
                                .ifPresent(added::add);
                        case 2 -> {
                            final var id = added.poll();
                            if (id != null && engine.removeMemory(id)) {
                                removed.incrementAndGet();
                            }
                        }
                        default -> engine.searchMemories("Concurrent memory " + (n - 3), 5);
                    }
                }));
            }
            for (final var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        }
        finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }
        assertEquals(100 - removed.get(), engine.size());
        assertEquals(engine.size(), engine.indexStats().getTotalVectors());
        assertEquals(engine.size(), engine.retrievalStats().getTotalMemories());
    }

    private static List<String> ids(SearchResponse response) {
        return topIds(response.getResults());
    }

    private static List<String> topIds(List<RankedResult> results) {
        return results.stream().map(RankedResult::getId).toList();
    }
}
