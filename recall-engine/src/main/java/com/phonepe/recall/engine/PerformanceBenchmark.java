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

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Measures search latency of an engine with and without the query cache. Runs against the live engine, so the
 * searches it makes show up in the engine statistics.
 */
@Slf4j
public class PerformanceBenchmark {
    static final List<String> QUERIES = List.of("项目需求分析",
                                                "系统架构设计",
                                                "数据库优化",
                                                "用户界面设计",
                                                "性能测试",
                                                "部署配置",
                                                "错误处理",
                                                "安全考虑",
                                                "代码重构",
                                                "文档编写");
    public static final int DEFAULT_NUM_QUERIES = 100;
    private static final int RESULT_LIMIT = 5;
    private static final double MIN_CACHE_MILLIS = 0.001;

    private final RetrievalEngine engine;

    public PerformanceBenchmark(RetrievalEngine engine) {
        this.engine = engine;
    }

    /**
     * Run the benchmark
     *
     * @param numQueries Number of uncached searches to run. Half as many are repeated against the cache.
     * @return Timings and the resulting grade
     */
    public BenchmarkReport run(int numQueries) {
        if (numQueries < 1) {
            throw new MemoryValidationException(ErrorType.INVALID_ARGUMENT, "numQueries must be positive");
        }
        final var minSimilarity = engine.getConfig().getMinSimilarityDefault();

        var totalSearchMillis = 0.0;
        for (int i = 0; i < numQueries; i++) {
            totalSearchMillis += engine.searchMemories(query(i), RESULT_LIMIT, null, null, minSimilarity, false)
                    .getProcessingTimeMillis();
        }
        final var averageSearchMillis = totalSearchMillis / numQueries;

        final var cachedQueries = Math.max(1, numQueries / 2);
        var totalCacheMillis = 0.0;
        var hits = 0;
        for (int i = 0; i < cachedQueries; i++) {
            final var query = query(i);
            engine.searchMemories(query, RESULT_LIMIT, null, null, minSimilarity, true);
            final var response = engine.searchMemories(query, RESULT_LIMIT, null, null, minSimilarity, true);
            totalCacheMillis += response.getProcessingTimeMillis();
            if (response.getSource() == ResultSource.CACHE) {
                hits++;
            }
        }
        final var averageCacheMillis = totalCacheMillis / cachedQueries;
        final var indexStats = engine.indexStats();
        final var report = BenchmarkReport.builder()
                .numQueries(numQueries)
                .averageSearchTimeMillis(averageSearchMillis)
                .averageCacheTimeMillis(averageCacheMillis)
                .queriesPerSecond(1000.0 / Math.max(averageSearchMillis, 1e-6))
                .cacheHitRate(hits / (double) cachedQueries)
                .cacheSpeedup(averageSearchMillis / Math.max(averageCacheMillis, MIN_CACHE_MILLIS))
                .totalMemories(engine.size())
                .vectorDimension(indexStats.getDimension())
                .performanceGrade(PerformanceGrade.forLatency(averageSearchMillis))
                .build();
        log.info("Benchmark over {} queries: average search {} ms, average cached {} ms, grade {}",
                 numQueries, averageSearchMillis, averageCacheMillis, report.getPerformanceGrade().getLabel());
        return report;
    }

    static String query(int i) {
        return QUERIES.get(i % QUERIES.size()) + " " + i;
    }
}
