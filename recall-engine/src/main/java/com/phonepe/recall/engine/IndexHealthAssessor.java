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

import com.phonepe.recall.core.model.CacheStats;
import com.phonepe.recall.core.model.IndexStats;
import lombok.experimental.UtilityClass;

/**
 * Scores index health. Overall health is 0.4 * index coverage + 0.3 * cache hit rate + 0.3 * search speed, where
 * search speed saturates at 1 for searches taking a second or less.
 */
@UtilityClass
public class IndexHealthAssessor {
    private static final double VECTOR_WEIGHT = 0.4;
    private static final double CACHE_WEIGHT = 0.3;
    private static final double SEARCH_WEIGHT = 0.3;

    public static IndexHealth assess(IndexStats indexStats, CacheStats cacheStats, int memoryCount) {
        final var vectorHealth = Math.min(1.0, indexStats.getTotalVectors() / (double) Math.max(1, memoryCount));
        final var cacheHealth = cacheStats.getHitRate();
        final var averageSearchSeconds = indexStats.getAverageSearchTimeMillis() / 1000.0;
        final var searchHealth = Math.min(1.0, 1.0 / Math.max(0.001, averageSearchSeconds));
        final var overall = vectorHealth * VECTOR_WEIGHT + cacheHealth * CACHE_WEIGHT + searchHealth * SEARCH_WEIGHT;
        return IndexHealth.builder()
                .overall(overall)
                .vectorIndexHealth(vectorHealth)
                .cacheHealth(cacheHealth)
                .searchPerformanceHealth(searchHealth)
                .status(status(overall))
                .build();
    }

    private static IndexHealth.Status status(double overall) {
        if (overall > 0.8) {
            return IndexHealth.Status.EXCELLENT;
        }
        return overall > 0.6 ? IndexHealth.Status.GOOD : IndexHealth.Status.FAIR;
    }
}
