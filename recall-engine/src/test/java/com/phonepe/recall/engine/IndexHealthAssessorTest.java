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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IndexHealthAssessorTest {

    @Test
    void testHealthyIndex() {
        final var health = IndexHealthAssessor.assess(index(10, 2.0), cache(0.5), 10);
        assertEquals(1.0, health.getVectorIndexHealth(), 1e-9);
        assertEquals(0.5, health.getCacheHealth(), 1e-9);
        assertEquals(1.0, health.getSearchPerformanceHealth(), 1e-9);
        assertEquals(0.85, health.getOverall(), 1e-9);
        assertEquals(IndexHealth.Status.EXCELLENT, health.getStatus());
    }

    @Test
    void testSlowSearches() {
        final var health = IndexHealthAssessor.assess(index(10, 2000.0), cache(0.5), 10);
        assertEquals(0.5, health.getSearchPerformanceHealth(), 1e-9);
        assertEquals(0.7, health.getOverall(), 1e-9);
        assertEquals(IndexHealth.Status.GOOD, health.getStatus());
    }

    @Test
    void testEmptyIndex() {
        final var health = IndexHealthAssessor.assess(index(0, 0.0), cache(0.0), 0);
        assertEquals(0.0, health.getVectorIndexHealth(), 1e-9);
        assertEquals(0.3, health.getOverall(), 1e-9);
        assertEquals(IndexHealth.Status.FAIR, health.getStatus());
    }

    @Test
    void testMissingVectors() {
        final var health = IndexHealthAssessor.assess(index(5, 1.0), cache(1.0), 10);
        assertEquals(0.5, health.getVectorIndexHealth(), 1e-9);
        assertEquals(0.8, health.getOverall(), 1e-9);
        //Exactly 0.8 is not excellent
        assertEquals(IndexHealth.Status.GOOD, health.getStatus());
    }

    private static IndexStats index(int vectors, double averageSearchMillis) {
        return IndexStats.builder()
                .totalVectors(vectors)
                .dimension(384)
                .averageSearchTimeMillis(averageSearchMillis)
                .build();
    }

    private static CacheStats cache(double hitRate) {
        return CacheStats.builder()
                .hitRate(hitRate)
                .build();
    }
}
