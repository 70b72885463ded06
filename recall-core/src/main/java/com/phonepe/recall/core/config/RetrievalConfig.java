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

package com.phonepe.recall.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tunables for the retrieval engine and the components it owns. All weights are defaults carried over from
 * experiments and can be changed freely.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RetrievalConfig {
    public static final int DEFAULT_DIMENSION = 384;

    /**
     * Length of every vector stored in the index
     */
    @Builder.Default
    int dimension = DEFAULT_DIMENSION;

    @Builder.Default
    @JsonProperty("cache_max_size")
    int cacheMaxSize = 1000;

    @Builder.Default
    @JsonProperty("cache_ttl_hours")
    double cacheTtlHours = 24;

    /**
     * Minimum similarity used when the caller does not pass one
     */
    @Builder.Default
    @JsonProperty("min_similarity_default")
    double minSimilarityDefault = 0.3;

    /**
     * Minimum query similarity for a cached result to be served for a different query text
     */
    @Builder.Default
    @JsonProperty("cache_similarity_threshold")
    double cacheSimilarityThreshold = 0.85;

    @Builder.Default
    @JsonProperty("query_jaccard_weight")
    double queryJaccardWeight = 0.7;

    @Builder.Default
    @JsonProperty("query_char_weight")
    double queryCharWeight = 0.3;

    @Builder.Default
    @JsonProperty("rank_similarity_weight")
    double rankSimilarityWeight = 0.7;

    @Builder.Default
    @JsonProperty("rank_importance_weight")
    double rankImportanceWeight = 0.3;

    /**
     * Access bookkeeping for fragments that have not been touched for this long is dropped during optimisation
     */
    @Builder.Default
    @JsonProperty("metadata_retention_days")
    int metadataRetentionDays = 30;

    public static RetrievalConfig defaults() {
        return RetrievalConfig.builder().build();
    }

    /**
     * Sanity check all values
     *
     * @return this
     * @throws MemoryValidationException if any value is out of range
     */
    public RetrievalConfig validate() {
        check(dimension > 0, "dimension must be positive");
        check(cacheMaxSize > 0, "cache_max_size must be positive");
        check(cacheTtlHours > 0, "cache_ttl_hours must be positive");
        check(inUnitRange(minSimilarityDefault), "min_similarity_default must be between 0 and 1");
        check(inUnitRange(cacheSimilarityThreshold), "cache_similarity_threshold must be between 0 and 1");
        check(queryJaccardWeight >= 0 && queryCharWeight >= 0, "query weights must not be negative");
        check(rankSimilarityWeight >= 0 && rankImportanceWeight >= 0, "rank weights must not be negative");
        check(metadataRetentionDays > 0, "metadata_retention_days must be positive");
        return this;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0 && value <= 1;
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new MemoryValidationException(ErrorType.INVALID_CONFIGURATION, message);
        }
    }
}
