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

package com.phonepe.recall.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Retrieval level counters. Persisted along with the fragments so that they survive restarts.
 */
@Value
@Builder
@Jacksonized
public class RetrievalStats {
    @JsonProperty("total_retrievals")
    long totalRetrievals;

    @JsonProperty("cache_hits")
    long cacheHits;

    @JsonProperty("vector_searches")
    long vectorSearches;

    @JsonProperty("average_retrieval_time_ms")
    double averageRetrievalTimeMillis;

    @JsonProperty("total_memories")
    long totalMemories;
}
