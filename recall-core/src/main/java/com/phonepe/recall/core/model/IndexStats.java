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
 * Point-in-time statistics of a vector index
 */
@Value
@Builder
@Jacksonized
public class IndexStats {
    @JsonProperty("total_vectors")
    int totalVectors;

    int categories;

    int tags;

    int dimension;

    @JsonProperty("search_count")
    long searchCount;

    @JsonProperty("average_search_time_ms")
    double averageSearchTimeMillis;

    @JsonProperty("index_updates")
    long indexUpdates;
}
