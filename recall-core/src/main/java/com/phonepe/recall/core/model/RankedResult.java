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

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A fragment as returned to callers of search and lookup operations
 */
@Value
@Builder
@With
public class RankedResult {
    String id;
    String content;
    MemoryCategory category;
    double importance;

    /**
     * Similarity to the query, between 0 and 1. Null for results that did not come out of a similarity search.
     */
    Double similarity;

    List<String> tags;
    LocalDateTime createdAt;
    long accessCount;
}
