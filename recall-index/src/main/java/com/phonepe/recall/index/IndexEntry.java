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

import com.phonepe.recall.core.model.MemoryCategory;
import com.phonepe.recall.core.storage.StoredVector;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A vector along with the metadata needed to filter and order it
 */
@Value
@Builder
public class IndexEntry {
    @NonNull
    String id;

    @NonNull
    float[] vector;

    @NonNull
    MemoryCategory category;

    double importance;

    @NonNull
    List<String> tags;

    @NonNull
    LocalDateTime createdAt;

    public StoredVector toStored() {
        return StoredVector.builder()
                .memoryId(id)
                .vector(vector.clone())
                .category(category)
                .importance(importance)
                .timestamp(createdAt)
                .tags(tags)
                .build();
    }

    public static IndexEntry fromStored(String id, StoredVector stored) {
        return IndexEntry.builder()
                .id(id)
                .vector(stored.getVector().clone())
                .category(stored.getCategory())
                .importance(stored.getImportance())
                .tags(stored.getTags() == null ? List.of() : List.copyOf(stored.getTags()))
                .createdAt(stored.getTimestamp() == null ? LocalDateTime.now() : stored.getTimestamp())
                .build();
    }
}
