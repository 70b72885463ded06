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

package com.phonepe.recall.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phonepe.recall.core.model.MemoryCategory;
import com.phonepe.recall.core.model.MemoryFragment;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Persisted form of a {@link MemoryFragment}. The id is the key under which this is stored.
 */
@Value
@Builder
@Jacksonized
public class StoredFragment {
    String content;

    MemoryCategory category;

    double importance;

    List<String> tags;

    @JsonProperty("created_at")
    LocalDateTime createdAt;

    @JsonProperty("project_id")
    String projectId;

    public static StoredFragment from(MemoryFragment fragment) {
        return StoredFragment.builder()
                .content(fragment.getContent())
                .category(fragment.getCategory())
                .importance(fragment.getImportance())
                .tags(fragment.getTags())
                .createdAt(fragment.getCreatedAt())
                .projectId(fragment.getProjectId())
                .build();
    }

    public MemoryFragment toFragment(String id, String defaultProjectId, LocalDateTime defaultCreatedAt) {
        return MemoryFragment.builder()
                .id(id)
                .content(content)
                .category(category)
                .importance(importance)
                .tags(List.copyOf(Objects.requireNonNullElseGet(tags, List::of)))
                .createdAt(Objects.requireNonNullElse(createdAt, defaultCreatedAt))
                .projectId(Objects.requireNonNullElse(projectId, defaultProjectId))
                .build();
    }
}
