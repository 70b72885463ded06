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
import com.phonepe.recall.core.model.IndexStats;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Full snapshot of the vector index of a collection
 */
@Value
@Builder
@Jacksonized
public class IndexSnapshot {
    @Singular("index")
    Map<String, StoredVector> indices;

    IndexStats stats;

    @JsonProperty("last_saved")
    LocalDateTime lastSaved;
}
