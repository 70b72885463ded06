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
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Access bookkeeping for a fragment. Updated every time a fragment is returned from a lookup or a search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FragmentMetadata {
    @JsonProperty("access_count")
    private long accessCount;

    @JsonProperty("last_access")
    private LocalDateTime lastAccess;

    /**
     * Epoch millis at which the fragment was added
     */
    @JsonProperty("creation_time")
    private long creationTime;

    public static FragmentMetadata created(long creationTime) {
        return new FragmentMetadata(0, null, creationTime);
    }

    public long recordAccess(LocalDateTime now) {
        this.lastAccess = now;
        return ++accessCount;
    }
}
