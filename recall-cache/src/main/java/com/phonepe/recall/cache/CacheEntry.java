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

package com.phonepe.recall.cache;

import com.phonepe.recall.core.model.RankedResult;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Results cached for a query
 */
@Getter
public class CacheEntry {
    private final String queryHash;
    private final String scope;
    private final String queryText;
    private final List<RankedResult> results;
    private final Instant createdAt;
    private Instant lastAccess;
    private long accessCount;

    CacheEntry(String queryHash, String scope, String queryText, List<RankedResult> results, Instant createdAt) {
        this.queryHash = queryHash;
        this.scope = scope;
        this.queryText = queryText;
        this.results = List.copyOf(results);
        this.createdAt = createdAt;
    }

    void recordAccess(Instant now) {
        lastAccess = now;
        accessCount++;
    }

    /**
     * Age is measured from the last access, or from creation if the entry was never read
     */
    boolean isExpired(Instant now, Duration ttl) {
        final var reference = lastAccess != null ? lastAccess : createdAt;
        return Duration.between(reference, now).compareTo(ttl) > 0;
    }
}
