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

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps snapshots on the heap. Useful for tests and for callers that do not need durability.
 */
@Slf4j
public class InMemorySnapshotStore implements SnapshotStore {
    private final AtomicReference<FragmentSnapshot> fragments = new AtomicReference<>();
    private final AtomicReference<IndexSnapshot> index = new AtomicReference<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public Optional<FragmentSnapshot> loadFragments() {
        return Optional.ofNullable(fragments.get());
    }

    @Override
    public Optional<IndexSnapshot> loadIndex() {
        return Optional.ofNullable(index.get());
    }

    @Override
    public void save(FragmentSnapshot fragments, IndexSnapshot index) {
        this.fragments.set(fragments);
        this.index.set(index);
        log.debug("Saved snapshot with {} fragments and {} vectors",
                  fragments.getMemories().size(), index.getIndices().size());
        saveCount.incrementAndGet();
    }

    /**
     * @return Number of times {@link #save(FragmentSnapshot, IndexSnapshot)} has been called
     */
    public int getSaveCount() {
        return saveCount.get();
    }
}
