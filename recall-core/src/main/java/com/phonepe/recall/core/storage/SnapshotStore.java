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

import com.phonepe.recall.core.errors.SnapshotStoreException;

import java.util.Optional;

/**
 * Durable storage for the fragments and the vector index of a single collection. Every save is a full snapshot that
 * replaces whatever was stored before.
 */
public interface SnapshotStore {
    /**
     * Read the last saved fragment snapshot
     *
     * @return Snapshot, empty if nothing has been saved yet
     * @throws SnapshotStoreException if stored data exists but cannot be read
     */
    Optional<FragmentSnapshot> loadFragments();

    /**
     * Read the last saved index snapshot
     *
     * @return Snapshot, empty if nothing has been saved yet
     * @throws SnapshotStoreException if stored data exists but cannot be read
     */
    Optional<IndexSnapshot> loadIndex();

    /**
     * Replace both stored snapshots
     *
     * @param fragments Fragment snapshot
     * @param index     Index snapshot
     * @throws SnapshotStoreException on write failure
     */
    void save(FragmentSnapshot fragments, IndexSnapshot index);
}
