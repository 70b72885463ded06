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

package com.phonepe.recall.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.SnapshotStoreException;
import com.phonepe.recall.core.storage.FragmentSnapshot;
import com.phonepe.recall.core.storage.IndexSnapshot;
import com.phonepe.recall.core.storage.SnapshotStore;
import com.phonepe.recall.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores the snapshots of a collection as two JSON files in a directory:
 * {@code <collection>_memories.json} and {@code <collection>_vector_index.json}.
 * A file that exists but cannot be parsed is renamed to {@code <file>.corrupt-<millis>} before the read fails.
 */
@Slf4j
public class FileSystemSnapshotStore implements SnapshotStore {
    private static final String MEMORIES_FILE_SUFFIX = "_memories.json";
    private static final String INDEX_FILE_SUFFIX = "_vector_index.json";
    private static final String CORRUPT_FILE_MARKER = "corrupt";

    @Getter
    private final Path memoriesFile;
    @Getter
    private final Path indexFile;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    @Builder
    public FileSystemSnapshotStore(@NonNull Path baseDir,
                                   @NonNull String collectionId,
                                   @NonNull ObjectMapper mapper) {
        if (Strings.isNullOrEmpty(collectionId.strip())
                || collectionId.contains("/")
                || collectionId.contains("\\")
                || collectionId.contains("..")) {
            throw new IllegalArgumentException("Invalid collection id: " + collectionId);
        }
        final var root = FileUtils.ensureDirectory(baseDir, true);
        this.memoriesFile = root.resolve(collectionId + MEMORIES_FILE_SUFFIX);
        this.indexFile = root.resolve(collectionId + INDEX_FILE_SUFFIX);
        this.mapper = mapper;
    }

    @Override
    public Optional<FragmentSnapshot> loadFragments() {
        return read(memoriesFile, FragmentSnapshot.class);
    }

    @Override
    public Optional<IndexSnapshot> loadIndex() {
        return read(indexFile, IndexSnapshot.class);
    }

    @Override
    public void save(FragmentSnapshot fragments, IndexSnapshot index) {
        lock.lock();
        try {
            write(memoriesFile, fragments);
            write(indexFile, index);
            log.debug("Saved {} fragments and {} vectors to {}",
                      fragments.getMemories().size(), index.getIndices().size(), memoriesFile.getParent());
        }
        finally {
            lock.unlock();
        }
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(file.toFile(), type));
        }
        catch (IOException e) {
            quarantine(file, e);
            throw new SnapshotStoreException(ErrorType.SNAPSHOT_READ_FAILURE, e, file, e.getMessage());
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Moves an unreadable file out of the way so that the next save cannot overwrite it
     */
    private static void quarantine(Path file, IOException readError) {
        try {
            final var moved = FileUtils.moveAside(file, CORRUPT_FILE_MARKER);
            log.warn("Unreadable snapshot {} moved to {}", file, moved);
        }
        catch (IOException e) {
            readError.addSuppressed(e);
            log.error("Could not move unreadable snapshot {} aside: {}", file, e.getMessage());
        }
    }

    private void write(Path file, Object snapshot) {
        try {
            FileUtils.writeAtomically(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
        }
        catch (IOException e) {
            throw new SnapshotStoreException(ErrorType.SNAPSHOT_WRITE_FAILURE, e, file, e.getMessage());
        }
    }
}
