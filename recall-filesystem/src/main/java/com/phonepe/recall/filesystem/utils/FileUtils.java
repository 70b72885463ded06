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

package com.phonepe.recall.filesystem.utils;


import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a directory with the required permissions. If the path does not
     * exist and createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid, does not have the required permissions, or cannot be
     *                                  created when requested.
     */
    public static Path ensureDirectory(Path path, boolean createIfNotExists) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new IllegalArgumentException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException("Sanity check for %s Failed. Please check it is a directory and has the required permissions"
                    .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Renames a file to {@code <name>.<suffix>-<millis>} in the same directory, leaving its contents untouched.
     *
     * @param filePath The file to move
     * @param suffix   Marker to add to the name
     * @return Path the file now lives at
     * @throws IOException if the file could not be moved
     */
    public static Path moveAside(Path filePath, String suffix) throws IOException {
        final var target = filePath.resolveSibling("%s.%s-%d".formatted(filePath.getFileName(),
                                                                        suffix,
                                                                        System.currentTimeMillis()));
        return Files.move(filePath, target);
    }

    /**
     * Replaces the contents of a file atomically. Data is written to a temporary file in the same directory which
     * is then moved over the target, so readers see either the old or the new contents, never a partial write.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     * @throws IOException if the data could not be written
     */
    public static void writeAtomically(Path filePath, byte[] data) throws IOException {
        final var parent = filePath.toAbsolutePath().getParent();
        final var tempFile = Files.createTempFile(parent, filePath.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFile, data);
            try {
                Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to plain replace", filePath);
                Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        finally {
            Files.deleteIfExists(tempFile);
        }
    }
}
