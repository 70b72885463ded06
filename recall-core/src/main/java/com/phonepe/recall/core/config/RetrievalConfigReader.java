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

package com.phonepe.recall.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link RetrievalConfig} from JSON files
 */
@UtilityClass
public class RetrievalConfigReader {

    /**
     * Load and validate configuration from the provided file. Missing fields take their default values.
     *
     * @param filePath     Path to the configuration file
     * @param objectMapper ObjectMapper to use for deserialization
     * @return Validated configuration
     */
    @SneakyThrows
    public static RetrievalConfig read(final Path filePath, final ObjectMapper objectMapper) {
        return objectMapper.readValue(Files.readAllBytes(filePath), RetrievalConfig.class)
                .validate();
    }

    /**
     * Load configuration if the file exists, defaults otherwise
     *
     * @param filePath     Path to the configuration file
     * @param objectMapper ObjectMapper to use for deserialization
     * @return Validated configuration
     */
    public static RetrievalConfig readOrDefault(final Path filePath, final ObjectMapper objectMapper) {
        if (filePath == null || !Files.exists(filePath)) {
            return RetrievalConfig.defaults();
        }
        return read(filePath, objectMapper);
    }
}
