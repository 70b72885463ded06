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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of information a memory fragment holds
 */
public enum MemoryCategory {
    /**
     * Something the project needs to do or satisfy
     */
    REQUIREMENT,
    /**
     * A choice that was made, usually with its rationale
     */
    DECISION,
    /**
     * A reusable way of doing things
     */
    PATTERN,
    /**
     * A problem that was hit
     */
    ISSUE,
    /**
     * Something learnt along the way
     */
    LEARNING,
    /**
     * Background information
     */
    CONTEXT,
    ;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by name
     *
     * @param value Name of the category
     * @return The category if one matches
     */
    public static Optional<MemoryCategory> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var normalized = value.trim();
        return Arrays.stream(values())
                .filter(category -> category.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static MemoryCategory fromValue(String value) {
        return find(value)
                .orElseThrow(() -> new MemoryValidationException(ErrorType.INVALID_CATEGORY, value));
    }
}
