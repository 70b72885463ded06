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

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.MemoryValidationException;
import com.phonepe.recall.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryCategoryTest {

    @Test
    void testFindIgnoresCase() {
        assertEquals(Optional.of(MemoryCategory.DECISION), MemoryCategory.find("decision"));
        assertEquals(Optional.of(MemoryCategory.DECISION), MemoryCategory.find(" Decision "));
        assertTrue(MemoryCategory.find("opinion").isEmpty());
        assertTrue(MemoryCategory.find(null).isEmpty());
    }

    @Test
    void testFromValueRejectsUnknown() {
        final var error = assertThrows(MemoryValidationException.class, () -> MemoryCategory.fromValue("opinion"));
        assertEquals(ErrorType.INVALID_CATEGORY, error.getErrorType());
        assertEquals("Invalid memory category: opinion", error.getMessage());
    }

    @Test
    @SneakyThrows
    void testJsonUsesLowerCaseNames() {
        final var mapper = JsonUtils.createMapper();
        assertEquals("\"learning\"", mapper.writeValueAsString(MemoryCategory.LEARNING));
        assertEquals(MemoryCategory.ISSUE, mapper.readValue("\"issue\"", MemoryCategory.class));
    }
}
