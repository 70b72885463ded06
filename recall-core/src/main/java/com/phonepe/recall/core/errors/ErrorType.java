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

package com.phonepe.recall.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error codes with message templates. Retryable errors are the ones caused by I/O.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    INVALID_CONTENT("Memory content must not be null", false),
    INVALID_CATEGORY("Invalid memory category: %s", false),
    INVALID_IMPORTANCE("Importance must be between 0 and 1. Provided: %s", false),
    INVALID_ARGUMENT("Invalid argument: %s", false),
    INVALID_CONFIGURATION("Invalid configuration: %s", false),
    SNAPSHOT_READ_FAILURE("Failed to read snapshot from %s. Error: %s", true),
    SNAPSHOT_WRITE_FAILURE("Failed to write snapshot to %s. Error: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}
