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

package com.phonepe.recall.engine;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Letter grade for average search latency
 */
@Getter
@AllArgsConstructor
public enum PerformanceGrade {
    A_PLUS("A+", 1),
    A("A", 5),
    B("B", 10),
    C("C", 50),
    D("D", Double.POSITIVE_INFINITY),
    ;

    private final String label;
    /**
     * Latencies strictly below this many milliseconds earn the grade
     */
    private final double upperBoundMillis;

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static PerformanceGrade forLatency(double averageMillis) {
        for (final var grade : values()) {
            if (averageMillis < grade.upperBoundMillis) {
                return grade;
            }
        }
        return D;
    }
}
