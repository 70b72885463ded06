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

package com.phonepe.recall.embedding;

import lombok.Getter;
import lombok.NonNull;

import java.util.Objects;

/**
 * Wraps any embedding model so that its output always has the configured dimension and unit length. This lets a
 * different model be plugged in without anything downstream having to care about its native output size.
 */
public class NormalizingEmbeddingModel implements EmbeddingModel {
    private final EmbeddingModel delegate;
    @Getter
    private final int dimension;

    public NormalizingEmbeddingModel(@NonNull EmbeddingModel delegate, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive. Provided: " + dimension);
        }
        this.delegate = delegate;
        this.dimension = dimension;
    }

    @Override
    public float[] getEmbedding(String input) {
        final var raw = delegate.getEmbedding(Objects.requireNonNullElse(input, ""));
        final var fitted = raw != null && raw.length == dimension ? raw : VectorMath.fit(raw, dimension);
        return VectorMath.normalize(fitted);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
