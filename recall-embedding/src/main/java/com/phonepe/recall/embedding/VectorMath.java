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

import lombok.experimental.UtilityClass;

/**
 * Vector arithmetic shared by the index and the embedding models
 */
@UtilityClass
public class VectorMath {

    /**
     * L2 norm of the vector
     */
    public static double norm(float[] vector) {
        if (vector == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Scale the vector to unit length. A zero vector is returned as is (as a copy).
     *
     * @param vector Input vector, not modified
     * @return Normalized copy
     */
    public static float[] normalize(float[] vector) {
        final var copy = vector.clone();
        final var norm = norm(copy);
        if (norm == 0.0) {
            return copy;
        }
        for (int i = 0; i < copy.length; i++) {
            copy[i] = (float) (copy[i] / norm);
        }
        return copy;
    }

    /**
     * Zero pad or truncate the vector to the required dimension
     *
     * @param vector    Input vector, not modified
     * @param dimension Required length
     * @return Copy with exactly dimension elements
     */
    public static float[] fit(float[] vector, int dimension) {
        final var fitted = new float[dimension];
        if (vector != null) {
            System.arraycopy(vector, 0, fitted, 0, Math.min(vector.length, dimension));
        }
        return fitted;
    }

    /**
     * Compute cosine similarity between two vectors.
     * Returns a value between -1 and 1, where 1 means identical, 0 means orthogonal, and -1 means opposite.
     * Zero vectors and vectors of differing lengths have a similarity of 0.
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs == null || rhs == null || lhs.length != rhs.length) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += (double) lhs[i] * rhs[i];
            normLhs += (double) lhs[i] * lhs[i];
            normRhs += (double) rhs[i] * rhs[i];
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs));
    }
}
