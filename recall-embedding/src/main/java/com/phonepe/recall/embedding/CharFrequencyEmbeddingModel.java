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

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Deterministic feature extractor that needs no model files. Features, in order:
 * <ol>
 *     <li>Frequency of each of a-z and 0-9 in the lower-cased text (36 dimensions)</li>
 *     <li>Length of the text and number of whitespace separated words (2 dimensions)</li>
 *     <li>Number of occurrences of each domain keyword (one dimension per keyword)</li>
 * </ol>
 * The result is zero padded or truncated to the configured dimension and scaled to unit length. Empty text maps to
 * the zero vector.
 */
public class CharFrequencyEmbeddingModel implements EmbeddingModel {
    public static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "项目", "需求", "设计", "实现", "测试", "部署", "问题", "解决", "学习", "决策");

    private static final int LENGTH_FEATURE = ALPHABET.length();
    private static final int WORD_COUNT_FEATURE = LENGTH_FEATURE + 1;
    private static final int KEYWORD_FEATURES_START = WORD_COUNT_FEATURE + 1;

    @Getter
    private final int dimension;
    private final List<String> keywords;

    public CharFrequencyEmbeddingModel() {
        this(384, null);
    }

    @Builder
    public CharFrequencyEmbeddingModel(int dimension, List<String> keywords) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive. Provided: " + dimension);
        }
        this.dimension = dimension;
        this.keywords = List.copyOf(Objects.requireNonNullElse(keywords, DEFAULT_KEYWORDS));
    }

    @Override
    public float[] getEmbedding(String input) {
        final var text = Objects.requireNonNullElse(input, "");
        final var vector = new float[dimension];
        final var lower = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            final var position = ALPHABET.indexOf(lower.charAt(i));
            if (position >= 0 && position < dimension) {
                vector[position]++;
            }
        }
        if (dimension > WORD_COUNT_FEATURE) {
            vector[LENGTH_FEATURE] = text.length();
            vector[WORD_COUNT_FEATURE] = wordCount(text);
        }
        for (int i = 0; i < keywords.size() && KEYWORD_FEATURES_START + i < dimension; i++) {
            vector[KEYWORD_FEATURES_START + i] = occurrences(text, keywords.get(i));
        }
        return VectorMath.normalize(vector);
    }

    private static int wordCount(String text) {
        final var trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static int occurrences(String text, String keyword) {
        if (keyword.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = text.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = text.indexOf(keyword, from + keyword.length());
        }
        return count;
    }
}
