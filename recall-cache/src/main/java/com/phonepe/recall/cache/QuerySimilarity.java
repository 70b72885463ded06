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

package com.phonepe.recall.cache;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lexical similarity between two query strings. A weighted sum of word level Jaccard similarity and a character
 * overlap ratio. Used to decide whether two queries are close enough to share cached results; the embedding model
 * plays no part in it.
 */
public class QuerySimilarity {
    public static final double DEFAULT_JACCARD_WEIGHT = 0.7;
    public static final double DEFAULT_CHAR_WEIGHT = 0.3;

    private final double jaccardWeight;
    private final double charWeight;

    public QuerySimilarity() {
        this(DEFAULT_JACCARD_WEIGHT, DEFAULT_CHAR_WEIGHT);
    }

    public QuerySimilarity(double jaccardWeight, double charWeight) {
        Preconditions.checkArgument(jaccardWeight >= 0 && charWeight >= 0, "Weights must not be negative");
        this.jaccardWeight = jaccardWeight;
        this.charWeight = charWeight;
    }

    /**
     * @return Similarity between 0 and 1. 0 if either query is empty, 1 for identical queries.
     */
    public double similarity(String lhs, String rhs) {
        if (lhs == null || rhs == null) {
            return 0.0;
        }
        final var left = lhs.toLowerCase(Locale.ROOT);
        final var right = rhs.toLowerCase(Locale.ROOT);
        final var leftWords = words(left);
        final var rightWords = words(right);
        if (leftWords.isEmpty() || rightWords.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        final var union = Sets.union(leftWords, rightWords).size();
        final var jaccard = Sets.intersection(leftWords, rightWords).size() / (double) union;
        return Math.min(1.0, jaccard * jaccardWeight + charOverlap(left, right) * charWeight);
    }

    /**
     * Number of characters the two strings have in common (counting repeats) relative to the longer one
     */
    static double charOverlap(String lhs, String rhs) {
        if (lhs.isEmpty() || rhs.isEmpty()) {
            return 0.0;
        }
        final var leftChars = chars(lhs);
        final var rightChars = chars(rhs);
        int common = 0;
        for (final var entry : leftChars.entrySet()) {
            common += Math.min(entry.getCount(), rightChars.count(entry.getElement()));
        }
        return common / (double) Math.max(lhs.length(), rhs.length());
    }

    private static Set<String> words(String text) {
        final var trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(trimmed.split("\\s+")).collect(Collectors.toSet());
    }

    private static Multiset<Character> chars(String text) {
        final Multiset<Character> counts = HashMultiset.create();
        for (int i = 0; i < text.length(); i++) {
            counts.add(text.charAt(i));
        }
        return counts;
    }
}
