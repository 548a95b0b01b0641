/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.zhfilter.algo;

import com.axonops.zhfilter.api.MatchResult;

import java.util.List;

/**
 * Compares every pattern against every text offset, character by character.
 *
 * <p>O(total pattern length x text length). Used as the reference result for the other
 * algorithms and for very small pattern sets.
 *
 * @since 1.0.0
 */
public final class BruteForceMatcher implements ExactMatcher {

    private final List<String> patterns;

    public BruteForceMatcher(List<String> patterns) {
        this.patterns = PatternValidator.validate(patterns);
    }

    @Override
    public MatchResult match(String text) {
        PatternValidator.requireText(text);
        if (text.isEmpty()) {
            return MatchResult.empty();
        }

        MatchResult.Builder matches = MatchResult.builder();
        int n = text.length();
        for (String pattern : patterns) {
            int m = pattern.length();
            for (int i = 0; i + m <= n; i++) {
                int j = 0;
                while (j < m && text.charAt(i + j) == pattern.charAt(j)) {
                    j++;
                }
                if (j == m) {
                    matches.add(i, pattern);
                }
            }
        }
        return matches.build();
    }

    @Override
    public List<String> dump() {
        return List.of("BruteForce: " + patterns.size() + " patterns");
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.BRUTE_FORCE;
    }

    @Override
    public List<String> patterns() {
        return patterns;
    }
}
