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

import java.util.List;

/**
 * The exact matching algorithms available to a {@link com.axonops.zhfilter.api.Filter}.
 *
 * @since 1.0.0
 */
public enum Algorithm {
    /** Aho-Corasick automaton over UTF-8 bytes. Linear in text length. */
    AHO_CORASICK("AC"),
    /** Wu-Manber block-hash matcher. Best for large sets with similar minimum length. */
    WU_MANBER("WM"),
    /** Character-by-character comparison of every pattern at every offset. */
    BRUTE_FORCE("BruteForce"),
    /** Repeated {@link String#indexOf(String, int)} per pattern. */
    NATIVE("Native");

    private final String shortName;

    Algorithm(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Builds a matcher for this algorithm.
     *
     * @param patterns the pattern set
     * @param blockSize Wu-Manber block size in bytes (ignored by the other algorithms)
     * @return the built matcher
     * @throws com.axonops.zhfilter.api.ConfigurationException if the patterns are invalid
     */
    public ExactMatcher create(List<String> patterns, int blockSize) {
        return switch (this) {
            case AHO_CORASICK -> new AhoCorasickMatcher(patterns);
            case WU_MANBER -> new WuManberMatcher(patterns, blockSize);
            case BRUTE_FORCE -> new BruteForceMatcher(patterns);
            case NATIVE -> new NativeMatcher(patterns);
        };
    }
}
