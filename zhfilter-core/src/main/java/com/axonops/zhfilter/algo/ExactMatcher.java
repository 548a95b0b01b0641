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
 * Exact multi-pattern matcher over a fixed pattern set.
 *
 * <p>Implementations build all their index structures in the constructor and are read-only
 * afterwards, so one instance can be shared between threads without synchronization.
 *
 * <p>Contract shared by all implementations:
 * <ul>
 *   <li>{@code match(null)} throws {@link com.axonops.zhfilter.api.InvalidInputException}</li>
 *   <li>{@code match("")} returns {@link MatchResult#empty()}</li>
 *   <li>Reported offsets are {@code char} indices of the match start in the searched string</li>
 *   <li>Overlapping occurrences, of the same or of different patterns, are all reported</li>
 * </ul>
 *
 * @since 1.0.0
 * @see Algorithm
 */
public interface ExactMatcher {

    /**
     * Finds every occurrence of every pattern in {@code text}.
     *
     * @param text the text to search
     * @return the matches, in the order this algorithm discovers them
     */
    MatchResult match(String text);

    /**
     * Diagnostic view of the internal state, one line per entry.
     *
     * <p>Pure accessor: builds and returns the lines, never logs.
     */
    List<String> dump();

    /** The algorithm this matcher implements. */
    Algorithm algorithm();

    /** The patterns this matcher was built from, in the order given. */
    List<String> patterns();
}
