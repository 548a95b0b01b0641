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
 * Searches each pattern with the JDK's {@link String#indexOf(String, int)}.
 *
 * <p>Each search resumes one character after the previous match's start, so overlapping
 * occurrences of the same pattern are reported just like the automaton reports them.
 *
 * @since 1.0.0
 */
public final class NativeMatcher implements ExactMatcher {

    private final List<String> patterns;

    public NativeMatcher(List<String> patterns) {
        this.patterns = PatternValidator.validate(patterns);
    }

    @Override
    public MatchResult match(String text) {
        PatternValidator.requireText(text);
        if (text.isEmpty()) {
            return MatchResult.empty();
        }

        MatchResult.Builder matches = MatchResult.builder();
        for (String pattern : patterns) {
            int idx = text.indexOf(pattern);
            while (idx >= 0) {
                matches.add(idx, pattern);
                idx = text.indexOf(pattern, idx + 1);
            }
        }
        return matches.build();
    }

    @Override
    public List<String> dump() {
        return List.of("Native: " + patterns.size() + " patterns");
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.NATIVE;
    }

    @Override
    public List<String> patterns() {
        return patterns;
    }
}
