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

package com.axonops.zhfilter.api;

/**
 * Snapshot of a {@link Filter}'s lifetime counters.
 *
 * @param patternCount patterns the filter was built from
 * @param matchCalls {@code match} calls, empty input included
 * @param candidatesEvaluated candidate texts scanned over all calls
 * @param matchesFound matches reported over all candidates and calls
 * @param emptyInputs calls with an empty text
 * @since 1.0.0
 */
public record FilterStatistics(
    int patternCount,
    long matchCalls,
    long candidatesEvaluated,
    long matchesFound,
    long emptyInputs
) {

    /**
     * Mean candidates scanned per non-empty call: 1.0 with fuzzy expansion off.
     *
     * @return the average, or 0.0 if no non-empty call was made
     */
    public double averageCandidatesPerCall() {
        long calls = matchCalls - emptyInputs;
        return calls == 0 ? 0.0 : (double) candidatesEvaluated / calls;
    }
}
