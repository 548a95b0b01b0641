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

package com.axonops.zhfilter.fuzzy;

import com.axonops.zhfilter.config.FilterConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one input text into the list of candidate texts that are matched exactly.
 *
 * <p>The first candidate is always the normalized input ({@link TextNormalizer}). Radical
 * rewrites follow, then pinyin rewrites, each produced from the normalized input. Candidates are
 * not deduplicated: two hits that rewrite to the same text yield two candidates.
 *
 * <p>Immutable and thread-safe once built.
 *
 * @since 1.0.0
 */
public final class FuzzyPreprocessor {

    private final RadicalIndex radicals;
    private final PinyinIndex pinyin;

    /**
     * @param radicals radical index, or {@code null} to disable radical expansion
     * @param pinyin pinyin index, or {@code null} to disable pinyin expansion
     */
    public FuzzyPreprocessor(RadicalIndex radicals, PinyinIndex pinyin) {
        this.radicals = radicals;
        this.pinyin = pinyin;
    }

    /**
     * Builds the indexes that {@code config} enables for a pattern set.
     */
    public static FuzzyPreprocessor create(List<String> patterns, FilterConfig config) {
        RadicalIndex radicals = config.enableRadical()
            ? new RadicalIndex(patterns, config.radicalTable())
            : null;
        PinyinIndex pinyin = config.enablePinyin()
            ? new PinyinIndex(patterns, config.pinyinConverter(), config.pinyinTokenizer(),
                config.maxReadingCombinations())
            : null;
        return new FuzzyPreprocessor(radicals, pinyin);
    }

    /**
     * Candidate texts for {@code text}, normalized original first.
     *
     * @param text non-null input text
     * @return at least one candidate
     */
    public List<Candidate> candidates(String text) {
        String normalized = TextNormalizer.normalize(text);
        List<Candidate> candidates = new ArrayList<>();
        candidates.add(Candidate.original(normalized));
        if (radicals != null) {
            candidates.addAll(radicals.expand(normalized));
        }
        if (pinyin != null) {
            candidates.addAll(pinyin.expand(normalized));
        }
        return candidates;
    }

    public boolean radicalEnabled() {
        return radicals != null;
    }

    public boolean pinyinEnabled() {
        return pinyin != null;
    }

    /**
     * Diagnostic view of the enabled maps.
     */
    public List<String> dump() {
        List<String> lines = new ArrayList<>();
        if (radicals != null) {
            lines.addAll(radicals.dump());
        }
        if (pinyin != null) {
            lines.addAll(pinyin.dump());
        }
        return lines;
    }
}
