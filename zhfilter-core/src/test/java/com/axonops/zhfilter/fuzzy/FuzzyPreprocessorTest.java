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
import com.axonops.zhfilter.test.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FuzzyPreprocessorTest {

    private static final PinyinConverter READINGS = TestUtils.fixedReadings(Map.of(
        "她", List.of("ta"),
        "的", List.of("de")));

    private static FuzzyPreprocessor both(List<String> patterns) {
        FilterConfig config = TestUtils.testConfigBuilder()
            .enableRadical(true)
            .enablePinyin(true)
            .pinyinConverter(READINGS)
            .build();
        return FuzzyPreprocessor.create(patterns, config);
    }

    @Test
    void testDisabledYieldsOnlyTheOriginal() {
        FuzzyPreprocessor preprocessor = FuzzyPreprocessor.create(List.of("她的"), FilterConfig.DEFAULT);

        assertThat(preprocessor.radicalEnabled()).isFalse();
        assertThat(preprocessor.pinyinEnabled()).isFalse();
        assertThat(preprocessor.candidates("女也 ta de")).containsExactly(Candidate.original("女也 ta de"));
        assertThat(preprocessor.dump()).isEmpty();
    }

    @Test
    void testOriginalIsNormalized() {
        FuzzyPreprocessor preprocessor = both(List.of("她的"));

        assertThat(preprocessor.candidates("ＴＡ").get(0)).isEqualTo(Candidate.original("ta"));
    }

    @Test
    void testOriginalThenRadicalThenPinyin() {
        FuzzyPreprocessor preprocessor = both(List.of("她的"));

        List<Candidate> candidates = preprocessor.candidates("女也de");

        assertThat(candidates).extracting(Candidate::source).containsExactly(
            Candidate.Source.ORIGINAL, Candidate.Source.RADICAL, Candidate.Source.PINYIN);
        assertThat(candidates).extracting(Candidate::text).containsExactly("女也de", "她de", "女也的");
    }

    @Test
    void testExpansionsAreNotChained() {
        FuzzyPreprocessor preprocessor = both(List.of("她的"));

        // Neither rewrite alone yields 她的, and rewrites never apply to each other's output
        assertThat(preprocessor.candidates("女也de")).extracting(Candidate::text).doesNotContain("她的");
    }

    @Test
    void testCandidatesAreStable() {
        FuzzyPreprocessor preprocessor = both(List.of("她的"));

        assertThat(preprocessor.candidates("ta de 女也")).isEqualTo(preprocessor.candidates("ta de 女也"));
    }

    @Test
    void testDumpListsEnabledMaps() {
        FuzzyPreprocessor preprocessor = both(List.of("她"));

        assertThat(preprocessor.dump()).containsExactly(
            "Radical map: 1 keys", "  女也 -> [她]",
            "Pinyin map: 1 entries", "  [ta] -> [她]");
    }
}
