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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SyllableTokenizerTest {

    private final SyllableTokenizer tokenizer = new SyllableTokenizer();

    @Test
    void testSpacedAndUnspacedAgree() {
        assertThat(tokenizer.tokenize("zhong guo")).containsExactly("zhong", "guo");
        assertThat(tokenizer.tokenize("zhongguo")).containsExactly("zhong", "guo");
        assertThat(tokenizer.tokenize("ta de")).containsExactly("ta", "de");
        assertThat(tokenizer.tokenize("tade")).containsExactly("ta", "de");
    }

    @Test
    void testLongestSyllableFirst() {
        assertThat(tokenizer.tokenize("xian")).containsExactly("xian");
        assertThat(tokenizer.tokenize("xianggang")).containsExactly("xiang", "gang");
        assertThat(tokenizer.tokenize("zhuang")).containsExactly("zhuang");
    }

    @Test
    void testBacktracksWhenLongestLeavesNoSegmentation() {
        // "zhuang" + "u" fails, "zhuan" + "gu" succeeds
        assertThat(tokenizer.tokenize("zhuangu")).containsExactly("zhuan", "gu");
    }

    @Test
    void testUnsegmentableLettersAreSkipped() {
        assertThat(tokenizer.tokenize("taq")).containsExactly("ta");
        assertThat(tokenizer.tokenize("vvta")).containsExactly("ta");
        assertThat(tokenizer.tokenize("qqq")).isEmpty();
    }

    @Test
    void testWhitespaceOnly() {
        assertThat(tokenizer.tokenize("")).isEmpty();
        assertThat(tokenizer.tokenize("   ")).isEmpty();
        assertThat(tokenizer.tokenize("  ta   de ")).containsExactly("ta", "de");
    }

    @Test
    void testLongInputDoesNotBlowUp() {
        assertThat(tokenizer.tokenize("ta".repeat(60000)))
            .hasSize(60000)
            .containsOnly("ta");
        assertThat(tokenizer.tokenize("tade".repeat(30000) + "q"))
            .hasSize(60000)
            .containsOnly("ta", "de");
    }

    @Test
    void testLongInputWithNoCompleteSegmentation() {
        // Every "xq" leaves a dead end, so each position falls back to the longest syllable
        List<String> tokens = tokenizer.tokenize("xiaxq".repeat(25000));

        assertThat(tokens).hasSize(25000).containsOnly("xia");
    }

    @Test
    void testSyllablesWithoutVowels() {
        assertThat(SyllableTokenizer.isSyllable("m")).isTrue();
        assertThat(SyllableTokenizer.isSyllable("n")).isTrue();
        assertThat(SyllableTokenizer.isSyllable("ng")).isTrue();
        assertThat(SyllableTokenizer.isSyllable("hm")).isTrue();
        assertThat(tokenizer.tokenize("ng")).containsExactly("ng");
        assertThat(tokenizer.tokenize("hm")).containsExactly("hm");
        assertThat(tokenizer.tokenize("n m")).containsExactly("n", "m");
    }

    @Test
    void testTei() {
        assertThat(SyllableTokenizer.isSyllable("tei")).isTrue();
        assertThat(tokenizer.tokenize("teiguo")).containsExactly("tei", "guo");
    }

    @Test
    void testIsSyllable() {
        assertThat(SyllableTokenizer.isSyllable("lv")).isTrue();
        assertThat(SyllableTokenizer.isSyllable("shuang")).isTrue();
        assertThat(SyllableTokenizer.isSyllable("q")).isFalse();
    }
}
