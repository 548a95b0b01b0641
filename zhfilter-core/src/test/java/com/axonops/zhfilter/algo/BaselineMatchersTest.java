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

import com.axonops.zhfilter.api.ConfigurationException;
import com.axonops.zhfilter.api.InvalidInputException;
import com.axonops.zhfilter.api.Match;
import com.axonops.zhfilter.api.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Brute-force and native matchers, the oracles the automata are checked against.
 */
class BaselineMatchersTest {

    private static final List<String> BLOCKLIST =
        List.of("longlo", "ongword", "shortword", "shiningword", "longlongword");

    @Test
    void testBruteForceFindsAllOccurrences() {
        MatchResult result = new BruteForceMatcher(BLOCKLIST).match("shortwordlonglongword");

        assertThat(result.sorted()).containsExactly(
            new Match(0, "shortword"),
            new Match(9, "longlo"),
            new Match(9, "longlongword"),
            new Match(14, "ongword"));
    }

    @Test
    void testNativeFindsAllOccurrences() {
        MatchResult result = new NativeMatcher(BLOCKLIST).match("shortwordlonglongword");

        assertThat(result.sorted()).containsExactly(
            new Match(0, "shortword"),
            new Match(9, "longlo"),
            new Match(9, "longlongword"),
            new Match(14, "ongword"));
    }

    @Test
    void testOverlappingOccurrencesOfSamePattern() {
        List<String> patterns = List.of("aa");

        assertThat(new BruteForceMatcher(patterns).match("aaaa").sorted())
            .containsExactly(new Match(0, "aa"), new Match(1, "aa"), new Match(2, "aa"));
        assertThat(new NativeMatcher(patterns).match("aaaa").sorted())
            .containsExactly(new Match(0, "aa"), new Match(1, "aa"), new Match(2, "aa"));
    }

    @Test
    void testChineseOffsetsAreCharacterIndices() {
        List<String> patterns = List.of("他", "她", "他的", "她的");

        MatchResult brute = new BruteForceMatcher(patterns).match("他和她的");
        MatchResult nativeResult = new NativeMatcher(patterns).match("他和她的");

        assertThat(brute.sorted()).containsExactly(
            new Match(0, "他"), new Match(2, "她"), new Match(2, "她的"));
        assertThat(nativeResult).isEqualTo(brute);
    }

    @Test
    void testPatternLongerThanTextNeverMatches() {
        assertThat(new BruteForceMatcher(List.of("longlongword")).match("long")).isEmpty();
        assertThat(new NativeMatcher(List.of("longlongword")).match("long")).isEmpty();
    }

    @Test
    void testEmptyTextReturnsEmptyResult() {
        assertThat(new BruteForceMatcher(BLOCKLIST).match("")).isSameAs(MatchResult.empty());
        assertThat(new NativeMatcher(BLOCKLIST).match("")).isSameAs(MatchResult.empty());
    }

    @Test
    void testNullTextRejected() {
        assertThatThrownBy(() -> new BruteForceMatcher(BLOCKLIST).match(null))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new NativeMatcher(BLOCKLIST).match(null))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void testInvalidPatternSetsRejected() {
        assertThatThrownBy(() -> new BruteForceMatcher(List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> new NativeMatcher(null))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new NativeMatcher(List.of("ok", "")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("index 1 is empty");
        assertThatThrownBy(() -> new BruteForceMatcher(Arrays.asList("ok", null)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("index 1 is null");
    }

    @Test
    void testPatternListIsCopied() {
        List<String> patterns = new ArrayList<>(List.of("他"));
        NativeMatcher matcher = new NativeMatcher(patterns);

        patterns.add("她");

        assertThat(matcher.patterns()).containsExactly("他");
        assertThat(matcher.match("她")).isEmpty();
        assertThatThrownBy(() -> matcher.patterns().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testAlgorithmAndDump() {
        BruteForceMatcher brute = new BruteForceMatcher(BLOCKLIST);
        NativeMatcher nativeMatcher = new NativeMatcher(BLOCKLIST);

        assertThat(brute.algorithm()).isEqualTo(Algorithm.BRUTE_FORCE);
        assertThat(nativeMatcher.algorithm()).isEqualTo(Algorithm.NATIVE);
        assertThat(brute.dump()).containsExactly("BruteForce: 5 patterns");
        assertThat(nativeMatcher.dump()).containsExactly("Native: 5 patterns");
    }
}
