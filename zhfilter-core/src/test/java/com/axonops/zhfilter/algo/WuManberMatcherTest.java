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
import com.axonops.zhfilter.api.Match;
import com.axonops.zhfilter.api.MatchResult;
import com.axonops.zhfilter.util.PositionMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WuManberMatcherTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testShiftTable() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("abcde"), 2);

        assertThat(matcher.minPatternLength()).isEqualTo(5);
        assertThat(matcher.shiftFor(bytes("ab"))).isEqualTo(3);
        assertThat(matcher.shiftFor(bytes("bc"))).isEqualTo(2);
        assertThat(matcher.shiftFor(bytes("cd"))).isEqualTo(1);
        assertThat(matcher.shiftFor(bytes("de"))).isZero();
        assertThat(matcher.shiftFor(bytes("zz"))).as("default shift").isEqualTo(4);
    }

    @Test
    void testSmallestShiftWinsAcrossPatterns() {
        // "cd" is 1 from the end in "abcde" and 0 from the end of the window in "xxxcd"
        WuManberMatcher matcher = new WuManberMatcher(List.of("abcde", "xxxcd"), 2);

        assertThat(matcher.shiftFor(bytes("cd"))).isZero();
    }

    @Test
    void testOnlyMinLengthPrefixIsHashed() {
        // min length 3: "longer" contributes only "lon"
        WuManberMatcher matcher = new WuManberMatcher(List.of("abc", "longer"), 2);

        assertThat(matcher.minPatternLength()).isEqualTo(3);
        assertThat(matcher.shiftFor(bytes("on"))).isZero();
        assertThat(matcher.shiftFor(bytes("ge"))).isEqualTo(2);
        assertThat(matcher.match("a longer abc").sorted())
            .containsExactly(new Match(2, "longer"), new Match(9, "abc"));
    }

    @Test
    void testShiftNeverSkipsAnOccurrence() {
        List<String> patterns = List.of("abcab", "bcabc", "cabca");
        String text = "abcabcabcabcabc";
        WuManberMatcher matcher = new WuManberMatcher(patterns, 2);

        MatchResult expected = new BruteForceMatcher(patterns).match(text);

        assertThat(expected.size()).isGreaterThan(5);
        assertThat(matcher.match(text)).isEqualTo(expected);
    }

    @Test
    void testBlockCollisionVerifiedByByteComparison() {
        // Same prefix block and same suffix block, different middle
        WuManberMatcher matcher = new WuManberMatcher(List.of("abxde"), 2);

        assertThat(matcher.match("abyde abxde")).containsExactly(new Match(6, "abxde"));
    }

    @Test
    void testPatternsThatAreExtendedPastTheWindowAreVerifiedInFull() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("ab", "abcdef"), 2);

        // "abcd" at the end: the long pattern would run past the text
        assertThat(matcher.match("abcd")).containsExactly(new Match(0, "ab"));
    }

    @Test
    void testBlocklistScenario() {
        WuManberMatcher matcher = new WuManberMatcher(
            List.of("longlo", "ongword", "shortword", "shiningword", "longlongword"));

        assertThat(matcher.match("shortwordlonglongword").sorted()).containsExactly(
            new Match(0, "shortword"),
            new Match(9, "longlo"),
            new Match(9, "longlongword"),
            new Match(14, "ongword"));
    }

    @Test
    void testChineseScenarioWithThreeByteBlocks() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("他", "她", "他的", "她的"), 3);

        assertThat(matcher.match("他和她的").sorted()).containsExactly(
            new Match(0, "他"), new Match(2, "她"), new Match(2, "她的"));
    }

    @Test
    void testPatternShorterThanBlockRejected() {
        assertThatThrownBy(() -> new WuManberMatcher(List.of("ab", "他"), 3))
            .isInstanceOfSatisfying(ConfigurationException.class,
                e -> assertThat(e.getPattern()).isEqualTo("ab"))
            .hasMessageContaining("shorter than blockSize 3");
    }

    @Test
    void testBlockSizeBelowOneRejected() {
        assertThatThrownBy(() -> new WuManberMatcher(List.of("abc"), 0))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("blockSize must be at least 1");
    }

    @Test
    void testShiftForRejectsWrongBlockLength() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("abc"));

        assertThatThrownBy(() -> matcher.shiftFor(bytes("abc")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTextShorterThanWindow() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("abcdef"));

        assertThat(matcher.match("abc")).isEmpty();
        assertThat(matcher.match("")).isSameAs(MatchResult.empty());
    }

    @Test
    void testDump() {
        WuManberMatcher matcher = new WuManberMatcher(List.of("ab"), 1);

        List<String> dump = matcher.dump();

        assertThat(dump.get(0)).isEqualTo("WM: 1 patterns, blockSize 1, minPatternLength 2");
        assertThat(dump.get(1)).isEqualTo("Shift table: {61=1, 62=0}");
        assertThat(dump.get(2)).isEqualTo("Hash table: {62=[ab]}");
        assertThat(dump.get(3)).isEqualTo("Prefix table: {61=[ab]}");
        assertThat(PositionMapper.encode("ab")).hasSize(matcher.minPatternLength());
    }
}
