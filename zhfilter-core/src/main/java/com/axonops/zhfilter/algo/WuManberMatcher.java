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
import com.axonops.zhfilter.api.MatchResult;
import com.axonops.zhfilter.util.PatternHasher;
import com.axonops.zhfilter.util.PositionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wu-Manber multi-pattern matcher over UTF-8 bytes.
 *
 * <p>Only the first {@code minPatternLength} bytes of each pattern (the length of the shortest
 * encoded pattern) take part in hashing; the scan window has that length. Three tables are keyed
 * by {@code blockSize}-byte blocks:
 * <ul>
 *   <li><b>shift</b> - how far the window may safely advance when its last block is this one.
 *       The smallest distance wins when several patterns or positions share a block.</li>
 *   <li><b>hash</b> - patterns whose block ending at {@code minPatternLength} is this one</li>
 *   <li><b>prefix</b> - patterns whose first block is this one</li>
 * </ul>
 *
 * <p>A zero shift means a pattern may end at the current window; the candidates from the hash
 * and prefix tables are then compared byte-for-byte against the text, which discards block
 * collisions before anything is reported.
 *
 * <p>Thread-safe after construction.
 *
 * @since 1.0.0
 */
public final class WuManberMatcher implements ExactMatcher {
    private static final Logger logger = LoggerFactory.getLogger(WuManberMatcher.class);

    /** Default block size in bytes. */
    public static final int DEFAULT_BLOCK_SIZE = 2;

    private final List<String> patterns;
    private final int blockSize;
    private final int minPatternLength;
    private final int defaultShift;

    private final Map<Block, Integer> shift = new LinkedHashMap<>();
    private final Map<Block, Set<String>> hash = new LinkedHashMap<>();
    private final Map<Block, Set<String>> prefix = new LinkedHashMap<>();
    private final Map<String, byte[]> encoded = new LinkedHashMap<>();

    public WuManberMatcher(List<String> patterns) {
        this(patterns, DEFAULT_BLOCK_SIZE);
    }

    /**
     * Builds the shift, hash and prefix tables.
     *
     * @param patterns the pattern set
     * @param blockSize block length in bytes
     * @throws ConfigurationException if {@code blockSize < 1}, the set is empty, or the shortest
     *     encoded pattern is shorter than {@code blockSize}
     */
    public WuManberMatcher(List<String> patterns, int blockSize) {
        this.patterns = PatternValidator.validate(patterns);
        if (blockSize < 1) {
            throw new ConfigurationException("blockSize must be at least 1, got " + blockSize);
        }
        this.blockSize = blockSize;

        long startNanos = System.nanoTime();
        int min = Integer.MAX_VALUE;
        for (String pattern : this.patterns) {
            byte[] bytes = PositionMapper.encode(pattern);
            encoded.put(pattern, bytes);
            if (bytes.length < blockSize) {
                throw new ConfigurationException(pattern,
                    "pattern is " + bytes.length + " bytes, shorter than blockSize " + blockSize);
            }
            min = Math.min(min, bytes.length);
        }
        this.minPatternLength = min;
        this.defaultShift = minPatternLength - blockSize + 1;

        for (String pattern : this.patterns) {
            insert(pattern, encoded.get(pattern));
        }

        logger.debug("ZhFilter: Wu-Manber built - patterns: {}, blockSize: {}, minLength: {}, "
                + "shiftEntries: {}, timeNs: {}",
            PatternHasher.hashAll(this.patterns), blockSize, minPatternLength, shift.size(),
            System.nanoTime() - startNanos);
    }

    private void insert(String pattern, byte[] bytes) {
        // e.g. blockSize 2, minPatternLength 5, "abcde": ab=3, bc=2, cd=1, de=0
        for (int i = 0; i <= minPatternLength - blockSize; i++) {
            Block block = Block.of(bytes, i, blockSize);
            int distance = minPatternLength - i - blockSize;
            shift.merge(block, distance, Math::min);
        }

        Block suffixKey = Block.of(bytes, minPatternLength - blockSize, blockSize);
        hash.computeIfAbsent(suffixKey, k -> new LinkedHashSet<>()).add(pattern);

        Block prefixKey = Block.of(bytes, 0, blockSize);
        prefix.computeIfAbsent(prefixKey, k -> new LinkedHashSet<>()).add(pattern);
    }

    @Override
    public MatchResult match(String text) {
        PatternValidator.requireText(text);
        if (text.isEmpty()) {
            return MatchResult.empty();
        }

        MatchResult.Builder matches = MatchResult.builder();
        byte[] textBytes = PositionMapper.encode(text);

        int endPos = minPatternLength - 1;
        while (endPos < textBytes.length) {
            Block endBlock = Block.of(textBytes, endPos - blockSize + 1, blockSize);
            int shiftValue = shift.getOrDefault(endBlock, defaultShift);
            if (shiftValue != 0) {
                endPos += shiftValue;
                continue;
            }

            int startPos = endPos - minPatternLength + 1;
            Set<String> suffixCandidates = hash.getOrDefault(endBlock, Collections.emptySet());
            Set<String> prefixCandidates =
                prefix.getOrDefault(Block.of(textBytes, startPos, blockSize), Collections.emptySet());

            for (String pattern : suffixCandidates) {
                if (!prefixCandidates.contains(pattern)) {
                    continue;
                }
                byte[] patternBytes = encoded.get(pattern);
                if (regionMatches(textBytes, startPos, patternBytes)) {
                    int end = startPos + patternBytes.length - 1;
                    matches.add(PositionMapper.toCharOffset(textBytes, end, patternBytes.length), pattern);
                } else {
                    logger.trace("ZhFilter: Block collision for pattern {} at byte {}",
                        PatternHasher.hash(pattern), startPos);
                }
            }

            endPos++;
        }
        return matches.build();
    }

    private static boolean regionMatches(byte[] text, int start, byte[] pattern) {
        if (start + pattern.length > text.length) {
            return false;
        }
        return Arrays.equals(text, start, start + pattern.length, pattern, 0, pattern.length);
    }

    public int blockSize() {
        return blockSize;
    }

    /** Encoded length of the shortest pattern, which is also the scan window length. */
    public int minPatternLength() {
        return minPatternLength;
    }

    /**
     * Shift distance for a block, or the default shift if no pattern contains it.
     *
     * @param block exactly {@link #blockSize()} bytes
     */
    public int shiftFor(byte[] block) {
        if (block.length != blockSize) {
            throw new IllegalArgumentException("block must be " + blockSize + " bytes, got " + block.length);
        }
        return shift.getOrDefault(Block.of(block, 0, blockSize), defaultShift);
    }

    @Override
    public List<String> dump() {
        List<String> lines = new ArrayList<>();
        lines.add("WM: " + patterns.size() + " patterns, blockSize " + blockSize
            + ", minPatternLength " + minPatternLength);
        lines.add("Shift table: " + shift);
        lines.add("Hash table: " + hash);
        lines.add("Prefix table: " + prefix);
        return lines;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.WU_MANBER;
    }

    @Override
    public List<String> patterns() {
        return patterns;
    }

    /**
     * Fixed-length byte window used as a table key. Compared by content.
     */
    private record Block(byte[] bytes) {

        static Block of(byte[] source, int from, int length) {
            return new Block(Arrays.copyOfRange(source, from, from + length));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Block other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (byte b : bytes) {
                sb.append(String.format("%02x", b & 0xff));
            }
            return sb.toString();
        }
    }
}
