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

import com.axonops.zhfilter.api.ConfigurationException;
import com.axonops.zhfilter.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pinyin map for one pattern set: syllable sequence to the pattern substrings it can spell.
 *
 * <p>For every run of common ideographs ({@code U+4E00..U+9FA5}) in a pattern, all readings are
 * expanded (the Cartesian product over each character's heteronyms), and every contiguous
 * sub-sequence of a reading is mapped to the aligned substring of the run. For {@code 她的} with
 * {@code 的} read as de or di:
 * <pre>
 * [ta]     -> 她      [ta, de] -> 她的
 * [de]     -> 的      [ta, di] -> 她的
 * [di]     -> 的
 * </pre>
 *
 * <p>Immutable and thread-safe, provided the tokenizer is.
 *
 * @since 1.0.0
 */
public final class PinyinIndex {
    private static final Logger logger = LoggerFactory.getLogger(PinyinIndex.class);

    private static final Pattern IDEOGRAPH_RUN = Pattern.compile("[\\u4e00-\\u9fa5]+");
    private static final Pattern TONE_DIGITS = Pattern.compile("[1-5]");

    private final Map<List<String>, Set<String>> spellings;
    private final int maxKeyLength;
    private final PinyinTokenizer tokenizer;

    /**
     * Builds the map.
     *
     * @param patterns the pattern set
     * @param converter source of per-character readings
     * @param tokenizer splits input pinyin into syllables
     * @param maxReadingCombinations cap on expanded readings per ideograph run; further
     *     combinations are dropped with a warning
     * @throws ConfigurationException if {@code maxReadingCombinations < 1}
     */
    public PinyinIndex(List<String> patterns, PinyinConverter converter, PinyinTokenizer tokenizer,
                       int maxReadingCombinations) {
        if (maxReadingCombinations < 1) {
            throw new ConfigurationException(
                "maxReadingCombinations must be at least 1, got " + maxReadingCombinations);
        }
        this.tokenizer = tokenizer;

        long startNanos = System.nanoTime();
        Map<List<String>, Set<String>> map = new LinkedHashMap<>();
        for (String pattern : patterns) {
            Matcher m = IDEOGRAPH_RUN.matcher(pattern);
            while (m.find()) {
                index(m.group(), converter, maxReadingCombinations, map);
            }
        }

        Map<List<String>, Set<String>> frozen = new LinkedHashMap<>();
        map.forEach((syllables, hanzi) -> frozen.put(syllables, Collections.unmodifiableSet(hanzi)));
        this.spellings = Collections.unmodifiableMap(frozen);
        this.maxKeyLength = spellings.keySet().stream().mapToInt(List::size).max().orElse(0);

        logger.debug("ZhFilter: Pinyin index built - patterns: {}, entries: {}, timeNs: {}",
            PatternHasher.hashAll(patterns), spellings.size(), System.nanoTime() - startNanos);
    }

    private static void index(String run, PinyinConverter converter, int maxCombinations,
                              Map<List<String>, Set<String>> map) {
        List<String> characters = Sequences.characters(run);
        List<List<String>> readings = converter.readings(run);
        if (readings.size() != characters.size()) {
            throw new IllegalStateException("ZhFilter: Pinyin converter returned " + readings.size()
                + " reading lists for " + characters.size() + " characters");
        }

        for (List<String> reading : combinations(readings, maxCombinations, run)) {
            for (int i = 0; i < reading.size(); i++) {
                for (int j = i + 1; j <= reading.size(); j++) {
                    String hanzi = String.join("", characters.subList(i, j));
                    map.computeIfAbsent(List.copyOf(reading.subList(i, j)), k -> new LinkedHashSet<>())
                        .add(hanzi);
                }
            }
        }
    }

    /**
     * Cartesian product of the per-character readings, in odometer order, at most {@code max}.
     */
    static List<List<String>> combinations(List<List<String>> readings, int max, String run) {
        long total = 1;
        for (List<String> options : readings) {
            if (options.isEmpty()) {
                throw new IllegalStateException("ZhFilter: Pinyin converter returned no reading for a character");
            }
            total *= options.size();
            if (total > max) {
                logger.warn("ZhFilter: Heteronym expansion capped - run: {}, kept: {} combinations",
                    PatternHasher.hash(run), max);
                break;
            }
        }

        List<List<String>> out = new ArrayList<>();
        int[] odometer = new int[readings.size()];
        while (out.size() < max) {
            List<String> reading = new ArrayList<>(readings.size());
            for (int i = 0; i < readings.size(); i++) {
                reading.add(readings.get(i).get(odometer[i]));
            }
            out.add(reading);

            int pos = readings.size() - 1;
            while (pos >= 0 && ++odometer[pos] == readings.get(pos).size()) {
                odometer[pos] = 0;
                pos--;
            }
            if (pos < 0) {
                break;
            }
        }
        return out;
    }

    /**
     * Pattern substrings spelled by a syllable sequence.
     *
     * @return the substrings in pattern order, empty if none
     */
    public Set<String> lookup(List<String> syllables) {
        return spellings.getOrDefault(syllables, Set.of());
    }

    public int size() {
        return spellings.size();
    }

    /**
     * Rewrites pinyin spellings in {@code text} back to pattern characters.
     *
     * <p>Each run of lower-case letters (optionally followed by tone digits and separated by
     * single spaces) is tokenized twice: as written, and with the spaces removed. Every contiguous
     * sub-sequence of either tokenization that is in the map yields one candidate per substring it
     * spells. The candidate replaces every occurrence of those syllables in the text, each
     * optionally followed by a tone digit and separated by any amount of whitespace.
     *
     * @param text normalized text
     * @return the rewritten candidates, possibly empty
     */
    public List<Candidate> expand(String text) {
        if (spellings.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (String found : pinyinRuns(text)) {
            String run = TONE_DIGITS.matcher(found).replaceAll("").strip();
            if (run.isEmpty()) {
                continue;
            }
            for (List<String> tokens : tokenizations(run)) {
                for (int i = 0; i < tokens.size(); i++) {
                    // No key is longer than maxKeyLength syllables
                    int last = Math.min(tokens.size(), i + maxKeyLength);
                    for (int j = i + 1; j <= last; j++) {
                        List<String> syllables = tokens.subList(i, j);
                        for (String hanzi : lookup(syllables)) {
                            String rewritten = spellingPattern(syllables).matcher(text)
                                .replaceAll(Matcher.quoteReplacement(hanzi));
                            candidates.add(new Candidate(rewritten, Candidate.Source.PINYIN));
                            logger.trace("ZhFilter: Pinyin hit - syllables: {}", syllables.size());
                        }
                    }
                }
            }
        }
        return candidates;
    }

    /**
     * Runs of letters, each word optionally followed by one tone digit and one space
     * ({@code "ta1 de5"}, {@code "tade"}). Scanned by hand; a repeated regex group recurses once
     * per repetition and overflows the stack on long runs.
     */
    static List<String> pinyinRuns(String text) {
        List<String> runs = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (!isLetter(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < text.length() && isLetter(text.charAt(i))) {
                while (i < text.length() && isLetter(text.charAt(i))) {
                    i++;
                }
                if (i < text.length() && isToneDigit(text.charAt(i))) {
                    i++;
                }
                if (i < text.length() && text.charAt(i) == ' ') {
                    i++;
                }
            }
            runs.add(text.substring(start, i));
        }
        return runs;
    }

    private static boolean isLetter(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isToneDigit(char c) {
        return c >= '1' && c <= '5';
    }

    private Set<List<String>> tokenizations(String run) {
        Set<List<String>> out = new LinkedHashSet<>();
        out.add(tokenizer.tokenize(run));
        out.add(tokenizer.tokenize(run.replace(" ", "")));
        return out;
    }

    private static Pattern spellingPattern(List<String> syllables) {
        StringBuilder regex = new StringBuilder();
        for (String syllable : syllables) {
            if (regex.length() > 0) {
                regex.append("\\s*");
            }
            regex.append(Pattern.quote(syllable)).append("[1-5]?");
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Diagnostic view: one line per syllable sequence.
     */
    public List<String> dump() {
        List<String> lines = new ArrayList<>(spellings.size() + 1);
        lines.add("Pinyin map: " + spellings.size() + " entries");
        spellings.forEach((syllables, hanzi) -> lines.add("  " + syllables + " -> " + hanzi));
        return lines;
    }
}
