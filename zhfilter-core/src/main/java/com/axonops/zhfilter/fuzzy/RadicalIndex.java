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

import com.axonops.zhfilter.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Radical map for one pattern set: decomposition key to the pattern characters it stands for.
 *
 * <p>Only characters that occur in the patterns are indexed. Text that spells a character by its
 * components ({@code 女也} for {@code 她}) is rewritten back to the character by
 * {@link #expand(String)}.
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
public final class RadicalIndex {
    private static final Logger logger = LoggerFactory.getLogger(RadicalIndex.class);

    private static final int MIN_RUN_LENGTH = 2;

    private final Map<String, Set<String>> charactersByKey;
    private final Set<Integer> keyCharacters;
    private final int maxKeyLength;

    /**
     * Indexes every pattern character that has an entry in {@code table}.
     */
    public RadicalIndex(List<String> patterns, RadicalTable table) {
        Map<String, Set<String>> byKey = new LinkedHashMap<>();
        Set<Integer> components = new HashSet<>();
        for (String pattern : patterns) {
            for (String character : Sequences.characters(pattern)) {
                for (String key : table.keys(character)) {
                    byKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(character);
                    key.codePoints().forEach(components::add);
                }
            }
        }

        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        byKey.forEach((key, chars) -> frozen.put(key, Collections.unmodifiableSet(chars)));
        this.charactersByKey = Collections.unmodifiableMap(frozen);
        this.keyCharacters = Collections.unmodifiableSet(components);
        this.maxKeyLength = charactersByKey.keySet().stream()
            .mapToInt(key -> key.codePointCount(0, key.length()))
            .max().orElse(0);

        logger.debug("ZhFilter: Radical index built - patterns: {}, keys: {}, components: {}",
            PatternHasher.hashAll(patterns), charactersByKey.size(), keyCharacters.size());
    }

    /**
     * Pattern characters that decompose into {@code key}.
     *
     * @return the characters in pattern order, empty if none
     */
    public Set<String> lookup(String key) {
        return charactersByKey.getOrDefault(key, Set.of());
    }

    /** True if the code point is a component of at least one indexed key. */
    public boolean isKeyCharacter(int codePoint) {
        return keyCharacters.contains(codePoint);
    }

    public int keyCount() {
        return charactersByKey.size();
    }

    /**
     * Rewrites component spellings in {@code text} back to pattern characters.
     *
     * <p>Every maximal run of at least two key characters is considered once, in order of first
     * appearance. Each contiguous sub-run of length two or more that is a known key yields one
     * candidate per character it stands for, with every occurrence of the sub-run replaced.
     * Hits are never combined into one candidate.
     *
     * @param text normalized text
     * @return the rewritten candidates, possibly empty
     */
    public List<Candidate> expand(String text) {
        if (charactersByKey.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (String run : keyRuns(text)) {
            List<String> characters = Sequences.characters(run);
            for (List<String> subRun : Sequences.contiguous(characters, MIN_RUN_LENGTH, maxKeyLength)) {
                String key = String.join("", subRun);
                for (String character : lookup(key)) {
                    candidates.add(new Candidate(text.replace(key, character), Candidate.Source.RADICAL));
                    logger.trace("ZhFilter: Radical hit - key length: {}", subRun.size());
                }
            }
        }
        return candidates;
    }

    private Set<String> keyRuns(String text) {
        Set<String> runs = new LinkedHashSet<>();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (!isKeyCharacter(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            int start = i;
            int length = 0;
            while (i < text.length() && isKeyCharacter(text.codePointAt(i))) {
                i += Character.charCount(text.codePointAt(i));
                length++;
            }
            if (length >= MIN_RUN_LENGTH) {
                runs.add(text.substring(start, i));
            }
        }
        return runs;
    }

    /**
     * Diagnostic view: one line per key.
     */
    public List<String> dump() {
        List<String> lines = new ArrayList<>(charactersByKey.size() + 1);
        lines.add("Radical map: " + charactersByKey.size() + " keys");
        charactersByKey.forEach((key, chars) -> lines.add("  " + key + " -> " + chars));
        return lines;
    }
}
