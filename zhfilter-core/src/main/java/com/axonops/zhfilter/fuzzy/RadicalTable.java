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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static character to radical-decomposition table.
 *
 * <p>Each character maps to one or more decomposition keys: strings of at least two component
 * characters, e.g. {@code 她 -> [女也]}. A character without an entry never takes part in radical
 * expansion.
 *
 * <p>The text format read by {@link #load(InputStream)} is one entry per line,
 * {@code character<TAB>key1 key2 ...}. Blank lines and lines starting with {@code #} are ignored.
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
public final class RadicalTable {
    private static final Logger logger = LoggerFactory.getLogger(RadicalTable.class);

    /** Classpath location of the bundled table. */
    public static final String DEFAULT_RESOURCE = "/com/axonops/zhfilter/fuzzy/radicals.tsv";

    private static final RadicalTable EMPTY = new RadicalTable(Collections.emptyMap());

    private final Map<String, List<String>> keysByCharacter;

    private RadicalTable(Map<String, List<String>> keysByCharacter) {
        this.keysByCharacter = keysByCharacter;
    }

    /** A table with no entries. */
    public static RadicalTable empty() {
        return EMPTY;
    }

    /**
     * Loads the table bundled with the library.
     *
     * <p>The bundled table is small: about eighty common characters and frequent blocklist
     * characters, not a full decomposition dictionary. Pattern characters outside it get no radical
     * candidates. Callers that need wider coverage should supply their own table through
     * {@link #load(InputStream)} or {@link #of(Map)}.
     *
     * @throws UncheckedIOException if the resource is missing or unreadable
     */
    public static RadicalTable loadDefault() {
        try (InputStream in = RadicalTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("ZhFilter: Radical table not found on classpath: " + DEFAULT_RESOURCE);
            }
            RadicalTable table = load(in);
            logger.debug("ZhFilter: Default radical table loaded - entries: {}", table.size());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads a table in the tab-separated format. Malformed lines are skipped with a warning.
     *
     * <p>The stream is read fully but not closed.
     *
     * @throws UncheckedIOException if reading fails
     */
    public static RadicalTable load(InputStream in) {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (!parseLine(trimmed, entries)) {
                    logger.warn("ZhFilter: Skipping malformed radical table line {}", lineNumber);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ZhFilter: Failed to read radical table", e);
        }
        return new RadicalTable(freeze(entries));
    }

    private static boolean parseLine(String line, Map<String, List<String>> entries) {
        int tab = line.indexOf('\t');
        if (tab < 0) {
            return false;
        }
        String character = line.substring(0, tab).strip();
        if (!isSingleCharacter(character)) {
            return false;
        }
        List<String> keys = new ArrayList<>();
        for (String key : line.substring(tab + 1).strip().split("\\s+")) {
            if (!isValidKey(key)) {
                return false;
            }
            keys.add(key);
        }
        List<String> existing = entries.computeIfAbsent(character, c -> new ArrayList<>());
        for (String key : keys) {
            if (!existing.contains(key)) {
                existing.add(key);
            }
        }
        return true;
    }

    /**
     * Builds a table from a map.
     *
     * @param entries character to decomposition keys
     * @throws ConfigurationException if a character is not exactly one code point, or a key is
     *     shorter than two code points
     */
    public static RadicalTable of(Map<String, ? extends Collection<String>> entries) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : entries.entrySet()) {
            String character = entry.getKey();
            if (!isSingleCharacter(character)) {
                throw new ConfigurationException("radical table key must be one character: " + character);
            }
            List<String> keys = new ArrayList<>();
            for (String key : entry.getValue()) {
                if (!isValidKey(key)) {
                    throw new ConfigurationException(
                        "decomposition of " + character + " must have at least two components: " + key);
                }
                if (!keys.contains(key)) {
                    keys.add(key);
                }
            }
            copy.put(character, keys);
        }
        return new RadicalTable(freeze(copy));
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> entries) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        entries.forEach((character, keys) -> frozen.put(character, List.copyOf(keys)));
        return Collections.unmodifiableMap(frozen);
    }

    private static boolean isSingleCharacter(String s) {
        return s != null && !s.isEmpty() && s.codePointCount(0, s.length()) == 1;
    }

    private static boolean isValidKey(String key) {
        return key != null && key.codePointCount(0, key.length()) >= 2;
    }

    /**
     * Decomposition keys of one character.
     *
     * @param character a single character
     * @return its keys, empty if the table has no entry
     */
    public List<String> keys(String character) {
        return keysByCharacter.getOrDefault(character, List.of());
    }

    /** Characters that have an entry. */
    public Set<String> characters() {
        return keysByCharacter.keySet();
    }

    public int size() {
        return keysByCharacter.size();
    }
}
