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

import java.util.List;

/**
 * Converts Chinese characters to their pinyin readings.
 *
 * <p>Implementations must be thread-safe; one converter is shared by every filter built from the
 * same configuration.
 *
 * @since 1.0.0
 * @see Pinyin4jConverter
 */
@FunctionalInterface
public interface PinyinConverter {

    /**
     * Returns the candidate readings of each character of {@code hanzi}.
     *
     * <p>The outer list has one entry per character, in order. Each entry lists every reading of
     * that character (heteronyms), lower-case, without tone marks or digits, with {@code v}
     * standing for {@code ü}. A character with no known reading is returned as itself.
     *
     * @param hanzi Chinese characters
     * @return per-character reading lists, never empty lists
     */
    List<List<String>> readings(String hanzi);
}
