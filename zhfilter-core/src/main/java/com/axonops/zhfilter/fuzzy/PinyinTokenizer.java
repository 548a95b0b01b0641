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
 * Splits romanized text into pinyin syllables.
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 1.0.0
 * @see SyllableTokenizer
 */
@FunctionalInterface
public interface PinyinTokenizer {

    /**
     * Tokenizes lower-case letters (optionally separated by whitespace) into syllables.
     *
     * <p>{@code "zhong guo"} and {@code "zhongguo"} both yield {@code [zhong, guo]}. Letters that
     * cannot be part of any syllable are dropped.
     *
     * @param pinyin romanized text
     * @return syllables in order
     */
    List<String> tokenize(String pinyin);
}
