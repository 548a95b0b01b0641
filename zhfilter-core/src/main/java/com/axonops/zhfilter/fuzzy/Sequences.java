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

import java.util.ArrayList;
import java.util.List;

/**
 * Contiguous sub-sequence enumeration used by the radical and pinyin expansions.
 */
final class Sequences {

    private Sequences() {
        // Utility class
    }

    /**
     * All contiguous sub-lists of {@code minLength} to {@code maxLength} elements, ordered by start
     * index, then by length.
     *
     * <p>e.g. {@code [a, b, c]} with minLength 2 and maxLength 3: {@code [a, b], [a, b, c], [b, c]}
     */
    static <T> List<List<T>> contiguous(List<T> seq, int minLength, int maxLength) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < seq.size(); i++) {
            int last = Math.min(seq.size(), i + maxLength);
            for (int j = i + minLength; j <= last; j++) {
                out.add(List.copyOf(seq.subList(i, j)));
            }
        }
        return out;
    }

    /**
     * Code points of a string as one-character strings, so supplementary characters stay whole.
     */
    static List<String> characters(String s) {
        List<String> chars = new ArrayList<>(s.length());
        s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
        return chars;
    }
}
