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

package com.axonops.zhfilter.util;

import java.nio.charset.StandardCharsets;

/**
 * Converts byte positions in a UTF-8 buffer into {@code char} offsets of the original string.
 *
 * <p>The byte-level matchers report where a pattern ends in the encoded text; callers need the
 * start of the occurrence as an index into the {@link String} they searched. Offsets are in
 * UTF-16 code units, the same unit as {@link String#indexOf(String)}.
 *
 * <p>Callers must pass positions derived from valid pattern encodings, so the computed start
 * always falls on a code point boundary.
 *
 * @since 1.0.0
 */
public final class PositionMapper {

    private PositionMapper() {
        // Utility class
    }

    /**
     * Returns the character offset where a match starts.
     *
     * @param text the UTF-8 encoded text
     * @param endByte index of the last byte of the match
     * @param patternByteLength encoded length of the matched pattern
     * @return start offset of the match in {@code char} units
     * @throws IllegalArgumentException if the computed start lies outside the buffer
     */
    public static int toCharOffset(byte[] text, int endByte, int patternByteLength) {
        int startByte = endByte - patternByteLength + 1;
        if (startByte < 0 || startByte > text.length) {
            throw new IllegalArgumentException(
                "ZhFilter: match start byte " + startByte + " outside text of " + text.length + " bytes");
        }
        return new String(text, 0, startByte, StandardCharsets.UTF_8).length();
    }

    /**
     * Encodes a string as UTF-8.
     */
    public static byte[] encode(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
