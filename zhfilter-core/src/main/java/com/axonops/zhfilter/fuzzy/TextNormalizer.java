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

import com.ibm.icu.text.Transliterator;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalization applied before fuzzy expansion and matching.
 *
 * <p>Runs of non-Chinese characters are NFKD-decomposed, stripped of combining marks,
 * transliterated to ASCII with ICU ({@code Any-Latin; Latin-ASCII}) and lower-cased with
 * {@link Locale#ROOT}. {@code "Tā"} and {@code "ｔａ"} both become {@code "ta"},
 * {@code "Straße"} becomes {@code "strasse"} and {@code "Привет"} becomes {@code "privet"}.
 * Chinese characters are left untouched: compatibility decomposition would turn Kangxi radicals
 * into their unified ideograph forms and break radical keys, and transliteration would turn
 * ideographs into pinyin.
 *
 * <p>{@code normalize(normalize(s)).equals(normalize(s))} holds for every {@code s}.
 *
 * @since 1.0.0
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final int MAX_FOLD_PASSES = 4;

    // Global filter keeps the Chinese ranges of isChinese out of the transform
    private static final String ASCII_RULES =
        ":: [^\\u2E80-\\u2FDF\\u3400-\\u4DBF\\u4E00-\\u9FFF] ;\n"
            + ":: Any-Latin ;\n"
            + ":: Latin-ASCII ;\n";

    // ICU transliterators are not documented as thread-safe
    private static final ThreadLocal<Transliterator> TO_ASCII = ThreadLocal.withInitial(
        () -> Transliterator.createFromRules("ZhFilter-ASCII", ASCII_RULES, Transliterator.FORWARD));

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Normalizes a text.
     *
     * @param text any text
     * @return the normalized text
     */
    public static String normalize(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int start = i;
            boolean chinese = isChinese(text.codePointAt(i));
            while (i < text.length() && isChinese(text.codePointAt(i)) == chinese) {
                i += Character.charCount(text.codePointAt(i));
            }
            String run = text.substring(start, i);
            out.append(chinese ? run : foldRun(run));
        }
        return out.toString();
    }

    private static String foldRun(String run) {
        String current = run;
        // Lower-casing can produce characters that decompose again (e.g. U+0130), so fold to a fixed point
        for (int pass = 0; pass < MAX_FOLD_PASSES; pass++) {
            String decomposed = Normalizer.normalize(current, Normalizer.Form.NFKD);
            String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
            String folded = TO_ASCII.get().transliterate(stripped).toLowerCase(Locale.ROOT);
            if (folded.equals(current)) {
                break;
            }
            current = folded;
        }
        return current;
    }

    /**
     * True for CJK radicals (supplement and Kangxi), CJK extension A and CJK unified ideographs.
     */
    public static boolean isChinese(int codePoint) {
        return (codePoint >= 0x2E80 && codePoint <= 0x2FDF)
            || (codePoint >= 0x3400 && codePoint <= 0x4DBF)
            || (codePoint >= 0x4E00 && codePoint <= 0x9FFF);
    }

    /**
     * True if normalizing {@code s} leaves it unchanged.
     */
    public static boolean isNormalized(String s) {
        return normalize(s).equals(s);
    }
}
