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

import net.sourceforge.pinyin4j.PinyinHelper;
import net.sourceforge.pinyin4j.format.HanyuPinyinCaseType;
import net.sourceforge.pinyin4j.format.HanyuPinyinOutputFormat;
import net.sourceforge.pinyin4j.format.HanyuPinyinToneType;
import net.sourceforge.pinyin4j.format.HanyuPinyinVCharType;
import net.sourceforge.pinyin4j.format.exception.BadHanyuPinyinOutputFormatCombination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PinyinConverter} backed by pinyin4j.
 *
 * <p>Readings are tone-less and lower-case with {@code v} for {@code ü}. Heteronyms that only
 * differ by tone collapse into one reading ({@code 的}: de5, di1, di2, di4 becomes
 * {@code [de, di]}).
 *
 * <p>Thread-safe: the output format is never modified after construction.
 *
 * @since 1.0.0
 */
public final class Pinyin4jConverter implements PinyinConverter {
    private static final Logger logger = LoggerFactory.getLogger(Pinyin4jConverter.class);

    private final HanyuPinyinOutputFormat format;

    public Pinyin4jConverter() {
        this.format = new HanyuPinyinOutputFormat();
        format.setCaseType(HanyuPinyinCaseType.LOWERCASE);
        format.setToneType(HanyuPinyinToneType.WITHOUT_TONE);
        format.setVCharType(HanyuPinyinVCharType.WITH_V);
    }

    @Override
    public List<List<String>> readings(String hanzi) {
        List<List<String>> result = new ArrayList<>(hanzi.length());
        hanzi.codePoints().forEach(cp -> result.add(readingsOf(cp)));
        return result;
    }

    private List<String> readingsOf(int codePoint) {
        String self = new String(Character.toChars(codePoint));
        if (Character.isSupplementaryCodePoint(codePoint)) {
            return List.of(self);
        }

        String[] raw;
        try {
            raw = PinyinHelper.toHanyuPinyinStringArray((char) codePoint, format);
        } catch (BadHanyuPinyinOutputFormatCombination e) {
            // Only thrown for WITH_TONE_MARK without WITH_U_UNICODE, which is never configured
            throw new IllegalStateException("ZhFilter: Invalid pinyin output format", e);
        }

        if (raw == null || raw.length == 0) {
            logger.trace("ZhFilter: No pinyin reading for U+{}", Integer.toHexString(codePoint));
            return List.of(self);
        }

        Set<String> distinct = new LinkedHashSet<>();
        for (String reading : raw) {
            if (reading != null && !reading.isEmpty()) {
                distinct.add(reading);
            }
        }
        return distinct.isEmpty() ? List.of(self) : List.copyOf(distinct);
    }
}
