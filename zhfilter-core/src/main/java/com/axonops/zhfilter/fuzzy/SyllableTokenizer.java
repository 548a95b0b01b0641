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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PinyinTokenizer} over the standard Mandarin syllable inventory.
 *
 * <p>Input is split on whitespace first; each chunk is then segmented greedily, longest syllable
 * first, backtracking when the remainder cannot be segmented ({@code "xian"} stays one syllable,
 * {@code "xianggang"} becomes {@code [xiang, gang]}). A letter that starts no syllable of any
 * complete segmentation is skipped and segmentation resumes after it.
 *
 * <p>Stateless and thread-safe.
 *
 * @since 1.0.0
 */
public final class SyllableTokenizer implements PinyinTokenizer {
    private static final Logger logger = LoggerFactory.getLogger(SyllableTokenizer.class);

    private static final int MAX_SYLLABLE_LENGTH = 6;

    private static final Set<String> SYLLABLES = Collections.unmodifiableSet(new HashSet<>(List.of(
        // Interjections with no vowel
        "m", "n", "ng", "hm",
        "a", "ai", "an", "ang", "ao",
        "ba", "bai", "ban", "bang", "bao", "bei", "ben", "beng", "bi", "bian", "biao", "bie", "bin",
        "bing", "bo", "bu",
        "ca", "cai", "can", "cang", "cao", "ce", "cen", "ceng", "cha", "chai", "chan", "chang",
        "chao", "che", "chen", "cheng", "chi", "chong", "chou", "chu", "chua", "chuai", "chuan",
        "chuang", "chui", "chun", "chuo", "ci", "cong", "cou", "cu", "cuan", "cui", "cun", "cuo",
        "da", "dai", "dan", "dang", "dao", "de", "dei", "den", "deng", "di", "dia", "dian", "diao",
        "die", "ding", "diu", "dong", "dou", "du", "duan", "dui", "dun", "duo",
        "e", "ei", "en", "eng", "er",
        "fa", "fan", "fang", "fei", "fen", "feng", "fo", "fou", "fu",
        "ga", "gai", "gan", "gang", "gao", "ge", "gei", "gen", "geng", "gong", "gou", "gu", "gua",
        "guai", "guan", "guang", "gui", "gun", "guo",
        "ha", "hai", "han", "hang", "hao", "he", "hei", "hen", "heng", "hong", "hou", "hu", "hua",
        "huai", "huan", "huang", "hui", "hun", "huo",
        "ji", "jia", "jian", "jiang", "jiao", "jie", "jin", "jing", "jiong", "jiu", "ju", "juan",
        "jue", "jun",
        "ka", "kai", "kan", "kang", "kao", "ke", "kei", "ken", "keng", "kong", "kou", "ku", "kua",
        "kuai", "kuan", "kuang", "kui", "kun", "kuo",
        "la", "lai", "lan", "lang", "lao", "le", "lei", "leng", "li", "lia", "lian", "liang",
        "liao", "lie", "lin", "ling", "liu", "lo", "long", "lou", "lu", "luan", "lun", "luo", "lv",
        "lve",
        "ma", "mai", "man", "mang", "mao", "me", "mei", "men", "meng", "mi", "mian", "miao", "mie",
        "min", "ming", "miu", "mo", "mou", "mu",
        "na", "nai", "nan", "nang", "nao", "ne", "nei", "nen", "neng", "ni", "nian", "niang",
        "niao", "nie", "nin", "ning", "niu", "nong", "nou", "nu", "nuan", "nun", "nuo", "nv", "nve",
        "o", "ou",
        "pa", "pai", "pan", "pang", "pao", "pei", "pen", "peng", "pi", "pian", "piao", "pie", "pin",
        "ping", "po", "pou", "pu",
        "qi", "qia", "qian", "qiang", "qiao", "qie", "qin", "qing", "qiong", "qiu", "qu", "quan",
        "que", "qun",
        "ran", "rang", "rao", "re", "ren", "reng", "ri", "rong", "rou", "ru", "rua", "ruan", "rui",
        "run", "ruo",
        "sa", "sai", "san", "sang", "sao", "se", "sen", "seng", "sha", "shai", "shan", "shang",
        "shao", "she", "shei", "shen", "sheng", "shi", "shou", "shu", "shua", "shuai", "shuan",
        "shuang", "shui", "shun", "shuo", "si", "song", "sou", "su", "suan", "sui", "sun", "suo",
        "ta", "tai", "tan", "tang", "tao", "te", "tei", "teng", "ti", "tian", "tiao", "tie", "ting",
        "tong", "tou", "tu", "tuan", "tui", "tun", "tuo",
        "wa", "wai", "wan", "wang", "wei", "wen", "weng", "wo", "wu",
        "xi", "xia", "xian", "xiang", "xiao", "xie", "xin", "xing", "xiong", "xiu", "xu", "xuan",
        "xue", "xun",
        "ya", "yan", "yang", "yao", "ye", "yi", "yin", "ying", "yo", "yong", "you", "yu", "yuan",
        "yue", "yun",
        "za", "zai", "zan", "zang", "zao", "ze", "zei", "zen", "zeng", "zha", "zhai", "zhan",
        "zhang", "zhao", "zhe", "zhei", "zhen", "zheng", "zhi", "zhong", "zhou", "zhu", "zhua",
        "zhuai", "zhuan", "zhuang", "zhui", "zhun", "zhuo", "zi", "zong", "zou", "zu", "zuan",
        "zui", "zun", "zuo")));

    @Override
    public List<String> tokenize(String pinyin) {
        List<String> syllables = new ArrayList<>();
        for (String chunk : pinyin.trim().split("\\s+")) {
            if (!chunk.isEmpty()) {
                tokenizeChunk(chunk, syllables);
            }
        }
        return syllables;
    }

    private void tokenizeChunk(String chunk, List<String> out) {
        boolean[] complete = completeFrom(chunk);
        int pos = 0;
        while (pos < chunk.length()) {
            if (complete[pos]) {
                appendSegmentation(chunk, pos, complete, out);
                return;
            }
            // Nothing from here on segments completely: take the longest syllable, or skip a letter
            String head = longestAt(chunk, pos);
            if (head == null) {
                logger.trace("ZhFilter: Skipping unsegmentable letter '{}' at {}", chunk.charAt(pos), pos);
                pos++;
            } else {
                out.add(head);
                pos += head.length();
            }
        }
    }

    /**
     * {@code complete[p]} is true if {@code chunk[p..]} splits entirely into syllables. Filled
     * right to left so long chunks need no recursion.
     */
    private static boolean[] completeFrom(String chunk) {
        boolean[] complete = new boolean[chunk.length() + 1];
        complete[chunk.length()] = true;
        for (int from = chunk.length() - 1; from >= 0; from--) {
            int maxEnd = Math.min(chunk.length(), from + MAX_SYLLABLE_LENGTH);
            for (int end = maxEnd; end > from && !complete[from]; end--) {
                complete[from] = complete[end] && SYLLABLES.contains(chunk.substring(from, end));
            }
        }
        return complete;
    }

    /**
     * Longest-first segmentation of {@code chunk[from..]}, which must be complete: at each step the
     * longest syllable whose remainder still segments.
     */
    private static void appendSegmentation(String chunk, int from, boolean[] complete, List<String> out) {
        int pos = from;
        while (pos < chunk.length()) {
            int maxEnd = Math.min(chunk.length(), pos + MAX_SYLLABLE_LENGTH);
            int end = maxEnd;
            while (!(complete[end] && SYLLABLES.contains(chunk.substring(pos, end)))) {
                end--;
            }
            out.add(chunk.substring(pos, end));
            pos = end;
        }
    }

    private static String longestAt(String chunk, int from) {
        int maxEnd = Math.min(chunk.length(), from + MAX_SYLLABLE_LENGTH);
        for (int end = maxEnd; end > from; end--) {
            String candidate = chunk.substring(from, end);
            if (SYLLABLES.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /** True if {@code s} is one syllable of the inventory. */
    public static boolean isSyllable(String s) {
        return SYLLABLES.contains(s);
    }
}
