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

package com.axonops.zhfilter.api;

import com.axonops.zhfilter.algo.ExactMatcher;
import com.axonops.zhfilter.config.FilterConfig;
import com.axonops.zhfilter.fuzzy.Candidate;
import com.axonops.zhfilter.fuzzy.FuzzyPreprocessor;
import com.axonops.zhfilter.fuzzy.TextNormalizer;
import com.axonops.zhfilter.metrics.FilterMetricsRegistry;
import com.axonops.zhfilter.metrics.MetricNames;
import com.axonops.zhfilter.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

/**
 * Blocklist filter: fuzzy preprocessing in front of one exact matcher.
 *
 * <p>Each call to {@link #match(String)} normalizes the text, expands it into candidate texts
 * (radical and pinyin rewrites, when enabled) and scans every candidate with the configured
 * algorithm. The result has one {@link MatchResult} per candidate; the first always belongs to
 * the normalized original text.
 *
 * <pre>{@code
 * Filter filter = Filter.build(List.of("他", "她", "他的", "她的"));
 * List<MatchResult> results = filter.match("他和她的");
 * // results.get(0): (0, 他), (2, 她), (2, 她的)
 *
 * Filter fuzzy = Filter.build(List.of("她的"), false, true);
 * fuzzy.match("ta1 de5");
 * // original "ta1 de5" finds nothing; the pinyin rewrite "她的" finds (0, 她的)
 * }</pre>
 *
 * <p>Patterns are matched as given. Normalization is applied to the text only, so a pattern that
 * normalization would change (upper-case Latin, accented letters) can never match; such patterns
 * are reported with a warning at build time.
 *
 * <p>Thread-safe: a built filter is immutable apart from its statistics counters.
 *
 * @since 1.0.0
 */
public final class Filter {
    private static final Logger logger = LoggerFactory.getLogger(Filter.class);

    private final List<String> patterns;
    private final FilterConfig config;
    private final ExactMatcher matcher;
    private final FuzzyPreprocessor preprocessor;
    private final FilterMetricsRegistry metrics;

    private final LongAdder matchCalls = new LongAdder();
    private final LongAdder candidatesEvaluated = new LongAdder();
    private final LongAdder matchesFound = new LongAdder();
    private final LongAdder emptyInputs = new LongAdder();

    private Filter(FilterConfig config, ExactMatcher matcher, FuzzyPreprocessor preprocessor) {
        this.patterns = matcher.patterns();
        this.config = config;
        this.matcher = matcher;
        this.preprocessor = preprocessor;
        this.metrics = config.metricsRegistry();
    }

    /**
     * Builds an Aho-Corasick filter without fuzzy expansion.
     *
     * @throws ConfigurationException if the pattern set is empty or holds a null or empty pattern
     */
    public static Filter build(List<String> patterns) {
        return build(patterns, FilterConfig.DEFAULT);
    }

    /**
     * Builds an Aho-Corasick filter with the given fuzzy expansions.
     *
     * @throws ConfigurationException if the pattern set is empty or holds a null or empty pattern
     */
    public static Filter build(List<String> patterns, boolean enableRadical, boolean enablePinyin) {
        return build(patterns, FilterConfig.DEFAULT.toBuilder()
            .enableRadical(enableRadical)
            .enablePinyin(enablePinyin)
            .build());
    }

    /**
     * Builds a filter.
     *
     * @param patterns the blocklist
     * @param config algorithm, fuzzy expansion and metrics settings
     * @return the built filter
     * @throws ConfigurationException if the pattern set is empty, holds a null or empty pattern,
     *     or (Wu-Manber) holds a pattern shorter than the block size
     */
    public static Filter build(List<String> patterns, FilterConfig config) {
        if (config == null) {
            throw new ConfigurationException("config must not be null");
        }
        FilterMetricsRegistry metrics = config.metricsRegistry();
        long startNanos = System.nanoTime();

        ExactMatcher matcher;
        try {
            matcher = config.algorithm().create(patterns, config.blockSize());
        } catch (ConfigurationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_CONFIGURATION);
            logger.debug("ZhFilter: Filter build rejected - algorithm: {}", config.algorithm().shortName(), e);
            throw e;
        }

        for (String pattern : matcher.patterns()) {
            if (!TextNormalizer.isNormalized(pattern)) {
                logger.warn("ZhFilter: Pattern {} changes under normalization and will never match",
                    PatternHasher.hash(pattern));
            }
        }

        FuzzyPreprocessor preprocessor = FuzzyPreprocessor.create(matcher.patterns(), config);
        Filter filter = new Filter(config, matcher, preprocessor);

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.FILTER_BUILDS);
        metrics.recordTimer(MetricNames.FILTER_BUILD_LATENCY, durationNanos);
        logger.debug("ZhFilter: Filter built - algorithm: {}, patterns: {}, radical: {}, pinyin: {}, timeNs: {}",
            config.algorithm().shortName(), PatternHasher.hashAll(filter.patterns),
            config.enableRadical(), config.enablePinyin(), durationNanos);
        return filter;
    }

    /**
     * Matches a text against the blocklist.
     *
     * <p>An empty text is not an error: it yields a single degenerate {@link MatchResult}
     * ({@link MatchResult#emptyInput()}), a warning in the log and an increment of the
     * {@link MetricNames#MATCHING_EMPTY_INPUT} counter.
     *
     * @param text the text to screen
     * @return one result per candidate text, normalized original first
     * @throws InvalidInputException if {@code text} is null
     */
    public List<MatchResult> match(String text) {
        if (text == null) {
            metrics.incrementCounter(MetricNames.ERRORS_INVALID_INPUT);
            throw new InvalidInputException("text must be a non-null string");
        }

        matchCalls.increment();
        metrics.incrementCounter(MetricNames.MATCHING_CALLS);

        if (text.isEmpty()) {
            emptyInputs.increment();
            metrics.incrementCounter(MetricNames.MATCHING_EMPTY_INPUT);
            logger.warn("ZhFilter: Empty text passed to match - returning empty result");
            return List.of(MatchResult.emptyInput());
        }

        long startNanos = System.nanoTime();
        List<Candidate> candidates = preprocessor.candidates(text);
        List<MatchResult> results = new ArrayList<>(candidates.size());
        long found = 0;
        int radicalCandidates = 0;
        int pinyinCandidates = 0;
        for (Candidate candidate : candidates) {
            MatchResult result = matcher.match(candidate.text());
            results.add(result);
            found += result.size();
            switch (candidate.source()) {
                case RADICAL -> radicalCandidates++;
                case PINYIN -> pinyinCandidates++;
                default -> { }
            }
        }
        long durationNanos = System.nanoTime() - startNanos;

        candidatesEvaluated.add(candidates.size());
        matchesFound.add(found);
        metrics.incrementCounter(MetricNames.PREPROCESS_CANDIDATES, candidates.size());
        if (radicalCandidates > 0) {
            metrics.incrementCounter(MetricNames.PREPROCESS_RADICAL_CANDIDATES, radicalCandidates);
        }
        if (pinyinCandidates > 0) {
            metrics.incrementCounter(MetricNames.PREPROCESS_PINYIN_CANDIDATES, pinyinCandidates);
        }
        if (found > 0) {
            metrics.incrementCounter(MetricNames.MATCHING_MATCHES_FOUND, found);
        }
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);

        logger.trace("ZhFilter: Matched text {} - candidates: {}, matches: {}, timeNs: {}",
            PatternHasher.hash(text), candidates.size(), found, durationNanos);
        return results;
    }

    /**
     * Diagnostic view of the exact matcher and the enabled fuzzy maps.
     *
     * <p>Pure accessor: builds and returns the lines, never logs.
     */
    public List<String> dump() {
        List<String> lines = new ArrayList<>(matcher.dump());
        lines.addAll(preprocessor.dump());
        return lines;
    }

    public FilterStatistics statistics() {
        return new FilterStatistics(
            patterns.size(),
            matchCalls.sum(),
            candidatesEvaluated.sum(),
            matchesFound.sum(),
            emptyInputs.sum());
    }

    /** The patterns, in the order given to {@code build}. */
    public List<String> patterns() {
        return patterns;
    }

    public FilterConfig config() {
        return config;
    }

    /** The exact matcher every candidate is scanned with. */
    public ExactMatcher matcher() {
        return matcher;
    }
}
