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

package com.axonops.zhfilter.metrics;

/**
 * Metric name constants for zhfilter instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Build (2 metrics)</b> - Filter construction count and latency
 *   <li><b>Matching (4 metrics)</b> - Match calls, latency, matches found, empty inputs
 *   <li><b>Preprocessing (3 metrics)</b> - Candidate texts produced by fuzzy expansion
 *   <li><b>Errors (2 metrics)</b> - Configuration and input errors
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Fuzzy fan-out:</b> PREPROCESS_CANDIDATES / MATCHING_CALLS - every candidate costs one
 *       full exact scan, so matching latency grows with this ratio
 *   <li><b>Empty inputs:</b> MATCHING_EMPTY_INPUT should stay near zero; high values point at a
 *       caller passing unset fields
 * </ul>
 *
 * @since 1.0.0
 * @see FilterMetricsRegistry
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Build Metrics (2)
  // ========================================

  /**
   * Total filters built.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String FILTER_BUILDS = "filter.builds.total.count";

  /**
   * Filter build latency: exact matcher tables plus radical and pinyin indexes.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Dominated by the pinyin index when heteronym expansion is enabled
   */
  public static final String FILTER_BUILD_LATENCY = "filter.build.latency";

  // ========================================
  // Matching Metrics (4)
  // ========================================

  /**
   * Total {@code Filter.match} calls, empty input included.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_CALLS = "matching.total.count";

  /**
   * End-to-end latency of {@code Filter.match}: preprocessing plus one exact scan per candidate.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  /**
   * Matches reported, summed over all candidates of a call.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_MATCHES_FOUND = "matching.matches.total.count";

  /**
   * Match calls with an empty text. These return a degenerate result instead of failing.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_EMPTY_INPUT = "matching.empty_input.total.count";

  // ========================================
  // Preprocessing Metrics (3)
  // ========================================

  /**
   * Candidate texts scanned, the normalized original included.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PREPROCESS_CANDIDATES = "preprocess.candidates.total.count";

  /**
   * Candidates produced by radical expansion.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PREPROCESS_RADICAL_CANDIDATES =
      "preprocess.candidates.radical.total.count";

  /**
   * Candidates produced by pinyin expansion.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PREPROCESS_PINYIN_CANDIDATES =
      "preprocess.candidates.pinyin.total.count";

  // ========================================
  // Error Metrics (2)
  // ========================================

  /**
   * Filter builds rejected with a configuration error.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_CONFIGURATION = "errors.configuration.total.count";

  /**
   * Match calls rejected because the input was not text.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_INVALID_INPUT = "errors.invalid_input.total.count";
}
