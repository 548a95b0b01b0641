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

package com.axonops.zhfilter.config;

import com.axonops.zhfilter.algo.Algorithm;
import com.axonops.zhfilter.algo.WuManberMatcher;
import com.axonops.zhfilter.api.ConfigurationException;
import com.axonops.zhfilter.fuzzy.Pinyin4jConverter;
import com.axonops.zhfilter.fuzzy.PinyinConverter;
import com.axonops.zhfilter.fuzzy.PinyinTokenizer;
import com.axonops.zhfilter.fuzzy.RadicalTable;
import com.axonops.zhfilter.fuzzy.SyllableTokenizer;
import com.axonops.zhfilter.metrics.FilterMetricsRegistry;
import com.axonops.zhfilter.metrics.NoOpMetricsRegistry;

/**
 * Configuration for building a {@link com.axonops.zhfilter.api.Filter}.
 *
 * <p>Immutable configuration using Java 17 records. Selects the exact matching algorithm, turns
 * the fuzzy expansions on or off, and supplies their lookup collaborators and the metrics sink.
 *
 * <h2>Fuzzy Expansion</h2>
 *
 * <p>Both expansions are off by default. Each enabled expansion adds rewritten candidate texts,
 * and every candidate costs one full exact scan:
 *
 * <ul>
 *   <li><b>Radical</b> - component spellings ({@code 女也}) rewritten to pattern characters
 *       ({@code 她}) using {@code radicalTable}
 *   <li><b>Pinyin</b> - romanized spellings ({@code ta de}) rewritten to pattern characters
 *       using {@code pinyinConverter} and {@code pinyinTokenizer}
 * </ul>
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Aho-Corasick, no fuzzy expansion, metrics disabled
 * FilterConfig config = FilterConfig.DEFAULT;
 *
 * // Wu-Manber with 3-byte blocks, both expansions, Dropwizard metrics
 * FilterConfig config = FilterConfig.builder()
 *     .algorithm(Algorithm.WU_MANBER)
 *     .blockSize(3)
 *     .enableRadical(true)
 *     .enablePinyin(true)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.zhfilter"))
 *     .build();
 * }</pre>
 *
 * <h2>Heteronym Cap</h2>
 *
 * <p>A run of n ideographs with k readings each expands to k^n readings. {@code
 * maxReadingCombinations} bounds this per run (default 1024); readings past the cap are dropped
 * with a warning, so long heteronym-heavy patterns may only match some of their spellings.
 *
 * @param algorithm exact matcher used for every candidate
 * @param blockSize Wu-Manber block size in bytes (must be >= 1, ignored by other algorithms)
 * @param enableRadical expand radical spellings
 * @param enablePinyin expand pinyin spellings
 * @param maxReadingCombinations cap on heteronym readings per ideograph run (must be >= 1)
 * @param radicalTable character to decomposition table
 * @param pinyinConverter character to readings
 * @param pinyinTokenizer pinyin text to syllables
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see com.axonops.zhfilter.metrics.MetricNames
 */
public record FilterConfig(
    Algorithm algorithm,
    int blockSize,
    boolean enableRadical,
    boolean enablePinyin,
    int maxReadingCombinations,
    RadicalTable radicalTable,
    PinyinConverter pinyinConverter,
    PinyinTokenizer pinyinTokenizer,
    FilterMetricsRegistry metricsRegistry) {

  /** Default cap on heteronym readings per ideograph run. */
  public static final int DEFAULT_MAX_READING_COMBINATIONS = 1024;

  /**
   * Default configuration: Aho-Corasick, fuzzy expansion off, bundled radical table, pinyin4j
   * readings, metrics disabled.
   */
  public static final FilterConfig DEFAULT = builder().build();

  /** Compact constructor with validation. */
  public FilterConfig {
    if (algorithm == null) {
      throw new ConfigurationException("algorithm must not be null");
    }
    if (blockSize < 1) {
      throw new ConfigurationException("blockSize must be at least 1, got " + blockSize);
    }
    if (maxReadingCombinations < 1) {
      throw new ConfigurationException(
          "maxReadingCombinations must be at least 1, got " + maxReadingCombinations);
    }
    if (radicalTable == null) {
      throw new ConfigurationException("radicalTable must not be null");
    }
    if (pinyinConverter == null) {
      throw new ConfigurationException("pinyinConverter must not be null");
    }
    if (pinyinTokenizer == null) {
      throw new ConfigurationException("pinyinTokenizer must not be null");
    }
    if (metricsRegistry == null) {
      throw new ConfigurationException("metricsRegistry must not be null");
    }
  }

  /**
   * Creates a builder for custom configuration.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder pre-filled with this configuration. */
  public Builder toBuilder() {
    return new Builder()
        .algorithm(algorithm)
        .blockSize(blockSize)
        .enableRadical(enableRadical)
        .enablePinyin(enablePinyin)
        .maxReadingCombinations(maxReadingCombinations)
        .radicalTable(radicalTable)
        .pinyinConverter(pinyinConverter)
        .pinyinTokenizer(pinyinTokenizer)
        .metricsRegistry(metricsRegistry);
  }

  /**
   * Builder for custom filter configuration.
   *
   * <p>All fields start with the defaults of {@link #DEFAULT}. The bundled radical table is only
   * loaded if no table is set by the time {@link #build()} runs.
   */
  public static class Builder {
    private Algorithm algorithm = Algorithm.AHO_CORASICK;
    private int blockSize = WuManberMatcher.DEFAULT_BLOCK_SIZE;
    private boolean enableRadical = false;
    private boolean enablePinyin = false;
    private int maxReadingCombinations = DEFAULT_MAX_READING_COMBINATIONS;
    private RadicalTable radicalTable;
    private PinyinConverter pinyinConverter;
    private PinyinTokenizer pinyinTokenizer;
    private FilterMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Exact matching algorithm.
     *
     * <p><b>Default: {@link Algorithm#AHO_CORASICK}</b>
     *
     * @return this builder
     */
    public Builder algorithm(Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    /**
     * Wu-Manber block size in bytes. Every pattern must encode to at least this many bytes.
     *
     * <p><b>Default: 2</b>
     *
     * @return this builder
     */
    public Builder blockSize(int blockSize) {
      this.blockSize = blockSize;
      return this;
    }

    public Builder enableRadical(boolean enableRadical) {
      this.enableRadical = enableRadical;
      return this;
    }

    public Builder enablePinyin(boolean enablePinyin) {
      this.enablePinyin = enablePinyin;
      return this;
    }

    /**
     * Cap on heteronym readings expanded per ideograph run.
     *
     * <p><b>Default: 1024</b>
     *
     * @return this builder
     */
    public Builder maxReadingCombinations(int maxReadingCombinations) {
      this.maxReadingCombinations = maxReadingCombinations;
      return this;
    }

    public Builder radicalTable(RadicalTable radicalTable) {
      this.radicalTable = radicalTable;
      return this;
    }

    public Builder pinyinConverter(PinyinConverter pinyinConverter) {
      this.pinyinConverter = pinyinConverter;
      return this;
    }

    public Builder pinyinTokenizer(PinyinTokenizer pinyinTokenizer) {
      this.pinyinTokenizer = pinyinTokenizer;
      return this;
    }

    /**
     * Metrics sink for build and match instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry#INSTANCE}</b>
     *
     * @return this builder
     */
    public Builder metricsRegistry(FilterMetricsRegistry metricsRegistry) {
      this.metricsRegistry = metricsRegistry;
      return this;
    }

    public FilterConfig build() {
      return new FilterConfig(
          algorithm,
          blockSize,
          enableRadical,
          enablePinyin,
          maxReadingCombinations,
          radicalTable != null ? radicalTable : DefaultTables.RADICALS,
          pinyinConverter != null ? pinyinConverter : new Pinyin4jConverter(),
          pinyinTokenizer != null ? pinyinTokenizer : new SyllableTokenizer(),
          metricsRegistry);
    }
  }

  /** Loads the bundled radical table on first use. */
  private static final class DefaultTables {
    static final RadicalTable RADICALS = RadicalTable.loadDefault();
  }
}
