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

package com.axonops.zhfilter.test;

import com.axonops.zhfilter.config.FilterConfig;
import com.axonops.zhfilter.fuzzy.PinyinConverter;
import com.axonops.zhfilter.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Test utilities for filter setup.
 *
 * <h2>Usage Patterns</h2>
 *
 * <h3>Deterministic Pinyin</h3>
 * <pre>{@code
 * PinyinConverter converter = TestUtils.fixedReadings(Map.of(
 *     "她", List.of("ta"),
 *     "的", List.of("de", "di")));
 * FilterConfig config = TestUtils.testConfigBuilder()
 *     .enablePinyin(true)
 *     .pinyinConverter(converter)
 *     .build();
 * }</pre>
 *
 * <h3>Test With Metrics</h3>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * FilterConfig config = TestUtils.configWithMetrics(registry, "test.zhfilter");
 * Filter filter = Filter.build(patterns, config);
 * assertThat(registry.counter("test.zhfilter.filter.builds.total.count").getCount()).isEqualTo(1);
 * }</pre>
 */
public final class TestUtils {

    private TestUtils() {
        // Utility class
    }

    /**
     * Builder with the library defaults. Separate method so tests read the same way whether or
     * not they override anything.
     */
    public static FilterConfig.Builder testConfigBuilder() {
        return FilterConfig.builder();
    }

    /**
     * Default config reporting to a Dropwizard registry under {@code prefix}.
     */
    public static FilterConfig configWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix))
            .build();
    }

    /**
     * Pinyin converter backed by a fixed table; characters missing from it read as themselves.
     */
    public static PinyinConverter fixedReadings(Map<String, List<String>> table) {
        return hanzi -> {
            List<List<String>> readings = new ArrayList<>();
            hanzi.codePoints().forEach(cp -> {
                String character = new String(Character.toChars(cp));
                readings.add(table.getOrDefault(character, List.of(character)));
            });
            return readings;
        };
    }
}
