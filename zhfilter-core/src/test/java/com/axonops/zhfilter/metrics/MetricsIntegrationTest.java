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

import com.axonops.zhfilter.algo.Algorithm;
import com.axonops.zhfilter.api.ConfigurationException;
import com.axonops.zhfilter.api.Filter;
import com.axonops.zhfilter.api.InvalidInputException;
import com.axonops.zhfilter.config.FilterConfig;
import com.axonops.zhfilter.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during filter operations.
 *
 * Builds filters against a Dropwizard registry, exercises them and reads the counters back.
 */
class MetricsIntegrationTest {

    private static final String PREFIX = "test.zhfilter";

    private MetricRegistry registry;
    private FilterConfig config;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        config = TestUtils.configWithMetrics(registry, PREFIX);
    }

    private Counter counter(String name) {
        return registry.counter(PREFIX + "." + name);
    }

    @Test
    void testBuildMetrics() {
        Filter.build(List.of("他", "她"), config);

        assertThat(counter(MetricNames.FILTER_BUILDS).getCount()).isEqualTo(1);
        Timer buildTime = registry.timer(PREFIX + "." + MetricNames.FILTER_BUILD_LATENCY);
        assertThat(buildTime.getCount()).isEqualTo(1);

        Filter.build(List.of("的"), config);

        assertThat(counter(MetricNames.FILTER_BUILDS).getCount()).isEqualTo(2);
        assertThat(buildTime.getCount()).isEqualTo(2);
    }

    @Test
    void testMatchingMetrics() {
        Filter filter = Filter.build(List.of("他", "她", "他的", "她的"), config);

        filter.match("他和她的");
        filter.match("没有");

        assertThat(counter(MetricNames.MATCHING_CALLS).getCount()).isEqualTo(2);
        assertThat(counter(MetricNames.MATCHING_MATCHES_FOUND).getCount()).isEqualTo(3);
        assertThat(counter(MetricNames.PREPROCESS_CANDIDATES).getCount()).isEqualTo(2);
        assertThat(registry.timer(PREFIX + "." + MetricNames.MATCHING_LATENCY).getCount()).isEqualTo(2);
        assertThat(counter(MetricNames.MATCHING_EMPTY_INPUT).getCount()).isZero();
    }

    @Test
    void testEmptyInputCounted() {
        Filter filter = Filter.build(List.of("他"), config);

        filter.match("");

        assertThat(counter(MetricNames.MATCHING_EMPTY_INPUT).getCount()).isEqualTo(1);
        assertThat(counter(MetricNames.MATCHING_CALLS).getCount()).isEqualTo(1);
        // No scan happened
        assertThat(registry.timer(PREFIX + "." + MetricNames.MATCHING_LATENCY).getCount()).isZero();
    }

    @Test
    void testPinyinCandidateMetrics() {
        FilterConfig pinyin = config.toBuilder()
            .enablePinyin(true)
            .pinyinConverter(TestUtils.fixedReadings(Map.of("她", List.of("ta"), "的", List.of("de"))))
            .build();
        Filter filter = Filter.build(List.of("她的"), pinyin);

        filter.match("ta1 de5");

        assertThat(counter(MetricNames.PREPROCESS_PINYIN_CANDIDATES).getCount()).isEqualTo(3);
        assertThat(counter(MetricNames.PREPROCESS_RADICAL_CANDIDATES).getCount()).isZero();
        assertThat(counter(MetricNames.PREPROCESS_CANDIDATES).getCount()).isEqualTo(4);
        assertThat(counter(MetricNames.MATCHING_MATCHES_FOUND).getCount()).isEqualTo(1);
    }

    @Test
    void testRadicalCandidateMetrics() {
        Filter filter = Filter.build(List.of("她的"), config.toBuilder().enableRadical(true).build());

        filter.match("女也的");

        assertThat(counter(MetricNames.PREPROCESS_RADICAL_CANDIDATES).getCount()).isEqualTo(1);
        assertThat(counter(MetricNames.MATCHING_MATCHES_FOUND).getCount()).isEqualTo(1);
    }

    @Test
    void testInvalidInputMetrics() {
        Filter filter = Filter.build(List.of("他"), config);

        assertThatThrownBy(() -> filter.match(null)).isInstanceOf(InvalidInputException.class);

        assertThat(counter(MetricNames.ERRORS_INVALID_INPUT).getCount()).isEqualTo(1);
        assertThat(counter(MetricNames.MATCHING_CALLS).getCount()).isZero();
    }

    @Test
    void testConfigurationErrorMetrics() {
        FilterConfig wuManber = config.toBuilder().algorithm(Algorithm.WU_MANBER).blockSize(3).build();

        assertThatThrownBy(() -> Filter.build(List.of("ab"), wuManber))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Filter.build(List.of(), config))
            .isInstanceOf(ConfigurationException.class);

        assertThat(counter(MetricNames.ERRORS_CONFIGURATION).getCount()).isEqualTo(2);
        assertThat(counter(MetricNames.FILTER_BUILDS).getCount()).isZero();
    }

    @Test
    void testNoOpRegistryIsDefault() {
        Filter filter = Filter.build(List.of("他"));

        filter.match("他");

        assertThat(filter.config().metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(registry.getMetrics()).isEmpty();
    }
}
