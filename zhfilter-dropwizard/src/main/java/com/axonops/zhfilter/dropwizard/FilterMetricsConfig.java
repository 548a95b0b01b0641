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

package com.axonops.zhfilter.dropwizard;

import com.axonops.zhfilter.config.FilterConfig;
import com.axonops.zhfilter.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link FilterConfig} with Dropwizard Metrics integration.
 *
 * <p>Wires a {@link DropwizardMetricsAdapter} into the config and, unless told otherwise, exposes
 * the registry through JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application that already owns a registry:
 * FilterConfig config = FilterMetricsConfig.withMetrics(registry, "com.myapp.blocklist");
 * Filter filter = Filter.build(blocklist, config);
 *
 * // Metrics on top of fuzzy settings, JMX handled elsewhere:
 * FilterConfig fuzzy = FilterConfig.builder().enablePinyin(true).build();
 * FilterConfig config = FilterMetricsConfig.withMetrics(fuzzy, registry, "com.myapp.blocklist", false);
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one {@link JmxReporter} is started per JVM, for the first
 * registry passed with JMX enabled. {@link #shutdown()} stops it.
 *
 * @since 1.0.0
 */
public final class FilterMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(FilterMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private FilterMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a default FilterConfig with Dropwizard metrics under the default prefix
     * ({@code com.axonops.zhfilter}) and JMX exposure.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured FilterConfig with metrics enabled
     */
    public static FilterConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a default FilterConfig with Dropwizard metrics and JMX exposure.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured FilterConfig with metrics enabled
     */
    public static FilterConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a default FilterConfig with Dropwizard metrics.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start JMX exposure
     * @return configured FilterConfig with metrics enabled
     */
    public static FilterConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(FilterConfig.DEFAULT, registry, metricPrefix, enableJmx);
    }

    /**
     * Copies {@code base} with Dropwizard metrics.
     *
     * @param base settings to keep (algorithm, fuzzy expansion, lookup tables)
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start JMX exposure
     * @return configured FilterConfig with metrics enabled
     */
    public static FilterConfig withMetrics(FilterConfig base, MetricRegistry registry, String metricPrefix,
                                           boolean enableJmx) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return base.toBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter != null) {
            return;
        }
        try {
            JmxReporter reporter = JmxReporter.forRegistry(registry).build();
            reporter.start();
            jmxReporter = reporter;
            logger.info("ZhFilter: JmxReporter started - metrics available via JMX");
        } catch (RuntimeException e) {
            // Not fatal: the host may already expose the registry
            logger.warn("ZhFilter: Failed to start JmxReporter (may already be configured)", e);
        }
    }

    /** True if this class started a JmxReporter that is still running. */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("ZhFilter: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
