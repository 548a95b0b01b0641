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

/**
 * Thrown when a filter or matcher cannot be built from the given patterns or settings.
 *
 * <p>Raised for an empty pattern set, a null or empty pattern, a block size below 1, or (for
 * Wu-Manber) a pattern whose UTF-8 encoding is shorter than the block size.
 *
 * @since 1.0.0
 */
public final class ConfigurationException extends ZhFilterException {

    private final String pattern;

    public ConfigurationException(String message) {
        super("ZhFilter: Invalid configuration: " + message);
        this.pattern = null;
    }

    public ConfigurationException(String pattern, String message) {
        super("ZhFilter: Invalid configuration: " + message + " (pattern: " + truncate(pattern) + ")");
        this.pattern = pattern;
    }

    /**
     * The offending pattern, or {@code null} if the error is not tied to one pattern.
     */
    public String getPattern() {
        return pattern;
    }

    private static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
