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

package com.axonops.zhfilter.algo;

import com.axonops.zhfilter.api.ConfigurationException;
import com.axonops.zhfilter.api.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Argument checks shared by the matcher implementations.
 */
final class PatternValidator {

    private PatternValidator() {
        // Utility class
    }

    /**
     * Validates and copies a pattern list.
     *
     * @return unmodifiable copy in the given order
     * @throws ConfigurationException if the list is null or empty, or holds a null or empty pattern
     */
    static List<String> validate(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new ConfigurationException("pattern set must not be empty");
        }
        List<String> copy = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            String pattern = patterns.get(i);
            if (pattern == null) {
                throw new ConfigurationException("pattern at index " + i + " is null");
            }
            if (pattern.isEmpty()) {
                throw new ConfigurationException(pattern, "pattern at index " + i + " is empty");
            }
            copy.add(pattern);
        }
        return Collections.unmodifiableList(copy);
    }

    static String requireText(String text) {
        if (text == null) {
            throw new InvalidInputException("text must be a non-null string");
        }
        return text;
    }
}
