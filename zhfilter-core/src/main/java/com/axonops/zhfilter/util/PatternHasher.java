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

package com.axonops.zhfilter.util;

import java.util.Collection;

/**
 * Utility for hashing blocklist entries and texts for logging purposes.
 *
 * <p>Blocklist entries are offensive or sensitive by nature, so they are not written to logs
 * verbatim:
 * <ul>
 *   <li>Privacy: Don't log the blocked terms or the user text being screened</li>
 *   <li>Readability: Logs aren't cluttered with long texts</li>
 *   <li>Debuggability: Same string always gets same hash, easy to grep/trace</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a string for logging.
     *
     * <p>Uses {@link String#hashCode()} for consistency and simplicity.
     * The hash is deterministic - same string always produces same hash.
     *
     * @param value the pattern or text
     * @return hex string (e.g., "7a3f2b1c")
     */
    public static String hash(String value) {
        if (value == null) {
            return "null";
        }
        return Integer.toHexString(value.hashCode());
    }

    /**
     * Creates one order-sensitive hash for a whole pattern list.
     *
     * @param patterns the pattern list
     * @return hash with the list size (e.g., "7a3f2b1c[12]")
     */
    public static String hashAll(Collection<String> patterns) {
        if (patterns == null) {
            return "null";
        }
        return Integer.toHexString(patterns.hashCode()) + "[" + patterns.size() + "]";
    }
}
