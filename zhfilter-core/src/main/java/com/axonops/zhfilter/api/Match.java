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

import java.util.Comparator;
import java.util.Objects;

/**
 * One occurrence of a pattern in a text.
 *
 * <p>{@code offset} is the start of the occurrence in {@code char} units of the searched string,
 * so {@code text.substring(offset, offset + pattern.length())} equals {@code pattern}.
 *
 * @param offset start index of the occurrence (non-negative)
 * @param pattern the matched pattern
 * @since 1.0.0
 */
public record Match(int offset, String pattern) implements Comparable<Match> {

  private static final Comparator<Match> ORDER =
      Comparator.comparingInt(Match::offset).thenComparing(Match::pattern);

  public Match {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be non-negative: " + offset);
    }
    Objects.requireNonNull(pattern, "pattern cannot be null");
  }

  /** End index (exclusive) of the occurrence. */
  public int end() {
    return offset + pattern.length();
  }

  @Override
  public int compareTo(Match other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + offset + ", " + pattern + ")";
  }
}
