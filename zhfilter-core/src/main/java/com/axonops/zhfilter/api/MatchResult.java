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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Matches found in one searched text.
 *
 * <p>An ordered set of {@link Match} pairs: iteration follows the order in which the matcher
 * reported them, and the {@code (offset, pattern)} pair is the dedup key. Immutable and
 * thread-safe.
 *
 * <p>Two results are equal when they hold the same pairs, regardless of report order, so results
 * from different algorithms can be compared directly:
 *
 * <pre>{@code
 * MatchResult ac = new AhoCorasickMatcher(patterns).match(text);
 * MatchResult wm = new WuManberMatcher(patterns).match(text);
 * assert ac.equals(wm);
 * }</pre>
 *
 * <p>The result returned by {@link Filter#match(String)} for empty input is flagged
 * {@link #degenerate()}.
 *
 * @since 1.0.0
 */
public final class MatchResult implements Iterable<Match> {

  private static final MatchResult EMPTY = new MatchResult(Collections.emptySet(), false);
  private static final MatchResult EMPTY_INPUT = new MatchResult(Collections.emptySet(), true);

  private final Set<Match> matches;
  private final boolean degenerate;

  private MatchResult(Set<Match> matches, boolean degenerate) {
    this.matches = matches;
    this.degenerate = degenerate;
  }

  /** Result with no matches. */
  public static MatchResult empty() {
    return EMPTY;
  }

  /** Result for an empty input text: no matches, flagged degenerate. */
  public static MatchResult emptyInput() {
    return EMPTY_INPUT;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Number of distinct matches. */
  public int size() {
    return matches.size();
  }

  public boolean isEmpty() {
    return matches.isEmpty();
  }

  /** True only for the result produced for an empty input text. */
  public boolean degenerate() {
    return degenerate;
  }

  public boolean contains(int offset, String pattern) {
    return matches.contains(new Match(offset, pattern));
  }

  /** Matches in report order. */
  public List<Match> matches() {
    return List.copyOf(matches);
  }

  /** Matches ordered by offset, then pattern. */
  public List<Match> sorted() {
    return new ArrayList<>(new TreeSet<>(matches));
  }

  /** Distinct matched patterns in report order. */
  public Set<String> patterns() {
    Set<String> patterns = new LinkedHashSet<>();
    for (Match match : matches) {
      patterns.add(match.pattern());
    }
    return Collections.unmodifiableSet(patterns);
  }

  @Override
  public Iterator<Match> iterator() {
    return matches.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MatchResult other)) {
      return false;
    }
    return degenerate == other.degenerate && matches.equals(other.matches);
  }

  @Override
  public int hashCode() {
    return matches.hashCode() * 31 + Boolean.hashCode(degenerate);
  }

  @Override
  public String toString() {
    return (degenerate ? "MatchResult[degenerate]" : "MatchResult") + matches;
  }

  /**
   * Accumulates matches in report order. Not thread-safe; one builder per scan.
   */
  public static final class Builder {
    private final Set<Match> matches = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Records a match. Returns false if the pair was already recorded.
     */
    public boolean add(int offset, String pattern) {
      return matches.add(new Match(offset, pattern));
    }

    public int size() {
      return matches.size();
    }

    public MatchResult build() {
      if (matches.isEmpty()) {
        return EMPTY;
      }
      return new MatchResult(Collections.unmodifiableSet(new LinkedHashSet<>(matches)), false);
    }
  }
}
