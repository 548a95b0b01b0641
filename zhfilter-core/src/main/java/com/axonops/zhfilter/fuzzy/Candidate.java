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

package com.axonops.zhfilter.fuzzy;

/**
 * One text fed to the exact matcher, with where it came from.
 *
 * @param text the candidate text
 * @param source how it was produced
 * @since 1.0.0
 */
public record Candidate(String text, Source source) {

  /** Origin of a candidate text. */
  public enum Source {
    /** The normalized input. Always the first candidate. */
    ORIGINAL,
    /** A radical-key run rewritten back to a pattern character. */
    RADICAL,
    /** A pinyin run rewritten back to pattern characters. */
    PINYIN
  }

  public static Candidate original(String text) {
    return new Candidate(text, Source.ORIGINAL);
  }
}
