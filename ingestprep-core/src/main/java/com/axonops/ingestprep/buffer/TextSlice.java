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

package com.axonops.ingestprep.buffer;

/**
 * Read-only view of a range of a {@link TextArena}.
 *
 * <p>Valid only while the arena is still in the generation the view was cut from. Any read after
 * the arena has been reset throws {@link IllegalStateException}. Call {@link #toString()} to copy
 * the text out if it has to outlive the arena generation.
 *
 * @since 1.0.0
 */
public final class TextSlice implements CharSequence {

  private final TextArena arena;
  private final int start;
  private final int end;
  private final int generation;

  TextSlice(TextArena arena, int start, int end, int generation) {
    this.arena = arena;
    this.start = start;
    this.end = end;
    this.generation = generation;
  }

  /**
   * @return true if the backing arena has not been reset since this view was created
   */
  public boolean isValid() {
    return arena.generation() == generation;
  }

  @Override
  public int length() {
    return end - start;
  }

  @Override
  public char charAt(int index) {
    checkValid();
    if (index < 0 || index >= end - start) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + length());
    }
    return arena.charAt(start + index);
  }

  @Override
  public CharSequence subSequence(int from, int to) {
    checkValid();
    if (from < 0 || to > end - start || from > to) {
      throw new IndexOutOfBoundsException(
          "subSequence [" + from + ", " + to + ") out of bounds for length " + length());
    }
    return new TextSlice(arena, start + from, start + to, generation);
  }

  /**
   * Compares content without copying.
   *
   * @param other text to compare with
   * @return true if both hold the same chars
   */
  public boolean contentEquals(CharSequence other) {
    checkValid();
    int n = end - start;
    if (other.length() != n) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      if (arena.charAt(start + i) != other.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    checkValid();
    return arena.substring(start, end);
  }

  private void checkValid() {
    if (!isValid()) {
      throw new IllegalStateException(
          "ingestprep: field view read after its backing buffer was reset");
    }
  }
}
