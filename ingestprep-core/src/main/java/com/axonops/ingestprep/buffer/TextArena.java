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

import java.util.Arrays;

/**
 * Growable character buffer that field names and values are appended into.
 *
 * <p>Text is handed out as {@link TextSlice} views rather than copied into new strings. Every
 * {@link #reset()} starts a new generation: views from earlier generations refuse to be read, so a
 * caller holding on to a field past its validity window gets an exception instead of another
 * record's bytes.
 *
 * <p>NOT thread-safe: an arena belongs to exactly one {@link com.axonops.ingestprep.api.FieldExtractor}.
 *
 * @since 1.0.0
 */
public final class TextArena {

  private static final int DEFAULT_INITIAL_CAPACITY = 256;

  private char[] chars;
  private int length;
  private int generation;

  public TextArena() {
    this(DEFAULT_INITIAL_CAPACITY);
  }

  public TextArena(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("initialCapacity must be non-negative");
    }
    this.chars = new char[initialCapacity];
  }

  /** Number of chars currently written. */
  public int length() {
    return length;
  }

  /** Allocated size; retained across {@link #reset()}. */
  public int capacity() {
    return chars.length;
  }

  /** Current generation, bumped on every reset. */
  public int generation() {
    return generation;
  }

  public TextArena append(CharSequence s) {
    return append(s, 0, s.length());
  }

  public TextArena append(CharSequence s, int start, int end) {
    int n = end - start;
    ensureCapacity(length + n);
    if (s instanceof String) {
      ((String) s).getChars(start, end, chars, length);
    } else {
      for (int i = start; i < end; i++) {
        chars[length + i - start] = s.charAt(i);
      }
    }
    length += n;
    return this;
  }

  /**
   * Appends {@code len} chars of {@code src} starting at {@code offset}.
   *
   * <p>Lets tokenizers copy straight from their own char buffers.
   */
  public TextArena append(char[] src, int offset, int len) {
    ensureCapacity(length + len);
    System.arraycopy(src, offset, chars, length, len);
    length += len;
    return this;
  }

    public TextArena append(char c) {
    ensureCapacity(length + 1);
    chars[length++] = c;
    return this;
  }

  /**
   * Returns a view over everything appended since {@code start}.
   *
   * @param start offset previously read from {@link #length()}
   * @return view valid until the next {@link #reset()}
   */
  public TextSlice sliceFrom(int start) {
    return slice(start, length);
  }

  public TextSlice slice(int start, int end) {
    if (start < 0 || end > length || start > end) {
      throw new IndexOutOfBoundsException(
          "slice [" + start + ", " + end + ") out of bounds for length " + length);
    }
    return new TextSlice(this, start, end, generation);
  }

  /** Forgets all content and invalidates every outstanding view. Capacity is kept. */
  public void reset() {
    length = 0;
    generation++;
  }

  char charAt(int index) {
    return chars[index];
  }

  String substring(int start, int end) {
    return new String(chars, start, end - start);
  }

  private void ensureCapacity(int required) {
    if (required > chars.length) {
      int newCapacity = Math.max(required, Math.max(16, chars.length * 2));
      chars = Arrays.copyOf(chars, newCapacity);
    }
  }
}
