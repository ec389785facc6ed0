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

package com.axonops.ingestprep.api;

/**
 * A flattened (name, value) pair produced by {@link FieldExtractor}.
 *
 * <p>Name and value are views into the extractor's backing buffer and are only readable until the
 * extractor resets that buffer or is released. Copy them with {@code toString()} to keep them
 * longer. A name set through {@link FieldExtractor#renameField(String, String)} is the caller's own
 * string and never goes stale.
 *
 * @since 1.0.0
 */
public final class Field {

  private CharSequence name;
  private final CharSequence value;

  Field(CharSequence name, CharSequence value) {
    this.name = name;
    this.value = value;
  }

  /** Dotted field name, e.g. {@code foo.bar}. */
  public CharSequence name() {
    return name;
  }

  public CharSequence value() {
    return value;
  }

  boolean hasName(String candidate) {
    return CharSequence.compare(name, candidate) == 0;
  }

  void rename(String newName) {
    this.name = newName;
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
