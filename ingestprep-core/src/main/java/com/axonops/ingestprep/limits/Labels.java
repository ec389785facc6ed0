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

package com.axonops.ingestprep.limits;

import java.util.List;

/**
 * Helpers for label sets.
 *
 * @since 1.0.0
 */
public final class Labels {

  private Labels() {
    // Utility class
  }

  /**
   * Renders a label set the way Prometheus prints a series: {@code name{k="v",...}}.
   *
   * <p>The {@code __name__} label (or a label with an empty name) becomes the leading metric name;
   * the remaining labels keep the caller's order. A set holding only a metric name renders as
   * that name alone.
   *
   * @param labels label set
   * @return display form, used in diagnostics only
   */
  public static String toString(List<Label> labels) {
    int nameIndex = -1;
    for (int i = 0; i < labels.size(); i++) {
      if (isMetricName(labels.get(i))) {
        nameIndex = i;
        break;
      }
    }
    String metricName = nameIndex >= 0 ? labels.get(nameIndex).value() : "";
    if (nameIndex >= 0 && labels.size() == 1) {
      return metricName;
    }

    StringBuilder sb = new StringBuilder(metricName);
    sb.append('{');
    boolean first = true;
    for (int i = 0; i < labels.size(); i++) {
      if (i == nameIndex) {
        continue;
      }
      Label l = labels.get(i);
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append(l.name().isEmpty() ? Label.METRIC_NAME : l.name());
      sb.append('=');
      appendQuoted(sb, l.value());
    }
    sb.append('}');
    return sb.toString();
  }

  /**
   * Quotes a value with {@code "}, escaping backslash, quote and control characters.
   *
   * @param s value to quote
   * @return quoted value
   */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    appendQuoted(sb, s);
    return sb.toString();
  }

  /**
   * Length of {@code s} once encoded as UTF-8, without encoding it.
   *
   * <p>Unpaired surrogates count as one byte, matching the {@code '?'} the JDK encoder writes for
   * them.
   *
   * @param s text to measure
   * @return encoded length in bytes
   */
  public static int utf8Length(CharSequence s) {
    int n = s.length();
    int bytes = 0;
    for (int i = 0; i < n; i++) {
      char c = s.charAt(i);
      if (c < 0x80) {
        bytes++;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < n
          && Character.isLowSurrogate(s.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        bytes++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }

  /**
   * True if the UTF-8 form of {@code s} is longer than {@code limit} bytes.
   *
   * <p>Skips the scan when the char count alone decides it.
   */
  static boolean utf8LongerThan(String s, int limit) {
    int chars = s.length();
    if (chars > limit) {
      return true;
    }
    if ((long) chars * 3 <= limit) {
      return false;
    }
    return utf8Length(s) > limit;
  }

  private static boolean isMetricName(Label l) {
    return l.name().isEmpty() || l.name().equals(Label.METRIC_NAME);
  }

  private static void appendQuoted(StringBuilder sb, String s) {
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }
}
