// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// Write-only text accumulator shared by the writer and the driver. It also counts the literal
/// constants (numerals, strings and field names) appended so far, which is what the target runtime
/// limits per block.
final class TokenSink {
  private final StringBuilder text;
  private int literals;

  TokenSink() {
    this(256);
  }

  TokenSink(int capacity) {
    this.text = new StringBuilder(capacity);
  }

  TokenSink raw(String fragment) {
    text.append(fragment);
    return this;
  }

  TokenSink indent(int level) {
    for (int i = 0; i < level; i++) {
      text.append('\t');
    }
    return this;
  }

  /// Append a numeral or quoted string.
  TokenSink literal(String fragment) {
    literals++;
    text.append(fragment);
    return this;
  }

  /// Append a field name written as an identifier. The runtime stores it as a string constant.
  TokenSink name(String identifier) {
    literals++;
    text.append(identifier);
    return this;
  }

  int literals() {
    return literals;
  }

  int length() {
    return text.length();
  }

  String finish() {
    return text.toString();
  }

  @Override
  public String toString() {
    return text.toString();
  }
}
