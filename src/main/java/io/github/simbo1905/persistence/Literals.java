// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.Set;
import java.util.regex.Pattern;

/// Renders scalar literals as source text the target parser reads back to the same value.
public interface Literals {

  /// Reserved words that can never be written as a bare field name.
  Set<String> KEYWORDS = Set.of(
      "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "if", "in",
      "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

  Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /// Quoted string literal. Must be injective and re-parse to exactly `value`.
  String quote(String value);

  /// Numeral whose re-parsed value equals `value`.
  String numeral(double value);

  /// Whether `key` can be written as `key = ...` and `.key` rather than in brackets.
  static boolean isSafeIdentifier(Value key) {
    return key instanceof Value.Str str
        && IDENTIFIER.matcher(str.value()).matches()
        && !KEYWORDS.contains(str.value());
  }

  static Literals lua() {
    return LuaLiterals.INSTANCE;
  }
}
