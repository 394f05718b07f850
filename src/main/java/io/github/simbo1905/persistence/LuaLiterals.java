// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// Literal rendering in the style of `string.format("%q")`, kept to a single line.
enum LuaLiterals implements Literals {
  INSTANCE;

  @Override
  public String quote(String value) {
    final var sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            // always three digits so a following digit cannot join the escape
            sb.append('\\').append(String.format("%03d", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  @Override
  public String numeral(double value) {
    if (Double.isNaN(value)) {
      return "(0/0)";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "(1/0)" : "(-1/0)";
    }
    return new Value.Num(value).display();
  }
}
