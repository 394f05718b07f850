// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// The kinds of value the target runtime knows about, named as its `type()` function names them.
public enum Kind {
  NIL("nil"),
  NUMBER("number"),
  STRING("string"),
  BOOLEAN("boolean"),
  TABLE("table"),
  FUNCTION("function"),
  THREAD("thread"),
  USERDATA("userdata");

  private final String typeName;

  Kind(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  /// Key category rank: numbers, then strings, then booleans, then everything else.
  /// Kinds sharing the last rank are split by type name.
  int keyRank() {
    return switch (this) {
      case NUMBER -> 0;
      case STRING -> 1;
      case BOOLEAN -> 2;
      default -> 3;
    };
  }
}
