// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.Objects;

/// A value in the data graph. Tables are the only reference type; every other case compares by value.
public sealed interface Value permits Value.Nil, Value.Num, Value.Str, Value.Bool, Value.Opaque, LuaTable {

  Nil NIL = new Nil();
  Bool TRUE = new Bool(true);
  Bool FALSE = new Bool(false);

  Kind kind();

  /// The text the runtime's `tostring` would show for this value.
  String display();

  static Num of(double value) {
    return new Num(value);
  }

  static Str of(String value) {
    return new Str(value);
  }

  static Bool of(boolean value) {
    return value ? TRUE : FALSE;
  }

  /// Absence of a value.
  record Nil() implements Value {
    @Override
    public Kind kind() {
      return Kind.NIL;
    }

    @Override
    public String display() {
      return "nil";
    }
  }

  record Num(double value) implements Value {
    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    /// True when the number is a whole number small enough to be printed without an exponent.
    public boolean isIntegral() {
      return value == Math.rint(value) && Math.abs(value) < 0x1p53;
    }

    @Override
    public String display() {
      if (Double.isNaN(value)) {
        return "nan";
      } else if (Double.isInfinite(value)) {
        return value > 0 ? "inf" : "-inf";
      } else if (isIntegral() && !(value == 0 && 1 / value < 0)) {
        return Long.toString((long) value);
      }
      return Double.toString(value);
    }
  }

  record Str(String value) implements Value {
    public Str {
      Objects.requireNonNull(value, "string value must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public String display() {
      return value;
    }
  }

  record Bool(boolean value) implements Value {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public String display() {
      return Boolean.toString(value);
    }
  }

  /// A function, coroutine or host handle. These are never serialized, only described in a comment.
  record Opaque(Kind kind, String display) implements Value {
    public Opaque {
      Objects.requireNonNull(kind);
      Objects.requireNonNull(display);
      if (kind != Kind.FUNCTION && kind != Kind.THREAD && kind != Kind.USERDATA) {
        throw new IllegalArgumentException("Opaque values must be function, thread or userdata but got: " + kind);
      }
    }
  }
}
