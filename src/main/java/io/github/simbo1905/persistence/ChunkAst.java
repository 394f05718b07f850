// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.List;

/// Syntax tree for the subset of the target language that persisted chunks are written in.
sealed interface ChunkAst permits ChunkAst.Expr, ChunkAst.Field, ChunkAst.Stat {

  sealed interface Expr extends ChunkAst permits
      NilLiteral, BoolLiteral, NumberLiteral, StringLiteral, Name, Index, Negate, Divide, Constructor {
  }

  record NilLiteral() implements Expr {
  }

  record BoolLiteral(boolean value) implements Expr {
  }

  record NumberLiteral(double value) implements Expr {
  }

  record StringLiteral(String value) implements Expr {
  }

  record Name(String name) implements Expr {
  }

  /// `target[key]`, and `target.name` with the name as a string key.
  record Index(Expr target, Expr key) implements Expr {
  }

  record Negate(Expr operand) implements Expr {
  }

  record Divide(Expr left, Expr right) implements Expr {
  }

  record Constructor(List<Field> fields) implements Expr {
    public Constructor {
      fields = List.copyOf(fields);
    }
  }

  sealed interface Field extends ChunkAst permits Positional, Keyed {
  }

  record Positional(Expr value) implements Field {
  }

  record Keyed(Expr key, Expr value) implements Field {
  }

  sealed interface Stat extends ChunkAst permits Local, Assign, NumericFor, InvokeBlock {
    int line();
  }

  record Local(int line, String name, Expr value) implements Stat {
  }

  /// Assignment to a [Name] or an [Index].
  record Assign(int line, Expr target, Expr value) implements Stat {
  }

  record NumericFor(int line, String variable, Expr start, Expr limit, List<Stat> body) implements Stat {
    public NumericFor {
      body = List.copyOf(body);
    }
  }

  /// `(function () body end)()`
  record InvokeBlock(int line, List<Stat> body) implements Stat {
    public InvokeBlock {
      body = List.copyOf(body);
    }
  }
}
