// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Runs parsed chunk statements against a global table.
final class ChunkEvaluator {
  private static final String GLOBALS_NAME = "_G";

  private final LuaTable globals;
  /// local variable scopes, innermost first
  private final ArrayDeque<Map<String, Value>> scopes = new ArrayDeque<>();

  ChunkEvaluator(LuaTable globals) {
    this.globals = globals;
  }

  void run(List<ChunkAst.Stat> statements) {
    scopes.push(new HashMap<>());
    try {
      for (ChunkAst.Stat statement : statements) {
        execute(statement);
      }
    } finally {
      scopes.pop();
    }
  }

  private void execute(ChunkAst.Stat statement) {
    if (statement instanceof ChunkAst.Local local) {
      final Value value = evaluate(local.value(), local.line());
      scopes.element().put(local.name(), value);
    } else if (statement instanceof ChunkAst.Assign assign) {
      final Value value = evaluate(assign.value(), assign.line());
      assign(assign.target(), value, assign.line());
    } else if (statement instanceof ChunkAst.NumericFor loop) {
      final double start = number(evaluate(loop.start(), loop.line()), "'for' initial value", loop.line());
      final double limit = number(evaluate(loop.limit(), loop.line()), "'for' limit", loop.line());
      for (double i = start; i <= limit; i++) {
        scopes.push(new HashMap<>(Map.of(loop.variable(), Value.of(i))));
        try {
          for (ChunkAst.Stat inner : loop.body()) {
            execute(inner);
          }
        } finally {
          scopes.pop();
        }
      }
    } else if (statement instanceof ChunkAst.InvokeBlock block) {
      run(block.body());
    } else {
      throw new AssertionError("Unexpected statement: " + statement);
    }
  }

  private void assign(ChunkAst.Expr target, Value value, int line) {
    if (target instanceof ChunkAst.Name name) {
      for (Map<String, Value> scope : scopes) {
        if (scope.containsKey(name.name())) {
          scope.put(name.name(), value);
          return;
        }
      }
      globals.set(name.name(), value);
    } else if (target instanceof ChunkAst.Index index) {
      final LuaTable table = table(evaluate(index.target(), line), line);
      final Value key = evaluate(index.key(), line);
      try {
        table.set(key, value);
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException("line " + line + ": " + e.getMessage(), e);
      }
    } else {
      throw new IllegalStateException("line " + line + ": cannot assign to " + target);
    }
  }

  private Value evaluate(ChunkAst.Expr expr, int line) {
    if (expr instanceof ChunkAst.NilLiteral) {
      return Value.NIL;
    } else if (expr instanceof ChunkAst.BoolLiteral bool) {
      return Value.of(bool.value());
    } else if (expr instanceof ChunkAst.NumberLiteral number) {
      return Value.of(number.value());
    } else if (expr instanceof ChunkAst.StringLiteral string) {
      return Value.of(string.value());
    } else if (expr instanceof ChunkAst.Name name) {
      return lookup(name.name());
    } else if (expr instanceof ChunkAst.Index index) {
      return table(evaluate(index.target(), line), line).get(evaluate(index.key(), line));
    } else if (expr instanceof ChunkAst.Negate negate) {
      return Value.of(-number(evaluate(negate.operand(), line), "operand of '-'", line));
    } else if (expr instanceof ChunkAst.Divide divide) {
      final double left = number(evaluate(divide.left(), line), "operand of '/'", line);
      final double right = number(evaluate(divide.right(), line), "operand of '/'", line);
      return Value.of(left / right);
    } else if (expr instanceof ChunkAst.Constructor constructor) {
      return construct(constructor, line);
    }
    throw new AssertionError("Unexpected expression: " + expr);
  }

  private LuaTable construct(ChunkAst.Constructor constructor, int line) {
    final var table = new LuaTable();
    int position = 1;
    for (ChunkAst.Field field : constructor.fields()) {
      if (field instanceof ChunkAst.Positional positional) {
        final Value value = evaluate(positional.value(), line);
        table.set(position++, value);
      } else if (field instanceof ChunkAst.Keyed keyed) {
        final Value key = evaluate(keyed.key(), line);
        final Value value = evaluate(keyed.value(), line);
        try {
          table.set(key, value);
        } catch (IllegalArgumentException e) {
          throw new IllegalStateException("line " + line + ": " + e.getMessage(), e);
        }
      }
    }
    return table;
  }

  private Value lookup(String name) {
    for (Map<String, Value> scope : scopes) {
      final Value value = scope.get(name);
      if (value != null) {
        return value;
      }
    }
    if (GLOBALS_NAME.equals(name) && !globals.containsKey(Value.of(name))) {
      return globals;
    }
    return globals.get(name);
  }

  private static LuaTable table(Value value, int line) {
    if (value instanceof LuaTable table) {
      return table;
    }
    throw new IllegalStateException("line " + line + ": attempt to index a " + value.kind().typeName() + " value");
  }

  private static double number(Value value, String what, int line) {
    if (value instanceof Value.Num num) {
      return num.value();
    }
    throw new IllegalStateException("line " + line + ": " + what + " must be a number but was " + value.kind().typeName());
  }
}
