// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/// Holds only immutable configuration, so one instance may serve any number of threads.
record PersistenceImpl(PersistenceLimits limits, Literals literals, SyntaxCheck syntaxCheck,
                       DebugChannel debugChannel) implements Persistence {

  @Override
  public Optional<String> serializeInline(Value value) {
    Objects.requireNonNull(value, "value must not be null, use Value.NIL");
    final var sink = new TokenSink();
    try {
      ValueWriter.inline(sink, literals, limits).write(value, 0);
    } catch (ValueWriter.InlineRefusal refusal) {
      LOGGER.fine(() -> "Inline rendering refused: " + refusal.getMessage());
      return Optional.empty();
    }
    return Optional.of(sink.finish());
  }

  @Override
  public String serializeFull(LuaTable bindings) {
    return serializeFull(bindings, bindings);
  }

  @Override
  public String serializeFull(LuaTable bindings, LuaTable mustExist) {
    return serializeFull(bindings, mustExist, Strategy.TREE);
  }

  @Override
  public String serializeFull(LuaTable bindings, LuaTable mustExist, Strategy floor) {
    Objects.requireNonNull(bindings, "bindings must not be null");
    Objects.requireNonNull(mustExist, "mustExist must not be null");
    Objects.requireNonNull(floor, "floor must not be null");
    return new PersistenceDriver(limits, literals, syntaxCheck).persist(bindings, mustExist, floor);
  }

  @Override
  public void dump(Value... values) {
    Objects.requireNonNull(values, "values must not be null");
    final var printable = new ArrayList<Value>(values.length);
    for (Value value : values) {
      if (value instanceof LuaTable table) {
        printable.add(Value.of(serializeInline(table).orElse(SERIALIZATION_FAILED)));
      } else {
        printable.add(value == null ? Value.NIL : value);
      }
    }
    debugChannel.print(printable);
  }
}
