// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/// Helpers for building and comparing value graphs.
public final class Values {

  private Values() {
  }

  /// Converts plain Java objects into values. Maps become keyed tables; lists and arrays become
  /// sequences; numbers, characters, strings and booleans become scalars; `null` becomes nil.
  /// The same collection instance always becomes the same table, so sharing and cycles survive.
  /// Anything else is kept as an opaque function or userdata that will only be described in output.
  public static Value from(Object object) {
    return new Converter().convert(object);
  }

  private static final class Converter {
    private final IdentityHashMap<Object, LuaTable> seen = new IdentityHashMap<>();

    Value convert(Object object) {
      if (object == null) {
        return Value.NIL;
      } else if (object instanceof Value value) {
        return value;
      } else if (object instanceof Boolean b) {
        return Value.of(b);
      } else if (object instanceof Number n) {
        return Value.of(n.doubleValue());
      } else if (object instanceof CharSequence || object instanceof Character) {
        return Value.of(object.toString());
      } else if (object instanceof Map<?, ?> map) {
        final LuaTable existing = seen.get(map);
        if (existing != null) {
          return existing;
        }
        final var table = new LuaTable();
        seen.put(map, table);
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          table.set(convert(entry.getKey()), convert(entry.getValue()));
        }
        return table;
      } else if (object instanceof Iterable<?> iterable) {
        final LuaTable existing = seen.get(iterable);
        if (existing != null) {
          return existing;
        }
        final var table = new LuaTable();
        seen.put(iterable, table);
        int index = 1;
        for (Object element : iterable) {
          table.set(index++, convert(element));
        }
        return table;
      } else if (object.getClass().isArray()) {
        final LuaTable existing = seen.get(object);
        if (existing != null) {
          return existing;
        }
        final var table = new LuaTable();
        seen.put(object, table);
        final int length = Array.getLength(object);
        for (int i = 0; i < length; i++) {
          table.set(i + 1, convert(Array.get(object, i)));
        }
        return table;
      } else if (object instanceof Runnable || object instanceof Function<?, ?>
          || object instanceof Supplier<?> || object instanceof Consumer<?>) {
        return new Value.Opaque(Kind.FUNCTION, "function: " + object);
      }
      return new Value.Opaque(Kind.USERDATA, "userdata: " + object);
    }
  }

  /// Structural equality of two graphs. Scalars compare by value, tables by content. Cycles are
  /// handled by assuming a pair of tables equal while it is being compared. Table keys match any
  /// structurally equal table key of the other side.
  public static boolean deepEquals(Value a, Value b) {
    return new Comparison().equal(a, b);
  }

  private static final class Comparison {
    /// pairs currently assumed, or already shown, to be equal
    private final IdentityHashMap<LuaTable, Set<LuaTable>> assumed = new IdentityHashMap<>();

    boolean equal(Value a, Value b) {
      if (a instanceof LuaTable ta && b instanceof LuaTable tb) {
        return equalTables(ta, tb);
      }
      return a.equals(b);
    }

    private boolean equalTables(LuaTable a, LuaTable b) {
      if (a == b) {
        return true;
      }
      final Set<LuaTable> partners = assumed.computeIfAbsent(a, k -> Collections.newSetFromMap(new IdentityHashMap<>()));
      if (partners.contains(b)) {
        return true;
      }
      if (a.size() != b.size()) {
        return false;
      }
      partners.add(b);
      final boolean result = equalEntries(a, b);
      if (!result) {
        partners.remove(b);
      }
      return result;
    }

    private boolean equalEntries(LuaTable a, LuaTable b) {
      final List<Value> unmatched = new ArrayList<>();
      for (Value key : b.entries().keySet()) {
        if (key instanceof LuaTable) {
          unmatched.add(key);
        }
      }
      for (Map.Entry<Value, Value> entry : a.entries().entrySet()) {
        final Value key = entry.getKey();
        if (key instanceof LuaTable) {
          if (!matchTableKey(key, entry.getValue(), b, unmatched)) {
            return false;
          }
        } else if (!b.containsKey(key) || !equal(entry.getValue(), b.get(key))) {
          return false;
        }
      }
      return true;
    }

    private boolean matchTableKey(Value key, Value value, LuaTable other, List<Value> unmatched) {
      for (int i = 0; i < unmatched.size(); i++) {
        final Value candidate = unmatched.get(i);
        if (equal(key, candidate) && equal(value, other.get(candidate))) {
          unmatched.remove(i);
          return true;
        }
      }
      return false;
    }
  }
}
