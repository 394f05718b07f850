// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The container node of the value model: a mutable associative table compared by identity.
/// A table may hold itself, directly or through other tables, and may be used as a key.
/// This class deliberately inherits `equals` and `hashCode` from `Object`.
public final class LuaTable implements Value {

  private final Map<Value, Value> entries = new LinkedHashMap<>();
  /// keys `1..sequence` are all present and `sequence + 1` is not
  private int sequence;

  public LuaTable() {
  }

  /// Builds a table holding the given values as a sequence `1..n`.
  public static LuaTable of(Value... values) {
    final var table = new LuaTable();
    for (Value value : values) {
      table.append(value);
    }
    return table;
  }

  @Override
  public Kind kind() {
    return Kind.TABLE;
  }

  @Override
  public String display() {
    return String.format("table: 0x%08x", System.identityHashCode(this));
  }

  @Override
  public String toString() {
    return display();
  }

  public Value get(Value key) {
    Objects.requireNonNull(key, "key must not be null");
    final Value value = entries.get(normalize(key));
    return value == null ? NIL : value;
  }

  public Value get(String key) {
    return get(Value.of(key));
  }

  public Value get(double key) {
    return get(Value.of(key));
  }

  /// Assigns `value` to `key`. Assigning nil removes the key, as the runtime does.
  public LuaTable set(Value key, Value value) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null, use Value.NIL");
    if (key instanceof Nil) {
      throw new IllegalArgumentException("table index is nil");
    }
    if (key instanceof Num num && Double.isNaN(num.value())) {
      throw new IllegalArgumentException("table index is NaN");
    }
    final Value normalized = normalize(key);
    if (value instanceof Nil) {
      if (entries.remove(normalized) != null && isInSequence(normalized, sequence)) {
        sequence = (int) ((Num) normalized).value() - 1;
      }
    } else {
      entries.put(normalized, value);
      if (normalized instanceof Num num && num.value() == sequence + 1.0) {
        do {
          sequence++;
        } while (entries.containsKey(Value.of(sequence + 1.0)));
      }
    }
    return this;
  }

  public LuaTable set(String key, Value value) {
    return set(Value.of(key), value);
  }

  public LuaTable set(double key, Value value) {
    return set(Value.of(key), value);
  }

  /// Appends at index `sequenceLength() + 1`.
  public LuaTable append(Value value) {
    return set(Value.of(sequenceLength() + 1), value);
  }

  public boolean containsKey(Value key) {
    return entries.containsKey(normalize(key));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /// Entries in insertion order.
  public Map<Value, Value> entries() {
    return Collections.unmodifiableMap(entries);
  }

  /// Length of the run of keys `1, 2, 3...` starting at 1 with no gap.
  public int sequenceLength() {
    return sequence;
  }

  /// Entries in the canonical output order: the sequence run first, by index, followed by every
  /// other key sorted by [KeyOrder]. Independent of insertion order.
  public List<Map.Entry<Value, Value>> orderedEntries() {
    final int length = sequenceLength();
    final var ordered = new ArrayList<Map.Entry<Value, Value>>(entries.size());
    for (int i = 1; i <= length; i++) {
      final Value key = Value.of(i);
      ordered.add(Map.entry(key, entries.get(key)));
    }
    final var rest = new ArrayList<Value>(entries.size() - length);
    for (Value key : entries.keySet()) {
      if (!isInSequence(key, length)) {
        rest.add(key);
      }
    }
    rest.sort(KeyOrder.INSTANCE);
    for (Value key : rest) {
      ordered.add(Map.entry(key, entries.get(key)));
    }
    return ordered;
  }

  static boolean isInSequence(Value key, int length) {
    if (key instanceof Num num) {
      final double d = num.value();
      return d >= 1 && d <= length && d == Math.rint(d);
    }
    return false;
  }

  private static Value normalize(Value key) {
    // 0.0 and -0.0 address the same slot
    if (key instanceof Num num && num.value() == 0.0) {
      return Value.of(0.0);
    }
    return key;
  }
}
