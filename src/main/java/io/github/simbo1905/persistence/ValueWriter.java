// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Renders a single value as source text into a [TokenSink].
///
/// Tables found in the reference map are written as `ref[i]`. Any other table is written as a
/// constructor: the sequence run as bare values, then the remaining keys in [KeyOrder], each as
/// `name = value` when the key is a safe identifier and `[key] = value` otherwise.
///
/// In pretty mode every entry sits on its own line, indented with tabs. In inline mode entries are
/// separated by `", "` and the writer refuses to visit any table twice, or to go deeper or longer
/// than the configured ceilings, by throwing [InlineRefusal].
final class ValueWriter {
  private final TokenSink sink;
  private final Literals literals;
  private final Map<LuaTable, Integer> references;
  private final Set<LuaTable> inlineSeen;
  private final int nestingLimit;
  private final int inlineCharLimit;

  private ValueWriter(TokenSink sink, Literals literals, Map<LuaTable, Integer> references,
                      Set<LuaTable> inlineSeen, int nestingLimit, int inlineCharLimit) {
    this.sink = Objects.requireNonNull(sink);
    this.literals = Objects.requireNonNull(literals);
    this.references = Objects.requireNonNull(references);
    this.inlineSeen = inlineSeen;
    this.nestingLimit = nestingLimit;
    this.inlineCharLimit = inlineCharLimit;
  }

  /// Multi-line writer resolving shared tables through `references`.
  static ValueWriter pretty(TokenSink sink, Literals literals, Map<LuaTable, Integer> references) {
    return new ValueWriter(sink, literals, references, null, Integer.MAX_VALUE, Integer.MAX_VALUE);
  }

  /// Single-line writer for trees only.
  static ValueWriter inline(TokenSink sink, Literals literals, PersistenceLimits limits) {
    return new ValueWriter(sink, literals, Map.of(),
        Collections.newSetFromMap(new IdentityHashMap<>()),
        limits.nestingLimit(), limits.inlineCharLimit());
  }

  boolean isInline() {
    return inlineSeen != null;
  }

  void write(Value value, int level) {
    switch (value.kind()) {
      case NIL -> sink.raw("nil");
      case NUMBER -> sink.literal(literals.numeral(((Value.Num) value).value()));
      case STRING -> sink.literal(literals.quote(((Value.Str) value).value()));
      case BOOLEAN -> sink.raw(((Value.Bool) value).value() ? "true" : "false");
      case TABLE -> writeTable((LuaTable) value, level);
      case FUNCTION, THREAD, USERDATA -> writeOpaque(value);
    }
  }

  /// Writes `ref[i]` for a table that has a reference slot.
  void writeReference(int index) {
    sink.raw("ref[").literal(Integer.toString(index)).raw("]");
  }

  private void writeOpaque(Value value) {
    sink.raw("nil ").raw(comment(value.display()));
  }

  /// A long comment whose bracket level cannot be closed early by the text inside it.
  static String comment(String text) {
    final var equals = new StringBuilder();
    while (text.contains("]" + equals + "]") || text.endsWith("]" + equals)) {
      equals.append('=');
    }
    return "--[" + equals + "[" + text + "]" + equals + "]";
  }

  private void writeTable(LuaTable table, int level) {
    if (isInline()) {
      if (!inlineSeen.add(table)) {
        throw new InlineRefusal("table reached twice: " + table.display());
      }
      if (level >= nestingLimit) {
        throw new InlineRefusal("nesting deeper than " + nestingLimit);
      }
    }
    final Integer index = references.get(table);
    if (index != null) {
      writeReference(index);
      return;
    }
    final var entries = table.orderedEntries();
    if (entries.isEmpty()) {
      sink.raw("{}");
      return;
    }
    final int sequence = table.sequenceLength();
    sink.raw("{");
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        sink.raw(isInline() ? ", " : ",");
      }
      if (!isInline()) {
        sink.raw("\n").indent(level + 1);
      }
      final var entry = entries.get(i);
      if (i >= sequence) {
        writeKey(entry.getKey(), level + 1);
      }
      write(entry.getValue(), level + 1);
      if (isInline() && sink.length() > inlineCharLimit) {
        throw new InlineRefusal("text longer than " + inlineCharLimit + " characters");
      }
    }
    if (!isInline()) {
      sink.raw("\n").indent(level);
    }
    sink.raw("}");
  }

  private void writeKey(Value key, int level) {
    if (Literals.isSafeIdentifier(key)) {
      sink.name(((Value.Str) key).value()).raw(" = ");
    } else {
      sink.raw("[");
      write(key, level);
      sink.raw("] = ");
    }
  }

  /// Raised in inline mode when the value is not a tree or is too large to show.
  static final class InlineRefusal extends RuntimeException {
    InlineRefusal(String message) {
      super(message, null, false, false);
    }
  }
}
