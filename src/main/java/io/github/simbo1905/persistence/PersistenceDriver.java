// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.persistence.Persistence.LOGGER;

/// Writes a set of top-level bindings as a chunk and climbs the [Strategy] ladder until the chunk
/// passes the syntax check.
///
/// Each [#attempt] is a complete, independent render: analysis is redone because a higher
/// strategy changes which tables go through the reference table.
final class PersistenceDriver {
  private static final Value GLOBALS = Value.of("_G");
  private static final Value REFERENCE_TABLE = Value.of("ref");

  private final PersistenceLimits limits;
  private final Literals literals;
  private final SyntaxCheck syntaxCheck;

  PersistenceDriver(PersistenceLimits limits, Literals literals, SyntaxCheck syntaxCheck) {
    this.limits = Objects.requireNonNull(limits);
    this.literals = Objects.requireNonNull(literals);
    this.syntaxCheck = Objects.requireNonNull(syntaxCheck);
  }

  /// Result of one render at one strategy level.
  sealed interface Attempt permits Attempt.Rendered, Attempt.NeedsEscalation, Attempt.Fatal {

    /// The strategy actually used, which may be above the one requested.
    Strategy strategy();

    record Rendered(Strategy strategy, String chunk) implements Attempt {
    }

    record NeedsEscalation(Strategy strategy, Strategy next, String reason) implements Attempt {
    }

    record Fatal(Strategy strategy, String reason) implements Attempt {
    }
  }

  /// Renders with the lowest strategy that works, starting at `floor`.
  /// @throws IllegalStateException if even split form does not pass the syntax check
  String persist(LuaTable bindings, LuaTable mustExist, Strategy floor) {
    var strategy = floor;
    while (true) {
      final Attempt attempt = attempt(bindings, mustExist, strategy);
      if (attempt instanceof Attempt.Rendered rendered) {
        LOGGER.fine(() -> "Persisted " + bindings.size() + " bindings using " + rendered.strategy()
            + " (" + rendered.chunk().length() + " chars)");
        return rendered.chunk();
      } else if (attempt instanceof Attempt.NeedsEscalation escalation) {
        LOGGER.info(() -> "Escalating from " + escalation.strategy() + " to " + escalation.next()
            + ": " + escalation.reason());
        strategy = escalation.next();
      } else if (attempt instanceof Attempt.Fatal fatal) {
        LOGGER.severe(() -> "No strategy produces a loadable chunk: " + fatal.reason());
        throw new IllegalStateException("Cannot persist properly, please report this: " + fatal.reason());
      }
    }
  }

  Attempt attempt(LuaTable bindings, LuaTable mustExist, Strategy requested) {
    final List<Value> names = bindingNames(bindings, mustExist);
    // sorted before analysis so reference indices do not depend on insertion order
    names.sort(KeyOrder.INSTANCE);

    final var analyzer = new ReferenceAnalyzer();
    for (Value name : names) {
      analyzer.visit(name);
      analyzer.visit(bindings.get(name));
    }
    final var graph = analyzer.result();

    var strategy = requested;
    if (graph.containerCount() > limits.containerThreshold()) {
      LOGGER.fine(() -> graph.containerCount() + " tables exceeds " + limits.containerThreshold() + ", forcing " + Strategy.SPLIT);
      strategy = Strategy.max(strategy, Strategy.SPLIT);
    }
    if (graph.maxDepth() > limits.nestingLimit()) {
      LOGGER.fine(() -> "Nesting depth " + graph.maxDepth() + " exceeds " + limits.nestingLimit() + ", forcing " + Strategy.REFERENCE);
      strategy = Strategy.max(strategy, Strategy.REFERENCE);
    }

    final Map<LuaTable, Integer> references = graph.referenceIndices(strategy.referencesEverything());
    final var sink = new TokenSink();
    final var writer = ValueWriter.pretty(sink, literals, references);

    if (!references.isEmpty()) {
      writeReferenceTable(sink, writer, references, strategy.splitsBlocks());
    }

    // `_G` goes last: once assigned, later `_G[...]` statements would index the new value
    Value globalsBinding = null;
    for (Value name : names) {
      if (GLOBALS.equals(name)) {
        globalsBinding = name;
      } else {
        writeBinding(sink, writer, name, bindings.get(name), !references.isEmpty());
      }
    }
    if (globalsBinding != null) {
      writeBinding(sink, writer, globalsBinding, bindings.get(globalsBinding), !references.isEmpty());
    }

    final String chunk = sink.finish();
    try {
      syntaxCheck.verify(chunk);
      return new Attempt.Rendered(strategy, chunk);
    } catch (ChunkSyntaxException e) {
      final Strategy failed = strategy;
      return failed.next()
          .<Attempt>map(next -> new Attempt.NeedsEscalation(failed, next, e.getMessage()))
          .orElseGet(() -> new Attempt.Fatal(failed, e.getMessage()));
    }
  }

  /// Every key of `bindings`, then every key of `mustExist` that `bindings` lacks.
  static List<Value> bindingNames(LuaTable bindings, LuaTable mustExist) {
    final var names = new ArrayList<Value>(bindings.entries().keySet());
    for (Value key : mustExist.entries().keySet()) {
      if (!bindings.containsKey(key)) {
        names.add(key);
      }
    }
    return names;
  }

  /// `name = value`, or `_G[name] = value` when the name is not an identifier or is shadowed by
  /// the chunk's own `local ref`.
  private static void writeBinding(TokenSink sink, ValueWriter writer, Value name, Value value, boolean refShadowed) {
    if (Literals.isSafeIdentifier(name) && !(refShadowed && REFERENCE_TABLE.equals(name))) {
      sink.raw(((Value.Str) name).value()).raw(" = ");
    } else {
      sink.raw("_G[");
      writer.write(name, 0);
      sink.raw("] = ");
    }
    writer.write(value, 0);
    sink.raw("\n");
  }

  /// Creates every slot before filling any, since fills may point at slots created later.
  private void writeReferenceTable(TokenSink sink, ValueWriter writer, Map<LuaTable, Integer> references, boolean split) {
    sink.raw("local ref = {}\n");
    sink.raw("for k=").literal("1").raw(",").literal(Integer.toString(references.size())).raw(" do ref[k] = {} end\n");

    int blockStart = sink.literals();
    if (split) {
      sink.raw(";(function ()\n");
    }
    int blocks = 1;
    for (var slot : references.entrySet()) {
      for (var entry : slot.getKey().orderedEntries()) {
        writer.writeReference(slot.getValue());
        final Value key = entry.getKey();
        if (Literals.isSafeIdentifier(key)) {
          sink.raw(".").name(((Value.Str) key).value());
        } else {
          sink.raw("[");
          writer.write(key, 0);
          sink.raw("]");
        }
        sink.raw(" = ");
        writer.write(entry.getValue(), 0);
        sink.raw("\n");
        if (split && sink.literals() - blockStart > limits.blockLiteralBudget()) {
          sink.raw("end)()\n;(function ()\n");
          blockStart = sink.literals();
          blocks++;
        }
      }
    }
    if (split) {
      sink.raw("end)()\n");
      final int count = blocks;
      LOGGER.fine(() -> "Split " + references.size() + " reference fills into " + count + " blocks");
    }
  }
}
