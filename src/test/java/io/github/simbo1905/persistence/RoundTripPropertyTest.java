// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.persistence;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Random graphs rendered and read back. A seed drives each graph so failures can be replayed.
public class RoundTripPropertyTest {

  private static final Logger log = Logger.getLogger(RoundTripPropertyTest.class.getName());

  static {
    log.setLevel(Level.INFO);
  }

  private static final String ALPHABET = "abcXYZ_09 \"'\\\n\t\u0000\u0007é中]=[-";

  private final Persistence persistence = Persistence.create(PersistenceLimits.DEFAULTS);
  private final ChunkReader reader = new ChunkReader();

  @Property(tries = 200)
  void treesRoundTripThroughFullRender(@ForAll long seed) {
    final var random = new Random(seed);
    final var tree = tree(random, 4);
    final String chunk = persistence.serializeFull(new LuaTable().set("x", tree));
    log.fine(() -> "seed " + seed + ":\n" + chunk);
    assertThat(Values.deepEquals(reader.load(chunk).get("x"), tree)).as(chunk).isTrue();
  }

  @Property(tries = 200)
  void treesRoundTripThroughInlineRender(@ForAll long seed) {
    final var random = new Random(seed);
    final var tree = tree(random, 4);
    final var text = persistence.serializeInline(tree);
    assertThat(text).isPresent();
    assertThat(text.get()).doesNotContain("\n");
    assertThat(Values.deepEquals(reader.load("x = " + text.get()).get("x"), tree)).as(text.get()).isTrue();
  }

  @Property(tries = 100)
  void insertionOrderDoesNotChangeOutput(@ForAll long seed) {
    final var tree = tree(new Random(seed), 3);
    final var reversed = reversedCopy(tree);
    assertThat(persistence.serializeFull(new LuaTable().set("x", reversed)))
        .isEqualTo(persistence.serializeFull(new LuaTable().set("x", tree)));
  }

  @Property(tries = 200)
  void graphsWithSharingAndCyclesRoundTrip(@ForAll long seed) {
    final var random = new Random(seed);
    final var pool = new ArrayList<LuaTable>();
    for (int i = 0; i < 1 + random.nextInt(8); i++) {
      pool.add(new LuaTable());
    }
    for (LuaTable table : pool) {
      for (int i = 0; i < random.nextInt(5); i++) {
        final Value key = random.nextInt(4) == 0 ? pool.get(random.nextInt(pool.size())) : scalarKey(random);
        final Value value = random.nextBoolean() ? pool.get(random.nextInt(pool.size())) : scalar(random);
        table.set(key, value);
      }
    }
    final var bindings = new LuaTable();
    for (int i = 0; i < 1 + random.nextInt(3); i++) {
      bindings.set("g" + i, pool.get(random.nextInt(pool.size())));
    }
    final String chunk = persistence.serializeFull(bindings);
    final var globals = reader.load(chunk);
    assertThat(Values.deepEquals(globals, bindings)).as(chunk).isTrue();
    // bindings naming the same table still name one table
    for (var a : bindings.entries().entrySet()) {
      for (var b : bindings.entries().entrySet()) {
        if (a.getValue() == b.getValue()) {
          assertThat(globals.get(a.getKey())).isSameAs(globals.get(b.getKey()));
        }
      }
    }
  }

  @Property(tries = 50)
  void sharedTreesAreRefusedInline(@ForAll long seed) {
    final var random = new Random(seed);
    final var shared = tree(random, 2);
    final var holder = LuaTable.of(shared);
    holder.set("again", shared);
    assertThat(persistence.serializeInline(holder)).isEmpty();
  }

  static LuaTable tree(Random random, int depth) {
    final var table = new LuaTable();
    final int sequence = random.nextInt(4);
    for (int i = 1; i <= sequence; i++) {
      table.set(i, value(random, depth));
    }
    final int keyed = random.nextInt(5);
    for (int i = 0; i < keyed; i++) {
      table.set(scalarKey(random), value(random, depth));
    }
    return table;
  }

  private static Value value(Random random, int depth) {
    if (depth > 0 && random.nextInt(3) == 0) {
      return tree(random, depth - 1);
    }
    return scalar(random);
  }

  private static Value scalar(Random random) {
    return switch (random.nextInt(3)) {
      case 0 -> scalarKey(random);
      case 1 -> Value.of(random.nextGaussian() * 1e6);
      default -> Value.of(random.nextInt(2000) - 1000);
    };
  }

  private static Value scalarKey(Random random) {
    return switch (random.nextInt(5)) {
      case 0 -> Value.of(random.nextInt(20) - 5);
      case 1 -> Value.of(random.nextDouble() * 100);
      case 2 -> Value.of(random.nextBoolean());
      case 3 -> Value.of(identifier(random));
      default -> Value.of(text(random));
    };
  }

  private static String identifier(Random random) {
    final List<String> words = List.of("name", "value", "end", "nil", "_x1", "for", "Items");
    return words.get(random.nextInt(words.size()));
  }

  private static String text(Random random) {
    final var sb = new StringBuilder();
    for (int i = 0; i < random.nextInt(8); i++) {
      sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }

  private static LuaTable reversedCopy(LuaTable table) {
    final var entries = new ArrayList<Map.Entry<Value, Value>>(table.entries().entrySet());
    Collections.reverse(entries);
    final var copy = new LuaTable();
    for (var entry : entries) {
      final Value value = entry.getValue() instanceof LuaTable nested ? reversedCopy(nested) : entry.getValue();
      copy.set(entry.getKey(), value);
    }
    return copy;
  }
}
