// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.persistence;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Strategy escalation, driven with small ceilings so the target runtime's limits are easy to hit.
public class PersistenceDriverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// 64 constants per function, split blocks after 40 literals.
  static final PersistenceLimits SMALL = new PersistenceLimits(1_000, 40, 64, 200, 1 << 20);

  /// Records every chunk it is asked to verify.
  static final class RecordingCheck implements SyntaxCheck {
    final List<String> chunks = new ArrayList<>();
    final ChunkReader reader;

    RecordingCheck(PersistenceLimits limits) {
      this.reader = new ChunkReader(limits.constantCeiling(), limits.nestingLimit());
    }

    @Override
    public void verify(String chunk) {
      chunks.add(chunk);
      reader.verify(chunk);
    }
  }

  private static LuaTable strings(int count) {
    final var table = new LuaTable();
    for (int i = 1; i <= count; i++) {
      table.append(Value.of("s" + i));
    }
    return table;
  }

  private static int occurrences(String text, String fragment) {
    int count = 0;
    for (int i = text.indexOf(fragment); i >= 0; i = text.indexOf(fragment, i + 1)) {
      count++;
    }
    return count;
  }

  @Test
  @DisplayName("Too many constants climbs from tree to reference to split form")
  void escalatesToSplitForm() {
    final var check = new RecordingCheck(SMALL);
    final var driver = new PersistenceDriver(SMALL, Literals.lua(), check);
    final var value = strings(100);
    final var bindings = new LuaTable().set("x", value);

    final String chunk = driver.persist(bindings, bindings, Strategy.TREE);

    assertThat(check.chunks).hasSize(3);
    assertThat(check.chunks.get(0)).doesNotContain("local ref");
    assertThat(check.chunks.get(1)).contains("local ref").doesNotContain("(function ()");
    assertThat(chunk).isEqualTo(check.chunks.get(2));
    assertThat(chunk).startsWith("local ref = {}\nfor k=1,1 do ref[k] = {} end\n;(function ()\n");
    assertThat(chunk).endsWith("end)()\nx = ref[1]\n");
    // 3 literals per fill, a new block once a block passes 40
    assertThat(occurrences(chunk, ";(function ()\n")).isEqualTo(8);
    assertThat(occurrences(chunk, "end)()\n")).isEqualTo(8);

    final var globals = new ChunkReader(SMALL.constantCeiling(), SMALL.nestingLimit()).load(chunk);
    assertThat(Values.deepEquals(globals.get("x"), value)).isTrue();
  }

  @Test
  @DisplayName("Identifier field names count towards the constant ceiling")
  void identifierKeysCountAsConstants() {
    final var check = new RecordingCheck(SMALL);
    final var driver = new PersistenceDriver(SMALL, Literals.lua(), check);
    final var value = new LuaTable();
    for (int i = 1; i <= 40; i++) {
      value.set("k" + i, Value.of("v" + i));
    }
    final var bindings = new LuaTable().set("x", value);

    final String chunk = driver.persist(bindings, bindings, Strategy.TREE);

    assertThat(check.chunks).hasSize(3);
    assertThat(chunk).startsWith("local ref = {}\nfor k=1,1 do ref[k] = {} end\n;(function ()\n");
    // 3 constants per fill: the slot index, the field name and the string
    assertThat(occurrences(chunk, ";(function ()\n")).isEqualTo(3);
    assertThat(chunk).contains("ref[1].k17 = \"v17\"\n");
    final var globals = new ChunkReader(SMALL.constantCeiling(), SMALL.nestingLimit()).load(chunk);
    assertThat(Values.deepEquals(globals.get("x"), value)).isTrue();
  }

  @Test
  void attemptReportsTheNextStrategy() {
    final var driver = new PersistenceDriver(SMALL, Literals.lua(), SyntaxCheck.lua(SMALL));
    final var bindings = new LuaTable().set("x", strings(100));

    final var tree = driver.attempt(bindings, bindings, Strategy.TREE);
    assertThat(tree).isInstanceOfSatisfying(PersistenceDriver.Attempt.NeedsEscalation.class, escalation -> {
      assertThat(escalation.strategy()).isEqualTo(Strategy.TREE);
      assertThat(escalation.next()).isEqualTo(Strategy.REFERENCE);
      assertThat(escalation.reason()).contains("constant table overflow");
    });
    assertThat(driver.attempt(bindings, bindings, Strategy.REFERENCE))
        .isInstanceOf(PersistenceDriver.Attempt.NeedsEscalation.class);
    assertThat(driver.attempt(bindings, bindings, Strategy.SPLIT))
        .isInstanceOf(PersistenceDriver.Attempt.Rendered.class);
  }

  @Test
  @DisplayName("Failing even in split form is fatal")
  void fatalWhenNothingParses() {
    final var tiny = new PersistenceLimits(1_000, 40, 8, 200, 1 << 20);
    final var check = new RecordingCheck(tiny);
    final var driver = new PersistenceDriver(tiny, Literals.lua(), check);
    final var bindings = new LuaTable();
    for (int i = 1; i <= 20; i++) {
      bindings.set("v" + i, Value.of(i));
    }
    assertThat(driver.attempt(bindings, bindings, Strategy.SPLIT))
        .isInstanceOf(PersistenceDriver.Attempt.Fatal.class);
    check.chunks.clear();

    assertThatThrownBy(() -> driver.persist(bindings, bindings, Strategy.TREE))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Cannot persist properly");
    assertThat(check.chunks).hasSize(3);
  }

  @Test
  @DisplayName("Many tables go straight to split form")
  void containerThresholdForcesSplit() {
    final var limits = new PersistenceLimits(3, 65_500, 65_535, 200, 1 << 20);
    final var check = new RecordingCheck(limits);
    final var persistence = Persistence.create(limits, check, DebugChannel.STDOUT);
    final var value = new LuaTable().set("a", new LuaTable().set("b", new LuaTable().set("c", LuaTable.of(new LuaTable()))));

    final String chunk = persistence.serializeFull(new LuaTable().set("x", value));

    assertThat(check.chunks).hasSize(1);
    assertThat(chunk).startsWith("local ref = {}\nfor k=1,5 do ref[k] = {} end\n;(function ()\n");
    final var globals = new ChunkReader().load(chunk);
    assertThat(Values.deepEquals(globals.get("x"), value)).isTrue();
  }

  @Test
  @DisplayName("Very deep nesting skips tree form")
  void deepNestingUsesReferences() {
    final var root = new LuaTable();
    var current = root;
    for (int i = 0; i < 300; i++) {
      final var next = new LuaTable().set("depth", Value.of(i));
      current.set("next", next);
      current = next;
    }
    final var check = new RecordingCheck(PersistenceLimits.DEFAULTS);
    final var persistence = Persistence.create(PersistenceLimits.DEFAULTS, check, DebugChannel.STDOUT);

    final String chunk = persistence.serializeFull(new LuaTable().set("chain", root));

    assertThat(check.chunks).hasSize(1);
    assertThat(chunk).startsWith("local ref = {}\nfor k=1,301 do ref[k] = {} end\n").doesNotContain("(function ()");
    assertThat(Values.deepEquals(new ChunkReader().load(chunk).get("chain"), root)).isTrue();
  }

  @Test
  @DisplayName("A strategy floor is honoured even when tree form would do")
  void strategyFloor() {
    final var persistence = Persistence.create(PersistenceLimits.DEFAULTS);
    final var child = LuaTable.of(Value.of(1));
    final var bindings = new LuaTable().set("t", new LuaTable().set("child", child));

    final String chunk = persistence.serializeFull(bindings, bindings, Strategy.REFERENCE);

    assertThat(chunk).isEqualTo("""
        local ref = {}
        for k=1,2 do ref[k] = {} end
        ref[1].child = ref[2]
        ref[2][1] = 1
        t = ref[1]
        """);
    assertThat(Values.deepEquals(new ChunkReader().load(chunk), bindings)).isTrue();
  }
}
