// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/// Reads persisted chunks back. [#verify(String)] only parses, which is what the driver uses as
/// its syntax check. [#load(String)] parses and then runs the chunk, returning the globals it assigned.
public final class ChunkReader implements SyntaxCheck {
  private final int constantCeiling;
  private final int nestingLimit;

  /// A reader with the default ceilings.
  public ChunkReader() {
    this(PersistenceLimits.DEFAULTS.constantCeiling(), PersistenceLimits.DEFAULTS.nestingLimit());
  }

  public ChunkReader(int constantCeiling, int nestingLimit) {
    if (constantCeiling <= 0 || nestingLimit <= 0) {
      throw new IllegalArgumentException("ceilings must be positive: constantCeiling=" + constantCeiling
          + " nestingLimit=" + nestingLimit);
    }
    this.constantCeiling = constantCeiling;
    this.nestingLimit = nestingLimit;
  }

  @Override
  public void verify(@NotNull String chunk) {
    parse(chunk);
  }

  /// Runs `chunk` against fresh globals. `_G` names the globals table itself.
  /// @throws ChunkSyntaxException if the chunk does not parse
  /// @throws IllegalStateException if running it fails, e.g. indexing a non-table
  public LuaTable load(@NotNull String chunk) {
    final var statements = parse(chunk);
    final var globals = new LuaTable();
    new ChunkEvaluator(globals).run(statements);
    return globals;
  }

  List<ChunkAst.Stat> parse(String chunk) {
    Objects.requireNonNull(chunk, "chunk must not be null");
    final var tokens = new ChunkLexer(chunk).tokens();
    return new ChunkParser(tokens, constantCeiling, nestingLimit).chunk();
  }
}
