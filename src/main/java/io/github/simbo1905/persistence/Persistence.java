// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Main interface of the persistence library. Turns data graphs of numbers, strings, booleans and
/// tables into source text that rebuilds an equal graph when loaded by the target runtime.
///
/// Two renderings are offered:
/// - [#serializeInline(Value)] writes one tree-shaped value on a single line, for display.
/// - [#serializeFull(LuaTable, LuaTable)] writes named bindings as a chunk of statements and copes
///   with shared tables, cycles and very large graphs.
///
/// Functions and other opaque values are written as `nil` followed by a comment naming them.
public sealed interface Persistence permits PersistenceImpl {

  Logger LOGGER = Logger.getLogger(Persistence.class.getName());

  /// Written by [#dump(Value...)] in place of a table that could not be rendered inline.
  String SERIALIZATION_FAILED = "(serialization failed)";

  /// Renders one value on a single line.
  /// @return the text, or empty if the value contains a shared or cyclic table, nests too deeply,
  ///         or would be longer than the inline ceiling
  Optional<String> serializeInline(@NotNull Value value);

  /// Renders `bindings` as a chunk of global assignments, using the bindings themselves as the
  /// must-exist set.
  String serializeFull(@NotNull LuaTable bindings);

  /// Renders `bindings` as a chunk of global assignments. Every key of `mustExist` that `bindings`
  /// lacks is written as an explicit `nil` assignment.
  /// @throws IllegalStateException if no output strategy yields a loadable chunk
  String serializeFull(@NotNull LuaTable bindings, @NotNull LuaTable mustExist);

  /// As [#serializeFull(LuaTable, LuaTable)] but never using a strategy below `floor`.
  String serializeFull(@NotNull LuaTable bindings, @NotNull LuaTable mustExist, @NotNull Strategy floor);

  /// Renders each table argument inline, substituting [#SERIALIZATION_FAILED] when that fails,
  /// and hands all arguments to the debug channel.
  void dump(Value... values);

  /// A persistence engine with limits from [PersistenceLimits#current()] printing dumps to standard output.
  static Persistence create() {
    return create(PersistenceLimits.current());
  }

  static Persistence create(@NotNull PersistenceLimits limits) {
    return create(limits, SyntaxCheck.lua(limits), DebugChannel.STDOUT);
  }

  static Persistence create(@NotNull PersistenceLimits limits, @NotNull SyntaxCheck syntaxCheck,
                            @NotNull DebugChannel debugChannel) {
    Objects.requireNonNull(limits, "limits must not be null");
    Objects.requireNonNull(syntaxCheck, "syntaxCheck must not be null");
    Objects.requireNonNull(debugChannel, "debugChannel must not be null");
    return new PersistenceImpl(limits, Literals.lua(), syntaxCheck, debugChannel);
  }
}
