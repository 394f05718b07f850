// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// Checks that a chunk would be accepted by the target parser, without running it.
@FunctionalInterface
public interface SyntaxCheck {

  /// @throws ChunkSyntaxException when the chunk would not load
  void verify(String chunk);

  /// The built-in reader configured with the parser ceilings from `limits`.
  static SyntaxCheck lua(PersistenceLimits limits) {
    return new ChunkReader(limits.constantCeiling(), limits.nestingLimit());
  }
}
