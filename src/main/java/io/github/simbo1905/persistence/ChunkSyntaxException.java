// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// A chunk the target parser would reject, including chunks that exceed its constant or nesting limits.
public class ChunkSyntaxException extends RuntimeException {
  private final int line;

  public ChunkSyntaxException(int line, String message) {
    super("line " + line + ": " + message);
    this.line = line;
  }

  public int line() {
    return line;
  }
}
