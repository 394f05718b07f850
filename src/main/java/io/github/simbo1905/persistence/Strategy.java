// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.Optional;

/// The output strategy ladder. Each level trades readability for robustness against the target
/// runtime's limits, and the driver climbs it when a chunk fails the syntax check.
public enum Strategy {
  /// One nested constructor per binding; shared or cyclic tables still go through the reference table.
  TREE,
  /// Every table goes through the reference table, so no constructor nests inside another.
  REFERENCE,
  /// As REFERENCE, with the fill statements spread over sequential function blocks.
  SPLIT;

  boolean referencesEverything() {
    return this.compareTo(REFERENCE) >= 0;
  }

  boolean splitsBlocks() {
    return this == SPLIT;
  }

  Optional<Strategy> next() {
    return this == SPLIT ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
  }

  static Strategy max(Strategy a, Strategy b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
