// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.Comparator;

/// Total order over keys so that output never depends on hash iteration order.
/// Numbers sort before strings, strings before booleans, and booleans before every other kind.
/// Numbers and strings use their natural order, `true` sorts before `false`, and anything else
/// falls back to the order of its display text.
enum KeyOrder implements Comparator<Value> {
  INSTANCE;

  @Override
  public int compare(Value a, Value b) {
    final Kind ka = a.kind();
    final Kind kb = b.kind();
    if (ka != kb) {
      final int byRank = Integer.compare(ka.keyRank(), kb.keyRank());
      return byRank != 0 ? byRank : ka.typeName().compareTo(kb.typeName());
    }
    return switch (ka) {
      case NUMBER -> Double.compare(((Value.Num) a).value(), ((Value.Num) b).value());
      case STRING -> ((Value.Str) a).value().compareTo(((Value.Str) b).value());
      case BOOLEAN -> Boolean.compare(((Value.Bool) b).value(), ((Value.Bool) a).value());
      default -> a.display().compareTo(b.display());
    };
  }
}
