// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.List;
import java.util.stream.Collectors;

/// Destination for [Persistence#dump(Value...)]. Owns the formatting of anything that is not already text.
@FunctionalInterface
public interface DebugChannel {

  void print(List<Value> values);

  /// Prints display forms separated by tabs on standard output, like the runtime's `print`.
  DebugChannel STDOUT = values -> System.out.println(values.stream()
      .map(Value::display)
      .collect(Collectors.joining("\t")));
}
