// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.persistence.Persistence.LOGGER;

/// Counts how often each table is reached from a set of roots. A table seen more than once is shared,
/// whether through two paths or through a cycle. Each table's entries are walked only on its first
/// visit, so cyclic graphs terminate. The walk uses an explicit stack so deep graphs cannot overflow
/// the Java stack.
final class ReferenceAnalyzer {

  /// Visit counts keyed by table identity, in first-visit order.
  private final Map<LuaTable, Integer> counts = new LinkedHashMap<>();
  private final ArrayDeque<Frame> pending = new ArrayDeque<>();
  private boolean revisited;
  private int maxDepth;

  private record Frame(LuaTable table, int depth) {
  }

  /// Walks everything reachable from `root`. May be called once per root; counts accumulate.
  /// @return true if this walk reached any table that had already been visited
  boolean visit(Value root) {
    final boolean before = revisited;
    revisited = false;
    final Frame first = touch(root, 1);
    if (first != null) {
      pending.push(first);
    }
    final var discovered = new ArrayList<Frame>();
    while (!pending.isEmpty()) {
      final Frame frame = pending.pop();
      discovered.clear();
      for (var entry : frame.table().orderedEntries()) {
        addIfNew(discovered, touch(entry.getKey(), frame.depth() + 1));
        addIfNew(discovered, touch(entry.getValue(), frame.depth() + 1));
      }
      // reversed so the stack pops children in canonical order
      for (int i = discovered.size() - 1; i >= 0; i--) {
        pending.push(discovered.get(i));
      }
    }
    final boolean sawSharing = revisited;
    revisited = before || sawSharing;
    return sawSharing;
  }

  private static void addIfNew(List<Frame> discovered, Frame frame) {
    if (frame != null) {
      discovered.add(frame);
    }
  }

  /// Counts one visit. Returns a frame to walk when the table is seen for the first time.
  private Frame touch(Value value, int depth) {
    if (!(value instanceof LuaTable table)) {
      return null;
    }
    final Integer seen = counts.get(table);
    if (seen != null) {
      counts.put(table, seen + 1);
      revisited = true;
      return null;
    }
    counts.put(table, 1);
    maxDepth = Math.max(maxDepth, depth);
    return new Frame(table, depth);
  }

  ReferenceGraph result() {
    LOGGER.finer(() -> "Reference analysis: tables=" + counts.size() + " shared=" + revisited + " maxDepth=" + maxDepth);
    return new ReferenceGraph(Collections.unmodifiableMap(new LinkedHashMap<>(counts)), revisited, maxDepth);
  }

  /// Outcome of a reference analysis.
  /// @param counts visit count per table, in first-visit order
  /// @param sharing whether any table was reached more than once
  /// @param maxDepth deepest nesting level at which a table was first reached, roots being level 1
  record ReferenceGraph(Map<LuaTable, Integer> counts, boolean sharing, int maxDepth) {

    int containerCount() {
      return counts.size();
    }

    int count(LuaTable table) {
      return counts.getOrDefault(table, 0);
    }

    /// Assigns 1-based reference indices in first-visit order.
    /// @param everything treat every table as shared, not just those with more than one visit
    Map<LuaTable, Integer> referenceIndices(boolean everything) {
      final var indices = new LinkedHashMap<LuaTable, Integer>();
      if (!everything && !sharing) {
        return indices;
      }
      for (var entry : counts.entrySet()) {
        if (everything || entry.getValue() > 1) {
          indices.put(entry.getKey(), indices.size() + 1);
        }
      }
      return indices;
    }
  }
}
