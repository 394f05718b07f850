// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.persistence;

/// Thresholds that keep generated chunks within the target runtime's limits.
/// Overridable through system properties prefixed `io.github.simbo1905.persistence.`, e.g.
/// `-Dio.github.simbo1905.persistence.containerThreshold=1000`.
///
/// @param containerThreshold above this many distinct tables the driver goes straight to split form
/// @param blockLiteralBudget literals allowed in one split block before a new block is opened
/// @param constantCeiling most literal constants the target parser accepts in one function body
/// @param nestingLimit deepest constructor nesting the target parser accepts
/// @param inlineCharLimit longest text inline rendering will produce
public record PersistenceLimits(int containerThreshold, int blockLiteralBudget, int constantCeiling,
                                int nestingLimit, int inlineCharLimit) {

  static final String PROPERTY_PREFIX = "io.github.simbo1905.persistence.";

  /// Defaults sized for LuaJIT: 65536 constants per function and 200 nested C calls.
  public static final PersistenceLimits DEFAULTS = new PersistenceLimits(65_000, 65_500, 65_535, 200, 1 << 20);

  public PersistenceLimits {
    requirePositive("containerThreshold", containerThreshold);
    requirePositive("blockLiteralBudget", blockLiteralBudget);
    requirePositive("constantCeiling", constantCeiling);
    requirePositive("nestingLimit", nestingLimit);
    requirePositive("inlineCharLimit", inlineCharLimit);
  }

  /// Defaults with any system property overrides applied.
  public static PersistenceLimits current() {
    return new PersistenceLimits(
        property("containerThreshold", DEFAULTS.containerThreshold()),
        property("blockLiteralBudget", DEFAULTS.blockLiteralBudget()),
        property("constantCeiling", DEFAULTS.constantCeiling()),
        property("nestingLimit", DEFAULTS.nestingLimit()),
        property("inlineCharLimit", DEFAULTS.inlineCharLimit()));
  }

  private static int property(String name, int defaultValue) {
    final String raw = System.getProperty(PROPERTY_PREFIX + name);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + name + ": " + raw + ". Must be an integer.", e);
    }
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive but was " + value);
    }
  }
}
