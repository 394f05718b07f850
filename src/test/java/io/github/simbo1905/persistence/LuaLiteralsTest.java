// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LuaLiteralsTest {

  private final Literals literals = Literals.lua();
  private final ChunkReader reader = new ChunkReader();

  @Test
  void quotesAndEscapes() {
    assertThat(literals.quote("plain")).isEqualTo("\"plain\"");
    assertThat(literals.quote("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
    assertThat(literals.quote("line\nbreak\r")).isEqualTo("\"line\\nbreak\\r\"");
    assertThat(literals.quote("\u0000" + "1")).isEqualTo("\"\\0001\"");
    assertThat(literals.quote("tab\t")).isEqualTo("\"tab\\009\"");
  }

  @Test
  @DisplayName("Quoted strings read back to the same text")
  void quotedStringsReadBack() {
    final String nasty = "q\"uo'te \\ back\nnew\rret\u0000nul\u0001\u001f\u007f é 中 ]] --[[";
    final var globals = reader.load("x = " + literals.quote(nasty));
    assertThat(globals.get("x")).isEqualTo(Value.of(nasty));
  }

  @Test
  void numerals() {
    assertThat(literals.numeral(1)).isEqualTo("1");
    assertThat(literals.numeral(-42)).isEqualTo("-42");
    assertThat(literals.numeral(0.1)).isEqualTo("0.1");
    assertThat(literals.numeral(Double.NaN)).isEqualTo("(0/0)");
    assertThat(literals.numeral(Double.POSITIVE_INFINITY)).isEqualTo("(1/0)");
    assertThat(literals.numeral(Double.NEGATIVE_INFINITY)).isEqualTo("(-1/0)");
  }

  @Test
  @DisplayName("Numerals read back to the same double")
  void numeralsReadBack() {
    final double[] samples = {0, -0.0, 1, -1, 0.1, 1.0 / 3, 1e20, -1e-300, Double.MAX_VALUE,
        Double.MIN_VALUE, 9007199254740993.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
    for (double sample : samples) {
      final var globals = reader.load("x = " + literals.numeral(sample));
      final double read = ((Value.Num) globals.get("x")).value();
      assertThat(Double.compare(read, sample)).as("round trip of %s", sample).isZero();
    }
  }

  @Test
  void safeIdentifiers() {
    assertThat(Literals.isSafeIdentifier(Value.of("name_1"))).isTrue();
    assertThat(Literals.isSafeIdentifier(Value.of("_"))).isTrue();
    assertThat(Literals.isSafeIdentifier(Value.of("1name"))).isFalse();
    assertThat(Literals.isSafeIdentifier(Value.of("two words"))).isFalse();
    assertThat(Literals.isSafeIdentifier(Value.of("end"))).isFalse();
    assertThat(Literals.isSafeIdentifier(Value.of("nil"))).isFalse();
    assertThat(Literals.isSafeIdentifier(Value.of(""))).isFalse();
    assertThat(Literals.isSafeIdentifier(Value.of(1))).isFalse();
  }
}
