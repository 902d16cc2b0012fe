/*
 * Copyright (c) 2023, Notix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.notix.mensural;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests the mensural duration tables of {@link MensurInfo} and {@link DurationReader}.
 */
@DisplayName("Mensural durations")
class DurationReaderTest {

  private static final MensurInfo PERFECT = new MensurInfo(3, 3, 3, 3);

  @Nested
  @DisplayName("Multipliers")
  class Multipliers {

    @ParameterizedTest(name = "{0}: binary {1}/{2}, perfect {3}/{4}")
    @CsvSource({"MAXIMA, 16, 1, 81, 1", "LONGA, 8, 1, 27, 1", "BREVIS, 4, 1, 9, 1", "SEMIBREVIS, 2, 1, 3, 1",
        "MINIMA, 1, 1, 1, 1", "SEMIMINIMA, 1, 2, 1, 2", "FUSA, 1, 4, 1, 4", "SEMIFUSA, 1, 8, 1, 8"})
    @DisplayName("the nominal length in minims follows the mensuration")
    void testMultiplier(final Duration duration, final long binaryNum, final long binaryDen, final long perfectNum,
        final long perfectDen) {
      assertEquals(Ratio.of(binaryNum, binaryDen), MensurInfo.binary().getMultiplier(duration));
      assertEquals(Ratio.of(perfectNum, perfectDen), PERFECT.getMultiplier(duration));
    }

    @Test
    @DisplayName("perfect tempus with imperfect prolation")
    void testMixedMensuration() {
      final MensurInfo mensurInfo = new MensurInfo(2, 3, 2, 2);
      assertEquals(Ratio.of(6), mensurInfo.getMultiplier(Duration.BREVIS));
      assertEquals(Ratio.of(12), mensurInfo.getMultiplier(Duration.LONGA));
    }

    @Test
    @DisplayName("levels are binary or ternary")
    void testInvalidLevel() {
      assertThrows(IllegalArgumentException.class, () -> new MensurInfo(4, 2, 2, 2));
      assertThrows(IllegalArgumentException.class, () -> new MensurInfo(2, 2, 2, 0));
    }

    @Test
    @DisplayName("mensurations are values")
    void testEquals() {
      assertEquals(MensurInfo.binary(), new MensurInfo(2, 2, 2, 2));
      assertEquals(PERFECT, new MensurInfo(3, 3, 3, 3));
      assertEquals(PERFECT.hashCode(), new MensurInfo(3, 3, 3, 3).hashCode());
      assertNotEquals(MensurInfo.binary(), new MensurInfo(3, 2, 2, 2));
      assertNotEquals(PERFECT, new MensurInfo(3, 2, 2, 2));
    }
  }

  @Nested
  @DisplayName("Labels")
  class Labels {

    @Test
    @DisplayName("known labels resolve to their value")
    void testKnownLabel() {
      assertEquals(Duration.SEMIMINIMA, DurationReader.readDuration("Semiminima"));
      assertEquals(Duration.MAXIMA, DurationReader.readDuration("Maxima"));
    }

    @Test
    @DisplayName("unknown or missing labels fall back to the brevis")
    void testUnknownLabel() {
      assertEquals(Duration.BREVIS, DurationReader.readDuration("Crotchet"));
      assertEquals(Duration.BREVIS, DurationReader.readDuration(""));
      assertEquals(Duration.BREVIS, DurationReader.readDuration(null));
    }
  }

  @Nested
  @DisplayName("Proportions")
  class Proportions {

    @Test
    @DisplayName("the nominal length needs no proportion")
    void testNominalLength() {
      assertEquals(Optional.empty(), DurationReader.readProportion(Duration.BREVIS, 4, 1, MensurInfo.binary()));
      assertEquals(Optional.empty(), DurationReader.readProportion(Duration.FUSA, 1, 4, MensurInfo.binary()));
    }

    @ParameterizedTest
    @CsvSource({"0, 1", "1, 0", "0, 0", "-2, 1"})
    @DisplayName("a length that is not positive is ignored")
    void testInvalidLength(final int lengthNum, final int lengthDen) {
      assertEquals(Optional.empty(), DurationReader.readProportion(Duration.BREVIS, lengthNum, lengthDen,
          MensurInfo.binary()));
    }

    @Test
    @DisplayName("an altered length yields a proportion")
    void testAlteredLength() {
      final Proportion proportion =
          DurationReader.readProportion(Duration.BREVIS, 6, 1, MensurInfo.binary()).orElseThrow();
      assertEquals(4, proportion.getNum());
      assertEquals(6, proportion.getNumbase());
      assertEquals(Ratio.of(6), DurationReader.toMinims(Duration.BREVIS, proportion, MensurInfo.binary()));
    }

    @Test
    @DisplayName("a proportion of a fractional value")
    void testFractionalValue() {
      final Proportion proportion =
          DurationReader.readProportion(Duration.SEMIMINIMA, 1, 3, MensurInfo.binary()).orElseThrow();
      assertEquals(3, proportion.getNum());
      assertEquals(2, proportion.getNumbase());
      assertEquals(Ratio.of(1, 3), DurationReader.toMinims(Duration.SEMIMINIMA, proportion, MensurInfo.binary()));
    }

    @Test
    @DisplayName("without proportion the nominal length counts")
    void testToMinims() {
      assertEquals(Ratio.of(9), DurationReader.toMinims(Duration.BREVIS, null, PERFECT));
    }
  }
}
