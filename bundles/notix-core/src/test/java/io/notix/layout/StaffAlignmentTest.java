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

package io.notix.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the verse bookkeeping of {@link StaffAlignment}.
 */
@DisplayName("StaffAlignment")
class StaffAlignmentTest {

  private static StaffAlignment withVerses(final int... verseNs) {
    final StaffAlignment alignment = new StaffAlignment(0, 1);
    for (final int verseN : verseNs) {
      alignment.addVerseN(verseN);
    }
    return alignment;
  }

  @Test
  @DisplayName("verses are kept in the order of their reservation, once")
  void testReservationOrder() {
    final StaffAlignment alignment = withVerses(3, 1, 3);
    assertEquals(List.of(3, 1), new ArrayList<>(alignment.getVerseNs()));
  }

  @Test
  @DisplayName("the staff index must not be negative")
  void testNegativeIndex() {
    assertThrows(IllegalArgumentException.class, () -> new StaffAlignment(-1, 1));
  }

  @Nested
  @DisplayName("With collapsed verses")
  class Collapsed {

    @Test
    @DisplayName("only reserved verses are represented")
    void testRepresented() {
      final StaffAlignment alignment = withVerses(3);
      assertTrue(alignment.isVerseRepresented(3, true));
      assertFalse(alignment.isVerseRepresented(1, true));
      assertEquals(1, alignment.getVerseCount(true));
    }

    @Test
    @DisplayName("slots are counted over reserved verses")
    void testPosition() {
      final StaffAlignment alignment = withVerses(4, 2);
      assertEquals(1, alignment.getVersePosition(2, true));
      assertEquals(2, alignment.getVersePosition(4, true));
      assertEquals(0, alignment.getVersePosition(3, true));
    }
  }

  @Nested
  @DisplayName("Without collapsed verses")
  class Expanded {

    @Test
    @DisplayName("every verse up to the highest reserved one is represented")
    void testRepresented() {
      final StaffAlignment alignment = withVerses(3);
      assertTrue(alignment.isVerseRepresented(1, false));
      assertTrue(alignment.isVerseRepresented(3, false));
      assertFalse(alignment.isVerseRepresented(4, false));
      assertEquals(3, alignment.getVerseCount(false));
    }

    @Test
    @DisplayName("an alignment without verses has no slots")
    void testEmpty() {
      final StaffAlignment alignment = withVerses();
      assertFalse(alignment.isVerseRepresented(1, false));
      assertEquals(0, alignment.getVerseCount(false));
      assertEquals(0, alignment.getVersePosition(1, false));
    }

    @Test
    @DisplayName("the slot is the verse number")
    void testPosition() {
      final StaffAlignment alignment = withVerses(4, 2);
      assertEquals(3, alignment.getVersePosition(3, false));
    }
  }
}
