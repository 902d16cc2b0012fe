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

import io.notix.layout.LedgerLine.Dash;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the dash accumulation of {@link LedgerLine}.
 */
@DisplayName("LedgerLine")
class LedgerLineTest {

  @Test
  @DisplayName("distant dashes are kept sorted by their left edge")
  void testSorted() {
    final LedgerLine line = new LedgerLine();
    line.addDash(100, 120, 4);
    line.addDash(10, 30, 4);
    line.addDash(50, 70, 4);

    assertEquals(List.of(new Dash(10, 30), new Dash(50, 70), new Dash(100, 120)), line.getDashes());
  }

  @Test
  @DisplayName("overlapping dashes are merged")
  void testMerge() {
    final LedgerLine line = new LedgerLine();
    line.addDash(10, 30, 4);
    line.addDash(20, 40, 4);

    assertEquals(List.of(new Dash(10, 40)), line.getDashes());
  }

  @Test
  @DisplayName("a dash contained in another one does not extend it")
  void testMergeContained() {
    final LedgerLine line = new LedgerLine();
    line.addDash(10, 50, 4);
    line.addDash(20, 30, 4);

    assertEquals(List.of(new Dash(10, 50)), line.getDashes());
  }

  @Test
  @DisplayName("dashes touching within the extension tolerance stay apart")
  void testMergeThreshold() {
    final LedgerLine line = new LedgerLine();
    line.addDash(10, 30, 4);
    // 30 > 25 + 6 does not hold
    line.addDash(25, 45, 4);
    assertEquals(2, line.getDashes().size());

    final LedgerLine merged = new LedgerLine();
    merged.addDash(10, 32, 4);
    merged.addDash(25, 45, 4);
    assertEquals(List.of(new Dash(10, 45)), merged.getDashes());
  }

  @Test
  @DisplayName("a dash bridging two dashes merges all three")
  void testMergeChain() {
    final LedgerLine line = new LedgerLine();
    line.addDash(0, 20, 2);
    line.addDash(40, 60, 2);
    line.addDash(10, 50, 2);

    assertEquals(List.of(new Dash(0, 60)), line.getDashes());
  }

  @Test
  @DisplayName("degenerate dashes are rejected")
  void testDegenerateDash() {
    final LedgerLine line = new LedgerLine();
    assertThrows(IllegalArgumentException.class, () -> line.addDash(10, 10, 4));
    assertThrows(IllegalArgumentException.class, () -> line.addDash(20, 10, 4));
    assertTrue(line.getDashes().isEmpty());
  }

  @RepeatedTest(20)
  @DisplayName("random dashes end up sorted, separated and covered")
  void testRandomDashes(final RepetitionInfo repetitionInfo) {
    final long seed = 0x5EEDL + repetitionInfo.getCurrentRepetition();
    final Random random = new Random(seed);
    final int extension = 1 + random.nextInt(6);
    final LedgerLine line = new LedgerLine();
    final List<Dash> added = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      final int left = random.nextInt(1000);
      final int right = left + 1 + random.nextInt(40);
      line.addDash(left, right, extension);
      added.add(new Dash(left, right));
    }

    final List<Dash> dashes = line.getDashes();
    for (int i = 1; i < dashes.size(); i++) {
      final Dash previous = dashes.get(i - 1);
      final Dash current = dashes.get(i);
      assertTrue(previous.left() <= current.left(), () -> "seed " + seed + ", unsorted: " + dashes);
      assertTrue(previous.right() <= current.left() + 1.5 * extension, () -> "seed " + seed + ", unmerged: " + dashes);
    }
    for (final Dash dash : added) {
      assertTrue(dashes.stream().anyMatch(d -> d.left() <= dash.left() && dash.right() <= d.right()),
          () -> "seed " + seed + ", " + dash + " not covered by " + dashes);
    }
  }
}
