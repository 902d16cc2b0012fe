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

package io.notix.node.score;

import io.notix.NotixTestHelper;
import io.notix.layout.StaffAlignment;
import io.notix.node.data.NotationType;
import io.notix.node.data.StaffRel;
import io.notix.node.data.Visibility;
import io.notix.node.facsimile.Facsimile;
import io.notix.node.facsimile.Zone;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the coordinates and drawing state of {@link Staff}.
 */
@DisplayName("Staff")
class StaffTest {

  private Doc doc;

  private ScoreSystem system;

  private Staff staff;

  @BeforeEach
  void setUp() {
    doc = new Doc();
    final Page page = new Page();
    system = new ScoreSystem();
    final Measure measure = new Measure(true, 1);
    staff = NotixTestHelper.createStaff(1);
    measure.addChild(staff);
    system.addChild(measure);
    page.addChild(system);
    doc.addChild(page);
  }

  @Nested
  @DisplayName("Coordinates")
  class Coordinates {

    @Test
    @DisplayName("without alignment the staff sits at zero")
    void testUnaligned() {
      system.setDrawingYRel(1000);
      assertEquals(0, staff.getDrawingY());
    }

    @Test
    @DisplayName("the system y plus the offset of the alignment, cached until the system moves")
    void testAligned() {
      final StaffAlignment alignment = new StaffAlignment(0, 1);
      alignment.setYRel(-200);
      staff.setStaffAlignment(alignment);
      system.setDrawingYRel(1000);
      assertEquals(800, staff.getDrawingY());

      alignment.setYRel(-300);
      assertEquals(800, staff.getDrawingY());

      system.setDrawingYRel(1500);
      assertEquals(1200, staff.getDrawingY());
    }

    @Test
    @DisplayName("an absolute y wins over the alignment")
    void testYAbs() {
      final StaffAlignment alignment = new StaffAlignment(0, 1);
      alignment.setYRel(-200);
      staff.setStaffAlignment(alignment);
      staff.setYAbs(640);
      assertEquals(640, staff.getDrawingY());
      staff.resetYAbs();
      assertEquals(-200, staff.getDrawingY());
    }

    @Test
    @DisplayName("resetting the vertical alignment unbinds the alignment")
    void testResetVerticalAlignment() {
      final StaffAlignment alignment = new StaffAlignment(0, 1);
      alignment.setYRel(-200);
      staff.setStaffAlignment(alignment);
      system.setDrawingYRel(1000);
      assertEquals(800, staff.getDrawingY());
      staff.resetVerticalAlignment();
      assertEquals(0, staff.getDrawingY());
    }
  }

  @Nested
  @DisplayName("Staff lines")
  class StaffLines {

    @BeforeEach
    void setUp() {
      staff.setYAbs(1000);
    }

    @Test
    @DisplayName("a five line staff is eight units high")
    void testHeight() {
      assertEquals(72, staff.getDrawingHeight(doc));
      staff.setDrawingLines(4);
      assertEquals(54, staff.getDrawingHeight(doc));
    }

    @Test
    @DisplayName("pitch positions are relative to the top line")
    void testCalcPitchPosYRel() {
      assertEquals(0, staff.calcPitchPosYRel(doc, 8));
      assertEquals(-72, staff.calcPitchPosYRel(doc, 0));
      assertEquals(9, staff.calcPitchPosYRel(doc, 9));
    }

    @Test
    @DisplayName("staff lines are two units apart")
    void testIsOnStaffLine() {
      assertTrue(staff.isOnStaffLine(1000, doc));
      assertTrue(staff.isOnStaffLine(964, doc));
      assertFalse(staff.isOnStaffLine(991, doc));
    }

    @Test
    @DisplayName("snapping to the nearest inter staff position")
    void testGetNearestInterStaffPosition() {
      assertEquals(1000, staff.getNearestInterStaffPosition(987, doc, StaffRel.ABOVE));
      assertEquals(973, staff.getNearestInterStaffPosition(987, doc, StaffRel.BELOW));
    }

    @Test
    @DisplayName("tablature is drawn smaller")
    void testTablature() {
      assertEquals(100, staff.getDrawingStaffNotationSize());
      staff.setDrawingNotationType(NotationType.TAB);
      assertTrue(staff.isTablature());
      assertEquals(57, staff.getDrawingStaffNotationSize());
    }

    @Test
    @DisplayName("guitar tablature typed stems.within draws the stems inside")
    void testTabWithStemsOutside() {
      final StaffDef staffDef = new StaffDef(1);
      staff.setDrawingStaffDef(staffDef);
      staff.setDrawingNotationType(NotationType.TAB_GUITAR);
      assertTrue(staff.isTabWithStemsOutside());
      staffDef.setType("stems.within");
      assertFalse(staff.isTabWithStemsOutside());
      staff.setDrawingNotationType(NotationType.TAB_LUTE_ITALIAN);
      assertTrue(staff.isTabWithStemsOutside());
    }
  }

  @Nested
  @DisplayName("Ledger lines")
  class LedgerLines {

    @Test
    @DisplayName("dashes are added to each of the first lines")
    void testAddLedgerLines() {
      staff.addLedgerLineAbove(2, 10, 30, 5, false);
      staff.addLedgerLineAbove(1, 100, 120, 5, false);
      assertEquals(2, staff.getLedgerLinesAbove().size());
      assertEquals(2, staff.getLedgerLinesAbove().get(0).getDashes().size());
      assertEquals(1, staff.getLedgerLinesAbove().get(1).getDashes().size());
      assertTrue(staff.getLedgerLinesBelow().isEmpty());
    }

    @Test
    @DisplayName("cue sized dashes are kept apart")
    void testCueLedgerLines() {
      staff.addLedgerLineBelow(1, 10, 30, 5, true);
      assertTrue(staff.getLedgerLinesBelow().isEmpty());
      assertEquals(1, staff.getLedgerLinesBelowCue().size());
      staff.clearLedgerLines();
      assertTrue(staff.getLedgerLinesBelowCue().isEmpty());
    }

    @Test
    @DisplayName("an empty dash is rejected")
    void testInvalidDash() {
      assertThrows(IllegalArgumentException.class, () -> staff.addLedgerLineAbove(1, 30, 30, 5, false));
    }
  }

  @Nested
  @DisplayName("Facsimile")
  class FacsimileTests {

    private Zone zone;

    @BeforeEach
    void setUp() {
      final Facsimile facsimile = new Facsimile();
      zone = new Zone(100, 200, 1100, 344);
      facsimile.addChild(zone);
      doc.addChild(facsimile);
      staff.setFacs(zone.getId());
    }

    @Test
    @DisplayName("the zone gives position and size in a facsimile document")
    void testFacsimileMode() {
      doc.setType(DocType.FACSIMILE);
      staff.setFromFacsimile(doc);
      assertTrue(staff.isFacsimileMode());
      assertEquals(100, staff.getDrawingX());
      assertEquals(200, staff.getDrawingY());
      assertEquals(200, staff.getDrawingStaffSize());
    }

    @Test
    @DisplayName("the zone is ignored outside a facsimile document")
    void testComputedMode() {
      staff.setFromFacsimile(doc);
      assertEquals(zone, staff.getZone());
      assertFalse(staff.isFacsimileMode());
      assertEquals(0, staff.getDrawingY());
      assertEquals(100, staff.getDrawingStaffSize());
    }

    @Test
    @DisplayName("a zone without height keeps the current staff size")
    void testFlatZone() {
      doc.setType(DocType.FACSIMILE);
      zone.setCoordinates(100, 200, 1100, 200);
      staff.setFromFacsimile(doc);
      assertTrue(staff.isFacsimileMode());
      assertEquals(100, staff.getDrawingStaffSize());
      assertFalse(staff.isOnStaffLine(210, doc));
      assertTrue(staff.isOnStaffLine(218, doc));
    }

    @Test
    @DisplayName("a single line staff keeps the current staff size")
    void testSingleLine() {
      doc.setType(DocType.FACSIMILE);
      staff.setDrawingLines(1);
      staff.setFromFacsimile(doc);
      assertTrue(staff.isFacsimileMode());
      assertEquals(100, staff.getDrawingStaffSize());
    }

    @Test
    @DisplayName("an unknown zone is not attached")
    void testUnknownZone() {
      doc.setType(DocType.FACSIMILE);
      staff.setFacs("zone-unknown");
      staff.setFromFacsimile(doc);
      assertNull(staff.getZone());
      assertFalse(staff.isFacsimileMode());
    }
  }

  @Nested
  @DisplayName("Visibility")
  class VisibilityTests {

    @Test
    @DisplayName("a staff needs the score definition of its system")
    void testNoScoreDef() {
      assertThrows(IllegalStateException.class, () -> staff.isDrawingVisible());
    }

    @Test
    @DisplayName("the hidden staff definition hides the staff")
    void testHidden() {
      final ScoreDef scoreDef = NotixTestHelper.createScoreDef(1);
      system.setDrawingScoreDef(scoreDef);
      assertTrue(staff.isDrawingVisible());
      scoreDef.getStaffDef(1).setDrawingVisibility(Visibility.HIDDEN);
      assertFalse(staff.isDrawingVisible());
    }
  }
}
