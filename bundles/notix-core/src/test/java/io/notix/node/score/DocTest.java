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
import io.notix.mensural.Duration;
import io.notix.node.data.PitchName;
import io.notix.node.data.StemDirection;
import io.notix.node.data.SylConnector;
import io.notix.node.data.Visibility;
import io.notix.node.data.WordPos;
import io.notix.node.layer.Note;
import io.notix.node.layer.Syl;
import io.notix.node.layer.Verse;
import io.notix.settings.HiddenStaffPolicy;
import io.notix.settings.LayoutOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the layout passes of {@link Doc}.
 */
@DisplayName("Doc")
class DocTest {

  /** One brevis measure per system, two systems per page. */
  private static final LayoutOptions NARROW = LayoutOptions.newBuilder().pageWidth(200).pageHeight(350).build();

  private static Doc createPageBasedDoc(final LayoutOptions options, final int staffCount, final int measureCount) {
    final Doc doc = NotixTestHelper.createDoc(options, staffCount, measureCount);
    doc.convertToPageBasedDoc();
    return doc;
  }

  private static Note noteOf(final Measure measure, final int staffN) {
    return (Note) measure.getStaff(staffN).getLayers().get(0).getChild(0);
  }

  private static Syl addSyl(final Note note, final int verseN, final String text, final WordPos wordPos,
      final SylConnector con) {
    final Syl syl = new Syl(text);
    syl.setWordPos(wordPos);
    syl.setCon(con);
    final Verse verse = new Verse(verseN);
    verse.addChild(syl);
    note.addChild(verse);
    return syl;
  }

  @Nested
  @DisplayName("Conversion")
  class Conversion {

    @Test
    @DisplayName("sections are flattened into one page and system")
    void testConvertToPageBasedDoc() {
      final Doc doc = createPageBasedDoc(NARROW, 2, 4);

      assertEquals(DocType.PAGE_BASED, doc.getType());
      assertEquals(1, doc.getPages().size());
      assertEquals(1, NotixTestHelper.systemsOf(doc).size());
      assertEquals(List.of(1, 2, 3, 4),
          NotixTestHelper.measuresOf(doc).stream().map(Measure::getN).collect(Collectors.toList()));
      assertNotNull(doc.getScoreDef());
      assertThrows(IllegalStateException.class, doc::convertToPageBasedDoc);
    }

    @Test
    @DisplayName("layout passes need a page based document with a score definition")
    void testPreconditions() {
      final Doc raw = NotixTestHelper.createDoc(NARROW, 1, 1);
      assertThrows(IllegalStateException.class, raw::castOffDoc);
      assertThrows(IllegalStateException.class, raw::convertToCastOffMensuralDoc);

      final Doc withoutScoreDef = new Doc(NARROW);
      final Mdiv mdiv = new Mdiv();
      withoutScoreDef.addChild(mdiv);
      final Score score = new Score();
      mdiv.addChild(score);
      final Section section = new Section();
      score.addChild(section);
      final Measure measure = new Measure(true, 1);
      measure.addChild(NotixTestHelper.createStaff(1));
      section.addChild(measure);
      withoutScoreDef.convertToPageBasedDoc();
      assertThrows(IllegalStateException.class, withoutScoreDef::castOffDoc);
    }

    @Test
    @DisplayName("only facsimile documents are laid out from the facsimile")
    void testLayoutFacsimile() {
      final Doc doc = createPageBasedDoc(NARROW, 1, 1);
      assertThrows(IllegalStateException.class, doc::layoutFacsimile);
    }
  }

  @Nested
  @DisplayName("Cast off")
  class CastOff {

    @Test
    @DisplayName("measures are broken into systems and systems into pages")
    void testPagination() {
      final Doc doc = createPageBasedDoc(NARROW, 1, 6);
      doc.castOffDoc();

      final List<Page> pages = doc.getPages();
      assertEquals(3, pages.size());
      pages.forEach(page -> assertEquals(2, page.getSystems().size()));
      NotixTestHelper.systemsOf(doc).forEach(system -> assertEquals(1, system.getMeasures().size()));
      assertEquals(List.of(1, 2, 3, 4, 5, 6),
          NotixTestHelper.measuresOf(doc).stream().map(Measure::getN).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("systems are placed from the top margin downwards")
    void testSystemPositions() {
      final Doc doc = createPageBasedDoc(NARROW, 1, 6);
      doc.castOffDoc();

      final List<ScoreSystem> systems = doc.getPages().get(1).getSystems();
      assertEquals(50, systems.get(0).getDrawingX());
      assertEquals(300, systems.get(0).getDrawingY());
      assertEquals(72, systems.get(0).getSystemAligner().getHeight());
      assertEquals(192, systems.get(1).getDrawingY());
      assertEquals(192, systems.get(1).getMeasures().get(0).getStaff(1).getDrawingY());
    }

    @Test
    @DisplayName("measures are placed side by side within a system")
    void testMeasurePositions() {
      final Doc doc = createPageBasedDoc(NARROW.toBuilder().pageWidth(300).build(), 1, 4);
      doc.castOffDoc();

      final List<ScoreSystem> systems = NotixTestHelper.systemsOf(doc);
      assertEquals(2, systems.size());
      final List<Measure> measures = systems.get(0).getMeasures();
      assertEquals(3, measures.size());
      assertEquals(61, measures.get(0).getDrawingWidth());
      assertEquals(50, measures.get(0).getDrawingX());
      assertEquals(111, measures.get(1).getDrawingX());
      assertEquals(172, measures.get(2).getDrawingX());
      assertEquals(50, systems.get(1).getMeasures().get(0).getDrawingX());
    }

    @Test
    @DisplayName("a document can be cast off again with other options")
    void testRecast() {
      final Doc doc = createPageBasedDoc(NARROW, 2, 6);
      doc.castOffDoc();
      final List<String> ids = NotixTestHelper.measuresOf(doc).stream().map(Measure::getId).collect(Collectors.toList());
      doc.castOffDoc();
      assertEquals(6, NotixTestHelper.systemsOf(doc).size());

      doc.setOptions(LayoutOptions.defaults());
      doc.castOffDoc();
      assertEquals(1, doc.getPages().size());
      assertEquals(1, NotixTestHelper.systemsOf(doc).size());
      assertEquals(ids, NotixTestHelper.measuresOf(doc).stream().map(Measure::getId).collect(Collectors.toList()));
      assertEquals(2, NotixTestHelper.systemsOf(doc).get(0).getSystemAligner().getStaffAlignments().size());
    }
  }

  @Nested
  @DisplayName("Staves")
  class Staves {

    @Test
    @DisplayName("notes outside the staff get ledger lines")
    void testLedgerLines() {
      final Doc doc = createPageBasedDoc(LayoutOptions.defaults(), 1, 3);
      final List<Measure> measures = NotixTestHelper.measuresOf(doc);
      noteOf(measures.get(0), 1).setOct(6);
      noteOf(measures.get(1), 1).setPname(PitchName.A);
      noteOf(measures.get(1), 1).setOct(3);
      doc.castOffDoc();

      final Staff above = measures.get(0).getStaff(1);
      assertEquals(12, noteOf(measures.get(0), 1).getDrawingLoc().getAsInt());
      assertEquals(2, above.getLedgerLinesAbove().size());
      assertTrue(above.getLedgerLinesBelow().isEmpty());

      final Staff below = measures.get(1).getStaff(1);
      assertEquals(-4, noteOf(measures.get(1), 1).getDrawingLoc().getAsInt());
      assertEquals(2, below.getLedgerLinesBelow().size());

      final Staff inside = measures.get(2).getStaff(1);
      assertEquals(5, noteOf(measures.get(2), 1).getDrawingLoc().getAsInt());
      assertTrue(inside.getLedgerLinesAbove().isEmpty());
      assertTrue(inside.getLedgerLinesBelow().isEmpty());
    }

    @Test
    @DisplayName("two voices on a staff stem apart")
    void testStems() {
      final Doc doc = NotixTestHelper.createDoc(LayoutOptions.defaults(), 1, 2);
      final List<Measure> rawMeasures = doc.findDescendants(Measure.class);
      final Layer second = new Layer();
      second.addChild(new Note(PitchName.E, 4, Duration.BREVIS));
      rawMeasures.get(0).getStaff(1).addChild(second);
      rawMeasures.get(1).getStaff(1).addChild(new Layer());
      doc.convertToPageBasedDoc();
      doc.castOffDoc();

      final List<Layer> layers = rawMeasures.get(0).getStaff(1).getLayers();
      assertEquals(StemDirection.UP, layers.get(0).getDrawingStemDir());
      assertEquals(StemDirection.DOWN, layers.get(1).getDrawingStemDir());
      rawMeasures.get(1).getStaff(1).getLayers().forEach(layer -> assertNull(layer.getDrawingStemDir()));
    }

    @Test
    @DisplayName("empty staves are hidden when condensed")
    void testCondenseEmpty() {
      final LayoutOptions options = LayoutOptions.newBuilder().hiddenStaffPolicy(HiddenStaffPolicy.CONDENSE_EMPTY).build();
      final Doc doc = NotixTestHelper.createDoc(options, 3, 1);
      final Measure measure = doc.findDescendants(Measure.class).get(0);
      measure.getStaff(2).getLayers().get(0).clearChildren();
      doc.convertToPageBasedDoc();
      doc.castOffDoc();

      final ScoreSystem system = NotixTestHelper.systemsOf(doc).get(0);
      assertEquals(Visibility.HIDDEN, system.getDrawingScoreDef().getStaffDef(2).getDrawingVisibility());
      final List<StaffAlignment> alignments = system.getSystemAligner().getStaffAlignments();
      assertEquals(List.of(1, 3), alignments.stream().map(StaffAlignment::getStaffN).collect(Collectors.toList()));
      assertNull(measure.getStaff(2).getStaffAlignment());
      assertSame(alignments.get(1), measure.getStaff(3).getStaffAlignment());
    }

    @Test
    @DisplayName("empty staves are kept by default")
    void testKeepEmpty() {
      final Doc doc = NotixTestHelper.createDoc(LayoutOptions.defaults(), 3, 1);
      doc.findDescendants(Measure.class).get(0).getStaff(2).getLayers().get(0).clearChildren();
      doc.convertToPageBasedDoc();
      doc.castOffDoc();

      assertEquals(3, NotixTestHelper.systemsOf(doc).get(0).getSystemAligner().getStaffAlignments().size());
    }

    @Test
    @DisplayName("absolute positions are divided by the pixels per unit")
    void testApplyPpuFactor() {
      final Doc doc = createPageBasedDoc(LayoutOptions.defaults(), 1, 1);
      doc.getPages().get(0).setPpuFactor(2.0);
      final Staff staff = NotixTestHelper.measuresOf(doc).get(0).getStaff(1);
      staff.setYAbs(1000);
      doc.applyPpuFactor();
      assertEquals(500, staff.getYAbs().getAsInt());
      assertEquals(500, staff.getDrawingY());
    }
  }

  @Nested
  @DisplayName("Lyrics")
  class Lyrics {

    @Test
    @DisplayName("a word spanning systems reserves its verse on every system it runs through")
    void testSpanningWord() {
      final Doc doc = NotixTestHelper.createDoc(NARROW, 2, 3);
      final List<Measure> measures = doc.findDescendants(Measure.class);
      final Syl ky = addSyl(noteOf(measures.get(0), 2), 2, "Ky", WordPos.INITIAL, SylConnector.DASHES);
      addSyl(noteOf(measures.get(1), 2), 1, "A", WordPos.TERMINAL, null);
      addSyl(noteOf(measures.get(2), 2), 2, "rie", WordPos.TERMINAL, null);
      doc.convertToPageBasedDoc();
      doc.castOffDoc();

      assertSame(noteOf(measures.get(0), 2), ky.getStart());
      assertSame(noteOf(measures.get(2), 2), ky.getEnd());
      assertTrue(ky.isSpanningMeasures());

      final List<ScoreSystem> systems = NotixTestHelper.systemsOf(doc);
      assertEquals(3, systems.size());
      assertEquals(List.of(2), List.copyOf(staffAlignment(systems.get(0), 1).getVerseNs()));
      assertEquals(List.of(2, 1), List.copyOf(staffAlignment(systems.get(1), 1).getVerseNs()));
      assertEquals(List.of(2), List.copyOf(staffAlignment(systems.get(2), 1).getVerseNs()));
      assertTrue(staffAlignment(systems.get(1), 0).getVerseNs().isEmpty());
      assertEquals(List.of(ky), measures.get(1).getStaff(2).getTimeSpanningElements());
      assertEquals(333, systems.get(1).getSystemAligner().getHeight());
    }

    @Test
    @DisplayName("collapsed verses only take the slots they use")
    void testCollapse() {
      final Doc doc = NotixTestHelper.createDoc(NARROW.toBuilder().lyricVerseCollapse(true).build(), 1, 1);
      addSyl(noteOf(doc.findDescendants(Measure.class).get(0), 1), 3, "Sanc", WordPos.TERMINAL, null);
      doc.convertToPageBasedDoc();
      doc.castOffDoc();

      final ScoreSystem system = NotixTestHelper.systemsOf(doc).get(0);
      assertEquals(1, staffAlignment(system, 0).getVersePosition(3, true));
      assertEquals(72 + 41, system.getSystemAligner().getHeight());
    }

    private StaffAlignment staffAlignment(final ScoreSystem system, final int staffIdx) {
      return system.getSystemAligner().getStaffAlignments().get(staffIdx);
    }
  }
}
