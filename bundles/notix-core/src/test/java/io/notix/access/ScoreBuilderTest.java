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

package io.notix.access;

import com.google.common.collect.ImmutableMap;
import io.notix.NotixTestHelper;
import io.notix.exception.NotixUsageException;
import io.notix.mensural.Duration;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Proportion;
import io.notix.node.Node;
import io.notix.node.data.Accidental;
import io.notix.node.data.ClefShape;
import io.notix.node.data.NotationType;
import io.notix.node.data.PitchName;
import io.notix.node.data.SylConnector;
import io.notix.node.data.WordPos;
import io.notix.node.layer.Clef;
import io.notix.node.layer.KeyAccid;
import io.notix.node.layer.KeySig;
import io.notix.node.layer.Mensur;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.layer.Syl;
import io.notix.node.score.Doc;
import io.notix.node.score.DocType;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link ScoreBuilder}.
 */
@DisplayName("ScoreBuilder")
class ScoreBuilderTest {

  private Doc doc;

  private ScoreBuilder builder;

  @BeforeEach
  void setUp() {
    doc = new Doc();
    builder = new ScoreBuilder(doc).voice("Cantus").voice("Tenor");
  }

  private static Layer layerOf(final Doc doc, final int measureIdx, final int staffN) {
    final Staff staff = NotixTestHelper.measuresOf(doc).get(measureIdx).getStaff(staffN);
    assertNotNull(staff);
    return staff.getLayers().get(0);
  }

  @Nested
  @DisplayName("Structure")
  class Structure {

    @Test
    @DisplayName("a section becomes an unmeasured measure with one staff per voice")
    void testSection() {
      builder.section("MensuralMusic").staff(2).note("C", 3, "Brevis", false).staff(1).rest("Longa").build();

      assertEquals(DocType.PAGE_BASED, doc.getType());
      final List<Measure> measures = NotixTestHelper.measuresOf(doc);
      assertEquals(1, measures.size());
      assertFalse(measures.get(0).isMeasured());
      assertEquals(List.of(1, 2), measures.get(0).getStaves().stream().map(Staff::getN).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("voices without content get an invisible staff")
    void testMissingVoice() {
      builder.section("MensuralMusic").staff(1).note("C", 3, "Brevis", false).build();

      final Measure measure = NotixTestHelper.measuresOf(doc).get(0);
      assertNull(measure.getStaff(1).getVisible());
      assertEquals(Boolean.FALSE, measure.getStaff(2).getVisible());
      assertTrue(measure.getStaff(2).getLayers().isEmpty());
    }

    @Test
    @DisplayName("the score definition holds one mensural staff definition per voice")
    void testScoreDef() {
      final ScoreBuilder unnamed = new ScoreBuilder(new Doc()).voice("Cantus").voice("");
      final Doc built = unnamed.section("MensuralMusic").build();

      final ScoreDef scoreDef = built.getScoreDef();
      assertNotNull(scoreDef);
      assertEquals(2, scoreDef.getStaffDefs().size());
      final StaffDef first = scoreDef.getStaffDef(1);
      assertEquals(5, first.getLines());
      assertEquals(NotationType.MENSURAL, first.getNotationType());
      assertEquals("Cantus", first.getLabel().getText());
      assertEquals(MensurInfo.binary(), first.getMensur().getMensurInfo());
      assertNull(scoreDef.getStaffDef(2).getLabel());
    }

    @Test
    @DisplayName("sections follow each other")
    void testSections() {
      builder.section("MensuralMusic")
             .staff(1)
             .note("C", 3, "Brevis", false)
             .section("Plainchant")
             .staff(2)
             .note("D", 3, "Brevis", false)
             .build();

      assertEquals(2, NotixTestHelper.measuresOf(doc).size());
      assertEquals(PitchName.D, ((Note) layerOf(doc, 1, 2).getChild(0)).getPname());
      assertEquals(Boolean.FALSE, NotixTestHelper.measuresOf(doc).get(1).getStaff(1).getVisible());
    }
  }

  @Nested
  @DisplayName("Events")
  class Events {

    @BeforeEach
    void setUp() {
      builder.section("MensuralMusic").staff(1);
    }

    @Test
    @DisplayName("octaves are counted from A")
    void testOctave() {
      builder.note("G", 3, "Brevis", false).note("A", 3, "Semibrevis", true).build();

      final Layer layer = layerOf(doc, 0, 1);
      final Note g = (Note) layer.getChild(0);
      final Note a = (Note) layer.getChild(1);
      assertEquals(4, g.getOct());
      assertEquals(3, a.getOct());
      assertEquals(Duration.SEMIBREVIS, a.getDur());
      assertTrue(a.isColored());
    }

    @Test
    @DisplayName("an encoded length other than the nominal one yields a proportion")
    void testLength() {
      builder.note("C", 3, "Semibrevis", 3, 1, false).note("C", 3, "Semibrevis", 2, 1, false).rest("Minima", 1, 2)
             .build();

      final Layer layer = layerOf(doc, 0, 1);
      assertEquals(new Proportion(2, 3), ((Note) layer.getChild(0)).getProportion());
      assertNull(((Note) layer.getChild(1)).getProportion());
      assertEquals(new Proportion(2, 1), ((Rest) layer.getChild(2)).getProportion());
    }

    @Test
    @DisplayName("clef lines are derived from the staff location")
    void testClef() {
      builder.clef("C", 1).clef("Frnd", 5).clef("Gothic", 3).build();

      final Layer layer = layerOf(doc, 0, 1);
      assertEquals(ClefShape.C, ((Clef) layer.getChild(0)).getShape());
      assertEquals(1, ((Clef) layer.getChild(0)).getLine());
      assertEquals(ClefShape.F, ((Clef) layer.getChild(1)).getShape());
      assertEquals(3, ((Clef) layer.getChild(1)).getLine());
      assertEquals(ClefShape.C, ((Clef) layer.getChild(2)).getShape());
    }

    @Test
    @DisplayName("the mensuration carries over to the next section")
    void testMensuration() {
      final MensurInfo perfectTempus = new MensurInfo(2, 3, 2, 2);
      builder.mensuration(perfectTempus).section("MensuralMusic").staff(1).mensuration(null).build();

      assertEquals(perfectTempus, ((Mensur) layerOf(doc, 0, 1).getChild(0)).getMensurInfo());
      assertEquals(perfectTempus, ((Mensur) layerOf(doc, 1, 1).getChild(0)).getMensurInfo());
    }

    @Test
    @DisplayName("syllables are linked within their word")
    void testSyllables() {
      builder.note("C", 3, "Brevis", false)
             .syllable("Ky", false)
             .note("D", 3, "Brevis", false)
             .syllable("ri", false)
             .note("E", 3, "Brevis", false)
             .syllable("e", true)
             .build();

      final List<Syl> syls = layerOf(doc, 0, 1).findDescendants(Syl.class);
      assertEquals(3, syls.size());
      assertEquals(WordPos.INITIAL, syls.get(0).getWordPos());
      assertEquals(SylConnector.DASHES, syls.get(0).getCon());
      assertEquals(WordPos.MEDIAL, syls.get(1).getWordPos());
      assertEquals(WordPos.TERMINAL, syls.get(2).getWordPos());
      assertNull(syls.get(2).getCon());
      assertEquals(1, syls.get(0).getVerse().getN());
    }

    @Test
    @DisplayName("generic events are dispatched by name")
    void testEvent() {
      builder.event("Clef", ImmutableMap.of("Appearance", "G", "StaffLoc", "3"))
             .event("Clef", ImmutableMap.of("Appearance", "Bmol", "Signature", "", "Pitch/LetterName", "B",
                 "Pitch/OctaveNum", "3", "StaffLoc", "5"))
             .event("Mensuration", ImmutableMap.of("MensInfo/Tempus", "3"))
             .event("Note", ImmutableMap.of("LetterName", "F", "OctaveNum", "3", "Type", "Minima", "Colored", "",
                 "ModernText/Syllable", "Sanc", "ModernText/WordEnd", ""))
             .event("Dot", ImmutableMap.of())
             .event("OriginalText", ImmutableMap.of("Phrase", "Sanctus"))
             .event("Ligature", ImmutableMap.of())
             .event("Rest", ImmutableMap.of("Type", "Semibrevis", "Length/Num", "2", "Length/Den", "1"))
             .build();

      final List<Node> children = layerOf(doc, 0, 1).getChildren();
      assertEquals(6, children.size());
      assertEquals(2, ((Clef) children.get(0)).getLine());
      final KeyAccid keyAccid = ((KeySig) children.get(1)).getKeyAccids().get(0);
      assertEquals(Accidental.FLAT, keyAccid.getAccid());
      assertEquals(PitchName.B, keyAccid.getPname());
      assertEquals(3, keyAccid.getOct());
      assertEquals(4, keyAccid.getLoc());
      assertEquals(new MensurInfo(2, 3, 2, 2), ((Mensur) children.get(2)).getMensurInfo());
      final Note note = (Note) children.get(3);
      assertEquals(4, note.getOct());
      assertTrue(note.isColored());
      assertEquals(WordPos.TERMINAL, note.findDescendants(Syl.class).get(0).getWordPos());
      assertNull(((Rest) children.get(5)).getProportion());
    }

    @Test
    @DisplayName("a malformed length is skipped and the event keeps its nominal value")
    void testMalformedLength() {
      builder.event("Note", ImmutableMap.of("LetterName", "G", "OctaveNum", "3", "Type", "Semibrevis", "Length/Num",
                 "x", "Length/Den", "1"))
             .event("Rest", ImmutableMap.of("Type", "Brevis", "Length/Num", "0", "Length/Den", "0"))
             .note("A", 3, "Minima", 1, -1, false)
             .build();

      final List<Node> children = layerOf(doc, 0, 1).getChildren();
      assertEquals(3, children.size());
      assertEquals(Duration.SEMIBREVIS, ((Note) children.get(0)).getDur());
      assertNull(((Note) children.get(0)).getProportion());
      assertEquals(Duration.BREVIS, ((Rest) children.get(1)).getDur());
      assertNull(((Rest) children.get(1)).getProportion());
      assertNull(((Note) children.get(2)).getProportion());
    }
  }

  @Nested
  @DisplayName("Usage")
  class Usage {

    @Test
    @DisplayName("the document must be raw")
    void testRawDoc() {
      final Doc built = new ScoreBuilder(new Doc()).voice("Cantus").build();
      assertThrows(IllegalStateException.class, () -> new ScoreBuilder(built));
    }

    @Test
    @DisplayName("voices are declared before the first section")
    void testLateVoice() {
      builder.section("MensuralMusic");
      assertThrows(IllegalStateException.class, () -> builder.voice("Bassus"));
    }

    @Test
    @DisplayName("only declared voices get a staff")
    void testUnknownVoice() {
      builder.section("MensuralMusic");
      assertThrows(IllegalArgumentException.class, () -> builder.staff(3));
      assertThrows(IllegalArgumentException.class, () -> builder.staff(0));
    }

    @Test
    @DisplayName("a voice has one staff per section")
    void testDuplicateStaff() {
      builder.section("MensuralMusic").staff(1);
      assertThrows(NotixUsageException.class, () -> builder.staff(1));
    }

    @Test
    @DisplayName("events need a staff and syllables a note")
    void testMissingContext() {
      assertThrows(IllegalStateException.class, () -> builder.staff(1));
      builder.section("MensuralMusic");
      assertThrows(IllegalStateException.class, () -> builder.note("C", 3, "Brevis", false));
      assertThrows(IllegalStateException.class, () -> builder.rest("Brevis", 4, 1));
      builder.staff(1);
      assertThrows(IllegalStateException.class, () -> builder.syllable("Ky", false));
    }

    @Test
    @DisplayName("a document is built once")
    void testBuildTwice() {
      builder.section("MensuralMusic").build();
      assertThrows(IllegalStateException.class, () -> builder.build());
      assertThrows(IllegalStateException.class, () -> builder.section("MensuralMusic"));
    }
  }
}
