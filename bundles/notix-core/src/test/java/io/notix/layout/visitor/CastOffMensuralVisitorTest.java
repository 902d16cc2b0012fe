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

package io.notix.layout.visitor;

import com.google.common.collect.ImmutableListMultimap;
import io.notix.NotixTestHelper;
import io.notix.access.ScoreBuilder;
import io.notix.mensural.Duration;
import io.notix.node.Node;
import io.notix.node.data.PitchName;
import io.notix.node.layer.BarLine;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Note;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link CastOffMensuralVisitor}.
 */
@DisplayName("CastOffMensuralVisitor")
class CastOffMensuralVisitorTest {

  private Doc doc;

  @BeforeEach
  void setUp() {
    doc = new ScoreBuilder(new Doc()).voice("Cantus")
                                     .voice("Tenor")
                                     .section("MensuralMusic")
                                     .staff(1)
                                     .note("C", 3, "Brevis", false)
                                     .barLine()
                                     .note("D", 3, "Brevis", false)
                                     .barLine()
                                     .note("E", 3, "Brevis", false)
                                     .staff(2)
                                     .note("F", 3, "Longa", false)
                                     .barLine()
                                     .note("G", 3, "Brevis", false)
                                     .build();
  }

  private static Layer layerOf(final Measure measure, final int staffN) {
    return measure.getStaff(staffN).getLayers().get(0);
  }

  @Test
  @DisplayName("measures are split at the bar lines, a bar line closing its segment")
  void testSplit() {
    doc.convertToCastOffMensuralDoc();

    final List<Measure> measures = NotixTestHelper.measuresOf(doc);
    assertEquals(3, measures.size());
    assertEquals(2, layerOf(measures.get(0), 1).getChildCount());
    assertTrue(layerOf(measures.get(0), 1).getChild(1) instanceof BarLine);
    assertEquals(PitchName.D, ((Note) layerOf(measures.get(1), 1).getChild(0)).getPname());
    assertEquals(1, layerOf(measures.get(2), 1).getChildCount());
    assertEquals(PitchName.G, ((Note) layerOf(measures.get(1), 2).getChild(0)).getPname());
    measures.forEach(measure -> assertFalse(measure.isMeasured()));
  }

  @Test
  @DisplayName("the fragments together hold the notes and rests of each staff exactly once")
  void testContentKept() {
    final ImmutableListMultimap<Integer, LayerElement> before = doc.getLayerContent();

    doc.convertToCastOffMensuralDoc();

    final ImmutableListMultimap<Integer, LayerElement> after = doc.getLayerContent();
    assertEquals(3, before.get(1).size());
    assertEquals(2, before.get(2).size());
    assertEquals(before, after);
    for (final int staffN : after.keySet()) {
      final List<LayerElement> content = after.get(staffN);
      assertEquals(content.size(), Set.copyOf(content).size(), "staff " + staffN);
    }
  }

  @Test
  @DisplayName("a staff with fewer segments gets empty fragments")
  void testEmptyFragment() {
    doc.convertToCastOffMensuralDoc();

    final Measure last = NotixTestHelper.measuresOf(doc).get(2);
    assertEquals(2, last.getStaves().size());
    assertTrue(layerOf(last, 2).isEmpty());
    assertEquals(1, layerOf(last, 2).getN());
  }

  @Test
  @DisplayName("the first fragments keep the identifiers")
  void testIdentifiers() {
    final Measure measure = NotixTestHelper.measuresOf(doc).get(0);
    final String measureId = measure.getId();
    final String staffId = measure.getStaff(1).getId();
    final String layerId = layerOf(measure, 2).getId();

    doc.convertToCastOffMensuralDoc();

    final List<Measure> measures = NotixTestHelper.measuresOf(doc);
    assertEquals(measureId, measures.get(0).getId());
    assertEquals(staffId, measures.get(0).getStaff(1).getId());
    assertEquals(layerId, layerOf(measures.get(0), 2).getId());
    assertNotEquals(measureId, measures.get(1).getId());
    assertNotEquals(layerId, layerOf(measures.get(1), 2).getId());
  }

  @Test
  @DisplayName("splitting twice changes nothing")
  void testIdempotent() {
    doc.convertToCastOffMensuralDoc();
    final List<String> ids = NotixTestHelper.measuresOf(doc).stream().map(Measure::getId).collect(Collectors.toList());
    doc.convertToCastOffMensuralDoc();
    assertEquals(ids, NotixTestHelper.measuresOf(doc).stream().map(Measure::getId).collect(Collectors.toList()));
  }

  @Test
  @DisplayName("measured measures are not split")
  void testMeasured() {
    final Doc measured = NotixTestHelper.createDoc(doc.getOptions(), 1, 1);
    measured.convertToPageBasedDoc();
    final Layer layer = NotixTestHelper.measuresOf(measured).get(0).getStaff(1).getLayers().get(0);
    layer.addChild(new BarLine());
    layer.addChild(new Note(PitchName.D, 5, Duration.BREVIS));

    measured.convertToCastOffMensuralDoc();

    assertEquals(1, NotixTestHelper.measuresOf(measured).size());
  }

  @Test
  @DisplayName("segments of a layer")
  void testSegmentsOf() {
    final Layer layer = new Layer();
    assertTrue(CastOffMensuralVisitor.segmentsOf(layer).isEmpty());

    layer.addChild(new Note(PitchName.C, 4, Duration.BREVIS));
    layer.addChild(new BarLine());
    assertEquals(1, CastOffMensuralVisitor.segmentsOf(layer).size());

    layer.addChild(new BarLine());
    layer.addChild(new Note(PitchName.D, 4, Duration.BREVIS));
    final List<List<Node>> segments = CastOffMensuralVisitor.segmentsOf(layer);
    assertEquals(3, segments.size());
    assertEquals(1, segments.get(1).size());
  }
}
