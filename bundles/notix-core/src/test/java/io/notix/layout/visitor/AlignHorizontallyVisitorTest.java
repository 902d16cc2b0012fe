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

import io.notix.NotixTestHelper;
import io.notix.access.ScoreBuilder;
import io.notix.mensural.Duration;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Ratio;
import io.notix.node.data.PitchName;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Mensur;
import io.notix.node.layer.Note;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import io.notix.settings.LayoutOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link AlignHorizontallyVisitor}.
 */
@DisplayName("AlignHorizontallyVisitor")
class AlignHorizontallyVisitorTest {

  private static void align(final Doc doc) {
    doc.processPages(new ScoreDefSetCurrentVisitor(doc));
    doc.processPages(new AlignHorizontallyVisitor(doc));
  }

  private static Ratio onsetOf(final Layer layer, final int index) {
    return ((LayerElement) layer.getChild(index)).getOnset();
  }

  @Test
  @DisplayName("mensural staves follow the mensuration signs")
  void testMensural() {
    final Doc doc = new ScoreBuilder(new Doc()).voice("Cantus")
                                               .voice("Tenor")
                                               .section("MensuralMusic")
                                               .staff(1)
                                               .mensuration(new MensurInfo(2, 3, 2, 2))
                                               .note("C", 3, "Brevis", false)
                                               .note("D", 3, "Semibrevis", false)
                                               .rest("Brevis")
                                               .staff(2)
                                               .note("C", 3, "Brevis", false)
                                               .note("D", 3, "Semibrevis", false)
                                               .build();
    align(doc);

    final Measure measure = NotixTestHelper.measuresOf(doc).get(0);
    final Layer perfect = measure.getStaff(1).getLayers().get(0);
    assertEquals(Ratio.ZERO, onsetOf(perfect, 0));
    assertEquals(Ratio.ZERO, onsetOf(perfect, 1));
    assertEquals(Ratio.of(6), onsetOf(perfect, 2));
    assertEquals(Ratio.of(8), onsetOf(perfect, 3));

    final Layer imperfect = measure.getStaff(2).getLayers().get(0);
    assertEquals(Ratio.of(4), onsetOf(imperfect, 1));
    assertTrue(measure.getDrawingWidth() > 0);
  }

  @Test
  @DisplayName("common notation ignores mensuration signs")
  void testCommonNotation() {
    final Doc doc = NotixTestHelper.createDoc(LayoutOptions.defaults(), 1, 1);
    final Layer layer = doc.findDescendants(Layer.class).get(0);
    layer.insertChild(new Mensur(new MensurInfo(3, 3, 3, 3)), 0);
    layer.addChild(new Note(PitchName.D, 5, Duration.SEMIBREVIS));
    doc.convertToPageBasedDoc();
    align(doc);

    assertEquals(Ratio.of(4), onsetOf(layer, 2));
  }

  @Test
  @DisplayName("a measure with a single brevis is as wide as its spacing")
  void testWidth() {
    final Doc doc = NotixTestHelper.createDoc(LayoutOptions.defaults(), 3, 2);
    doc.convertToPageBasedDoc();
    align(doc);

    NotixTestHelper.measuresOf(doc).forEach(measure -> assertEquals(61, measure.getDrawingWidth()));
  }
}
