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

package io.notix;

import io.notix.mensural.Duration;
import io.notix.node.data.PitchName;
import io.notix.node.layer.Note;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.node.score.Mdiv;
import io.notix.node.score.Measure;
import io.notix.node.score.Score;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;
import io.notix.node.score.Section;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.node.score.StaffGrp;
import io.notix.settings.LayoutOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds small documents for the tests.
 */
public final class NotixTestHelper {

  private NotixTestHelper() {
    throw new AssertionError();
  }

  /**
   * Create a score definition with one five line staff definition per staff.
   *
   * @param staffCount the number of staves
   * @return the score definition
   */
  public static ScoreDef createScoreDef(final int staffCount) {
    final ScoreDef scoreDef = new ScoreDef();
    final StaffGrp staffGrp = new StaffGrp();
    for (int n = 1; n <= staffCount; n++) {
      staffGrp.addChild(new StaffDef(n));
    }
    scoreDef.addChild(staffGrp);
    return scoreDef;
  }

  /**
   * Create a raw document with a score definition and measured measures. Every staff of every
   * measure holds one layer with a C5 brevis.
   *
   * @param options the layout options
   * @param staffCount the number of staves per measure
   * @param measureCount the number of measures
   * @return the raw document
   */
  public static Doc createDoc(final LayoutOptions options, final int staffCount, final int measureCount) {
    final Doc doc = new Doc(options);
    final Mdiv mdiv = new Mdiv();
    doc.addChild(mdiv);
    final Score score = new Score();
    mdiv.addChild(score);
    score.addChild(createScoreDef(staffCount));
    final Section section = new Section();
    score.addChild(section);
    for (int i = 1; i <= measureCount; i++) {
      final Measure measure = new Measure(true, i);
      for (int n = 1; n <= staffCount; n++) {
        measure.addChild(createStaff(n));
      }
      section.addChild(measure);
    }
    return doc;
  }

  /**
   * Create a staff with one layer holding a C5 brevis.
   *
   * @param n the staff number
   * @return the staff
   */
  public static Staff createStaff(final int n) {
    final Staff staff = new Staff(n);
    final Layer layer = new Layer();
    layer.addChild(new Note(PitchName.C, 5, Duration.BREVIS));
    staff.addChild(layer);
    return staff;
  }

  /**
   * Get the measures of a page based document in document order.
   *
   * @param doc the document
   * @return the measures
   */
  public static List<Measure> measuresOf(final Doc doc) {
    final List<Measure> measures = new ArrayList<>();
    doc.getPages().forEach(page -> page.getSystems().forEach(system -> measures.addAll(system.getMeasures())));
    return measures;
  }

  /**
   * Get the systems of a page based document in document order.
   *
   * @param doc the document
   * @return the systems
   */
  public static List<ScoreSystem> systemsOf(final Doc doc) {
    final List<ScoreSystem> systems = new ArrayList<>();
    doc.getPages().forEach(page -> systems.addAll(page.getSystems()));
    return systems;
  }
}
