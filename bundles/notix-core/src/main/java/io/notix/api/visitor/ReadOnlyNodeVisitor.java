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

package io.notix.api.visitor;

import io.notix.node.Node;
import io.notix.node.editorial.EditorialElement;
import io.notix.node.layer.BarLine;
import io.notix.node.layer.Clef;
import io.notix.node.layer.Dot;
import io.notix.node.layer.KeySig;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Mensur;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.layer.Syl;
import io.notix.node.layer.Verse;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.node.score.Mdiv;
import io.notix.node.score.Measure;
import io.notix.node.score.Page;
import io.notix.node.score.Score;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;
import io.notix.node.score.Section;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.node.score.StaffGrp;

/**
 * Read-only visitor over the document tree. Same dispatch table as {@link NodeVisitor}, but the
 * traversal walks the live child lists, so implementations must not add, remove or move nodes.
 */
public interface ReadOnlyNodeVisitor {
  /**
   * Fallback for every node kind without a dedicated handler.
   *
   * @param node the visited node
   * @return {@link VisitResultType#CONTINUE}
   */
  default VisitResult visitObject(final Node node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Fallback end hook for every node kind without a dedicated handler.
   *
   * @param node the visited node
   * @return {@link VisitResultType#CONTINUE}
   */
  default VisitResult visitObjectEnd(final Node node) {
    return VisitResultType.CONTINUE;
  }

  default VisitResult visitDoc(final Doc doc) {
    return visitObject(doc);
  }

  default VisitResult visitDocEnd(final Doc doc) {
    return visitObjectEnd(doc);
  }

  default VisitResult visitMdiv(final Mdiv mdiv) {
    return visitObject(mdiv);
  }

  default VisitResult visitMdivEnd(final Mdiv mdiv) {
    return visitObjectEnd(mdiv);
  }

  default VisitResult visitScore(final Score score) {
    return visitObject(score);
  }

  default VisitResult visitScoreEnd(final Score score) {
    return visitObjectEnd(score);
  }

  default VisitResult visitScoreDef(final ScoreDef scoreDef) {
    return visitObject(scoreDef);
  }

  default VisitResult visitScoreDefEnd(final ScoreDef scoreDef) {
    return visitObjectEnd(scoreDef);
  }

  default VisitResult visitStaffGrp(final StaffGrp staffGrp) {
    return visitObject(staffGrp);
  }

  default VisitResult visitStaffGrpEnd(final StaffGrp staffGrp) {
    return visitObjectEnd(staffGrp);
  }

  default VisitResult visitStaffDef(final StaffDef staffDef) {
    return visitObject(staffDef);
  }

  default VisitResult visitStaffDefEnd(final StaffDef staffDef) {
    return visitObjectEnd(staffDef);
  }

  default VisitResult visitSection(final Section section) {
    return visitObject(section);
  }

  default VisitResult visitSectionEnd(final Section section) {
    return visitObjectEnd(section);
  }

  default VisitResult visitPage(final Page page) {
    return visitObject(page);
  }

  default VisitResult visitPageEnd(final Page page) {
    return visitObjectEnd(page);
  }

  default VisitResult visitSystem(final ScoreSystem system) {
    return visitObject(system);
  }

  default VisitResult visitSystemEnd(final ScoreSystem system) {
    return visitObjectEnd(system);
  }

  default VisitResult visitMeasure(final Measure measure) {
    return visitObject(measure);
  }

  default VisitResult visitMeasureEnd(final Measure measure) {
    return visitObjectEnd(measure);
  }

  default VisitResult visitStaff(final Staff staff) {
    return visitObject(staff);
  }

  default VisitResult visitStaffEnd(final Staff staff) {
    return visitObjectEnd(staff);
  }

  default VisitResult visitLayer(final Layer layer) {
    return visitObject(layer);
  }

  default VisitResult visitLayerEnd(final Layer layer) {
    return visitObjectEnd(layer);
  }

  default VisitResult visitLayerElement(final LayerElement element) {
    return visitObject(element);
  }

  default VisitResult visitLayerElementEnd(final LayerElement element) {
    return visitObjectEnd(element);
  }

  default VisitResult visitNote(final Note note) {
    return visitLayerElement(note);
  }

  default VisitResult visitNoteEnd(final Note note) {
    return visitLayerElementEnd(note);
  }

  default VisitResult visitRest(final Rest rest) {
    return visitLayerElement(rest);
  }

  default VisitResult visitRestEnd(final Rest rest) {
    return visitLayerElementEnd(rest);
  }

  default VisitResult visitClef(final Clef clef) {
    return visitLayerElement(clef);
  }

  default VisitResult visitClefEnd(final Clef clef) {
    return visitLayerElementEnd(clef);
  }

  default VisitResult visitMensur(final Mensur mensur) {
    return visitLayerElement(mensur);
  }

  default VisitResult visitMensurEnd(final Mensur mensur) {
    return visitLayerElementEnd(mensur);
  }

  default VisitResult visitDot(final Dot dot) {
    return visitLayerElement(dot);
  }

  default VisitResult visitDotEnd(final Dot dot) {
    return visitLayerElementEnd(dot);
  }

  default VisitResult visitKeySig(final KeySig keySig) {
    return visitLayerElement(keySig);
  }

  default VisitResult visitKeySigEnd(final KeySig keySig) {
    return visitLayerElementEnd(keySig);
  }

  default VisitResult visitBarLine(final BarLine barLine) {
    return visitLayerElement(barLine);
  }

  default VisitResult visitBarLineEnd(final BarLine barLine) {
    return visitLayerElementEnd(barLine);
  }

  default VisitResult visitVerse(final Verse verse) {
    return visitObject(verse);
  }

  default VisitResult visitVerseEnd(final Verse verse) {
    return visitObjectEnd(verse);
  }

  default VisitResult visitSyl(final Syl syl) {
    return visitObject(syl);
  }

  default VisitResult visitSylEnd(final Syl syl) {
    return visitObjectEnd(syl);
  }

  default VisitResult visitEditorialElement(final EditorialElement element) {
    return visitObject(element);
  }

  default VisitResult visitEditorialElementEnd(final EditorialElement element) {
    return visitObjectEnd(element);
  }
}
