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

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.api.visitor.VisitResultType;
import io.notix.layout.HorizontalAligner;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Ratio;
import io.notix.node.interfaces.DurationNode;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Mensur;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.settings.LayoutOptions;

import static java.util.Objects.requireNonNull;

/**
 * Computes the onsets of the layer elements and their horizontal positions within their measure.
 * Mensural staves time their notes by the mensuration in effect, starting with the one of the staff
 * definition; other staves use binary values.
 */
public final class AlignHorizontallyVisitor implements NodeVisitor {

  private final LayoutOptions options;

  private HorizontalAligner aligner = new HorizontalAligner();

  private MensurInfo staffMensurInfo = MensurInfo.binary();

  private MensurInfo mensurInfo = MensurInfo.binary();

  private boolean mensural;

  private Ratio onset = Ratio.ZERO;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public AlignHorizontallyVisitor(final Doc doc) {
    this.options = requireNonNull(doc).getOptions();
  }

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    aligner = new HorizontalAligner();
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitMeasureEnd(final Measure measure) {
    measure.setDrawingWidth(aligner.align(options));
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    mensural = staff.isMensural();
    staffMensurInfo = MensurInfo.binary();
    final StaffDef staffDef = staff.getDrawingStaffDef();
    if (mensural && staffDef != null && staffDef.getMensur() != null) {
      staffMensurInfo = staffDef.getMensur().getMensurInfo();
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitLayer(final Layer layer) {
    onset = Ratio.ZERO;
    mensurInfo = staffMensurInfo;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitMensur(final Mensur mensur) {
    if (mensural) {
      mensurInfo = mensur.getMensurInfo();
    }
    return visitLayerElement(mensur);
  }

  @Override
  public VisitResult visitNote(final Note note) {
    return visitTimedElement(note, note);
  }

  @Override
  public VisitResult visitRest(final Rest rest) {
    return visitTimedElement(rest, rest);
  }

  private VisitResult visitTimedElement(final LayerElement element, final DurationNode durationNode) {
    final Ratio duration = durationNode.getDurationInMinims(mensurInfo);
    element.setOnset(onset);
    aligner.addElement(element, onset, duration);
    onset = onset.plus(duration);
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitLayerElement(final LayerElement element) {
    element.setOnset(onset);
    aligner.addElement(element, onset, Ratio.ZERO);
    return VisitResultType.SKIPSUBTREE;
  }
}
