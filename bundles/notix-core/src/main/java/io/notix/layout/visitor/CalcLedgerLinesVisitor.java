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
import io.notix.node.data.ClefShape;
import io.notix.node.layer.Clef;
import io.notix.node.layer.Note;
import io.notix.node.score.Doc;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.settings.LayoutOptions;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Computes the staff location of every note from its pitch and the clef in effect, and adds the
 * ledger line dashes the notes above and below the staff need. Invisible and tablature staves are
 * skipped.
 */
public final class CalcLedgerLinesVisitor implements NodeVisitor {

  private final Doc doc;

  private @Nullable Staff currentStaff;

  private @Nullable Clef currentClef;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public CalcLedgerLinesVisitor(final Doc doc) {
    this.doc = requireNonNull(doc);
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    if (!staff.isDrawingVisible() || staff.isTablature()) {
      return VisitResultType.SKIPSUBTREE;
    }
    currentStaff = staff;
    final StaffDef staffDef = staff.getDrawingStaffDef();
    final Clef clef = staffDef == null ? null : staffDef.getClef();
    currentClef = clef == null ? new Clef(ClefShape.G, 2) : clef;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitClef(final Clef clef) {
    currentClef = clef;
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitNote(final Note note) {
    final Staff staff = requireNonNull(currentStaff);
    final int loc = note.calcLoc(requireNonNull(currentClef));
    note.setDrawingLoc(loc);

    final LayoutOptions options = doc.getOptions();
    final int unit = doc.getDrawingUnit(staff.getDrawingStaffSize());
    final double scaling = note.isCue() ? options.getCueScaling() : 1.0;
    final int extension = (int) Math.round(options.getLedgerLineExtension() * unit * scaling);
    final int headWidth = (int) Math.round(2 * unit * scaling);
    final int left = note.getDrawingX() - extension;
    final int right = note.getDrawingX() + headWidth + extension;

    final int top = 2 * (staff.getDrawingLines() - 1);
    if (loc > top + 1) {
      staff.addLedgerLineAbove((loc - top) / 2, left, right, extension, note.isCue());
    } else if (loc < -1) {
      staff.addLedgerLineBelow(-loc / 2, left, right, extension, note.isCue());
    }
    return VisitResultType.SKIPSUBTREE;
  }
}
