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
import io.notix.layout.StaffAlignment;
import io.notix.layout.SystemAligner;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.layer.Syl;
import io.notix.node.layer.Verse;
import io.notix.node.score.Doc;
import io.notix.node.score.Measure;
import io.notix.node.score.ScoreSystem;
import io.notix.node.score.Staff;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Binds every visible staff to the alignment of its position in the system, reserves room for the
 * verses sung on it, and finally computes the vertical offsets of the alignments of each system.
 */
public final class AlignVerticallyVisitor implements NodeVisitor {

  private final Doc doc;

  private @Nullable SystemAligner systemAligner;

  /** Alignment of the staff being visited. */
  private @Nullable StaffAlignment currentAlignment;

  private int staffIdx;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public AlignVerticallyVisitor(final Doc doc) {
    this.doc = requireNonNull(doc);
  }

  @Override
  public VisitResult visitSystem(final ScoreSystem system) {
    systemAligner = system.getSystemAligner();
    staffIdx = 0;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    staffIdx = 0;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    if (!staff.isDrawingVisible()) {
      return VisitResultType.SKIPSUBTREE;
    }

    final StaffAlignment alignment = requireNonNull(systemAligner).getStaffAlignment(staffIdx, staff, doc);
    staff.setStaffAlignment(alignment);
    currentAlignment = alignment;

    final boolean collapse = doc.getOptions().isLyricVerseCollapse();
    firstOfKind(staff, NodeKind.VERSE).ifPresent(verse -> alignment.addVerseN(((Verse) verse).getN()));
    firstOfKind(staff, NodeKind.SYL).map(syl -> ((Syl) syl).getVerse()).ifPresent(verse -> {
      if (!alignment.isVerseRepresented(verse.getN(), collapse)) {
        alignment.addVerseN(verse.getN());
      }
    });

    staffIdx++;
    return VisitResultType.CONTINUE;
  }

  private static Optional<Node> firstOfKind(final Staff staff, final NodeKind kind) {
    return staff.getTimeSpanningElements().stream().filter(element -> element.is(kind)).findFirst();
  }

  @Override
  public VisitResult visitStaffEnd(final Staff staff) {
    currentAlignment = null;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitVerse(final Verse verse) {
    if (currentAlignment != null) {
      currentAlignment.addVerseN(verse.getN());
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitSystemEnd(final ScoreSystem system) {
    system.getSystemAligner().calculateYRel(doc.getOptions());
    systemAligner = null;
    return VisitResultType.CONTINUE;
  }
}
