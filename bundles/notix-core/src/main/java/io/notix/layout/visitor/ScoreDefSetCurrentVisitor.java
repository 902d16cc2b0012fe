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
import io.notix.node.data.NotationType;
import io.notix.node.score.Doc;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Resolves the staff definition of every staff from the score definition of its system, and copies
 * the number of lines, the notation type and the tuning to the staff. Systems without a score
 * definition get a copy of the one of the document.
 */
public final class ScoreDefSetCurrentVisitor implements NodeVisitor {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ScoreDefSetCurrentVisitor.class);

  private final Doc doc;

  private @Nullable ScoreDef currentScoreDef;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public ScoreDefSetCurrentVisitor(final Doc doc) {
    this.doc = requireNonNull(doc);
  }

  @Override
  public VisitResult visitSystem(final ScoreSystem system) {
    if (system.getDrawingScoreDef() == null) {
      final ScoreDef scoreDef = doc.getScoreDef();
      checkState(scoreDef != null, "Document has no score definition.");
      system.setDrawingScoreDef(scoreDef);
    }
    currentScoreDef = system.getDrawingScoreDef();
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    final StaffDef staffDef = currentScoreDef == null ? null : currentScoreDef.getStaffDef(staff.getN());
    if (staffDef == null) {
      LOGGER.warn("No staff definition for staff '{}' (n={})", staff.getId(), staff.getN());
      return VisitResultType.SKIPSUBTREE;
    }
    staff.setDrawingStaffDef(staffDef);
    staff.setDrawingLines(staffDef.getLines());
    final NotationType notationType = staffDef.getNotationType();
    staff.setDrawingNotationType(notationType == null ? NotationType.CMN : notationType);
    staff.setDrawingTuning(staffDef.getTuning());
    return VisitResultType.SKIPSUBTREE;
  }
}
