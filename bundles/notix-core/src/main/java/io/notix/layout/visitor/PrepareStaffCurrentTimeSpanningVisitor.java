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
import io.notix.node.layer.Syl;
import io.notix.node.score.Measure;
import io.notix.node.score.Staff;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands the syllables spanning several measures to the staves they run through. A staff receives
 * every running syllable that started in an earlier measure on a staff with the same number.
 */
public final class PrepareStaffCurrentTimeSpanningVisitor implements NodeVisitor {

  /** The syllables that started and have not ended yet. */
  private final List<Syl> running = new ArrayList<>();

  private @Nullable Measure currentMeasure;

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    currentMeasure = measure;
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    for (final Syl syl : running) {
      if (syl.getStartMeasure() != currentMeasure && syl.isOnStaff(staff.getN())) {
        staff.addTimeSpanningElement(syl);
      }
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitSyl(final Syl syl) {
    if (syl.getStart() != null && syl.getEnd() != null && syl.isSpanningMeasures()) {
      running.add(syl);
    }
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitMeasureEnd(final Measure measure) {
    running.removeIf(syl -> syl.getEndMeasure() == measure);
    return VisitResultType.CONTINUE;
  }
}
