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
import io.notix.node.NodeKind;
import io.notix.node.data.Visibility;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.settings.HiddenStaffPolicy;

import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Resolves the visibility of the staff definitions of each system. A staff definition is hidden if
 * it is marked invisible, if every staff with its number in the system is marked invisible, or, when
 * empty staves are condensed, if none of these staves holds a note or a rest.
 */
public final class OptimizeScoreDefVisitor implements NodeVisitor {

  private final HiddenStaffPolicy policy;

  /** Per staff number: does any staff of the system show up. */
  private final Map<Integer, Boolean> anyVisible = new HashMap<>();

  /** Per staff number: does any staff of the system hold a note or rest. */
  private final Map<Integer, Boolean> anyContent = new HashMap<>();

  /**
   * Constructor.
   *
   * @param policy the hidden staff policy
   */
  public OptimizeScoreDefVisitor(final HiddenStaffPolicy policy) {
    this.policy = requireNonNull(policy);
  }

  @Override
  public VisitResult visitSystem(final ScoreSystem system) {
    anyVisible.clear();
    anyContent.clear();
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitStaff(final Staff staff) {
    final boolean visible = !Boolean.FALSE.equals(staff.getVisible());
    final boolean content =
        staff.findFirstDescendant(NodeKind.NOTE) != null || staff.findFirstDescendant(NodeKind.REST) != null;
    anyVisible.merge(staff.getN(), visible, Boolean::logicalOr);
    anyContent.merge(staff.getN(), content, Boolean::logicalOr);
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitSystemEnd(final ScoreSystem system) {
    final ScoreDef scoreDef = system.getDrawingScoreDef();
    if (scoreDef == null) {
      return VisitResultType.CONTINUE;
    }
    for (final StaffDef staffDef : scoreDef.getStaffDefs()) {
      staffDef.setDrawingVisibility(isHidden(staffDef) ? Visibility.HIDDEN : Visibility.VISIBLE);
    }
    return VisitResultType.CONTINUE;
  }

  private boolean isHidden(final StaffDef staffDef) {
    if (Boolean.FALSE.equals(staffDef.getVisible())) {
      return true;
    }
    final Boolean visible = anyVisible.get(staffDef.getN());
    if (visible == null) {
      return false;
    }
    if (!visible) {
      return true;
    }
    return policy == HiddenStaffPolicy.CONDENSE_EMPTY && !anyContent.get(staffDef.getN());
  }
}
