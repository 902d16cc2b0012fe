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

package io.notix.node.score;

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Declarative configuration of the staves of a score. Every {@link ScoreSystem} resolves the staff
 * definitions on its own copy.
 */
public final class ScoreDef extends Node {

  /**
   * Constructor.
   */
  public ScoreDef() {
    super(NodeKind.SCORE_DEF);
  }

  /**
   * Find the definition of a staff.
   *
   * @param n the staff number
   * @return the staff definition, or {@code null}
   */
  public @Nullable StaffDef getStaffDef(final int n) {
    for (final StaffDef staffDef : findDescendants(StaffDef.class)) {
      if (staffDef.getN() == n) {
        return staffDef;
      }
    }
    return null;
  }

  /**
   * Get all staff definitions in document order.
   *
   * @return the staff definitions
   */
  public List<StaffDef> getStaffDefs() {
    return findDescendants(StaffDef.class);
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.is(NodeKind.STAFF_GRP);
  }

  @Override
  public ScoreDef clone() {
    return (ScoreDef) super.clone();
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitScoreDef(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitScoreDef(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitScoreDefEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitScoreDefEnd(this);
  }
}
