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
import io.notix.layout.SystemAligner;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A system: the measures drawn on one line of a page. The system owns the {@link SystemAligner}
 * holding the vertical alignment of its staves and its own copy of the score definition.
 */
public final class ScoreSystem extends Node {

  private SystemAligner systemAligner = new SystemAligner();

  private @Nullable ScoreDef drawingScoreDef;

  private int drawingXRel;

  private int drawingYRel;

  /**
   * Constructor.
   */
  public ScoreSystem() {
    super(NodeKind.SYSTEM);
  }

  public SystemAligner getSystemAligner() {
    return systemAligner;
  }

  /**
   * Get the score definition resolved for this system.
   *
   * @return the score definition, or {@code null} before it is set
   */
  public @Nullable ScoreDef getDrawingScoreDef() {
    return drawingScoreDef;
  }

  /**
   * Set the score definition of this system. The system keeps a copy.
   *
   * @param scoreDef the score definition to copy
   */
  public void setDrawingScoreDef(final ScoreDef scoreDef) {
    drawingScoreDef = scoreDef.clone();
  }

  /**
   * Drop the score definition of this system.
   */
  public void resetDrawingScoreDef() {
    drawingScoreDef = null;
  }

  public List<Measure> getMeasures() {
    return findDescendants(Measure.class);
  }

  public int getDrawingXRel() {
    return drawingXRel;
  }

  public void setDrawingXRel(final int drawingXRel) {
    this.drawingXRel = drawingXRel;
  }

  public int getDrawingYRel() {
    return drawingYRel;
  }

  /**
   * Set the vertical position of the system on its page. The cached positions of its staves become
   * invalid.
   *
   * @param drawingYRel the position
   */
  public void setDrawingYRel(final int drawingYRel) {
    this.drawingYRel = drawingYRel;
    for (final Staff staff : findDescendants(Staff.class)) {
      staff.resetDrawingCaches();
    }
  }

  @Override
  public int getDrawingX() {
    return drawingXRel;
  }

  @Override
  public int getDrawingY() {
    return drawingYRel;
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.is(NodeKind.MEASURE);
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    systemAligner = new SystemAligner();
    drawingScoreDef = null;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitSystem(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitSystem(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitSystemEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitSystemEnd(this);
  }
}
