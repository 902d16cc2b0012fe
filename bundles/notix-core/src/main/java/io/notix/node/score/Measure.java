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

import com.google.common.base.MoreObjects;
import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.exception.NotixUsageException;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A measure. Unmeasured measures hold continuous music that is split at its bar lines before it is
 * laid out.
 */
public final class Measure extends Node {

  private final boolean measured;

  private int n;

  private int drawingXRel;

  private int drawingWidth;

  /**
   * Constructor.
   *
   * @param measured {@code false} for continuous music without measure structure
   * @param n the measure number
   */
  public Measure(final boolean measured, final int n) {
    super(NodeKind.MEASURE);
    this.measured = measured;
    this.n = n;
  }

  public boolean isMeasured() {
    return measured;
  }

  public int getN() {
    return n;
  }

  public void setN(final int n) {
    this.n = n;
  }

  /**
   * Find the staff with the given number.
   *
   * @param staffN the staff number
   * @return the staff, or {@code null}
   */
  public @Nullable Staff getStaff(final int staffN) {
    for (final Node child : getChildren()) {
      if (child instanceof Staff && ((Staff) child).getN() == staffN) {
        return (Staff) child;
      }
    }
    return null;
  }

  public List<Staff> getStaves() {
    return findDescendants(Staff.class);
  }

  public int getDrawingXRel() {
    return drawingXRel;
  }

  public void setDrawingXRel(final int drawingXRel) {
    this.drawingXRel = drawingXRel;
  }

  public int getDrawingWidth() {
    return drawingWidth;
  }

  public void setDrawingWidth(final @NonNegative int drawingWidth) {
    checkArgument(drawingWidth >= 0, "drawingWidth must be >= 0!");
    this.drawingWidth = drawingWidth;
  }

  @Override
  public int getDrawingX() {
    final ScoreSystem system = getFirstAncestor(ScoreSystem.class);
    return (system == null ? 0 : system.getDrawingX()) + drawingXRel;
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.is(NodeKind.STAFF);
  }

  /**
   * {@inheritDoc}
   *
   * @throws NotixUsageException also if the measure already holds a staff with the same number
   */
  @Override
  public void insertChild(final Node child, final @NonNegative int index) {
    if (child instanceof Staff && child.getParent() != this) {
      final int staffN = ((Staff) child).getN();
      if (getStaff(staffN) != null) {
        throw new NotixUsageException("Measure '%s' already has a staff with n=%s", getId(), staffN);
      }
    }
    super.insertChild(child, index);
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    drawingXRel = 0;
    drawingWidth = 0;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitMeasure(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitMeasure(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitMeasureEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitMeasureEnd(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("n", n)
                      .add("measured", measured)
                      .add("staves", getChildCount())
                      .toString();
  }
}
