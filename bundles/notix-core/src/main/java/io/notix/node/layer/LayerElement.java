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

package io.notix.node.layer;

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.mensural.Ratio;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.score.Measure;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Base class of the events of a layer. The horizontal alignment sets the onset of an element and
 * its position relative to the measure.
 */
public abstract class LayerElement extends Node {

  private int drawingXRel;

  /** Onset in minims from the start of the measure. */
  private Ratio onset = Ratio.ZERO;

  /**
   * Constructor.
   *
   * @param kind the kind, a layer element kind
   */
  protected LayerElement(final NodeKind kind) {
    super(kind);
    checkArgument(kind.isLayerElement(), "%s is not a layer element kind", kind);
  }

  public int getDrawingXRel() {
    return drawingXRel;
  }

  public void setDrawingXRel(final int drawingXRel) {
    this.drawingXRel = drawingXRel;
  }

  public Ratio getOnset() {
    return onset;
  }

  public void setOnset(final Ratio onset) {
    this.onset = requireNonNull(onset);
  }

  @Override
  public int getDrawingX() {
    final Measure measure = getFirstAncestor(Measure.class);
    if (measure == null) {
      return super.getDrawingX();
    }
    return measure.getDrawingX() + drawingXRel;
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    drawingXRel = 0;
    onset = Ratio.ZERO;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitLayerElement(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitLayerElement(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitLayerElementEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitLayerElementEnd(this);
  }
}
