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
import io.notix.node.data.StemDirection;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One voice of a staff: a sequence of layer elements.
 */
public final class Layer extends Node {

  /** Layer number, {@code 0} if not set. */
  private int n;

  private @Nullable StemDirection drawingStemDir;

  /**
   * Constructor.
   */
  public Layer() {
    super(NodeKind.LAYER);
  }

  public int getN() {
    return n;
  }

  public boolean hasN() {
    return n > 0;
  }

  public void setN(final int n) {
    checkArgument(n > 0, "n must be > 0!");
    this.n = n;
  }

  /**
   * Get the stem direction resolved for the layer.
   *
   * @return the direction, or {@code null} if stems follow the pitch
   */
  public @Nullable StemDirection getDrawingStemDir() {
    return drawingStemDir;
  }

  public void setDrawingStemDir(final @Nullable StemDirection drawingStemDir) {
    this.drawingStemDir = drawingStemDir;
  }

  /**
   * Determines if the layer holds no note or rest.
   *
   * @return {@code true} if it does not
   */
  public boolean isEmpty() {
    return findFirstDescendant(NodeKind.NOTE) == null && findFirstDescendant(NodeKind.REST) == null;
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.getKind().isLayerElement() || child.getKind().isEditorialElement();
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    drawingStemDir = null;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitLayer(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitLayer(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitLayerEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitLayerEnd(this);
  }
}
