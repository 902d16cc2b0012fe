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
import io.notix.node.NodeKind;
import io.notix.node.data.ClefShape;
import io.notix.node.data.PitchName;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A clef, placed on a staff line counted from the bottom.
 */
public final class Clef extends LayerElement {

  private ClefShape shape;

  private int line;

  /**
   * Constructor.
   *
   * @param shape the shape
   * @param line the line, 1 being the bottom line
   */
  public Clef(final ClefShape shape, final int line) {
    super(NodeKind.CLEF);
    this.shape = requireNonNull(shape);
    setLine(line);
  }

  public ClefShape getShape() {
    return shape;
  }

  public void setShape(final ClefShape shape) {
    this.shape = requireNonNull(shape);
  }

  public int getLine() {
    return line;
  }

  public void setLine(final int line) {
    checkArgument(line > 0, "line must be > 0!");
    this.line = line;
  }

  /**
   * Get the staff location of a pitch under this clef.
   *
   * @param pname the pitch name
   * @param oct the octave
   * @return the location, {@code 0} being the bottom line and {@code 1} the first space
   */
  public int getLoc(final PitchName pname, final int oct) {
    return oct * 7 + pname.getDiatonicStep() - shape.getReferenceDiatonic() + 2 * (line - 1);
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitClef(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitClef(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitClefEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitClefEnd(this);
  }
}
