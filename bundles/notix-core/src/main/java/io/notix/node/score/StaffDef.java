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
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.data.NotationType;
import io.notix.node.data.Visibility;
import io.notix.node.layer.Clef;
import io.notix.node.layer.KeySig;
import io.notix.node.layer.Mensur;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Declarative configuration of one staff: number of lines, notation type, visibility and the
 * initial clef, key and mensuration.
 */
public final class StaffDef extends Node {

  private int n;

  private int lines = 5;

  /** {@code null} means common notation. */
  private @Nullable NotationType notationType;

  /** Encoded visibility, {@code null} if not given. */
  private @Nullable Boolean visible;

  private @Nullable String type;

  /** Visibility resolved for the system this definition belongs to. */
  private Visibility drawingVisibility = Visibility.VISIBLE;

  /**
   * Constructor.
   *
   * @param n the staff number, 1-based
   */
  public StaffDef(final int n) {
    super(NodeKind.STAFF_DEF);
    setN(n);
  }

  public int getN() {
    return n;
  }

  public void setN(final int n) {
    checkArgument(n > 0, "n must be > 0!");
    this.n = n;
  }

  public int getLines() {
    return lines;
  }

  public void setLines(final int lines) {
    checkArgument(lines > 0, "lines must be > 0!");
    this.lines = lines;
  }

  public @Nullable NotationType getNotationType() {
    return notationType;
  }

  public void setNotationType(final @Nullable NotationType notationType) {
    this.notationType = notationType;
  }

  public @Nullable Boolean getVisible() {
    return visible;
  }

  public void setVisible(final @Nullable Boolean visible) {
    this.visible = visible;
  }

  public @Nullable String getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(final @Nullable String type) {
    this.type = type;
  }

  public Visibility getDrawingVisibility() {
    return drawingVisibility;
  }

  public void setDrawingVisibility(final Visibility drawingVisibility) {
    this.drawingVisibility = requireNonNull(drawingVisibility);
  }

  public @Nullable Label getLabel() {
    return getFirstChild(Label.class);
  }

  public @Nullable Clef getClef() {
    return getFirstChild(Clef.class);
  }

  public @Nullable Mensur getMensur() {
    return getFirstChild(Mensur.class);
  }

  public @Nullable KeySig getKeySig() {
    return getFirstChild(KeySig.class);
  }

  public @Nullable Tuning getTuning() {
    return getFirstChild(Tuning.class);
  }

  private <T extends Node> @Nullable T getFirstChild(final Class<T> type) {
    for (final Node child : getChildren()) {
      if (type.isInstance(child)) {
        return type.cast(child);
      }
    }
    return null;
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return switch (child.getKind()) {
      case LABEL, CLEF, MENSUR, KEY_SIG, TUNING -> true;
      default -> false;
    };
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    drawingVisibility = Visibility.VISIBLE;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitStaffDef(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitStaffDef(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitStaffDefEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitStaffDefEnd(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("n", n)
                      .add("lines", lines)
                      .add("notationType", notationType)
                      .add("drawingVisibility", drawingVisibility)
                      .toString();
  }
}
