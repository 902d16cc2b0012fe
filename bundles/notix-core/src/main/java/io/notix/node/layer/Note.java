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

import com.google.common.base.MoreObjects;
import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.mensural.Duration;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Proportion;
import io.notix.mensural.Ratio;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.data.PitchName;
import io.notix.node.delegates.DurationDelegate;
import io.notix.node.interfaces.DurationNode;
import io.notix.node.score.Doc;
import io.notix.node.score.Staff;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * A note. Lyrics are attached as {@link Verse} children.
 */
public final class Note extends LayerElement implements DurationNode {

  private PitchName pname;

  private int oct;

  private DurationDelegate duration;

  private boolean colored;

  private boolean cue;

  /** Staff location computed by the ledger line pass. */
  private OptionalInt drawingLoc = OptionalInt.empty();

  /**
   * Constructor.
   *
   * @param pname the pitch name
   * @param oct the octave, 4 being the octave of middle C
   * @param dur the note value
   */
  public Note(final PitchName pname, final int oct, final Duration dur) {
    super(NodeKind.NOTE);
    this.pname = requireNonNull(pname);
    this.oct = oct;
    this.duration = new DurationDelegate(dur);
  }

  public PitchName getPname() {
    return pname;
  }

  public void setPname(final PitchName pname) {
    this.pname = requireNonNull(pname);
  }

  public int getOct() {
    return oct;
  }

  public void setOct(final int oct) {
    this.oct = oct;
  }

  @Override
  public Duration getDur() {
    return duration.getDur();
  }

  @Override
  public void setDur(final Duration dur) {
    duration.setDur(dur);
  }

  @Override
  public @Nullable Proportion getProportion() {
    return duration.getProportion();
  }

  @Override
  public void setProportion(final @Nullable Proportion proportion) {
    duration.setProportion(proportion);
  }

  @Override
  public Ratio getDurationInMinims(final MensurInfo mensurInfo) {
    return duration.getDurationInMinims(mensurInfo);
  }

  public boolean isColored() {
    return colored;
  }

  public void setColored(final boolean colored) {
    this.colored = colored;
  }

  public boolean isCue() {
    return cue;
  }

  public void setCue(final boolean cue) {
    this.cue = cue;
  }

  /**
   * Get the staff location of the note under the given clef.
   *
   * @param clef the clef in effect
   * @return the location, {@code 0} being the bottom line
   */
  public int calcLoc(final Clef clef) {
    return clef.getLoc(pname, oct);
  }

  public OptionalInt getDrawingLoc() {
    return drawingLoc;
  }

  public void setDrawingLoc(final int drawingLoc) {
    this.drawingLoc = OptionalInt.of(drawingLoc);
  }

  /**
   * Get the verse with the given number.
   *
   * @param n the verse number
   * @return the verse, or {@code null}
   */
  public @Nullable Verse getVerse(final int n) {
    for (final Node child : getChildren()) {
      if (child instanceof Verse && ((Verse) child).getN() == n) {
        return (Verse) child;
      }
    }
    return null;
  }

  /**
   * The y of a note with a computed staff location follows the location, otherwise the staff.
   */
  @Override
  public int getDrawingY() {
    final Staff staff = getFirstAncestor(Staff.class);
    final Doc doc = getFirstAncestor(Doc.class);
    if (drawingLoc.isEmpty() || staff == null || doc == null) {
      return super.getDrawingY();
    }
    return staff.getDrawingY() + staff.calcPitchPosYRel(doc, drawingLoc.getAsInt());
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.is(NodeKind.VERSE);
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    final DurationDelegate copy = new DurationDelegate(duration.getDur());
    copy.setProportion(duration.getProportion());
    duration = copy;
    drawingLoc = OptionalInt.empty();
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitNote(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitNote(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitNoteEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitNoteEnd(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("pname", pname)
                      .add("oct", oct)
                      .add("dur", getDur())
                      .add("proportion", getProportion())
                      .toString();
  }
}
