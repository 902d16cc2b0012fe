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
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.data.SylConnector;
import io.notix.node.data.WordPos;
import io.notix.node.delegates.TimeSpanningDelegate;
import io.notix.node.interfaces.TimeSpanningNode;
import io.notix.node.score.Measure;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A syllable. It starts at its note and, if connected to the next syllable, ends at the note the
 * connector runs to.
 */
public final class Syl extends Node implements TimeSpanningNode {

  private String text;

  private @Nullable WordPos wordPos;

  private @Nullable SylConnector con;

  private TimeSpanningDelegate timeSpanning = new TimeSpanningDelegate();

  /**
   * Constructor.
   *
   * @param text the text of the syllable
   */
  public Syl(final String text) {
    super(NodeKind.SYL);
    this.text = requireNonNull(text);
  }

  public String getText() {
    return text;
  }

  public void setText(final String text) {
    this.text = requireNonNull(text);
  }

  public @Nullable WordPos getWordPos() {
    return wordPos;
  }

  public void setWordPos(final @Nullable WordPos wordPos) {
    this.wordPos = wordPos;
  }

  public @Nullable SylConnector getCon() {
    return con;
  }

  public void setCon(final @Nullable SylConnector con) {
    this.con = con;
  }

  /**
   * Get the verse of this syllable.
   *
   * @return the verse, or {@code null} if the syllable is not in a verse
   */
  public @Nullable Verse getVerse() {
    return getFirstAncestor(Verse.class);
  }

  @Override
  public @Nullable LayerElement getStart() {
    return timeSpanning.getStart();
  }

  @Override
  public void setStart(final @Nullable LayerElement start) {
    timeSpanning.setStart(start);
  }

  @Override
  public @Nullable LayerElement getEnd() {
    return timeSpanning.getEnd();
  }

  @Override
  public void setEnd(final @Nullable LayerElement end) {
    timeSpanning.setEnd(end);
  }

  @Override
  public @Nullable Measure getStartMeasure() {
    return timeSpanning.getStartMeasure();
  }

  @Override
  public @Nullable Measure getEndMeasure() {
    return timeSpanning.getEndMeasure();
  }

  @Override
  public boolean isSpanningMeasures() {
    return timeSpanning.isSpanningMeasures();
  }

  @Override
  public boolean isOnStaff(final int staffN) {
    return timeSpanning.isOnStaff(staffN);
  }

  /**
   * Forget start and end, which the lyrics preparation sets again.
   */
  public void resetTimeSpanning() {
    timeSpanning.reset();
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    timeSpanning = new TimeSpanningDelegate();
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitSyl(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitSyl(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitSylEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitSylEnd(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("text", text)
                      .add("wordPos", wordPos)
                      .add("con", con)
                      .toString();
  }
}
