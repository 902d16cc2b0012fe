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
import io.notix.mensural.Duration;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Proportion;
import io.notix.mensural.Ratio;
import io.notix.node.NodeKind;
import io.notix.node.delegates.DurationDelegate;
import io.notix.node.interfaces.DurationNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A rest.
 */
public final class Rest extends LayerElement implements DurationNode {

  private DurationDelegate duration;

  /**
   * Constructor.
   *
   * @param dur the note value
   */
  public Rest(final Duration dur) {
    super(NodeKind.REST);
    this.duration = new DurationDelegate(dur);
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

  @Override
  protected void cloneReset() {
    super.cloneReset();
    final DurationDelegate copy = new DurationDelegate(duration.getDur());
    copy.setProportion(duration.getProportion());
    duration = copy;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitRest(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitRest(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitRestEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitRestEnd(this);
  }
}
