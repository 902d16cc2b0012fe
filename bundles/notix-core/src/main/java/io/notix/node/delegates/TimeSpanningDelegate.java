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

package io.notix.node.delegates;

import io.notix.node.interfaces.TimeSpanningNode;
import io.notix.node.layer.LayerElement;
import io.notix.node.score.Measure;
import io.notix.node.score.Staff;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Delegate implementing {@link TimeSpanningNode}. Measures and staves are looked up along the
 * current parent chain of the events, so the delegate stays valid when cast-off moves them.
 */
public final class TimeSpanningDelegate implements TimeSpanningNode {

  /** The start event. */
  private @Nullable LayerElement start;

  /** The end event. */
  private @Nullable LayerElement end;

  @Override
  public @Nullable LayerElement getStart() {
    return start;
  }

  @Override
  public void setStart(final @Nullable LayerElement start) {
    this.start = start;
  }

  @Override
  public @Nullable LayerElement getEnd() {
    return end;
  }

  @Override
  public void setEnd(final @Nullable LayerElement end) {
    this.end = end;
  }

  @Override
  public @Nullable Measure getStartMeasure() {
    return start == null ? null : start.getFirstAncestor(Measure.class);
  }

  @Override
  public @Nullable Measure getEndMeasure() {
    return end == null ? null : end.getFirstAncestor(Measure.class);
  }

  @Override
  public boolean isSpanningMeasures() {
    final Measure startMeasure = getStartMeasure();
    final Measure endMeasure = getEndMeasure();
    return startMeasure != null && endMeasure != null && startMeasure != endMeasure;
  }

  @Override
  public boolean isOnStaff(final int staffN) {
    if (start == null) {
      return false;
    }
    final Staff staff = start.getFirstAncestor(Staff.class);
    return staff != null && staff.getN() == staffN;
  }

  /**
   * Forget start and end.
   */
  public void reset() {
    start = null;
    end = null;
  }
}
