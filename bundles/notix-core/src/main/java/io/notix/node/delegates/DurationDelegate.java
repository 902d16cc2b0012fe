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

import io.notix.mensural.Duration;
import io.notix.mensural.DurationReader;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.Proportion;
import io.notix.mensural.Ratio;
import io.notix.node.interfaces.DurationNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Delegate implementing {@link DurationNode}.
 */
public final class DurationDelegate implements DurationNode {

  private Duration dur;

  private @Nullable Proportion proportion;

  /**
   * Constructor.
   *
   * @param dur the note value
   */
  public DurationDelegate(final Duration dur) {
    this.dur = requireNonNull(dur);
  }

  @Override
  public Duration getDur() {
    return dur;
  }

  @Override
  public void setDur(final Duration dur) {
    this.dur = requireNonNull(dur);
  }

  @Override
  public @Nullable Proportion getProportion() {
    return proportion;
  }

  @Override
  public void setProportion(final @Nullable Proportion proportion) {
    this.proportion = proportion;
  }

  @Override
  public Ratio getDurationInMinims(final MensurInfo mensurInfo) {
    return DurationReader.toMinims(dur, proportion, mensurInfo);
  }
}
