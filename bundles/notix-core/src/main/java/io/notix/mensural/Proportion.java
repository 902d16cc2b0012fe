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

package io.notix.mensural;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Duration proportion of a note or rest: {@code num} notes sounding in the time of {@code numbase}.
 * The values are kept as encoded and are not reduced.
 */
public final class Proportion {

  private final int num;

  private final int numbase;

  /**
   * Constructor.
   *
   * @param num the number of notes
   * @param numbase the number of notes they sound in the time of
   */
  public Proportion(final int num, final int numbase) {
    checkArgument(num > 0 && numbase > 0, "num and numbase must be > 0!");
    this.num = num;
    this.numbase = numbase;
  }

  public int getNum() {
    return num;
  }

  public int getNumbase() {
    return numbase;
  }

  /**
   * Apply the proportion to a nominal duration.
   *
   * @param duration the nominal duration
   * @return {@code duration * numbase / num}
   */
  public Ratio applyTo(final Ratio duration) {
    return duration.times(Ratio.of(numbase, num));
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Proportion)) {
      return false;
    }
    final Proportion other = (Proportion) obj;
    return num == other.num && numbase == other.numbase;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(num, numbase);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("num", num).add("numbase", numbase).toString();
  }
}
