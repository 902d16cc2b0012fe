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
import com.google.common.math.LongMath;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exact, reduced fraction. Used for onsets and durations, which are not binary in mensural music.
 */
public final class Ratio implements Comparable<Ratio> {

  public static final Ratio ZERO = new Ratio(0, 1);

  public static final Ratio ONE = new Ratio(1, 1);

  private final long numerator;

  private final long denominator;

  private Ratio(final long numerator, final long denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /**
   * Create a reduced fraction.
   *
   * @param numerator the numerator
   * @param denominator the denominator, not zero
   * @return the fraction
   */
  public static Ratio of(final long numerator, final long denominator) {
    checkArgument(denominator != 0, "denominator must not be 0!");
    final long sign = denominator < 0 ? -1 : 1;
    final long gcd = Math.max(1, LongMath.gcd(Math.abs(numerator), Math.abs(denominator)));
    return new Ratio(sign * numerator / gcd, sign * denominator / gcd);
  }

  public static Ratio of(final long value) {
    return new Ratio(value, 1);
  }

  public long getNumerator() {
    return numerator;
  }

  public long getDenominator() {
    return denominator;
  }

  public Ratio plus(final Ratio other) {
    return of(numerator * other.denominator + other.numerator * denominator, denominator * other.denominator);
  }

  public Ratio minus(final Ratio other) {
    return of(numerator * other.denominator - other.numerator * denominator, denominator * other.denominator);
  }

  public Ratio times(final Ratio other) {
    return of(numerator * other.numerator, denominator * other.denominator);
  }

  public boolean isZero() {
    return numerator == 0;
  }

  public double doubleValue() {
    return (double) numerator / denominator;
  }

  @Override
  public int compareTo(final Ratio other) {
    return Long.compare(numerator * other.denominator, other.numerator * denominator);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Ratio)) {
      return false;
    }
    final Ratio other = (Ratio) obj;
    return numerator == other.numerator && denominator == other.denominator;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(numerator, denominator);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue(numerator + "/" + denominator).toString();
  }
}
