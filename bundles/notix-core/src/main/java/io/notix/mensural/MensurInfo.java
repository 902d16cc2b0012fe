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
 * The four mensural levels in effect for a voice. Each level is either binary (2) or ternary (3)
 * and tells into how many units of the next smaller value a note value divides.
 */
public final class MensurInfo {

  private static final MensurInfo BINARY = new MensurInfo(2, 2, 2, 2);

  /** Semibrevis to minima. */
  private final int prolatio;

  /** Brevis to semibrevis. */
  private final int tempus;

  /** Longa to brevis. */
  private final int modusMinor;

  /** Maxima to longa. */
  private final int modusMaior;

  /**
   * Constructor.
   *
   * @param prolatio semibrevis to minima, 2 or 3
   * @param tempus brevis to semibrevis, 2 or 3
   * @param modusMinor longa to brevis, 2 or 3
   * @param modusMaior maxima to longa, 2 or 3
   */
  public MensurInfo(final int prolatio, final int tempus, final int modusMinor, final int modusMaior) {
    checkLevel(prolatio, "prolatio");
    checkLevel(tempus, "tempus");
    checkLevel(modusMinor, "modusMinor");
    checkLevel(modusMaior, "modusMaior");
    this.prolatio = prolatio;
    this.tempus = tempus;
    this.modusMinor = modusMinor;
    this.modusMaior = modusMaior;
  }

  private static void checkLevel(final int value, final String name) {
    checkArgument(value == 2 || value == 3, "%s must be 2 or 3 but is %s", name, value);
  }

  /**
   * Get the mensuration with every level binary.
   *
   * @return the binary mensuration
   */
  public static MensurInfo binary() {
    return BINARY;
  }

  public int getProlatio() {
    return prolatio;
  }

  public int getTempus() {
    return tempus;
  }

  public int getModusMinor() {
    return modusMinor;
  }

  public int getModusMaior() {
    return modusMaior;
  }

  /**
   * Get the nominal length of a note value in minims under this mensuration.
   *
   * @param duration the note value
   * @return the multiplier, for instance {@code tempus * prolatio} for a brevis
   */
  public Ratio getMultiplier(final Duration duration) {
    return switch (duration) {
      case MAXIMA -> Ratio.of((long) modusMaior * modusMinor * tempus * prolatio);
      case LONGA -> Ratio.of((long) modusMinor * tempus * prolatio);
      case BREVIS -> Ratio.of((long) tempus * prolatio);
      case SEMIBREVIS -> Ratio.of(prolatio);
      case MINIMA -> Ratio.ONE;
      case SEMIMINIMA -> Ratio.of(1, 2);
      case FUSA -> Ratio.of(1, 4);
      case SEMIFUSA -> Ratio.of(1, 8);
    };
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MensurInfo)) {
      return false;
    }
    final MensurInfo other = (MensurInfo) obj;
    return prolatio == other.prolatio && tempus == other.tempus && modusMinor == other.modusMinor
        && modusMaior == other.modusMaior;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(prolatio, tempus, modusMinor, modusMaior);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("prolatio", prolatio)
                      .add("tempus", tempus)
                      .add("modusMinor", modusMinor)
                      .add("modusMaior", modusMaior)
                      .toString();
  }
}
