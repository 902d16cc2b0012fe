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

import java.util.Optional;

/**
 * Mensural note values, from the longest to the shortest. Common-notation values map onto them
 * (brevis = breve, semibrevis = whole, minima = half, and so on).
 */
public enum Duration {
  MAXIMA("Maxima"),

  LONGA("Longa"),

  BREVIS("Brevis"),

  SEMIBREVIS("Semibrevis"),

  MINIMA("Minima"),

  SEMIMINIMA("Semiminima"),

  FUSA("Fusa"),

  SEMIFUSA("Semifusa");

  /** Value used for labels that can not be resolved. */
  public static final Duration DEFAULT = BREVIS;

  /** The label used by CMME encodings. */
  private final String label;

  Duration(final String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Look up a duration by its encoding label.
   *
   * @param label the label, for instance {@code "Semibrevis"}
   * @return the duration, or {@link Optional#empty()} for an unknown label
   */
  public static Optional<Duration> fromLabel(final String label) {
    for (final Duration duration : values()) {
      if (duration.label.equals(label)) {
        return Optional.of(duration);
      }
    }
    return Optional.empty();
  }
}
