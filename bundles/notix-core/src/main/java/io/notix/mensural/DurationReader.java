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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Converts encoded note values and lengths into durations and proportions.
 *
 * <p>
 * Encodings such as CMME give the actual length of a note in minims next to its note value. The
 * nominal length of the value under the current mensuration ({@link MensurInfo#getMultiplier}) is
 * compared with the encoded length; when they differ, the note carries a {@link Proportion}.
 * </p>
 */
public final class DurationReader {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DurationReader.class);

  private DurationReader() {
    throw new AssertionError();
  }

  /**
   * Resolve a note value label. Unknown labels fall back to {@link Duration#DEFAULT} with a warning.
   *
   * @param label the label, may be {@code null} if the encoding omits it
   * @return the note value
   */
  public static Duration readDuration(final @Nullable String label) {
    final Optional<Duration> duration = label == null ? Optional.empty() : Duration.fromLabel(label);
    if (duration.isEmpty()) {
      LOGGER.warn("Unsupported duration type '{}', using {}", label, Duration.DEFAULT);
      return Duration.DEFAULT;
    }
    return duration.get();
  }

  /**
   * Compute the proportion of a note whose encoded length is {@code lengthNum / lengthDen} minims.
   *
   * @param duration the note value
   * @param lengthNum numerator of the encoded length
   * @param lengthDen denominator of the encoded length
   * @param mensurInfo the mensuration in effect
   * @return the proportion, or {@link Optional#empty()} if the encoded length is the nominal one or
   *         not a positive length
   */
  public static Optional<Proportion> readProportion(final Duration duration, final int lengthNum,
      final int lengthDen, final MensurInfo mensurInfo) {
    requireNonNull(duration);
    if (lengthNum <= 0 || lengthDen <= 0) {
      LOGGER.warn("Unsupported length {}/{} of {}, keeping its nominal value", lengthNum, lengthDen, duration);
      return Optional.empty();
    }
    final Ratio multiplier = mensurInfo.getMultiplier(duration);
    if (multiplier.getNumerator() == lengthNum && multiplier.getDenominator() == lengthDen) {
      return Optional.empty();
    }
    final long num = (long) lengthDen * multiplier.getNumerator();
    final long numbase = (long) lengthNum * multiplier.getDenominator();
    return Optional.of(new Proportion(Math.toIntExact(num), Math.toIntExact(numbase)));
  }

  /**
   * Get the actual length of a note value in minims.
   *
   * @param duration the note value
   * @param proportion the proportion of the note, if any
   * @param mensurInfo the mensuration in effect
   * @return the length in minims
   */
  public static Ratio toMinims(final Duration duration, final @Nullable Proportion proportion,
      final MensurInfo mensurInfo) {
    final Ratio nominal = mensurInfo.getMultiplier(duration);
    return proportion == null ? nominal : proportion.applyTo(nominal);
  }
}
