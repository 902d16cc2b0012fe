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

package io.notix.layout;

import com.google.common.base.MoreObjects;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Vertical alignment of one staff within a system: the offset of the staff from the top of the
 * system and the lyric verses reserved below it. Owned by the {@link SystemAligner}; staves only
 * refer to it during one layout.
 */
public final class StaffAlignment {

  private final int staffIdx;

  private final int staffN;

  private int staffHeight;

  private int yRel;

  /** Reserved verse numbers in the order of their discovery. */
  private final Set<Integer> verseNs = new LinkedHashSet<>();

  /**
   * Constructor.
   *
   * @param staffIdx the index of the staff among the visible staves of the system
   * @param staffN the staff number
   */
  public StaffAlignment(final int staffIdx, final int staffN) {
    checkArgument(staffIdx >= 0, "staffIdx must be >= 0!");
    this.staffIdx = staffIdx;
    this.staffN = staffN;
  }

  public int getStaffIdx() {
    return staffIdx;
  }

  public int getStaffN() {
    return staffN;
  }

  public int getStaffHeight() {
    return staffHeight;
  }

  public void setStaffHeight(final int staffHeight) {
    this.staffHeight = staffHeight;
  }

  public int getYRel() {
    return yRel;
  }

  public void setYRel(final int yRel) {
    this.yRel = yRel;
  }

  /**
   * Reserve a lyric slot for a verse. Reserving a verse twice has no effect.
   *
   * @param verseN the verse number
   */
  public void addVerseN(final int verseN) {
    verseNs.add(verseN);
  }

  /**
   * Get the reserved verse numbers.
   *
   * @return unmodifiable view in the order of their reservation
   */
  public Set<Integer> getVerseNs() {
    return Collections.unmodifiableSet(verseNs);
  }

  /**
   * Determines if a verse has a lyric slot. When verses are collapsed, only reserved verses have
   * one. Otherwise every verse up to the highest reserved number has one.
   *
   * @param verseN the verse number
   * @param collapse the verse collapse setting
   * @return {@code true} if the verse is represented
   */
  public boolean isVerseRepresented(final int verseN, final boolean collapse) {
    if (collapse) {
      return verseNs.contains(verseN);
    }
    return verseN <= getMaxVerseN();
  }

  /**
   * Get the number of lyric slots below the staff.
   *
   * @param collapse the verse collapse setting
   * @return the number of reserved verses when collapsed, the highest reserved number otherwise
   */
  public int getVerseCount(final boolean collapse) {
    return collapse ? verseNs.size() : getMaxVerseN();
  }

  /**
   * Get the slot of a verse, counted from the staff downwards.
   *
   * @param verseN the verse number
   * @param collapse the verse collapse setting
   * @return the slot starting at {@code 1}, or {@code 0} if the verse is not represented
   */
  public int getVersePosition(final int verseN, final boolean collapse) {
    if (!isVerseRepresented(verseN, collapse)) {
      return 0;
    }
    if (!collapse) {
      return verseN;
    }
    int position = 0;
    for (final int n : verseNs) {
      if (n <= verseN) {
        position++;
      }
    }
    return position;
  }

  private int getMaxVerseN() {
    int max = 0;
    for (final int n : verseNs) {
      max = Math.max(max, n);
    }
    return max;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("staffIdx", staffIdx)
                      .add("staffN", staffN)
                      .add("yRel", yRel)
                      .add("verseNs", verseNs)
                      .toString();
  }
}
