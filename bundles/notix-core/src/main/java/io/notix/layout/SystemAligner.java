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

import io.notix.node.score.Doc;
import io.notix.node.score.Staff;
import io.notix.settings.LayoutOptions;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Vertical alignment of the staves of one system. Holds one {@link StaffAlignment} per visible
 * staff, ordered by staff index.
 */
public final class SystemAligner {

  private final List<StaffAlignment> staffAlignments = new ArrayList<>();

  private int height;

  /**
   * Get the alignment for the staff at the given index, creating it when the index is reached for
   * the first time. Staves are processed measure by measure, so every measure of the system reuses
   * the alignments created by the first one.
   *
   * @param staffIdx the index of the staff among the visible staves
   * @param staff the staff
   * @param doc the document
   * @return the alignment
   */
  public StaffAlignment getStaffAlignment(final @NonNegative int staffIdx, final Staff staff, final Doc doc) {
    checkArgument(staffIdx <= staffAlignments.size(), "Staff index %s skips an alignment", staffIdx);
    final StaffAlignment alignment;
    if (staffIdx < staffAlignments.size()) {
      alignment = staffAlignments.get(staffIdx);
    } else {
      alignment = new StaffAlignment(staffIdx, staff.getN());
      staffAlignments.add(alignment);
    }
    alignment.setStaffHeight(Math.max(alignment.getStaffHeight(), staff.getDrawingHeight(doc)));
    return alignment;
  }

  public List<StaffAlignment> getStaffAlignments() {
    return Collections.unmodifiableList(staffAlignments);
  }

  /**
   * Stack the staves downwards from the top of the system. Each staff sits below the previous one
   * by the height of the previous staff, its lyric slots and the staff spacing. The y axis points
   * upwards, so the offsets are negative.
   *
   * @param options the layout options
   */
  public void calculateYRel(final LayoutOptions options) {
    final int unit = options.getUnit();
    final boolean collapse = options.isLyricVerseCollapse();
    final int spacing = (int) Math.round(options.getSpacingStaff() * unit);
    int y = 0;
    int bottom = 0;
    for (final StaffAlignment alignment : staffAlignments) {
      alignment.setYRel(y);
      final int lyrics = (int) Math.round(alignment.getVerseCount(collapse) * options.getLyricSize() * unit);
      bottom = y - alignment.getStaffHeight() - lyrics;
      y = bottom - spacing;
    }
    height = -bottom;
  }

  /**
   * Get the height of the system, from the top line of the first staff to the last lyric slot of
   * the last staff.
   *
   * @return the height computed by {@link #calculateYRel(LayoutOptions)}
   */
  public int getHeight() {
    return height;
  }

  public void reset() {
    staffAlignments.clear();
    height = 0;
  }
}
