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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The dashes of one ledger line level above or below a staff, sorted by their left edge.
 *
 * <p>
 * Dashes overlapping by more than one and a half extensions are merged. The dashes of the notes of
 * a chord overlap by about two extensions and become one line, while the dashes of adjacent notes
 * overlap only slightly and stay apart.
 * </p>
 */
public final class LedgerLine {

  /**
   * A horizontal segment.
   *
   * @param left the left edge
   * @param right the right edge
   */
  public record Dash(int left, int right) {
  }

  private final List<Dash> dashes = new ArrayList<>();

  /**
   * Add a dash and merge it with overlapping ones.
   *
   * @param left the left edge
   * @param right the right edge, greater than {@code left}
   * @param extension the extension of a dash beyond the note head, which scales the merge threshold
   */
  public void addDash(final int left, final int right, final int extension) {
    checkArgument(left < right, "left (%s) must be < right (%s)", left, right);

    int index = 0;
    while (index < dashes.size() && dashes.get(index).left() <= left) {
      index++;
    }
    dashes.add(index, new Dash(left, right));

    final ListIterator<Dash> iterator = dashes.listIterator();
    Dash previous = iterator.next();
    while (iterator.hasNext()) {
      final Dash current = iterator.next();
      if (previous.right() > current.left() + 1.5 * extension) {
        iterator.remove();
        previous = new Dash(previous.left(), Math.max(current.right(), previous.right()));
        iterator.previous();
        iterator.set(previous);
        iterator.next();
      } else {
        previous = current;
      }
    }
  }

  /**
   * Get the dashes.
   *
   * @return unmodifiable view, sorted by left edge
   */
  public List<Dash> getDashes() {
    return Collections.unmodifiableList(dashes);
  }

  public void reset() {
    dashes.clear();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("dashes", dashes).toString();
  }
}
