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

import io.notix.mensural.Ratio;
import io.notix.node.layer.KeySig;
import io.notix.node.layer.LayerElement;
import io.notix.settings.LayoutOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Horizontal alignment of the elements of one measure across all its staves and layers.
 *
 * <p>
 * Elements with the same onset share a position, except that at one onset dots come first, then
 * bar lines, then clefs, key signatures and mensuration signs, and notes and rests last. Positions
 * of notes and rests are spaced by the time to the next position, positions of the other elements
 * by a fixed width.
 * </p>
 */
public final class HorizontalAligner {

  /** Minimum space after a note or rest, in units. */
  private static final int MIN_TIMED_SPACE = 3;

  /**
   * Order of element types at the same onset.
   */
  private enum PositionType {
    DOT,

    BAR_LINE,

    SIGNATURE,

    TIMED
  }

  private record Position(Ratio onset, PositionType type) implements Comparable<Position> {
    @Override
    public int compareTo(final Position other) {
      final int byOnset = onset.compareTo(other.onset);
      return byOnset != 0 ? byOnset : type.compareTo(other.type);
    }
  }

  private static final class Slot {
    private final List<LayerElement> elements = new ArrayList<>();

    private Ratio longest = Ratio.ZERO;
  }

  private final TreeMap<Position, Slot> positions = new TreeMap<>();

  /**
   * Add an element.
   *
   * @param element the element
   * @param onset the onset in minims from the start of the measure
   * @param duration the length in minims, zero for elements without duration
   */
  public void addElement(final LayerElement element, final Ratio onset, final Ratio duration) {
    requireNonNull(element);
    final Slot slot = positions.computeIfAbsent(new Position(onset, typeOf(element)), position -> new Slot());
    slot.elements.add(element);
    if (duration.compareTo(slot.longest) > 0) {
      slot.longest = duration;
    }
  }

  private static PositionType typeOf(final LayerElement element) {
    return switch (element.getKind()) {
      case DOT -> PositionType.DOT;
      case BAR_LINE -> PositionType.BAR_LINE;
      case NOTE, REST -> PositionType.TIMED;
      default -> PositionType.SIGNATURE;
    };
  }

  /**
   * Determines if no element was added.
   *
   * @return {@code true} if the aligner is empty
   */
  public boolean isEmpty() {
    return positions.isEmpty();
  }

  /**
   * Set the position of every element relative to the measure.
   *
   * @param options the layout options
   * @return the width of the measure
   */
  public int align(final LayoutOptions options) {
    final int unit = options.getUnit();
    int x = unit;
    for (final Map.Entry<Position, Slot> entry : positions.entrySet()) {
      final Position position = entry.getKey();
      final Slot slot = entry.getValue();
      for (final LayerElement element : slot.elements) {
        element.setDrawingXRel(x);
      }
      if (position.type() == PositionType.TIMED) {
        final Position next = positions.higherKey(position);
        final Ratio gap = next == null ? slot.longest : next.onset().minus(position.onset());
        x += timedSpace(gap, options);
      } else {
        x += fixedSpace(slot, unit);
      }
    }
    return x;
  }

  private static int timedSpace(final Ratio gap, final LayoutOptions options) {
    final int unit = options.getUnit();
    final double space =
        Math.pow(gap.doubleValue(), options.getSpacingNonLinear()) * options.getSpacingLinear() * 10 * unit;
    return Math.max(MIN_TIMED_SPACE * unit, (int) Math.round(space));
  }

  private static int fixedSpace(final Slot slot, final int unit) {
    int space = 0;
    for (final LayerElement element : slot.elements) {
      final int width = switch (element.getKind()) {
        case CLEF -> 6 * unit;
        case MENSUR -> 5 * unit;
        case KEY_SIG -> (2 * ((KeySig) element).getKeyAccids().size() + 1) * unit;
        default -> 2 * unit;
      };
      space = Math.max(space, width);
    }
    return space;
  }
}
