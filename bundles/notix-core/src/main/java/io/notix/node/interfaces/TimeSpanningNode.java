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

package io.notix.node.interfaces;

import io.notix.node.layer.LayerElement;
import io.notix.node.score.Measure;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node attached to a start and an end event, possibly in different measures or systems, such as
 * a syllable with a connector to the next syllable.
 */
public interface TimeSpanningNode {

  @Nullable
  LayerElement getStart();

  void setStart(@Nullable LayerElement start);

  @Nullable
  LayerElement getEnd();

  void setEnd(@Nullable LayerElement end);

  /**
   * Get the measure of the start event.
   *
   * @return the measure, or {@code null} if there is no start event
   */
  @Nullable
  Measure getStartMeasure();

  /**
   * Get the measure of the end event.
   *
   * @return the measure, or {@code null} if there is no end event
   */
  @Nullable
  Measure getEndMeasure();

  /**
   * Determines if start and end lie in different measures.
   *
   * @return {@code true} if they do
   */
  boolean isSpanningMeasures();

  /**
   * Determines if the node is drawn on the staff with the given number.
   *
   * @param staffN the staff number
   * @return {@code true} if it is
   */
  boolean isOnStaff(int staffN);
}
