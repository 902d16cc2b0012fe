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

package io.notix.node.delegates;

import io.notix.node.facsimile.Zone;
import io.notix.node.interfaces.FacsimileNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Delegate implementing {@link FacsimileNode} and the coordinates derived from the attached zone.
 */
public final class FacsimileDelegate implements FacsimileNode {

  /** Identifier of the referenced zone. */
  private @Nullable String facs;

  /** The attached zone. */
  private @Nullable Zone zone;

  @Override
  public boolean hasFacs() {
    return facs != null && !facs.isEmpty();
  }

  @Override
  public @Nullable String getFacs() {
    return facs;
  }

  @Override
  public void setFacs(final @Nullable String facs) {
    this.facs = facs;
  }

  @Override
  public @Nullable Zone getZone() {
    return zone;
  }

  @Override
  public void attachZone(final Zone zone) {
    this.zone = requireNonNull(zone);
    if (facs == null) {
      facs = zone.getId();
    }
  }

  /**
   * Get the x coordinate given by the zone.
   *
   * @return the upper left x of the zone
   */
  public int getDrawingX() {
    return requireZone().getUlx();
  }

  /**
   * Get the y coordinate given by the zone.
   *
   * @return the upper left y of the zone
   */
  public int getDrawingY() {
    return requireZone().getUly();
  }

  /**
   * Get the rotation given by the zone.
   *
   * @return the rotation in degrees
   */
  public double getDrawingRotation() {
    return requireZone().getRotate();
  }

  private Zone requireZone() {
    checkState(zone != null, "No zone attached for facs '%s'", facs);
    return zone;
  }
}
