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

package io.notix.node.facsimile;

import com.google.common.base.MoreObjects;
import io.notix.node.Node;
import io.notix.node.NodeKind;

/**
 * A rectangular region of a source image, optionally rotated around its upper left corner.
 */
public final class Zone extends Node {

  private int ulx;

  private int uly;

  private int lrx;

  private int lry;

  /** Rotation in degrees. */
  private double rotate;

  /**
   * Constructor.
   *
   * @param ulx upper left x
   * @param uly upper left y
   * @param lrx lower right x
   * @param lry lower right y
   */
  public Zone(final int ulx, final int uly, final int lrx, final int lry) {
    super(NodeKind.ZONE);
    this.ulx = ulx;
    this.uly = uly;
    this.lrx = lrx;
    this.lry = lry;
  }

  public int getUlx() {
    return ulx;
  }

  public int getUly() {
    return uly;
  }

  public int getLrx() {
    return lrx;
  }

  public int getLry() {
    return lry;
  }

  public double getRotate() {
    return rotate;
  }

  public void setRotate(final double rotate) {
    this.rotate = rotate;
  }

  /**
   * Move the zone, for instance after a correction of the source image.
   *
   * @param ulx upper left x
   * @param uly upper left y
   * @param lrx lower right x
   * @param lry lower right y
   */
  public void setCoordinates(final int ulx, final int uly, final int lrx, final int lry) {
    this.ulx = ulx;
    this.uly = uly;
    this.lrx = lrx;
    this.lry = lry;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("ulx", ulx)
                      .add("uly", uly)
                      .add("lrx", lrx)
                      .add("lry", lry)
                      .add("rotate", rotate)
                      .toString();
  }
}
