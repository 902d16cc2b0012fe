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

package io.notix.node.layer;

import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.data.Accidental;
import io.notix.node.data.PitchName;

import static java.util.Objects.requireNonNull;

/**
 * One accidental of a key signature.
 */
public final class KeyAccid extends Node {

  private final Accidental accid;

  private final PitchName pname;

  private final int oct;

  /** Staff location, {@code 0} being the bottom line. */
  private final int loc;

  /**
   * Constructor.
   *
   * @param accid the accidental
   * @param pname the altered pitch
   * @param oct the octave of the altered pitch
   * @param loc the staff location
   */
  public KeyAccid(final Accidental accid, final PitchName pname, final int oct, final int loc) {
    super(NodeKind.KEY_ACCID);
    this.accid = requireNonNull(accid);
    this.pname = requireNonNull(pname);
    this.oct = oct;
    this.loc = loc;
  }

  public Accidental getAccid() {
    return accid;
  }

  public PitchName getPname() {
    return pname;
  }

  public int getOct() {
    return oct;
  }

  public int getLoc() {
    return loc;
  }
}
