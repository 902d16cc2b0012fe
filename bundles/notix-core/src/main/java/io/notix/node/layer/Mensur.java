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

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.mensural.MensurInfo;
import io.notix.mensural.MensurationSign;
import io.notix.node.NodeKind;

import static java.util.Objects.requireNonNull;

/**
 * A mensuration sign. It sets the mensuration of the following notes of its layer.
 */
public final class Mensur extends LayerElement {

  private MensurInfo mensurInfo;

  private MensurationSign sign;

  private boolean dot;

  /**
   * Constructor. The sign is derived from the mensuration: a circle for perfect tempus, a dot for
   * major prolation.
   *
   * @param mensurInfo the mensuration
   */
  public Mensur(final MensurInfo mensurInfo) {
    super(NodeKind.MENSUR);
    this.mensurInfo = requireNonNull(mensurInfo);
    this.sign = mensurInfo.getTempus() == 3 ? MensurationSign.O : MensurationSign.C;
    this.dot = mensurInfo.getProlatio() == 3;
  }

  public MensurInfo getMensurInfo() {
    return mensurInfo;
  }

  public void setMensurInfo(final MensurInfo mensurInfo) {
    this.mensurInfo = requireNonNull(mensurInfo);
  }

  public MensurationSign getSign() {
    return sign;
  }

  public void setSign(final MensurationSign sign) {
    this.sign = requireNonNull(sign);
  }

  public boolean hasDot() {
    return dot;
  }

  public void setDot(final boolean dot) {
    this.dot = dot;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitMensur(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitMensur(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitMensurEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitMensurEnd(this);
  }
}
