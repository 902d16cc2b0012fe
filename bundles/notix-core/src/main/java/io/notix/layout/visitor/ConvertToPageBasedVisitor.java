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

package io.notix.layout.visitor;

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.api.visitor.VisitResultType;
import io.notix.node.score.Doc;
import io.notix.node.score.Measure;
import io.notix.node.score.Page;
import io.notix.node.score.Score;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;

import static java.util.Objects.requireNonNull;

/**
 * Moves the measures of all sections into one system. The score definition of the first score
 * becomes the score definition of the document.
 */
public final class ConvertToPageBasedVisitor implements NodeVisitor {

  private final Doc doc;

  private final ScoreSystem system;

  /**
   * Constructor.
   *
   * @param doc the document
   * @param system the system receiving the measures
   */
  public ConvertToPageBasedVisitor(final Doc doc, final ScoreSystem system) {
    this.doc = requireNonNull(doc);
    this.system = requireNonNull(system);
  }

  @Override
  public VisitResult visitScore(final Score score) {
    final ScoreDef scoreDef = score.getScoreDef();
    if (doc.getScoreDef() == null && scoreDef != null) {
      doc.setScoreDef(scoreDef);
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitScoreDef(final ScoreDef scoreDef) {
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    system.addChild(measure);
    return VisitResultType.SKIPSUBTREE;
  }

  @Override
  public VisitResult visitPage(final Page page) {
    return VisitResultType.SKIPSUBTREE;
  }
}
