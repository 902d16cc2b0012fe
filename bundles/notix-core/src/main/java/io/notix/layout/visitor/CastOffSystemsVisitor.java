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
import io.notix.node.Node;
import io.notix.node.score.Doc;
import io.notix.node.score.Measure;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.ScoreSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Breaks the measures of a system into systems fitting the page width. A system always takes at
 * least one measure, even if it is wider than the page. Every new system gets its own copy of the
 * score definition of the document.
 */
public final class CastOffSystemsVisitor implements NodeVisitor {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CastOffSystemsVisitor.class);

  private final Doc doc;

  private int systemCount;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public CastOffSystemsVisitor(final Doc doc) {
    this.doc = requireNonNull(doc);
  }

  @Override
  public VisitResult visitSystem(final ScoreSystem system) {
    final ScoreDef scoreDef = doc.getScoreDef();
    checkState(scoreDef != null, "Document has no score definition.");

    final int availableWidth = doc.getOptions().getContentWidth();
    final List<ScoreSystem> systems = new ArrayList<>();
    ScoreSystem current = new ScoreSystem();
    int x = 0;
    for (final Measure measure : system.getMeasures()) {
      final int width = measure.getDrawingWidth();
      if (current.getChildCount() > 0 && x + width > availableWidth) {
        systems.add(current);
        current = new ScoreSystem();
        x = 0;
      }
      measure.setDrawingXRel(x);
      current.addChild(measure);
      x += width;
    }
    if (current.getChildCount() > 0) {
      systems.add(current);
    }

    final Node page = requireNonNull(system.getParent());
    final int index = system.getIndexInParent();
    system.detachFromParent();
    for (int i = 0; i < systems.size(); i++) {
      final ScoreSystem newSystem = systems.get(i);
      newSystem.setDrawingScoreDef(scoreDef);
      newSystem.setDrawingXRel(doc.getOptions().getPageMarginLeft());
      page.insertChild(newSystem, index + i);
    }
    systemCount += systems.size();
    LOGGER.debug("Cast off {} systems", systems.size());

    return VisitResultType.SKIPSUBTREE;
  }

  /**
   * Get the number of systems created.
   *
   * @return the number of systems
   */
  public int getSystemCount() {
    return systemCount;
  }
}
