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
import io.notix.node.score.ScoreSystem;

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers the measures of all pages back into a single page and system, so that a document can be
 * cast off again. The visitor collects; {@link #apply(Doc)} restructures.
 */
public final class UnCastOffVisitor implements NodeVisitor {

  private final List<Measure> measures = new ArrayList<>();

  private double ppuFactor = 1.0;

  private boolean firstPage = true;

  @Override
  public VisitResult visitPage(final Page page) {
    if (firstPage) {
      ppuFactor = page.getPpuFactor();
      firstPage = false;
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    measures.add(measure);
    return VisitResultType.SKIPSUBTREE;
  }

  /**
   * Replace the pages of the document by one page holding one system with all collected measures.
   *
   * @param doc the document
   */
  public void apply(final Doc doc) {
    final List<Page> pages = doc.getPages();
    final int index = pages.isEmpty() ? doc.getChildCount() : pages.get(0).getIndexInParent();

    final Page page = new Page();
    page.setPpuFactor(ppuFactor);
    final ScoreSystem system = new ScoreSystem();
    page.addChild(system);
    for (final Measure measure : measures) {
      measure.setDrawingXRel(0);
      system.addChild(measure);
    }

    for (final Page oldPage : pages) {
      oldPage.detachFromParent();
    }
    doc.insertChild(page, Math.min(index, doc.getChildCount()));
  }
}
