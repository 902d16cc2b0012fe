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
import io.notix.node.score.Page;
import io.notix.node.score.ScoreSystem;
import io.notix.settings.LayoutOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Distributes the systems onto pages by their aligned heights. A page always takes at least one
 * system. The visitor collects; {@link #apply(Doc)} restructures.
 */
public final class CastOffPagesVisitor implements NodeVisitor {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CastOffPagesVisitor.class);

  private final List<ScoreSystem> systems = new ArrayList<>();

  private final LayoutOptions options;

  private double ppuFactor = 1.0;

  private boolean firstPage = true;

  /**
   * Constructor.
   *
   * @param doc the document
   */
  public CastOffPagesVisitor(final Doc doc) {
    this.options = doc.getOptions();
  }

  @Override
  public VisitResult visitPage(final Page page) {
    if (firstPage) {
      ppuFactor = page.getPpuFactor();
      firstPage = false;
    }
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitSystem(final ScoreSystem system) {
    systems.add(system);
    return VisitResultType.SKIPSUBTREE;
  }

  /**
   * Replace the pages of the document by pages filled with the collected systems.
   *
   * @param doc the document
   */
  public void apply(final Doc doc) {
    final List<Page> oldPages = doc.getPages();
    final int index = oldPages.isEmpty() ? doc.getChildCount() : oldPages.get(0).getIndexInParent();

    final int availableHeight = options.getContentHeight();
    final int spacing = (int) Math.round(options.getSpacingSystem() * options.getUnit());
    final List<Page> pages = new ArrayList<>();
    Page current = newPage();
    int used = 0;
    for (final ScoreSystem system : systems) {
      final int height = system.getSystemAligner().getHeight();
      if (current.getChildCount() > 0 && used + height > availableHeight) {
        pages.add(current);
        current = newPage();
        used = 0;
      }
      current.addChild(system);
      used += height + spacing;
    }
    pages.add(current);

    for (final Page oldPage : oldPages) {
      oldPage.detachFromParent();
    }
    final int start = Math.min(index, doc.getChildCount());
    for (int i = 0; i < pages.size(); i++) {
      doc.insertChild(pages.get(i), start + i);
    }
    LOGGER.debug("Cast off {} pages", pages.size());
  }

  private Page newPage() {
    final Page page = new Page();
    page.setPpuFactor(ppuFactor);
    return page;
  }
}
