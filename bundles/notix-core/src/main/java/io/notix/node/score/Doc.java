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

package io.notix.node.score;

import com.google.common.collect.ImmutableListMultimap;
import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.layout.visitor.AlignHorizontallyVisitor;
import io.notix.layout.visitor.AlignVerticallyVisitor;
import io.notix.layout.visitor.ApplyPpuFactorVisitor;
import io.notix.layout.visitor.CalcLedgerLinesVisitor;
import io.notix.layout.visitor.CalcStemVisitor;
import io.notix.layout.visitor.CastOffMensuralVisitor;
import io.notix.layout.visitor.CastOffPagesVisitor;
import io.notix.layout.visitor.CastOffSystemsVisitor;
import io.notix.layout.visitor.CollectLayerContentVisitor;
import io.notix.layout.visitor.ConvertToPageBasedVisitor;
import io.notix.layout.visitor.OptimizeScoreDefVisitor;
import io.notix.layout.visitor.PrepareLyricsVisitor;
import io.notix.layout.visitor.PrepareStaffCurrentTimeSpanningVisitor;
import io.notix.layout.visitor.ResetDataVisitor;
import io.notix.layout.visitor.ResetVerticalAlignmentVisitor;
import io.notix.layout.visitor.ScoreDefSetCurrentVisitor;
import io.notix.layout.visitor.SetFromFacsimileVisitor;
import io.notix.layout.visitor.UnCastOffVisitor;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.facsimile.Facsimile;
import io.notix.node.layer.LayerElement;
import io.notix.settings.LayoutOptions;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * The root of a document. Besides the tree, a document holds the layout options and the score
 * definition of the document, and it runs the layout passes.
 * </p>
 * <p>
 * An importer builds the document with its sections and calls {@link #convertToPageBasedDoc()}.
 * {@link #castOffDoc()} then breaks the measures into systems and pages and computes the layout.
 * Passes run one at a time; a document must not be shared between threads.
 * </p>
 */
public final class Doc extends Node {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Doc.class);

  private LayoutOptions options;

  private DocType type = DocType.RAW;

  /** Score definition of the document, owned by the first score. */
  private @Nullable ScoreDef scoreDef;

  /**
   * Constructor with the default options.
   */
  public Doc() {
    this(LayoutOptions.defaults());
  }

  /**
   * Constructor.
   *
   * @param options the layout options
   */
  public Doc(final LayoutOptions options) {
    super(NodeKind.DOC);
    this.options = requireNonNull(options);
  }

  public LayoutOptions getOptions() {
    return options;
  }

  public void setOptions(final LayoutOptions options) {
    this.options = requireNonNull(options);
  }

  public DocType getType() {
    return type;
  }

  public void setType(final DocType type) {
    this.type = requireNonNull(type);
  }

  /**
   * Get the score definition of the document.
   *
   * @return the score definition, or {@code null} before the conversion to pages
   */
  public @Nullable ScoreDef getScoreDef() {
    return scoreDef;
  }

  public void setScoreDef(final @Nullable ScoreDef scoreDef) {
    this.scoreDef = scoreDef;
  }

  /**
   * Get the facsimile.
   *
   * @return the facsimile child, or {@code null}
   */
  public @Nullable Facsimile getFacsimile() {
    for (final Node child : getChildren()) {
      if (child instanceof Facsimile) {
        return (Facsimile) child;
      }
    }
    return null;
  }

  public List<Page> getPages() {
    return findDescendants(Page.class);
  }

  /**
   * Get the drawing unit for a staff size.
   *
   * @param staffSize the staff size in percent
   * @return the unit scaled to the staff size
   */
  public int getDrawingUnit(final int staffSize) {
    return options.getUnit() * staffSize / 100;
  }

  // ------------------------------------------------------------------------
  // Passes
  // ------------------------------------------------------------------------

  /**
   * Move the measures of all sections into a single page and system. The score definition of the
   * first score becomes the score definition of the document.
   */
  public void convertToPageBasedDoc() {
    checkState(type == DocType.RAW, "Document is already page based.");
    final Page page = new Page();
    final ScoreSystem system = new ScoreSystem();
    page.addChild(system);

    final ConvertToPageBasedVisitor visitor = new ConvertToPageBasedVisitor(this, system);
    process(visitor);
    addChild(page);

    type = DocType.PAGE_BASED;
    LOGGER.debug("Converted to page based document with {} measures", system.getChildCount());
  }

  /**
   * Split the unmeasured measures at their bar lines.
   */
  public void convertToCastOffMensuralDoc() {
    checkState(type == DocType.PAGE_BASED, "Document must be page based.");
    processPages(new CastOffMensuralVisitor());
  }

  /**
   * Break the measures into systems and the systems into pages, then lay them out.
   */
  public void castOffDoc() {
    checkState(type == DocType.PAGE_BASED, "Document must be page based.");
    checkState(scoreDef != null, "Document has no score definition.");

    final UnCastOffVisitor unCastOff = new UnCastOffVisitor();
    processPages(unCastOff);
    unCastOff.apply(this);

    processPages(new ScoreDefSetCurrentVisitor(this));
    processPages(new AlignHorizontallyVisitor(this));

    final CastOffSystemsVisitor castOffSystems = new CastOffSystemsVisitor(this);
    processPages(castOffSystems);

    resetVerticalAlignment();
    processPages(new ResetDataVisitor());
    final PrepareLyricsVisitor prepareLyrics = new PrepareLyricsVisitor();
    processPages(prepareLyrics);
    prepareLyrics.finish();
    processPages(new PrepareStaffCurrentTimeSpanningVisitor());

    processPages(new ScoreDefSetCurrentVisitor(this));
    processPages(new OptimizeScoreDefVisitor(options.getHiddenStaffPolicy()));
    alignVertically();

    final CastOffPagesVisitor castOffPages = new CastOffPagesVisitor(this);
    processPages(castOffPages);
    castOffPages.apply(this);

    resetVerticalAlignment();
    alignVertically();
    positionSystems();

    processPages(new CalcLedgerLinesVisitor(this));
    processPages(new CalcStemVisitor());

    LOGGER.debug("Cast off {} systems on {} pages", findDescendants(ScoreSystem.class).size(), getPages().size());
  }

  /**
   * Compute the vertical alignment of the staves of every system.
   */
  public void alignVertically() {
    processPages(new AlignVerticallyVisitor(this));
  }

  /**
   * Unbind all staff alignments and drop everything derived from them.
   */
  public void resetVerticalAlignment() {
    processPages(new ResetVerticalAlignmentVisitor());
  }

  /**
   * Divide the absolute staff positions by the pixels per unit of their page.
   */
  public void applyPpuFactor() {
    processPages(new ApplyPpuFactorVisitor());
  }

  /**
   * Attach the zones of the facsimile and adjust the staff sizes to them.
   */
  public void layoutFacsimile() {
    checkState(type == DocType.FACSIMILE, "Document is not a facsimile document.");
    processPages(new SetFromFacsimileVisitor(this));
  }

  private void positionSystems() {
    final int spacing = (int) Math.round(options.getSpacingSystem() * options.getUnit());
    for (final Page page : getPages()) {
      int y = options.getPageHeight() - options.getPageMarginTop();
      for (final ScoreSystem system : page.getSystems()) {
        system.setDrawingXRel(options.getPageMarginLeft());
        system.setDrawingYRel(y);
        y -= system.getSystemAligner().getHeight() + spacing;
      }
    }
  }

  /**
   * Run a visitor on every page, in document order.
   *
   * @param visitor the visitor
   */
  public void processPages(final NodeVisitor visitor) {
    for (final Page page : getPages()) {
      page.process(visitor);
    }
  }

  /**
   * Get the notes and rests of every staff number in document order.
   *
   * @return the notes and rests keyed by staff number
   */
  public ImmutableListMultimap<Integer, LayerElement> getLayerContent() {
    final CollectLayerContentVisitor visitor = new CollectLayerContentVisitor();
    process(visitor);
    return visitor.getContent();
  }

  @Override
  protected boolean isSupportedChild(final Node child) {
    return child.is(NodeKind.MDIV) || child.is(NodeKind.PAGE) || child.is(NodeKind.FACSIMILE);
  }

  @Override
  public int getDrawingX() {
    return 0;
  }

  @Override
  public int getDrawingY() {
    return 0;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitDoc(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitDoc(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitDocEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitDocEnd(this);
  }
}
