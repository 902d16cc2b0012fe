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

import com.google.common.base.MoreObjects;
import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.layout.LedgerLine;
import io.notix.layout.StaffAlignment;
import io.notix.node.Node;
import io.notix.node.NodeKind;
import io.notix.node.data.NotationType;
import io.notix.node.data.StaffRel;
import io.notix.node.data.Visibility;
import io.notix.node.delegates.FacsimileDelegate;
import io.notix.node.facsimile.Facsimile;
import io.notix.node.facsimile.Zone;
import io.notix.node.interfaces.FacsimileNode;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * One performer's line within a measure.
 *
 * <p>
 * The drawing position of a staff is resolved in one of two ways. If the staff references a zone of
 * the facsimile and the document is a facsimile document, the zone gives the position, the rotation
 * and (through its height) the staff size. Otherwise the position is computed: an absolute y given
 * by the encoding wins, else the y of the system plus the offset of the {@link StaffAlignment}
 * bound by the vertical alignment, cached until the alignment is reset.
 * </p>
 */
public final class Staff extends Node implements FacsimileNode {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Staff.class);

  /** Size ratio between tablature and common staves. */
  public static final double TABLATURE_STAFF_RATIO = 1.75;

  private static final int DEFAULT_STAFF_SIZE = 100;

  private static final int DEFAULT_LINES = 5;

  private int n;

  private @Nullable Boolean visible;

  private @Nullable String type;

  /** Absolute y given by the encoding. */
  private OptionalInt yAbs = OptionalInt.empty();

  private FacsimileDelegate facsimile = new FacsimileDelegate();

  private int drawingStaffSize;

  private int drawingLines;

  private NotationType drawingNotationType;

  private @Nullable StaffAlignment staffAlignment;

  private @Nullable StaffDef drawingStaffDef;

  private @Nullable Tuning drawingTuning;

  private List<LedgerLine> ledgerLinesAbove;

  private List<LedgerLine> ledgerLinesBelow;

  private List<LedgerLine> ledgerLinesAboveCue;

  private List<LedgerLine> ledgerLinesBelowCue;

  /** Spanning elements that started in an earlier measure and reach into this one. */
  private List<Node> timeSpanningElements;

  /**
   * Constructor.
   *
   * @param n the staff number, 1-based
   */
  public Staff(final int n) {
    super(NodeKind.STAFF);
    setN(n);
    resetDrawingState();
  }

  private void resetDrawingState() {
    drawingStaffSize = DEFAULT_STAFF_SIZE;
    drawingLines = DEFAULT_LINES;
    drawingNotationType = NotationType.NONE;
    staffAlignment = null;
    drawingStaffDef = null;
    drawingTuning = null;
    timeSpanningElements = new ArrayList<>();
    ledgerLinesAbove = new ArrayList<>();
    ledgerLinesBelow = new ArrayList<>();
    ledgerLinesAboveCue = new ArrayList<>();
    ledgerLinesBelowCue = new ArrayList<>();
  }

  public int getN() {
    return n;
  }

  public void setN(final int n) {
    checkArgument(n > 0, "n must be > 0!");
    this.n = n;
  }

  public @Nullable Boolean getVisible() {
    return visible;
  }

  public void setVisible(final @Nullable Boolean visible) {
    this.visible = visible;
  }

  public @Nullable String getType() {
    return type;
  }

  public void setType(final @Nullable String type) {
    this.type = type;
  }

  public OptionalInt getYAbs() {
    return yAbs;
  }

  /**
   * Set the absolute y given by the encoding.
   *
   * @param yAbs the absolute y
   */
  public void setYAbs(final int yAbs) {
    this.yAbs = OptionalInt.of(yAbs);
    resetDrawingCaches();
  }

  public void resetYAbs() {
    yAbs = OptionalInt.empty();
    resetDrawingCaches();
  }

  public int getDrawingStaffSize() {
    return drawingStaffSize;
  }

  public void setDrawingStaffSize(final int drawingStaffSize) {
    checkArgument(drawingStaffSize > 0, "drawingStaffSize must be > 0!");
    this.drawingStaffSize = drawingStaffSize;
  }

  public int getDrawingLines() {
    return drawingLines;
  }

  public void setDrawingLines(final int drawingLines) {
    checkArgument(drawingLines > 0, "drawingLines must be > 0!");
    this.drawingLines = drawingLines;
  }

  public NotationType getDrawingNotationType() {
    return drawingNotationType;
  }

  public void setDrawingNotationType(final NotationType drawingNotationType) {
    this.drawingNotationType = requireNonNull(drawingNotationType);
  }

  public @Nullable StaffAlignment getStaffAlignment() {
    return staffAlignment;
  }

  /**
   * Bind the alignment of this staff. Only the vertical alignment binds alignments.
   *
   * @param staffAlignment the alignment
   */
  public void setStaffAlignment(final StaffAlignment staffAlignment) {
    this.staffAlignment = requireNonNull(staffAlignment);
    resetDrawingCaches();
  }

  public @Nullable StaffDef getDrawingStaffDef() {
    return drawingStaffDef;
  }

  public void setDrawingStaffDef(final @Nullable StaffDef drawingStaffDef) {
    this.drawingStaffDef = drawingStaffDef;
  }

  public @Nullable Tuning getDrawingTuning() {
    return drawingTuning;
  }

  public void setDrawingTuning(final @Nullable Tuning drawingTuning) {
    this.drawingTuning = drawingTuning;
  }

  // ------------------------------------------------------------------------
  // Facsimile
  // ------------------------------------------------------------------------

  @Override
  public boolean hasFacs() {
    return facsimile.hasFacs();
  }

  @Override
  public @Nullable String getFacs() {
    return facsimile.getFacs();
  }

  @Override
  public void setFacs(final @Nullable String facs) {
    facsimile.setFacs(facs);
  }

  @Override
  public @Nullable Zone getZone() {
    return facsimile.getZone();
  }

  /**
   * {@inheritDoc} The cached drawing position becomes invalid.
   */
  @Override
  public void attachZone(final Zone zone) {
    facsimile.attachZone(zone);
    resetDrawingCaches();
  }

  /**
   * Determines if the position of this staff is given by its zone.
   *
   * @return {@code true} if a zone is attached and the document is a facsimile document
   */
  public boolean isFacsimileMode() {
    if (!hasFacs() || getZone() == null) {
      return false;
    }
    final Doc doc = getFirstAncestor(Doc.class);
    return doc != null && doc.getType() == DocType.FACSIMILE;
  }

  /**
   * Resolve the zone of this staff in the facsimile of the document, if not attached yet, and adjust
   * the staff size to the zone.
   *
   * @param doc the document
   */
  public void setFromFacsimile(final Doc doc) {
    if (!hasFacs()) {
      return;
    }
    if (getZone() == null) {
      final Facsimile docFacsimile = doc.getFacsimile();
      final Zone zone = docFacsimile == null ? null : docFacsimile.findZoneById(requireNonNull(getFacs()));
      if (zone == null) {
        LOGGER.warn("Zone '{}' referenced by staff '{}' not found", getFacs(), getId());
        return;
      }
      attachZone(zone);
    }
    adjustDrawingStaffSize();
  }

  /**
   * Derive the staff size from the height of the zone, corrected by its rotation. A staff with a
   * single line or a zone without height keeps its current size.
   */
  public void adjustDrawingStaffSize() {
    if (!isFacsimileMode()) {
      return;
    }
    final Doc doc = requireAncestor(Doc.class);
    final Zone zone = requireNonNull(getZone());
    final double rotate = getDrawingRotation();
    final int yDiff =
        (int) ((zone.getLry() - zone.getUly()) - (zone.getLrx() - zone.getUlx()) * Math.tan(Math.abs(rotate) * Math.PI / 180.0));
    if (drawingLines <= 1 || yDiff <= 0) {
      LOGGER.warn("Zone '{}' of staff '{}' gives no staff size, keeping {}", zone.getId(), getId(), drawingStaffSize);
      return;
    }
    final int staffSize = 100 * yDiff / (doc.getOptions().getUnit() * 2 * (drawingLines - 1));
    if (staffSize <= 0) {
      LOGGER.warn("Zone '{}' of staff '{}' is too flat, keeping staff size {}", zone.getId(), getId(), drawingStaffSize);
      return;
    }
    drawingStaffSize = staffSize;
  }

  // ------------------------------------------------------------------------
  // Coordinates
  // ------------------------------------------------------------------------

  @Override
  public int getDrawingX() {
    if (isFacsimileMode()) {
      return facsimile.getDrawingX();
    }
    return super.getDrawingX();
  }

  @Override
  public int getDrawingY() {
    if (isFacsimileMode()) {
      return facsimile.getDrawingY();
    }

    if (yAbs.isPresent()) {
      return yAbs.getAsInt();
    }

    if (staffAlignment == null) {
      return 0;
    }

    final OptionalInt cached = getCachedDrawingY();
    if (cached.isPresent()) {
      return cached.getAsInt();
    }

    final ScoreSystem system = requireAncestor(ScoreSystem.class);
    final int y = system.getDrawingY() + staffAlignment.getYRel();
    setCachedDrawingY(y);
    return y;
  }

  @Override
  public double getDrawingRotation() {
    if (isFacsimileMode()) {
      return facsimile.getDrawingRotation();
    }
    return 0;
  }

  /**
   * Get the staff size used for the notation on the staff. Tablature is smaller.
   *
   * @return the size in percent
   */
  public int getDrawingStaffNotationSize() {
    return isTablature() ? (int) (drawingStaffSize / TABLATURE_STAFF_RATIO) : drawingStaffSize;
  }

  /**
   * Get the height of the staff from the top line to the bottom line.
   *
   * @param doc the document
   * @return the height
   */
  public int getDrawingHeight(final Doc doc) {
    return 2 * doc.getDrawingUnit(drawingStaffSize) * (drawingLines - 1);
  }

  /**
   * Get the y position of a staff location relative to the top line.
   *
   * @param doc the document
   * @param loc the location, {@code 0} being the bottom line
   * @return the relative y, {@code 0} or negative inside the staff
   */
  public int calcPitchPosYRel(final Doc doc, final int loc) {
    final int staffLocOffset = (drawingLines - 1) * 2;
    return (loc - staffLocOffset) * doc.getDrawingUnit(drawingStaffSize);
  }

  /**
   * Determines if a y coordinate lies on a staff line.
   *
   * @param y the coordinate
   * @param doc the document
   * @return {@code true} if it does
   */
  public boolean isOnStaffLine(final int y, final Doc doc) {
    return (y - getDrawingY()) % (2 * doc.getDrawingUnit(drawingStaffSize)) == 0;
  }

  /**
   * Snap a y coordinate to the nearest position between two staff lines in the given direction.
   *
   * @param y the coordinate
   * @param doc the document
   * @param place {@link StaffRel#ABOVE} rounds up, {@link StaffRel#BELOW} rounds down
   * @return the snapped coordinate
   */
  public int getNearestInterStaffPosition(final int y, final Doc doc, final StaffRel place) {
    final int unit = doc.getDrawingUnit(drawingStaffSize);
    final int yPos = y - getDrawingY();
    int distance = yPos % unit;
    if (place == StaffRel.ABOVE) {
      if (distance > 0) {
        distance = unit - distance;
      }
      return y - distance + unit;
    } else {
      if (distance < 0) {
        distance = unit + distance;
      }
      return y - distance - unit;
    }
  }

  /**
   * Determines if the staff is drawn, according to the score definition of its system.
   *
   * @return {@code true} unless the resolved staff definition is hidden
   */
  public boolean isDrawingVisible() {
    final ScoreSystem system = requireAncestor(ScoreSystem.class);
    final ScoreDef scoreDef = system.getDrawingScoreDef();
    checkState(scoreDef != null, "No score definition set for system '%s'", system.getId());
    final StaffDef staffDef = scoreDef.getStaffDef(n);
    return staffDef == null || staffDef.getDrawingVisibility() != Visibility.HIDDEN;
  }

  public boolean isMensural() {
    return drawingNotationType.isMensural();
  }

  public boolean isNeume() {
    return drawingNotationType.isNeume();
  }

  public boolean isTablature() {
    return drawingNotationType.isTablature();
  }

  public boolean isTabGuitar() {
    return drawingNotationType == NotationType.TAB_GUITAR;
  }

  /**
   * Determines if the stems of a tablature staff are drawn outside of it. Only guitar tablature
   * typed {@code stems.within} draws them inside.
   *
   * @return {@code true} if stems are drawn outside
   */
  public boolean isTabWithStemsOutside() {
    if (drawingStaffDef == null) {
      return false;
    }
    return !isTabGuitar() || !drawingStaffDef.hasType() || !"stems.within".equals(drawingStaffDef.getType());
  }

  // ------------------------------------------------------------------------
  // Ledger lines
  // ------------------------------------------------------------------------

  /**
   * Add a dash to each of the first {@code count} ledger lines above the staff.
   *
   * @param count the number of ledger lines
   * @param left left edge of the dash
   * @param right right edge of the dash
   * @param extension the extension used for merging
   * @param cueSize {@code true} for cue-sized notes
   */
  public void addLedgerLineAbove(final @NonNegative int count, final int left, final int right, final int extension,
      final boolean cueSize) {
    addLedgerLines(cueSize ? ledgerLinesAboveCue : ledgerLinesAbove, count, left, right, extension);
  }

  /**
   * Add a dash to each of the first {@code count} ledger lines below the staff.
   *
   * @param count the number of ledger lines
   * @param left left edge of the dash
   * @param right right edge of the dash
   * @param extension the extension used for merging
   * @param cueSize {@code true} for cue-sized notes
   */
  public void addLedgerLineBelow(final @NonNegative int count, final int left, final int right, final int extension,
      final boolean cueSize) {
    addLedgerLines(cueSize ? ledgerLinesBelowCue : ledgerLinesBelow, count, left, right, extension);
  }

  private static void addLedgerLines(final List<LedgerLine> lines, final int count, final int left, final int right,
      final int extension) {
    checkArgument(left < right, "left (%s) must be < right (%s)", left, right);
    checkArgument(count >= 0, "count must be >= 0!");
    while (lines.size() < count) {
      lines.add(new LedgerLine());
    }
    for (int i = 0; i < count; i++) {
      lines.get(i).addDash(left, right, extension);
    }
  }

  public List<LedgerLine> getLedgerLinesAbove() {
    return Collections.unmodifiableList(ledgerLinesAbove);
  }

  public List<LedgerLine> getLedgerLinesBelow() {
    return Collections.unmodifiableList(ledgerLinesBelow);
  }

  public List<LedgerLine> getLedgerLinesAboveCue() {
    return Collections.unmodifiableList(ledgerLinesAboveCue);
  }

  public List<LedgerLine> getLedgerLinesBelowCue() {
    return Collections.unmodifiableList(ledgerLinesBelowCue);
  }

  public void clearLedgerLines() {
    ledgerLinesAbove.clear();
    ledgerLinesBelow.clear();
    ledgerLinesAboveCue.clear();
    ledgerLinesBelowCue.clear();
  }

  // ------------------------------------------------------------------------
  // Time-spanning elements
  // ------------------------------------------------------------------------

  public List<Node> getTimeSpanningElements() {
    return Collections.unmodifiableList(timeSpanningElements);
  }

  public void addTimeSpanningElement(final Node element) {
    timeSpanningElements.add(requireNonNull(element));
  }

  public void clearTimeSpanningElements() {
    timeSpanningElements.clear();
  }

  /**
   * Unbind the alignment and drop everything derived from it.
   */
  public void resetVerticalAlignment() {
    staffAlignment = null;
    clearLedgerLines();
    resetDrawingCaches();
  }

  // ------------------------------------------------------------------------
  // Tree
  // ------------------------------------------------------------------------

  /**
   * Layers without a number are numbered after the layers already present.
   */
  @Override
  protected boolean isSupportedChild(final Node child) {
    if (child instanceof Layer) {
      final Layer layer = (Layer) child;
      if (!layer.hasN()) {
        layer.setN(getChildCount(NodeKind.LAYER) + 1);
      }
      return true;
    }
    return child.getKind().isEditorialElement();
  }

  public List<Layer> getLayers() {
    return findDescendants(Layer.class);
  }

  @Override
  public Staff clone() {
    return (Staff) super.clone();
  }

  @Override
  public Staff cloneWithoutChildren() {
    return (Staff) super.cloneWithoutChildren();
  }

  @Override
  protected void cloneReset() {
    super.cloneReset();
    final FacsimileDelegate copy = new FacsimileDelegate();
    copy.setFacs(facsimile.getFacs());
    final Zone zone = facsimile.getZone();
    if (zone != null) {
      copy.attachZone(zone);
    }
    facsimile = copy;
    resetDrawingState();
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitStaff(this);
  }

  @Override
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitStaff(this);
  }

  @Override
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitStaffEnd(this);
  }

  @Override
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitStaffEnd(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("n", n)
                      .add("drawingLines", drawingLines)
                      .add("drawingStaffSize", drawingStaffSize)
                      .add("drawingNotationType", drawingNotationType)
                      .toString();
  }
}
