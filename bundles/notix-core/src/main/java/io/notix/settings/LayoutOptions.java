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

package io.notix.settings;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.notix.exception.NotixIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Options of the layout. Lengths are given in units, the base spacing quantum, except for the unit
 * itself and the page dimensions, which are given in drawing coordinates.
 * </p>
 * <p>
 * Options are immutable and built with {@link #newBuilder()}. They can be persisted as JSON.
 * </p>
 */
public final class LayoutOptions {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutOptions.class);

  private static final String UNIT = "unit";

  private static final String LYRIC_VERSE_COLLAPSE = "lyricVerseCollapse";

  private static final String HIDDEN_STAFF_POLICY = "hiddenStaffPolicy";

  private static final String SPACING_STAFF = "spacingStaff";

  private static final String SPACING_SYSTEM = "spacingSystem";

  private static final String LYRIC_SIZE = "lyricSize";

  private static final String LEDGER_LINE_EXTENSION = "ledgerLineExtension";

  private static final String CUE_SCALING = "cueScaling";

  private static final String SPACING_LINEAR = "spacingLinear";

  private static final String SPACING_NON_LINEAR = "spacingNonLinear";

  private static final String PAGE_WIDTH = "pageWidth";

  private static final String PAGE_HEIGHT = "pageHeight";

  private static final String PAGE_MARGIN_LEFT = "pageMarginLeft";

  private static final String PAGE_MARGIN_RIGHT = "pageMarginRight";

  private static final String PAGE_MARGIN_TOP = "pageMarginTop";

  private static final String PAGE_MARGIN_BOTTOM = "pageMarginBottom";

  private final int unit;

  private final boolean lyricVerseCollapse;

  private final HiddenStaffPolicy hiddenStaffPolicy;

  private final double spacingStaff;

  private final double spacingSystem;

  private final double lyricSize;

  private final double ledgerLineExtension;

  private final double cueScaling;

  private final double spacingLinear;

  private final double spacingNonLinear;

  private final int pageWidth;

  private final int pageHeight;

  private final int pageMarginLeft;

  private final int pageMarginRight;

  private final int pageMarginTop;

  private final int pageMarginBottom;

  private LayoutOptions(final Builder builder) {
    unit = builder.unit;
    lyricVerseCollapse = builder.lyricVerseCollapse;
    hiddenStaffPolicy = builder.hiddenStaffPolicy;
    spacingStaff = builder.spacingStaff;
    spacingSystem = builder.spacingSystem;
    lyricSize = builder.lyricSize;
    ledgerLineExtension = builder.ledgerLineExtension;
    cueScaling = builder.cueScaling;
    spacingLinear = builder.spacingLinear;
    spacingNonLinear = builder.spacingNonLinear;
    pageWidth = builder.pageWidth;
    pageHeight = builder.pageHeight;
    pageMarginLeft = builder.pageMarginLeft;
    pageMarginRight = builder.pageMarginRight;
    pageMarginTop = builder.pageMarginTop;
    pageMarginBottom = builder.pageMarginBottom;
  }

  /**
   * Get a new builder instance with the default options.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get the default options.
   *
   * @return the default options
   */
  public static LayoutOptions defaults() {
    return newBuilder().build();
  }

  /**
   * Get a builder initialized with these options.
   *
   * @return {@link Builder} instance
   */
  public Builder toBuilder() {
    return new Builder().unit(unit)
                        .lyricVerseCollapse(lyricVerseCollapse)
                        .hiddenStaffPolicy(hiddenStaffPolicy)
                        .spacingStaff(spacingStaff)
                        .spacingSystem(spacingSystem)
                        .lyricSize(lyricSize)
                        .ledgerLineExtension(ledgerLineExtension)
                        .cueScaling(cueScaling)
                        .spacingLinear(spacingLinear)
                        .spacingNonLinear(spacingNonLinear)
                        .pageWidth(pageWidth)
                        .pageHeight(pageHeight)
                        .pageMarginLeft(pageMarginLeft)
                        .pageMarginRight(pageMarginRight)
                        .pageMarginTop(pageMarginTop)
                        .pageMarginBottom(pageMarginBottom);
  }

  public int getUnit() {
    return unit;
  }

  public boolean isLyricVerseCollapse() {
    return lyricVerseCollapse;
  }

  public HiddenStaffPolicy getHiddenStaffPolicy() {
    return hiddenStaffPolicy;
  }

  public double getSpacingStaff() {
    return spacingStaff;
  }

  public double getSpacingSystem() {
    return spacingSystem;
  }

  public double getLyricSize() {
    return lyricSize;
  }

  public double getLedgerLineExtension() {
    return ledgerLineExtension;
  }

  public double getCueScaling() {
    return cueScaling;
  }

  public double getSpacingLinear() {
    return spacingLinear;
  }

  public double getSpacingNonLinear() {
    return spacingNonLinear;
  }

  public int getPageWidth() {
    return pageWidth;
  }

  public int getPageHeight() {
    return pageHeight;
  }

  public int getPageMarginLeft() {
    return pageMarginLeft;
  }

  public int getPageMarginRight() {
    return pageMarginRight;
  }

  public int getPageMarginTop() {
    return pageMarginTop;
  }

  public int getPageMarginBottom() {
    return pageMarginBottom;
  }

  /**
   * Get the width available for the systems of a page.
   *
   * @return page width minus the left and right margins
   */
  public int getContentWidth() {
    return pageWidth - pageMarginLeft - pageMarginRight;
  }

  /**
   * Get the height available for the systems of a page.
   *
   * @return page height minus the top and bottom margins
   */
  public int getContentHeight() {
    return pageHeight - pageMarginTop - pageMarginBottom;
  }

  /**
   * Serialize the options.
   *
   * @param options the options to serialize
   * @param file the file to write
   * @throws NotixIOException if an I/O error occurs
   */
  public static void serialize(final LayoutOptions options, final Path file) {
    try (final Writer fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(options, fileWriter);
    } catch (final IOException e) {
      throw new NotixIOException("Could not write layout options to " + file, e);
    }
  }

  /**
   * Deserialize options.
   *
   * @param file the file to read
   * @return the options
   * @throws NotixIOException if an I/O error occurs
   */
  public static LayoutOptions deserialize(final Path file) {
    try (final Reader fileReader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(fileReader);
    } catch (final IOException e) {
      throw new NotixIOException("Could not read layout options from " + file, e);
    }
  }

  /**
   * Get the options as JSON.
   *
   * @return the JSON string
   */
  public String toJson() {
    final StringWriter writer = new StringWriter();
    try {
      write(this, writer);
    } catch (final IOException e) {
      throw new NotixIOException(e);
    }
    return writer.toString();
  }

  /**
   * Read options from JSON. Missing options keep their default, unknown ones are skipped.
   *
   * @param json the JSON string
   * @return the options
   */
  public static LayoutOptions fromJson(final String json) {
    try {
      return read(new StringReader(json));
    } catch (final IOException e) {
      throw new NotixIOException(e);
    }
  }

  private static void write(final LayoutOptions options, final Writer writer) throws IOException {
    try (final JsonWriter jsonWriter = new JsonWriter(writer)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name(UNIT).value(options.unit);
      jsonWriter.name(LYRIC_VERSE_COLLAPSE).value(options.lyricVerseCollapse);
      jsonWriter.name(HIDDEN_STAFF_POLICY).value(options.hiddenStaffPolicy.toString());
      jsonWriter.name(SPACING_STAFF).value(options.spacingStaff);
      jsonWriter.name(SPACING_SYSTEM).value(options.spacingSystem);
      jsonWriter.name(LYRIC_SIZE).value(options.lyricSize);
      jsonWriter.name(LEDGER_LINE_EXTENSION).value(options.ledgerLineExtension);
      jsonWriter.name(CUE_SCALING).value(options.cueScaling);
      jsonWriter.name(SPACING_LINEAR).value(options.spacingLinear);
      jsonWriter.name(SPACING_NON_LINEAR).value(options.spacingNonLinear);
      jsonWriter.name(PAGE_WIDTH).value(options.pageWidth);
      jsonWriter.name(PAGE_HEIGHT).value(options.pageHeight);
      jsonWriter.name(PAGE_MARGIN_LEFT).value(options.pageMarginLeft);
      jsonWriter.name(PAGE_MARGIN_RIGHT).value(options.pageMarginRight);
      jsonWriter.name(PAGE_MARGIN_TOP).value(options.pageMarginTop);
      jsonWriter.name(PAGE_MARGIN_BOTTOM).value(options.pageMarginBottom);
      jsonWriter.endObject();
    }
  }

  private static LayoutOptions read(final Reader reader) throws IOException {
    final Builder builder = newBuilder();
    try (final JsonReader jsonReader = new JsonReader(reader)) {
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case UNIT -> builder.unit(jsonReader.nextInt());
          case LYRIC_VERSE_COLLAPSE -> builder.lyricVerseCollapse(jsonReader.nextBoolean());
          case HIDDEN_STAFF_POLICY -> {
            final String value = jsonReader.nextString();
            builder.hiddenStaffPolicy(HiddenStaffPolicy.fromString(value).orElseGet(() -> {
              LOGGER.warn("Unknown hidden staff policy '{}', using {}", value, HiddenStaffPolicy.NONE);
              return HiddenStaffPolicy.NONE;
            }));
          }
          case SPACING_STAFF -> builder.spacingStaff(jsonReader.nextDouble());
          case SPACING_SYSTEM -> builder.spacingSystem(jsonReader.nextDouble());
          case LYRIC_SIZE -> builder.lyricSize(jsonReader.nextDouble());
          case LEDGER_LINE_EXTENSION -> builder.ledgerLineExtension(jsonReader.nextDouble());
          case CUE_SCALING -> builder.cueScaling(jsonReader.nextDouble());
          case SPACING_LINEAR -> builder.spacingLinear(jsonReader.nextDouble());
          case SPACING_NON_LINEAR -> builder.spacingNonLinear(jsonReader.nextDouble());
          case PAGE_WIDTH -> builder.pageWidth(jsonReader.nextInt());
          case PAGE_HEIGHT -> builder.pageHeight(jsonReader.nextInt());
          case PAGE_MARGIN_LEFT -> builder.pageMarginLeft(jsonReader.nextInt());
          case PAGE_MARGIN_RIGHT -> builder.pageMarginRight(jsonReader.nextInt());
          case PAGE_MARGIN_TOP -> builder.pageMarginTop(jsonReader.nextInt());
          case PAGE_MARGIN_BOTTOM -> builder.pageMarginBottom(jsonReader.nextInt());
          default -> {
            LOGGER.warn("Skipping unknown layout option '{}'", name);
            jsonReader.skipValue();
          }
        }
      }
      jsonReader.endObject();
    }
    return builder.build();
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LayoutOptions)) {
      return false;
    }
    final LayoutOptions other = (LayoutOptions) obj;
    return unit == other.unit && lyricVerseCollapse == other.lyricVerseCollapse
        && hiddenStaffPolicy == other.hiddenStaffPolicy && spacingStaff == other.spacingStaff
        && spacingSystem == other.spacingSystem && lyricSize == other.lyricSize
        && ledgerLineExtension == other.ledgerLineExtension && cueScaling == other.cueScaling
        && spacingLinear == other.spacingLinear && spacingNonLinear == other.spacingNonLinear
        && pageWidth == other.pageWidth && pageHeight == other.pageHeight && pageMarginLeft == other.pageMarginLeft
        && pageMarginRight == other.pageMarginRight && pageMarginTop == other.pageMarginTop
        && pageMarginBottom == other.pageMarginBottom;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(unit, lyricVerseCollapse, hiddenStaffPolicy, spacingStaff, spacingSystem, lyricSize,
        ledgerLineExtension, cueScaling, spacingLinear, spacingNonLinear, pageWidth, pageHeight, pageMarginLeft,
        pageMarginRight, pageMarginTop, pageMarginBottom);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add(UNIT, unit)
                      .add(LYRIC_VERSE_COLLAPSE, lyricVerseCollapse)
                      .add(HIDDEN_STAFF_POLICY, hiddenStaffPolicy)
                      .add(SPACING_STAFF, spacingStaff)
                      .add(SPACING_SYSTEM, spacingSystem)
                      .add(PAGE_WIDTH, pageWidth)
                      .add(PAGE_HEIGHT, pageHeight)
                      .toString();
  }

  /**
   * Builder for {@link LayoutOptions}. Every option starts with its default.
   */
  public static final class Builder {

    private int unit = 9;

    private boolean lyricVerseCollapse;

    private HiddenStaffPolicy hiddenStaffPolicy = HiddenStaffPolicy.NONE;

    private double spacingStaff = 12;

    private double spacingSystem = 4;

    private double lyricSize = 4.5;

    private double ledgerLineExtension = 0.54;

    private double cueScaling = 0.75;

    private double spacingLinear = 0.25;

    private double spacingNonLinear = 0.6;

    private int pageWidth = 2100;

    private int pageHeight = 2970;

    private int pageMarginLeft = 50;

    private int pageMarginRight = 50;

    private int pageMarginTop = 50;

    private int pageMarginBottom = 50;

    private Builder() {
    }

    /**
     * Set the unit, half the distance between two staff lines at staff size 100.
     *
     * @param unit the unit
     * @return this builder instance
     */
    public Builder unit(final int unit) {
      checkArgument(unit > 0, "unit must be > 0!");
      this.unit = unit;
      return this;
    }

    /**
     * Collapse the lyric slots of missing verses.
     *
     * @param lyricVerseCollapse {@code true} to reserve slots only for verses that occur
     * @return this builder instance
     */
    public Builder lyricVerseCollapse(final boolean lyricVerseCollapse) {
      this.lyricVerseCollapse = lyricVerseCollapse;
      return this;
    }

    public Builder hiddenStaffPolicy(final HiddenStaffPolicy hiddenStaffPolicy) {
      this.hiddenStaffPolicy = requireNonNull(hiddenStaffPolicy);
      return this;
    }

    public Builder spacingStaff(final double spacingStaff) {
      checkArgument(spacingStaff >= 0, "spacingStaff must be >= 0!");
      this.spacingStaff = spacingStaff;
      return this;
    }

    public Builder spacingSystem(final double spacingSystem) {
      checkArgument(spacingSystem >= 0, "spacingSystem must be >= 0!");
      this.spacingSystem = spacingSystem;
      return this;
    }

    public Builder lyricSize(final double lyricSize) {
      checkArgument(lyricSize > 0, "lyricSize must be > 0!");
      this.lyricSize = lyricSize;
      return this;
    }

    public Builder ledgerLineExtension(final double ledgerLineExtension) {
      checkArgument(ledgerLineExtension >= 0, "ledgerLineExtension must be >= 0!");
      this.ledgerLineExtension = ledgerLineExtension;
      return this;
    }

    public Builder cueScaling(final double cueScaling) {
      checkArgument(cueScaling > 0 && cueScaling <= 1, "cueScaling must be in (0, 1]!");
      this.cueScaling = cueScaling;
      return this;
    }

    public Builder spacingLinear(final double spacingLinear) {
      checkArgument(spacingLinear > 0, "spacingLinear must be > 0!");
      this.spacingLinear = spacingLinear;
      return this;
    }

    public Builder spacingNonLinear(final double spacingNonLinear) {
      checkArgument(spacingNonLinear > 0 && spacingNonLinear <= 1, "spacingNonLinear must be in (0, 1]!");
      this.spacingNonLinear = spacingNonLinear;
      return this;
    }

    public Builder pageWidth(final int pageWidth) {
      checkArgument(pageWidth > 0, "pageWidth must be > 0!");
      this.pageWidth = pageWidth;
      return this;
    }

    public Builder pageHeight(final int pageHeight) {
      checkArgument(pageHeight > 0, "pageHeight must be > 0!");
      this.pageHeight = pageHeight;
      return this;
    }

    public Builder pageMarginLeft(final int pageMarginLeft) {
      checkArgument(pageMarginLeft >= 0, "pageMarginLeft must be >= 0!");
      this.pageMarginLeft = pageMarginLeft;
      return this;
    }

    public Builder pageMarginRight(final int pageMarginRight) {
      checkArgument(pageMarginRight >= 0, "pageMarginRight must be >= 0!");
      this.pageMarginRight = pageMarginRight;
      return this;
    }

    public Builder pageMarginTop(final int pageMarginTop) {
      checkArgument(pageMarginTop >= 0, "pageMarginTop must be >= 0!");
      this.pageMarginTop = pageMarginTop;
      return this;
    }

    public Builder pageMarginBottom(final int pageMarginBottom) {
      checkArgument(pageMarginBottom >= 0, "pageMarginBottom must be >= 0!");
      this.pageMarginBottom = pageMarginBottom;
      return this;
    }

    /**
     * Build the options.
     *
     * @return new {@link LayoutOptions} instance
     */
    public LayoutOptions build() {
      checkArgument(pageMarginLeft + pageMarginRight < pageWidth, "Horizontal margins exceed the page width.");
      checkArgument(pageMarginTop + pageMarginBottom < pageHeight, "Vertical margins exceed the page height.");
      return new LayoutOptions(this);
    }
  }
}
