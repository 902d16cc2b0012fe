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

import io.notix.exception.NotixIOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link LayoutOptions}.
 */
@DisplayName("LayoutOptions")
class LayoutOptionsTest {

  @Nested
  @DisplayName("Builder")
  class BuilderTests {

    @Test
    @DisplayName("the defaults describe an A4 page")
    void testDefaults() {
      final LayoutOptions options = LayoutOptions.defaults();
      assertEquals(9, options.getUnit());
      assertFalse(options.isLyricVerseCollapse());
      assertEquals(HiddenStaffPolicy.NONE, options.getHiddenStaffPolicy());
      assertEquals(12, options.getSpacingStaff());
      assertEquals(4, options.getSpacingSystem());
      assertEquals(2000, options.getContentWidth());
      assertEquals(2870, options.getContentHeight());
    }

    @Test
    @DisplayName("toBuilder keeps every option")
    void testToBuilder() {
      final LayoutOptions options =
          LayoutOptions.newBuilder().unit(12).lyricVerseCollapse(true).pageWidth(1000).spacingLinear(0.3).build();
      assertEquals(options, options.toBuilder().build());
    }

    @Test
    @DisplayName("invalid values are rejected")
    void testValidation() {
      assertThrows(IllegalArgumentException.class, () -> LayoutOptions.newBuilder().unit(0));
      assertThrows(IllegalArgumentException.class, () -> LayoutOptions.newBuilder().spacingStaff(-1));
      assertThrows(IllegalArgumentException.class, () -> LayoutOptions.newBuilder().spacingNonLinear(1.5));
      assertThrows(IllegalArgumentException.class, () -> LayoutOptions.newBuilder().cueScaling(0));
      assertThrows(NullPointerException.class, () -> LayoutOptions.newBuilder().hiddenStaffPolicy(null));
      assertThrows(IllegalArgumentException.class,
          () -> LayoutOptions.newBuilder().pageWidth(100).pageMarginLeft(50).pageMarginRight(50).build());
    }

    @Test
    @DisplayName("options are values")
    void testEquals() {
      assertEquals(LayoutOptions.defaults(), LayoutOptions.newBuilder().build());
      assertEquals(LayoutOptions.defaults().hashCode(), LayoutOptions.newBuilder().build().hashCode());
      assertNotEquals(LayoutOptions.defaults(), LayoutOptions.newBuilder().unit(10).build());
      assertNotEquals(LayoutOptions.defaults(),
                      LayoutOptions.newBuilder().hiddenStaffPolicy(HiddenStaffPolicy.CONDENSE_EMPTY).build());
    }
  }

  @Nested
  @DisplayName("JSON")
  class Json {

    @Test
    @DisplayName("options survive a JSON round trip")
    void testJson() {
      final LayoutOptions options = LayoutOptions.newBuilder()
                                                 .hiddenStaffPolicy(HiddenStaffPolicy.CONDENSE_EMPTY)
                                                 .lyricVerseCollapse(true)
                                                 .pageHeight(1500)
                                                 .ledgerLineExtension(0.6)
                                                 .build();
      final String json = options.toJson();
      assertTrue(json.contains("\"hiddenStaffPolicy\": \"condense-empty\""));
      assertEquals(options, LayoutOptions.fromJson(json));
    }

    @Test
    @DisplayName("missing options keep their default and unknown ones are skipped")
    void testPartialJson() {
      final LayoutOptions options = LayoutOptions.fromJson("{\"unit\": 12, \"font\": {\"name\": \"Leipzig\"}}");
      assertEquals(LayoutOptions.newBuilder().unit(12).build(), options);
    }

    @Test
    @DisplayName("an unknown policy falls back to none")
    void testUnknownPolicy() {
      final LayoutOptions options = LayoutOptions.fromJson("{\"hiddenStaffPolicy\": \"hide-all\"}");
      assertEquals(HiddenStaffPolicy.NONE, options.getHiddenStaffPolicy());
    }

    @Test
    @DisplayName("options are persisted to a file")
    void testSerialize(@TempDir final Path tempDir) {
      final Path file = tempDir.resolve("layout.json");
      final LayoutOptions options = LayoutOptions.newBuilder().spacingSystem(6).pageMarginTop(80).build();
      LayoutOptions.serialize(options, file);
      assertEquals(options, LayoutOptions.deserialize(file));
    }

    @Test
    @DisplayName("reading a missing file fails with an I/O exception")
    void testMissingFile(@TempDir final Path tempDir) {
      assertThrows(NotixIOException.class, () -> LayoutOptions.deserialize(tempDir.resolve("missing.json")));
    }
  }
}
