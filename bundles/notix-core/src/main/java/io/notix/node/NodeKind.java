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

package io.notix.node;

/**
 * Enumeration of the concrete node kinds. Every kind carries the prefix of the identifiers generated
 * for its nodes.
 */
public enum NodeKind {
  DOC("doc"),

  MDIV("mdiv"),

  SCORE("score"),

  SCORE_DEF("scoredef"),

  STAFF_GRP("staffgrp"),

  STAFF_DEF("staffdef"),

  LABEL("label"),

  TUNING("tuning"),

  SECTION("section"),

  PAGE("page"),

  SYSTEM("system"),

  MEASURE("measure"),

  STAFF("staff"),

  LAYER("layer"),

  NOTE("note", Category.LAYER_ELEMENT),

  REST("rest", Category.LAYER_ELEMENT),

  CLEF("clef", Category.LAYER_ELEMENT),

  MENSUR("mensur", Category.LAYER_ELEMENT),

  DOT("dot", Category.LAYER_ELEMENT),

  KEY_SIG("keysig", Category.LAYER_ELEMENT),

  BAR_LINE("barline", Category.LAYER_ELEMENT),

  KEY_ACCID("keyaccid"),

  VERSE("verse"),

  SYL("syl"),

  SUPPLIED("supplied", Category.EDITORIAL),

  FACSIMILE("facsimile"),

  ZONE("zone");

  private enum Category {
    STRUCTURE,

    LAYER_ELEMENT,

    EDITORIAL
  }

  /** Prefix of generated identifiers. */
  private final String idPrefix;

  /** Coarse classification. */
  private final Category category;

  NodeKind(final String name) {
    this(name, Category.STRUCTURE);
  }

  NodeKind(final String name, final Category category) {
    this.idPrefix = name + "-";
    this.category = category;
  }

  /**
   * Get the prefix of identifiers generated for nodes of this kind.
   *
   * @return the prefix, for instance {@code "staff-"}
   */
  public String getIdPrefix() {
    return idPrefix;
  }

  /**
   * Determines if nodes of this kind are events within a layer.
   *
   * @return {@code true} for notes, rests, clefs, mensuration signs, dots, key signatures and bar
   *         lines
   */
  public boolean isLayerElement() {
    return category == Category.LAYER_ELEMENT;
  }

  /**
   * Determines if nodes of this kind are editorial wrappers.
   *
   * @return {@code true} for editorial elements
   */
  public boolean isEditorialElement() {
    return category == Category.EDITORIAL;
  }
}
