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

package io.notix.node.data;

/**
 * Notation types of a staff.
 */
public enum NotationType {
  /** Not resolved yet. */
  NONE,

  /** Common music notation. */
  CMN,

  MENSURAL,

  MENSURAL_WHITE,

  MENSURAL_BLACK,

  NEUME,

  TAB,

  TAB_GUITAR,

  TAB_LUTE_ITALIAN,

  TAB_LUTE_FRENCH,

  TAB_LUTE_GERMAN;

  public boolean isMensural() {
    return this == MENSURAL || this == MENSURAL_WHITE || this == MENSURAL_BLACK;
  }

  public boolean isNeume() {
    return this == NEUME;
  }

  public boolean isTablature() {
    return this == TAB || this == TAB_GUITAR || this == TAB_LUTE_ITALIAN || this == TAB_LUTE_FRENCH
        || this == TAB_LUTE_GERMAN;
  }
}
