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
import io.notix.node.data.SylConnector;
import io.notix.node.data.WordPos;
import io.notix.node.layer.Note;
import io.notix.node.layer.Syl;
import io.notix.node.layer.Verse;
import io.notix.node.score.Layer;
import io.notix.node.score.Staff;

import java.util.HashMap;
import java.util.Map;

/**
 * Sets start and end of the syllables. A syllable starts on its note. A syllable within a word ends
 * on the note of the next syllable of the same verse in the same staff and layer; a syllable with an
 * extender ends on the last note of the layer before that next syllable. Call {@link #finish()}
 * after the traversal to close the extenders still open at the end of the document.
 */
public final class PrepareLyricsVisitor implements NodeVisitor {

  private record LayerKey(int staffN, int layerN) {
  }

  private record VerseKey(LayerKey layer, int verseN) {
  }

  /** Previous syllable per verse. */
  private final Map<VerseKey, Syl> currentSyls = new HashMap<>();

  /** Last note per layer. */
  private final Map<LayerKey, Note> lastNotes = new HashMap<>();

  private int staffN;

  private int layerN;

  @Override
  public VisitResult visitStaff(final Staff staff) {
    staffN = staff.getN();
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitLayer(final Layer layer) {
    layerN = layer.getN();
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitNoteEnd(final Note note) {
    lastNotes.put(new LayerKey(staffN, layerN), note);
    return VisitResultType.CONTINUE;
  }

  @Override
  public VisitResult visitSyl(final Syl syl) {
    final Note note = syl.getFirstAncestor(Note.class);
    final Verse verse = syl.getVerse();
    if (note == null || verse == null) {
      return VisitResultType.SKIPSUBTREE;
    }
    final LayerKey layerKey = new LayerKey(staffN, layerN);
    final VerseKey verseKey = new VerseKey(layerKey, verse.getN());

    final Syl previous = currentSyls.get(verseKey);
    if (previous != null) {
      if (previous.getWordPos() == WordPos.INITIAL || previous.getWordPos() == WordPos.MEDIAL) {
        previous.setEnd(note);
      } else if (previous.getCon() == SylConnector.EXTENDER) {
        previous.setEnd(lastNotes.get(layerKey));
      }
    }

    syl.setStart(note);
    currentSyls.put(verseKey, syl);
    return VisitResultType.SKIPSUBTREE;
  }

  /**
   * Close the extenders of the last syllables on the last note of their layer.
   */
  public void finish() {
    for (final Map.Entry<VerseKey, Syl> entry : currentSyls.entrySet()) {
      final Syl syl = entry.getValue();
      if (syl.getCon() == SylConnector.EXTENDER && syl.getEnd() == null) {
        syl.setEnd(lastNotes.get(entry.getKey().layer()));
      }
    }
    currentSyls.clear();
  }
}
