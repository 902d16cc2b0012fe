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

package io.notix.access;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import io.notix.mensural.Duration;
import io.notix.mensural.DurationReader;
import io.notix.mensural.MensurInfo;
import io.notix.node.Node;
import io.notix.node.data.Accidental;
import io.notix.node.data.ClefShape;
import io.notix.node.data.NotationType;
import io.notix.node.data.PitchName;
import io.notix.node.data.SylConnector;
import io.notix.node.data.WordPos;
import io.notix.node.layer.BarLine;
import io.notix.node.layer.Clef;
import io.notix.node.layer.Dot;
import io.notix.node.layer.KeyAccid;
import io.notix.node.layer.KeySig;
import io.notix.node.layer.Mensur;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.layer.Syl;
import io.notix.node.layer.Verse;
import io.notix.node.score.Doc;
import io.notix.node.score.DocType;
import io.notix.node.score.Label;
import io.notix.node.score.Layer;
import io.notix.node.score.Mdiv;
import io.notix.node.score.Measure;
import io.notix.node.score.Score;
import io.notix.node.score.ScoreDef;
import io.notix.node.score.Section;
import io.notix.node.score.Staff;
import io.notix.node.score.StaffDef;
import io.notix.node.score.StaffGrp;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Builds the tree of a raw document from a stream of mensural voice events and finally converts it
 * into a page based document.
 *
 * <p>
 * Voices are declared first. Every section then holds one unmeasured measure with one staff per
 * voice; voices without content in a section get an invisible staff. Events are appended to the
 * single layer of the current staff. The mensuration of a voice carries over from one section to
 * the next.
 * </p>
 *
 * <pre>
 * final Doc doc = new Doc();
 * new ScoreBuilder(doc).voice("Cantus")
 *                      .section("MensuralMusic")
 *                      .staff(1)
 *                      .clef("C", 1)
 *                      .note("G", 3, "Brevis", false)
 *                      .build();
 * </pre>
 */
public final class ScoreBuilder {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ScoreBuilder.class);

  private static final ImmutableMap<String, ClefShape> CLEF_SHAPES = ImmutableMap.of("C", ClefShape.C, "F",
      ClefShape.F, "G", ClefShape.G, "Frnd", ClefShape.F, "Fsqr", ClefShape.F);

  private static final ImmutableMap<String, Accidental> ACCIDENTALS = ImmutableMap.of("Bmol", Accidental.FLAT,
      "BmolDouble", Accidental.FLAT, "Bqua", Accidental.NATURAL, "Diesis", Accidental.SHARP);

  private static final ImmutableSet<String> CLEF_APPEARANCES = CLEF_SHAPES.keySet();

  private final Doc doc;

  private final Score score;

  /** The names of the voices, empty if unnamed. */
  private final List<String> voices = new ArrayList<>();

  /** The mensuration in effect, per voice. */
  private final List<MensurInfo> mensurInfos = new ArrayList<>();

  private @Nullable Measure currentSection;

  private @Nullable Layer currentLayer;

  private @Nullable Note currentNote;

  private int currentVoice;

  /** Determines if the next syllable continues a word. */
  private boolean inSyllable;

  private boolean built;

  /**
   * Constructor. Adds the musical division and the score to the document.
   *
   * @param doc the raw document to fill
   * @throws IllegalStateException if the document is not raw
   */
  public ScoreBuilder(final Doc doc) {
    this.doc = requireNonNull(doc);
    checkState(doc.getType() == DocType.RAW, "Document must be raw.");
    final Mdiv mdiv = new Mdiv();
    doc.addChild(mdiv);
    score = new Score();
    mdiv.addChild(score);
  }

  /**
   * Create a staff with default drawing values (5 lines, size 100).
   *
   * @param n the staff number
   * @return the staff
   */
  public static Staff createStaff(final int n) {
    return new Staff(n);
  }

  /**
   * Append a child, enforcing the supported child rules of the parent.
   *
   * @param parent the parent
   * @param child the child
   * @throws io.notix.exception.NotixUsageException if the parent does not support the child
   */
  public static void addChild(final Node parent, final Node child) {
    parent.addChild(child);
  }

  /**
   * Declare the next voice.
   *
   * @param name the name of the voice, may be empty
   * @return this builder instance
   */
  public ScoreBuilder voice(final String name) {
    checkState(currentSection == null, "Voices must be declared before the first section.");
    voices.add(requireNonNull(name));
    mensurInfos.add(MensurInfo.binary());
    return this;
  }

  public int getVoiceCount() {
    return voices.size();
  }

  /**
   * Start a new section holding an unmeasured measure. Closes the previous section.
   *
   * @param type the section type, for instance {@code MensuralMusic}
   * @return this builder instance
   */
  public ScoreBuilder section(final String type) {
    checkNotBuilt();
    closeSection();
    final Section section = new Section();
    section.setType(type);
    score.addChild(section);
    currentSection = new Measure(false, 1);
    section.addChild(currentSection);
    return this;
  }

  /**
   * Start the staff of a voice in the current section.
   *
   * @param voiceN the voice number, 1-based
   * @return this builder instance
   */
  public ScoreBuilder staff(final int voiceN) {
    checkNotBuilt();
    checkState(currentSection != null, "No section started.");
    checkArgument(voiceN >= 1 && voiceN <= voices.size(), "Voice %s is not declared.", voiceN);
    final Staff staff = createStaff(voiceN);
    final Layer layer = new Layer();
    layer.setN(1);
    staff.addChild(layer);
    insertStaff(currentSection, staff);

    currentLayer = layer;
    currentNote = null;
    currentVoice = voiceN;
    inSyllable = false;
    return this;
  }

  private static void insertStaff(final Measure measure, final Staff staff) {
    final int index = (int) measure.getStaves().stream().filter(other -> other.getN() < staff.getN()).count();
    measure.insertChild(staff, index);
  }

  /**
   * Append a clef.
   *
   * @param appearance the clef appearance, unknown ones map to a C clef
   * @param staffLoc the staff location of the clef
   * @return this builder instance
   */
  public ScoreBuilder clef(final String appearance, final int staffLoc) {
    final ClefShape shape = CLEF_SHAPES.getOrDefault(appearance, ClefShape.C);
    requireLayer().addChild(new Clef(shape, (staffLoc + 1) / 2));
    return this;
  }

  /**
   * Append a key signature holding a single accidental.
   *
   * @param appearance the accidental appearance, unknown ones map to a flat
   * @param letterName the pitch letter, unknown ones map to C
   * @param octaveNum the octave
   * @param staffLoc the staff location of the accidental
   * @return this builder instance
   */
  public ScoreBuilder keySig(final String appearance, final String letterName, final int octaveNum,
      final int staffLoc) {
    final Accidental accid = ACCIDENTALS.getOrDefault(appearance, Accidental.FLAT);
    final PitchName pname = readPitchName(letterName);
    final KeySig keySig = new KeySig();
    keySig.addChild(new KeyAccid(accid, pname, shiftOctave(pname, octaveNum), staffLoc - 1));
    requireLayer().addChild(keySig);
    return this;
  }

  /**
   * Append a mensuration sign.
   *
   * @param mensurInfo the new mensuration of the voice, or {@code null} to restate the current one
   * @return this builder instance
   */
  public ScoreBuilder mensuration(final @Nullable MensurInfo mensurInfo) {
    final Layer layer = requireLayer();
    if (mensurInfo != null) {
      mensurInfos.set(currentVoice - 1, mensurInfo);
    }
    layer.addChild(new Mensur(mensurInfos.get(currentVoice - 1)));
    return this;
  }

  /**
   * Append a note of nominal length.
   *
   * @param letterName the pitch letter, unknown ones map to C
   * @param octaveNum the octave, counted from A
   * @param type the note value label, unknown ones map to brevis
   * @param colored {@code true} for colored notation
   * @return this builder instance
   */
  public ScoreBuilder note(final String letterName, final int octaveNum, final String type, final boolean colored) {
    addNote(letterName, octaveNum, type, colored);
    return this;
  }

  /**
   * Append a note with an encoded length in minims.
   *
   * @param letterName the pitch letter, unknown ones map to C
   * @param octaveNum the octave, counted from A
   * @param type the note value label, unknown ones map to brevis
   * @param lengthNum numerator of the length
   * @param lengthDen denominator of the length
   * @param colored {@code true} for colored notation
   * @return this builder instance
   */
  public ScoreBuilder note(final String letterName, final int octaveNum, final String type, final int lengthNum,
      final int lengthDen, final boolean colored) {
    final Note note = addNote(letterName, octaveNum, type, colored);
    DurationReader.readProportion(note.getDur(), lengthNum, lengthDen, mensurInfos.get(currentVoice - 1))
                  .ifPresent(note::setProportion);
    return this;
  }

  private Note addNote(final String letterName, final int octaveNum, final String type, final boolean colored) {
    final Layer layer = requireLayer();
    final PitchName pname = readPitchName(letterName);
    final Note note = new Note(pname, shiftOctave(pname, octaveNum), DurationReader.readDuration(type));
    note.setColored(colored);
    layer.addChild(note);
    currentNote = note;
    return note;
  }

  /**
   * Append a rest of nominal length.
   *
   * @param type the note value label, unknown ones map to brevis
   * @return this builder instance
   */
  public ScoreBuilder rest(final String type) {
    requireLayer().addChild(new Rest(DurationReader.readDuration(type)));
    return this;
  }

  /**
   * Append a rest with an encoded length in minims.
   *
   * @param type the note value label, unknown ones map to brevis
   * @param lengthNum numerator of the length
   * @param lengthDen denominator of the length
   * @return this builder instance
   */
  public ScoreBuilder rest(final String type, final int lengthNum, final int lengthDen) {
    final Layer layer = requireLayer();
    final Duration dur = DurationReader.readDuration(type);
    final Rest rest = new Rest(dur);
    DurationReader.readProportion(dur, lengthNum, lengthDen, mensurInfos.get(currentVoice - 1))
                  .ifPresent(rest::setProportion);
    layer.addChild(rest);
    return this;
  }

  public ScoreBuilder dot() {
    requireLayer().addChild(new Dot());
    return this;
  }

  public ScoreBuilder barLine() {
    requireLayer().addChild(new BarLine());
    return this;
  }

  /**
   * Attach a syllable of the first verse to the last note. A syllable not ending its word is
   * connected to the next one with dashes.
   *
   * @param text the syllable
   * @param wordEnd {@code true} if the syllable ends its word
   * @return this builder instance
   */
  public ScoreBuilder syllable(final String text, final boolean wordEnd) {
    checkState(currentNote != null, "No note to attach the syllable '%s' to.", text);
    final Syl syl = new Syl(text);
    if (wordEnd) {
      syl.setWordPos(WordPos.TERMINAL);
      inSyllable = false;
    } else {
      syl.setWordPos(inSyllable ? WordPos.MEDIAL : WordPos.INITIAL);
      syl.setCon(SylConnector.DASHES);
      inSyllable = true;
    }
    final Verse verse = new Verse(1);
    verse.addChild(syl);
    currentNote.addChild(verse);
    return this;
  }

  /**
   * Append an event given by its element name and child values, keyed by their paths, for instance
   * {@code Pitch/LetterName}. A field present without value, such as {@code Colored}, maps to the
   * empty string. Unsupported events are skipped with a warning.
   *
   * @param name the event name
   * @param fields the child values
   * @return this builder instance
   */
  public ScoreBuilder event(final String name, final Map<String, String> fields) {
    switch (name) {
      case "Clef" -> {
        final String appearance = fields.getOrDefault("Appearance", "");
        if (!fields.containsKey("Signature") && CLEF_APPEARANCES.contains(appearance)) {
          clef(appearance, intField(fields, "StaffLoc"));
        } else {
          keySig(appearance, fields.getOrDefault("Pitch/LetterName", ""), intField(fields, "Pitch/OctaveNum"),
              intField(fields, "StaffLoc"));
        }
      }
      case "Dot" -> dot();
      case "Mensuration" -> mensuration(readMensurInfo(fields));
      case "Note" -> {
        final String letterName = fields.getOrDefault("LetterName", "");
        final int octaveNum = intField(fields, "OctaveNum");
        final String type = fields.getOrDefault("Type", "");
        final boolean colored = fields.containsKey("Colored");
        if (fields.containsKey("Length/Num") && fields.containsKey("Length/Den")) {
          note(letterName, octaveNum, type, intField(fields, "Length/Num"), intField(fields, "Length/Den"), colored);
        } else {
          note(letterName, octaveNum, type, colored);
        }
        if (fields.containsKey("ModernText/Syllable")) {
          syllable(fields.get("ModernText/Syllable"), fields.containsKey("ModernText/WordEnd"));
        }
      }
      case "OriginalText" -> {
        // Original spelling is not kept.
      }
      case "Rest" -> {
        final String type = fields.getOrDefault("Type", "");
        if (fields.containsKey("Length/Num") && fields.containsKey("Length/Den")) {
          rest(type, intField(fields, "Length/Num"), intField(fields, "Length/Den"));
        } else {
          rest(type);
        }
      }
      default -> LOGGER.warn("Unsupported event '{}'", name);
    }
    return this;
  }

  private static @Nullable MensurInfo readMensurInfo(final Map<String, String> fields) {
    if (fields.keySet().stream().noneMatch(key -> key.startsWith("MensInfo/"))) {
      return null;
    }
    return new MensurInfo(level(fields, "MensInfo/Prolatio"), level(fields, "MensInfo/Tempus"),
        level(fields, "MensInfo/ModusMinor"), level(fields, "MensInfo/ModusMaior"));
  }

  private static int level(final Map<String, String> fields, final String key) {
    return intField(fields, key) == 3 ? 3 : 2;
  }

  private static int intField(final Map<String, String> fields, final String key) {
    final String value = fields.get(key);
    final Integer parsed = value == null ? null : Ints.tryParse(value.trim());
    return parsed == null ? 0 : parsed;
  }

  private static PitchName readPitchName(final String letterName) {
    return PitchName.fromLetter(letterName).orElse(PitchName.C);
  }

  /**
   * Octaves are counted from A, except for the key accidentals and notes on A and B.
   */
  private static int shiftOctave(final PitchName pname, final int octaveNum) {
    return pname == PitchName.A || pname == PitchName.B ? octaveNum : octaveNum + 1;
  }

  /**
   * Add the score definition with one mensural staff definition per voice, and convert the document
   * into a page based document.
   *
   * @return the document
   */
  public Doc build() {
    checkNotBuilt();
    closeSection();

    final StaffGrp staffGrp = new StaffGrp();
    for (int i = 0; i < voices.size(); i++) {
      final StaffDef staffDef = new StaffDef(i + 1);
      staffDef.setLines(5);
      staffDef.setNotationType(NotationType.MENSURAL);
      if (!voices.get(i).isEmpty()) {
        staffDef.addChild(new Label(voices.get(i)));
      }
      staffDef.addChild(new Mensur(MensurInfo.binary()));
      staffGrp.addChild(staffDef);
    }
    final ScoreDef scoreDef = new ScoreDef();
    scoreDef.addChild(staffGrp);
    score.insertChild(scoreDef, 0);

    doc.convertToPageBasedDoc();
    built = true;
    LOGGER.debug("Built document with {} voices", voices.size());
    return doc;
  }

  private void closeSection() {
    if (currentSection == null) {
      return;
    }
    for (int n = 1; n <= voices.size(); n++) {
      if (currentSection.getStaff(n) == null) {
        final Staff staff = createStaff(n);
        staff.setVisible(false);
        insertStaff(currentSection, staff);
      }
    }
    currentLayer = null;
    currentNote = null;
  }

  private Layer requireLayer() {
    checkNotBuilt();
    checkState(currentLayer != null, "No staff started.");
    return currentLayer;
  }

  private void checkNotBuilt() {
    checkState(!built, "Document is already built.");
  }
}
