/*
 * ModifierSequenceEnumerator.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Emojidump, an sbix colour emoji extractor.
 *
 * Emojidump is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Emojidump is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Emojidump.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.emojidump;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bluezoo.emojidump.CodepointSequence.FEMALE_SIGN;
import static org.bluezoo.emojidump.CodepointSequence.MALE_SIGN;
import static org.bluezoo.emojidump.CodepointSequence.SKIN_TONE_1;
import static org.bluezoo.emojidump.CodepointSequence.VS16;
import static org.bluezoo.emojidump.CodepointSequence.ZWJ;

/**
 * Synthesizes the skin tone sequences a colour emoji font should expose
 * and finds their images among glyphs named differently.
 * <p>
 * For each emoji whose first codepoint is a modifier base, five sequences
 * are generated, one per skin tone. If the emoji contains the male sign
 * they take the form {@code base tone ZWJ MALE VS16}; otherwise they are
 * the plain {@code base tone} pairs, followed by five more of the form
 * {@code base tone ZWJ FEMALE VS16}, since fonts encode the default skin
 * tone glyph directly but the explicit female variant only as a longer
 * joined sequence.
 * <p>
 * A glyph renders a sequence if its candidate set contains the sequence,
 * or the sequence followed by {@code VS16 ZWJ FEMALE}. When the sequence
 * carries a skin tone only glyphs whose names have a {@code .1} to
 * {@code .5} suffix are considered. The first such glyph in glyph ID
 * order wins.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ModifierSequenceEnumerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModifierSequenceEnumerator.class);

    private static final Pattern TONED_NAME = Pattern.compile("\\.[1-5]($|\\.)");

    private static final int NUM_SKIN_TONES = 5;

    private final ModifierBases bases;
    private final SequenceResolver resolver;

    /**
     * Creates an enumerator.
     *
     * @param bases the modifier bases, computed once per run
     * @param resolver the resolver used to match glyph names
     */
    public ModifierSequenceEnumerator(ModifierBases bases, SequenceResolver resolver) {
        this.bases = bases;
        this.resolver = resolver;
    }

    public ModifierBases getBases() {
        return bases;
    }

    /**
     * Indicates whether an emoji has modifier sequences.
     *
     * @param emoji the emoji
     * @return true if its first codepoint is a modifier base
     */
    public boolean hasModifierSequences(CodepointSequence emoji) {
        return emoji.length() > 0 && bases.contains(emoji.codepointAt(0));
    }

    /**
     * Generates the skin tone sequences for an emoji.
     *
     * @param emoji the emoji
     * @return 5 or 10 sequences, or an empty list if the emoji's first
     *         codepoint is not a modifier base
     */
    public List<CodepointSequence> sequencesFor(CodepointSequence emoji) {
        if (!hasModifierSequences(emoji)) {
            return Collections.emptyList();
        }
        int base = emoji.codepointAt(0);
        List<CodepointSequence> sequences = new ArrayList<>();
        if (emoji.contains(MALE_SIGN)) {
            for (int i = 0; i < NUM_SKIN_TONES; i++) {
                sequences.add(CodepointSequence.of(base, SKIN_TONE_1 + i, ZWJ, MALE_SIGN, VS16));
            }
        } else {
            for (int i = 0; i < NUM_SKIN_TONES; i++) {
                sequences.add(CodepointSequence.of(base, SKIN_TONE_1 + i));
            }
            for (int i = 0; i < NUM_SKIN_TONES; i++) {
                sequences.add(CodepointSequence.of(base, SKIN_TONE_1 + i, ZWJ, FEMALE_SIGN, VS16));
            }
        }
        return sequences;
    }

    /**
     * Finds the glyph that renders a sequence. Builds a fresh index of the
     * bitmaps for this one lookup; {@link #synthesize} shares one index.
     *
     * @param bitmaps the bitmaps of the font, in glyph ID order
     * @param sequence the sequence
     * @return the first matching bitmap, or null if none matches
     */
    GlyphBitmap findBitmap(List<GlyphBitmap> bitmaps, CodepointSequence sequence) {
        return new GlyphLookup(bitmaps).find(sequence);
    }

    /**
     * Reports a derived emoji for every generated sequence of every emoji
     * in the resolver's database that the handler has no image for and
     * that some glyph of the font renders.
     *
     * @param font the font
     * @param handler receives the derived emoji
     * @return the number of derived emoji reported
     * @throws IOException if the handler fails to store an image
     */
    public int synthesize(EmojiFont font, EmojiHandler handler) throws IOException {
        GlyphLookup lookup = new GlyphLookup(font.getBitmaps());
        Set<CodepointSequence> seen = new HashSet<>();
        int count = 0;
        for (CodepointSequence emoji : resolver.getDatabase().getSequences()) {
            for (CodepointSequence sequence : sequencesFor(emoji)) {
                if (!seen.add(sequence) || handler.hasEmoji(sequence)) {
                    continue;
                }
                GlyphBitmap bitmap = lookup.find(sequence);
                if (bitmap == null) {
                    LOGGER.debug("No glyph for {}", sequence);
                    continue;
                }
                LOGGER.debug("{} rendered by {}", sequence, bitmap);
                handler.derivedEmoji(sequence, bitmap);
                count++;
            }
        }
        return count;
    }

    /**
     * Candidate sequences of every glyph, keeping the first glyph for each.
     */
    private final class GlyphLookup {

        private final Map<CodepointSequence, GlyphBitmap> all = new HashMap<>();
        private final Map<CodepointSequence, GlyphBitmap> toned = new HashMap<>();

        GlyphLookup(List<GlyphBitmap> bitmaps) {
            for (GlyphBitmap bitmap : bitmaps) {
                boolean isToned = TONED_NAME.matcher(bitmap.getGlyphName()).find();
                for (CodepointSequence candidate : resolver.candidates(bitmap.getGlyphName())) {
                    all.putIfAbsent(candidate, bitmap);
                    if (isToned) {
                        toned.putIfAbsent(candidate, bitmap);
                    }
                }
            }
        }

        GlyphBitmap find(CodepointSequence sequence) {
            Map<CodepointSequence, GlyphBitmap> map = sequence.hasSkinTone() ? toned : all;
            GlyphBitmap exact = map.get(sequence);
            GlyphBitmap female = map.get(sequence.append(VS16, ZWJ, FEMALE_SIGN));
            if (exact == null) {
                return female;
            }
            if (female == null || exact.getGlyphId() <= female.getGlyphId()) {
                return exact;
            }
            return female;
        }

    }

}
