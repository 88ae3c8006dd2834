/*
 * SequenceResolverTest.java
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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceResolverTest {

    static final List<String> DATA = Arrays.asList(
            "# emoji-sequences.txt",
            "1F466         ; Basic_Emoji                  ; boy",
            "1F46A         ; Basic_Emoji                  ; family",
            "1F491         ; Basic_Emoji                  ; couple with heart",
            "1F48F         ; Basic_Emoji                  ; kiss",
            "2764          ; Basic_Emoji                  ; red heart",
            "2764 FE0F     ; Basic_Emoji                  ; red heart",
            "1F6B4 1F3FB   ; RGI_Emoji_Modifier_Sequence  ; person biking: light skin tone",
            "1F3C3 1F3FB   ; RGI_Emoji_Modifier_Sequence  ; person running: light skin tone",
            "",
            "# emoji-zwj-sequences.txt",
            "1F468 200D 1F469 200D 1F467 ; RGI_Emoji_ZWJ_Sequence ; family: man, woman, girl",
            "1F469 200D 2764 FE0F 200D 1F469 ; RGI_Emoji_ZWJ_Sequence ; couple with heart: woman, woman",
            "1F468 200D 2764 FE0F 200D 1F48B 200D 1F468 ; RGI_Emoji_ZWJ_Sequence ; kiss: man, man",
            "1F3C3 200D 2640 FE0F ; RGI_Emoji_ZWJ_Sequence ; woman running",
            "1F3C3 1F3FB 200D 2640 FE0F ; RGI_Emoji_ZWJ_Sequence ; woman running: light skin tone");

    private SequenceResolver resolver;

    private static CodepointSequence seq(String hex) {
        return CodepointSequence.parse(hex);
    }

    @BeforeEach
    void setUp() {
        resolver = new SequenceResolver(UnicodeEmojiDatabase.parse(DATA));
    }

    @Test
    void resolvesSingleCodepoint() {
        assertEquals(seq("1F466"), resolver.resolve("u1F466"));
    }

    @Test
    void resolvesSkinTone() {
        assertEquals(seq("1F6B4 1F3FB"), resolver.resolve("u1F6B4.1"));
    }

    @Test
    void resolvesLegacyFamily() {
        assertEquals(seq("1F46A"), resolver.resolve("u1F46A.MWB"));
    }

    @Test
    void resolvesFamilyMembers() {
        assertEquals(seq("1F468 200D 1F469 200D 1F467"), resolver.resolve("u1F46A.MWG"));
    }

    @Test
    void resolvesCouplesAndKisses() {
        assertEquals(seq("1F491"), resolver.resolve("u1F491.WM"));
        assertEquals(seq("1F469 200D 2764 FE0F 200D 1F469"), resolver.resolve("u1F491.WW"));
        assertEquals(seq("1F48F"), resolver.resolve("u1F48F.WM"));
        assertEquals(seq("1F468 200D 2764 FE0F 200D 1F48B 200D 1F468"),
                resolver.resolve("u1F48F.MM"));
    }

    @Test
    void resolvesGenderToQualifiedSequence() {
        assertEquals(seq("1F3C3 200D 2640 FE0F"), resolver.resolve("u1F3C3.W"));
        assertEquals(seq("1F3C3 1F3FB 200D 2640 FE0F"), resolver.resolve("u1F3C3.1.W"));
    }

    @Test
    void neutralSuffixResolvesToBase() {
        assertEquals(seq("1F3C3 1F3FB"), resolver.resolve("u1F3C3.1.0"));
        assertNull(resolver.resolve("u1F3C3.0"));
    }

    @Test
    void prefersFirstCandidate() {
        assertEquals(seq("2764"), resolver.resolve("u2764"));
        assertEquals(Arrays.asList(seq("2764"), seq("2764 FE0F")), resolver.aliases("u2764"));
    }

    @Test
    void resolutionIsRepeatable() {
        for (String name : Arrays.asList("u1F466", "u1F46A.MWG", "u1F3C3.1.W", "u2764")) {
            assertEquals(resolver.resolve(name), resolver.resolve(name), name);
            assertTrue(resolver.aliases(name).contains(resolver.resolve(name)), name);
        }
    }

    @Test
    void unresolvedNames() {
        assertNull(resolver.resolve(".notdef"));
        assertNull(resolver.resolve("u1F9FF"));
        assertNull(resolver.resolve("u1F46A.WWGG"));
        assertTrue(resolver.aliases("u1F9FF").isEmpty());
    }

    @Test
    void compositePatternsTakePrecedence() {
        assertEquals(Collections.singletonList(seq("1F46A")), resolver.candidates("u1F46A.MWB"));
        assertTrue(resolver.matches("u1F46A.MWG", seq("1F468 200D 1F469 200D 1F467")));
        assertFalse(resolver.matches("u1F46A.MWG", seq("1F46A")));
    }

    @Test
    void customPatterns() {
        SequenceResolver tokensOnly = new SequenceResolver(resolver.getDatabase(),
                Collections.<GlyphNamePattern>singletonList(new TokenNamePattern()));

        assertNull(tokensOnly.resolve("u1F46A.MWG"));
        assertEquals(seq("1F466"), tokensOnly.resolve("u1F466"));
        assertEquals(1, tokensOnly.getPatterns().size());
        assertEquals(4, SequenceResolver.defaultPatterns().size());
    }

    @Test
    void requiresDatabase() {
        assertThrows(NullPointerException.class, () -> new SequenceResolver(null));
    }

}
