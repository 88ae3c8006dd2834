/*
 * FontContainerParserTest.java
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FontContainerParserTest {

    @TempDir
    Path dir;

    private TestFonts.Builder font() {
        return new TestFonts.Builder()
                .names(".notdef", "u1F466")
                .strike(160, null, TestFonts.png(TestFonts.image(1)));
    }

    private TableDirectory parse(byte[] data, int fontIndex) throws IOException {
        Path file = TestFonts.write(dir, "font.bin", data);
        try (FontReader reader = FontReader.open(file)) {
            return new FontContainerParser(fontIndex).parse(reader);
        }
    }

    @Test
    void parsesCollection() throws Exception {
        TableDirectory tables = parse(font().buildTtc(), 0);

        assertEquals(16, tables.getFontOffset());
        assertEquals(FontContainerParser.SFNT_VERSION_TRUETYPE, tables.getSfntVersion());
        assertEquals(2, tables.size());
        assertTrue(tables.contains("post"));
        assertTrue(tables.contains("sbix"));
        TableRecord post = tables.get("post");
        assertEquals("post", post.getTag());
        assertEquals(16 + 12 + 2 * 16, post.getOffset());
        assertEquals(post.getOffset() + post.getLength(), post.getEnd());
    }

    @Test
    void selectsFontWithinCollection() throws Exception {
        byte[] ttc = TestFonts.ttc(font().tables(), 3);

        TableDirectory tables = parse(ttc, 2);

        assertEquals(12 + 3 * 4, tables.getFontOffset());
        assertTrue(tables.contains("sbix"));
    }

    @Test
    void parsesSingleFont() throws Exception {
        TableDirectory tables = parse(font().buildSfnt(), 0);

        assertEquals(0, tables.getFontOffset());
        assertNotNull(tables.get("sbix"));
        assertNull(tables.get("glyf"));
    }

    @Test
    void ignoresFontIndexForSingleFont() throws Exception {
        TableDirectory tables = parse(font().buildSfnt(), 5);

        assertEquals(0, tables.getFontOffset());
        assertEquals(2, tables.size());
    }

    @Test
    void rejectsUnknownSignature() throws Exception {
        byte[] data = new byte[64];
        System.arraycopy("wOFF".getBytes(StandardCharsets.US_ASCII), 0, data, 0, 4);

        MalformedFontException e = assertThrows(MalformedFontException.class,
                () -> parse(data, 0));

        assertEquals(FontParseException.Stage.CONTAINER, e.getStage());
        assertEquals(0, e.getOffset());
    }

    @Test
    void rejectsTruncatedCollectionHeader() {
        byte[] data = Arrays.copyOf(font().buildTtc(), 10);

        MalformedFontException e = assertThrows(MalformedFontException.class,
                () -> parse(data, 0));

        assertEquals(FontParseException.Stage.CONTAINER, e.getStage());
    }

    @Test
    void rejectsFontIndexOutOfRange() {
        byte[] ttc = font().buildTtc();

        MalformedFontException e = assertThrows(MalformedFontException.class,
                () -> parse(ttc, 1));

        assertEquals(FontParseException.Stage.CONTAINER, e.getStage());
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    }

    @Test
    void rejectsEmptyCollection() {
        byte[] ttc = TestFonts.ttc(font().tables(), 0);

        assertThrows(MalformedFontException.class, () -> parse(ttc, 0));
    }

    @Test
    void rejectsTableBeyondEndOfFile() {
        byte[] sfnt = font().buildSfnt();
        byte[] truncated = Arrays.copyOf(sfnt, 12 + 2 * 16 + 10);

        MalformedFontException e = assertThrows(MalformedFontException.class,
                () -> parse(truncated, 0));

        assertEquals(FontParseException.Stage.CONTAINER, e.getStage());
        assertEquals(12, e.getOffset());
    }

    @Test
    void rejectsNegativeFontIndex() {
        assertThrows(IllegalArgumentException.class, () -> new FontContainerParser(-1));
    }

    @Test
    void requiresPostTable() throws Exception {
        Map<String, byte[]> tables = new LinkedHashMap<>(font().tables());
        tables.remove("post");
        Path file = TestFonts.write(dir, "nopost.ttf", TestFonts.sfnt(tables, 0));

        FontParseException e = assertThrows(FontParseException.class,
                () -> EmojiFont.open(file, 0, 160));

        assertEquals(FontParseException.Stage.POST, e.getStage());
    }

    @Test
    void requiresSbixTable() throws Exception {
        Map<String, byte[]> tables = new LinkedHashMap<>(font().tables());
        tables.remove("sbix");
        Path file = TestFonts.write(dir, "nosbix.ttf", TestFonts.sfnt(tables, 0));

        FontParseException e = assertThrows(FontParseException.class,
                () -> EmojiFont.open(file, 0, 160));

        assertEquals(FontParseException.Stage.SBIX, e.getStage());
        assertFalse(e instanceof StrikeNotFoundException);
    }

}
