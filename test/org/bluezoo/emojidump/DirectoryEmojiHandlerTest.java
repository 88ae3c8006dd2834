/*
 * DirectoryEmojiHandlerTest.java
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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryEmojiHandlerTest {

    @TempDir
    Path dir;

    private EmojiFont open() throws Exception {
        Path file = TestFonts.write(dir, "emoji.ttc", EmojiExtractorTest.sampleFont());
        return EmojiFont.open(file, 0, 160);
    }

    @Test
    void namesFilesAfterSequences() {
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(dir);

        assertEquals(dir.resolve("emoji_u1f468_200d_1f469_200d_1f467.png"),
                handler.pathFor(CodepointSequence.parse("1F468 200D 1F469 200D 1F467")));
        assertEquals(dir.resolve("emoji_u2764.png"),
                handler.pathFor(CodepointSequence.parse("2764 FE0F")));
    }

    @Test
    void keepsUnresolvedGlyphsWhenAsked() throws Exception {
        Path out = dir.resolve("out");
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        handler.setKeepUnresolved(true);
        try (EmojiFont font = open()) {
            EmojiExtractorTest.extractor().extract(font, handler);
        }

        Path glyphs = out.resolve(DirectoryEmojiHandler.GLYPHS_DIRECTORY);
        assertArrayEquals(TestFonts.image(5), Files.readAllBytes(glyphs.resolve("component.png")));
        assertTrue(Files.exists(glyphs.resolve("u1F3C3.1.W.png")));
        assertTrue(Files.exists(glyphs.resolve("u1F3C3.2.png")));
        assertEquals(8, handler.getWritten());
    }

    @Test
    void dropsUnresolvedGlyphsByDefault() throws Exception {
        Path out = dir.resolve("out");
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        try (EmojiFont font = open()) {
            handler.startExtraction(font.getNumGlyphs(), 160);
            handler.unresolvedGlyph(font.getBitmap(5));
        }

        assertFalse(handler.isKeepUnresolved());
        assertFalse(Files.exists(out.resolve(DirectoryEmojiHandler.GLYPHS_DIRECTORY)));
        assertEquals(0, handler.getWritten());
    }

    @Test
    void derivedImagesNeverReplaceFiles() throws Exception {
        Path out = dir.resolve("out");
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        CodepointSequence toned = CodepointSequence.parse("1F3C3 1F3FC");
        try (EmojiFont font = open()) {
            handler.startExtraction(font.getNumGlyphs(), 160);
            assertFalse(handler.hasEmoji(toned));

            handler.derivedEmoji(toned, font.getBitmap(4));
            assertTrue(handler.hasEmoji(toned));
            handler.derivedEmoji(toned, font.getBitmap(3));
            assertArrayEquals(TestFonts.image(4), Files.readAllBytes(handler.pathFor(toned)));

            handler.emoji(toned, font.getBitmap(3));
            assertArrayEquals(TestFonts.image(3), Files.readAllBytes(handler.pathFor(toned)));
        }
        assertEquals(2, handler.getWritten());
    }

    @Test
    void derivedImagesKeepFilesWrittenByOthers() throws Exception {
        Path out = dir.resolve("out");
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        CodepointSequence toned = CodepointSequence.parse("1F3C3 1F3FC");
        byte[] existing = { 1, 2, 3 };
        try (EmojiFont font = open()) {
            handler.startExtraction(font.getNumGlyphs(), 160);
            Files.createDirectories(out);
            Files.write(handler.pathFor(toned), existing);

            handler.derivedEmoji(toned, font.getBitmap(4));
        }

        assertArrayEquals(existing, Files.readAllBytes(handler.pathFor(toned)));
        assertEquals(0, handler.getWritten());
        try (Stream<Path> files = Files.list(out)) {
            assertEquals(1, files.count());
        }
    }

}
