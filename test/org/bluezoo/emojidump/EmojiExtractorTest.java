/*
 * EmojiExtractorTest.java
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class EmojiExtractorTest {

    static final List<String> DATA = Arrays.asList(
            "1F466       ; Basic_Emoji                  ; boy",
            "1F3C3       ; Basic_Emoji                  ; person running",
            "1F3C3 1F3FB ; RGI_Emoji_Modifier_Sequence  ; person running: light skin tone");

    @TempDir
    Path dir;

    /**
     * Boy, person running, two toned runners that only the skin tone pass
     * can place, and a glyph that is not an emoji.
     */
    static byte[] sampleFont() {
        return new TestFonts.Builder()
                .names(".notdef", "u1F466", "u1F3C3", "u1F3C3.1.W", "u1F3C3.2", "component")
                .strike(40, null, null, null, null, null, null)
                .strike(160, null,
                        TestFonts.png(TestFonts.image(1)),
                        TestFonts.png(TestFonts.image(2)),
                        TestFonts.png(TestFonts.image(3)),
                        TestFonts.png(TestFonts.image(4)),
                        TestFonts.png(TestFonts.image(5)))
                .buildTtc();
    }

    static EmojiExtractor extractor() {
        return new EmojiExtractor(UnicodeEmojiDatabase.parse(DATA), ModifierBases.parse(DATA));
    }

    private EmojiFont open() throws IOException {
        Path file = dir.resolve("emoji.ttc");
        if (!Files.exists(file)) {
            Files.write(file, sampleFont());
        }
        return EmojiFont.open(file, 0, EmojiExtractor.DEFAULT_PPEM);
    }

    private Set<String> list(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toSet());
        }
    }

    @Test
    void reportsResolvedUnresolvedAndDerivedEmoji() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        try (EmojiFont font = open()) {
            extractor().extract(font, handler);
        }

        assertEquals(Arrays.asList("start 6 160",
                "emoji 1F466 1",
                "emoji 1F3C3 2",
                "unresolved 3",
                "unresolved 4",
                "unresolved 5",
                "derived 1F3C3 1F3FB 3",
                "derived 1F3C3 1F3FC 4",
                "derived 1F3C3 1F3FB 200D 2640 FE0F 3",
                "end"), handler.events);
    }

    @Test
    void skipsSkinTonePassWithoutBases() throws Exception {
        RecordingHandler handler = new RecordingHandler();
        try (EmojiFont font = open()) {
            new EmojiExtractor(UnicodeEmojiDatabase.parse(DATA), null).extract(font, handler);
        }

        assertFalse(handler.events.stream().anyMatch(e -> e.startsWith("derived")));
    }

    @Test
    void writesImagesToDirectory() throws Exception {
        Path out = dir.resolve("out");
        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        try (EmojiFont font = open()) {
            extractor().extract(font, handler);
        }

        assertEquals(new HashSet<>(Arrays.asList(
                "emoji_u1f466.png",
                "emoji_u1f3c3.png",
                "emoji_u1f3c3_1f3fb.png",
                "emoji_u1f3c3_1f3fc.png",
                "emoji_u1f3c3_1f3fb_200d_2640.png")), list(out));
        assertEquals(5, handler.getWritten());
        assertArrayEquals(TestFonts.image(1), Files.readAllBytes(out.resolve("emoji_u1f466.png")));
        assertArrayEquals(TestFonts.image(2), Files.readAllBytes(out.resolve("emoji_u1f3c3.png")));
        assertArrayEquals(TestFonts.image(3),
                Files.readAllBytes(out.resolve("emoji_u1f3c3_1f3fb.png")));
        assertArrayEquals(TestFonts.image(4),
                Files.readAllBytes(out.resolve("emoji_u1f3c3_1f3fc.png")));
        assertArrayEquals(TestFonts.image(3),
                Files.readAllBytes(out.resolve("emoji_u1f3c3_1f3fb_200d_2640.png")));
    }

    @Test
    void rerunNeverOverwritesDerivedImages() throws Exception {
        Path out = dir.resolve("out");
        try (EmojiFont font = open()) {
            extractor().extract(font, new DirectoryEmojiHandler(out));
        }
        Set<String> firstRun = list(out);
        byte[] edited = { 'e', 'd', 'i', 't', 'e', 'd' };
        Files.write(out.resolve("emoji_u1f3c3_1f3fc.png"), edited);
        Files.write(out.resolve("emoji_u1f466.png"), edited);

        DirectoryEmojiHandler handler = new DirectoryEmojiHandler(out);
        try (EmojiFont font = open()) {
            extractor().extract(font, handler);
        }

        assertEquals(firstRun, list(out));
        assertEquals(2, handler.getWritten());
        assertArrayEquals(edited, Files.readAllBytes(out.resolve("emoji_u1f3c3_1f3fc.png")));
        assertArrayEquals(TestFonts.image(1), Files.readAllBytes(out.resolve("emoji_u1f466.png")));
    }

    /**
     * Records handler events as strings.
     */
    static class RecordingHandler implements EmojiHandler {

        final List<String> events = new ArrayList<>();
        final Set<CodepointSequence> stored = new HashSet<>();

        @Override
        public void startExtraction(int numGlyphs, int ppem) {
            events.add("start " + numGlyphs + " " + ppem);
        }

        @Override
        public void emoji(CodepointSequence sequence, GlyphBitmap bitmap) {
            stored.add(sequence);
            events.add("emoji " + sequence + " " + bitmap.getGlyphId());
        }

        @Override
        public void unresolvedGlyph(GlyphBitmap bitmap) {
            events.add("unresolved " + bitmap.getGlyphId());
        }

        @Override
        public boolean hasEmoji(CodepointSequence sequence) {
            return stored.contains(sequence);
        }

        @Override
        public void derivedEmoji(CodepointSequence sequence, GlyphBitmap bitmap) {
            stored.add(sequence);
            events.add("derived " + sequence + " " + bitmap.getGlyphId());
        }

        @Override
        public void endExtraction() {
            events.add("end");
        }

    }

}
