/*
 * DebugEmojiHandlerTest.java
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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertTrue;

class DebugEmojiHandlerTest {

    @TempDir
    Path dir;

    @Test
    void printsExtractionEvents() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        Path file = TestFonts.write(dir, "emoji.ttc", EmojiExtractorTest.sampleFont());
        try (EmojiFont font = EmojiFont.open(file, 0, 160)) {
            EmojiExtractorTest.extractor().extract(font, new DebugEmojiHandler(out));
        }

        String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        String nl = System.lineSeparator();
        assertTrue(output.startsWith("startExtraction(glyphs=6, ppem=160)" + nl), output);
        assertTrue(output.contains("  emoji [1F466] glyph 1 'u1F466' png"), output);
        assertTrue(output.contains("  unresolved glyph 5 'component' png"), output);
        assertTrue(output.contains("  derived [1F3C3 1F3FC] from 'u1F3C3.2' (glyph 4)" + nl), output);
        assertTrue(output.endsWith(nl + "endExtraction" + nl), output);
    }

}
