/*
 * DebugEmojiHandler.java
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

import java.io.PrintStream;
import java.util.HashSet;
import java.util.Set;

/**
 * Debug implementation of {@link EmojiHandler} that prints events to a stream.
 * Image bytes are never read.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DebugEmojiHandler implements EmojiHandler {

    private final PrintStream out;
    private final Set<CodepointSequence> reported = new HashSet<>();
    private int indent = 0;

    public DebugEmojiHandler() {
        this(System.out);
    }

    public DebugEmojiHandler(PrintStream out) {
        this.out = out;
    }

    private void print(String format, Object... args) {
        for (int i = 0; i < indent; i++) out.print("  ");
        out.printf(format, args);
        out.println();
    }

    @Override
    public void startExtraction(int numGlyphs, int ppem) {
        print("startExtraction(glyphs=%d, ppem=%d)", numGlyphs, ppem);
        indent++;
    }

    @Override
    public void emoji(CodepointSequence sequence, GlyphBitmap bitmap) {
        reported.add(sequence);
        print("emoji [%s] %s", sequence, bitmap);
    }

    @Override
    public void unresolvedGlyph(GlyphBitmap bitmap) {
        print("unresolved %s", bitmap);
    }

    @Override
    public boolean hasEmoji(CodepointSequence sequence) {
        return reported.contains(sequence);
    }

    @Override
    public void derivedEmoji(CodepointSequence sequence, GlyphBitmap bitmap) {
        reported.add(sequence);
        print("derived [%s] from '%s' (glyph %d)", sequence, bitmap.getGlyphName(),
                bitmap.getGlyphId());
    }

    @Override
    public void endExtraction() {
        indent--;
        print("endExtraction");
    }

}
