/*
 * EmojiHandler.java
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

/**
 * Handler interface for emoji extraction events.
 * <p>
 * An {@link EmojiExtractor} reports events in this order:
 * <ol>
 *   <li>{@code startExtraction}</li>
 *   <li>for every glyph with a bitmap, in glyph ID order, either
 *       {@code emoji} or {@code unresolvedGlyph}</li>
 *   <li>for every skin tone sequence reachable only by composition,
 *       {@code hasEmoji} and, if that returns false, {@code derivedEmoji}</li>
 *   <li>{@code endExtraction}</li>
 * </ol>
 * Bitmaps may only be read during the callback, while the font is open.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface EmojiHandler {

    /**
     * Called before the first glyph is reported.
     *
     * @param numGlyphs the number of glyphs in the font
     * @param ppem the pixels-per-em of the strike being extracted
     */
    void startExtraction(int numGlyphs, int ppem);

    /**
     * Called for a glyph whose name resolved to an emoji.
     *
     * @param sequence the canonical sequence of the emoji
     * @param bitmap the glyph's image
     * @throws IOException if the image cannot be stored
     */
    void emoji(CodepointSequence sequence, GlyphBitmap bitmap) throws IOException;

    /**
     * Called for a glyph whose name resolved to no known emoji.
     *
     * @param bitmap the glyph's image
     * @throws IOException if the image cannot be stored
     */
    void unresolvedGlyph(GlyphBitmap bitmap) throws IOException;

    /**
     * Indicates whether an image is already stored for a sequence.
     * Derived emoji are only reported for sequences without one.
     *
     * @param sequence the sequence
     * @return true if an image exists
     */
    boolean hasEmoji(CodepointSequence sequence);

    /**
     * Called for a skin tone sequence whose image was found under
     * another glyph's name.
     *
     * @param sequence the synthesized sequence
     * @param bitmap the image of the glyph that renders it
     * @throws IOException if the image cannot be stored
     */
    void derivedEmoji(CodepointSequence sequence, GlyphBitmap bitmap) throws IOException;

    /**
     * Called after the last event.
     */
    void endExtraction();

}
