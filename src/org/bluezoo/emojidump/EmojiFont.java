/*
 * EmojiFont.java
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

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A colour emoji font opened for extraction at one pixels-per-em.
 * <p>
 * Opening the font decodes the container, the {@code post} glyph names
 * and the offsets of the selected {@code sbix} strike. These indices are
 * immutable afterwards. Image bytes stay in the file until a
 * {@link GlyphBitmap} is read, so the font must remain open while its
 * bitmaps are in use.
 * <p>
 * Example usage:
 * <pre>
 * try (EmojiFont font = EmojiFont.open(Paths.get("Apple Color Emoji.ttc"), 0, 160)) {
 *     for (GlyphBitmap bitmap : font.getBitmaps()) {
 *         byte[] png = bitmap.read();
 *     }
 * }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EmojiFont implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmojiFont.class);

    private final FontReader reader;
    private final TableDirectory tables;
    private final GlyphNameIndex glyphNames;
    private final BitmapStrike strike;
    private List<GlyphBitmap> bitmaps;

    /**
     * Decodes a font from the given reader.
     *
     * @param reader the font data; closed when this font is closed
     * @param fontIndex the font to select within a collection
     * @param ppem the pixels-per-em of the strike to extract
     * @throws FontParseException if the font cannot be decoded
     * @throws IOException if an I/O error occurs
     */
    public EmojiFont(FontReader reader, int fontIndex, int ppem) throws IOException {
        this.reader = reader;
        this.tables = new FontContainerParser(fontIndex).parse(reader);
        TableRecord post = tables.require("post", FontParseException.Stage.POST);
        TableRecord sbix = tables.require("sbix", FontParseException.Stage.SBIX);
        this.glyphNames = GlyphNameIndex.parse(reader, post);
        this.strike = BitmapStrike.select(reader, sbix, glyphNames.size(), ppem);
        LOGGER.info("Opened font with {} tables and {} glyphs, {}",
                tables.size(), glyphNames.size(), strike);
    }

    /**
     * Opens and decodes a font file.
     *
     * @param path the TTC or SFNT font file
     * @param fontIndex the font to select within a collection
     * @param ppem the pixels-per-em of the strike to extract
     * @return the opened font
     * @throws FontParseException if the font cannot be decoded
     * @throws IOException if an I/O error occurs
     */
    public static EmojiFont open(Path path, int fontIndex, int ppem) throws IOException {
        FontReader reader = FontReader.open(path);
        try {
            return new EmojiFont(reader, fontIndex, ppem);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    public TableDirectory getTableDirectory() {
        return tables;
    }

    public GlyphNameIndex getGlyphNames() {
        return glyphNames;
    }

    public BitmapStrike getStrike() {
        return strike;
    }

    public int getNumGlyphs() {
        return glyphNames.size();
    }

    /**
     * Returns the bitmap of a glyph at the selected strike.
     *
     * @param glyphId the glyph ID
     * @return the bitmap, or null if the glyph has no image at this size
     * @throws IOException if an I/O error occurs
     */
    public GlyphBitmap getBitmap(int glyphId) throws IOException {
        return strike.bitmapFor(glyphId, glyphNames.nameFor(glyphId));
    }

    /**
     * Returns the bitmaps of every glyph that has an image at the selected
     * strike, in glyph ID order. Glyph record headers are read on the first
     * call; image bytes are not.
     *
     * @return an unmodifiable list of bitmaps
     * @throws IOException if an I/O error occurs
     */
    public synchronized List<GlyphBitmap> getBitmaps() throws IOException {
        if (bitmaps == null) {
            List<GlyphBitmap> list = new ArrayList<>();
            for (int glyphId = 0; glyphId < glyphNames.size(); glyphId++) {
                GlyphBitmap bitmap = getBitmap(glyphId);
                if (bitmap != null) {
                    list.add(bitmap);
                }
            }
            LOGGER.debug("{} of {} glyphs have bitmaps at {} ppem",
                    list.size(), glyphNames.size(), strike.getPpem());
            bitmaps = Collections.unmodifiableList(list);
        }
        return bitmaps;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

}
