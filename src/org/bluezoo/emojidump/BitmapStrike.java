/*
 * BitmapStrike.java
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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bluezoo.emojidump.FontParseException.Stage.SBIX;

/**
 * One strike of an {@code sbix} table: the embedded images of every glyph
 * at a single pixels-per-em.
 * <p>
 * Only the strike matching the requested size is decoded; the glyph data
 * offsets of the other strikes are never read. The image of glyph
 * {@code i} occupies bytes {@code [offset[i], offset[i+1])} of the strike.
 * An empty range means the glyph has no image at this size.
 * <p>
 * Each glyph record starts with a signed 16-bit x and y origin offset and
 * a 4-character graphic type, followed by the image data. Records of type
 * {@code dupe} hold the glyph ID of another glyph whose image is reused.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BitmapStrike {

    private static final Logger LOGGER = LoggerFactory.getLogger(BitmapStrike.class);

    /** Graphic type of records that reference another glyph's image. */
    static final String TYPE_DUPE = "dupe";

    /** Size of the origin and graphic type fields of a glyph record. */
    static final int GLYPH_HEADER_SIZE = 8;

    /** Guards against dupe records that reference each other. */
    private static final int MAX_DUPE_DEPTH = 8;

    private final FontReader reader;
    private final TableRecord sbix;
    private final int ppem;
    private final int resolution;
    private final long offset;
    private final long[] glyphDataOffsets;

    private BitmapStrike(FontReader reader, TableRecord sbix, int ppem, int resolution,
                         long offset, long[] glyphDataOffsets) {
        this.reader = reader;
        this.sbix = sbix;
        this.ppem = ppem;
        this.resolution = resolution;
        this.offset = offset;
        this.glyphDataOffsets = glyphDataOffsets;
    }

    /**
     * Decodes the {@code sbix} header and selects the first strike with the
     * requested pixels-per-em.
     *
     * @param reader the font data
     * @param sbix the sbix table record
     * @param numGlyphs the number of glyphs in the font
     * @param ppem the requested pixels-per-em
     * @return the selected strike
     * @throws StrikeNotFoundException if no strike has the requested size
     * @throws MalformedFontException if the table is truncated or invalid
     * @throws IOException if an I/O error occurs
     */
    public static BitmapStrike select(FontReader reader, TableRecord sbix, int numGlyphs,
                                      int ppem) throws IOException {
        long tableStart = sbix.getOffset();
        ByteBuffer buf = readTable(reader, sbix, 0, 8);
        int version = buf.getShort() & 0xFFFF;
        int flags = buf.getShort() & 0xFFFF;
        long numStrikes = buf.getInt() & 0xFFFFFFFFL;
        if (version != 1) {
            throw new MalformedFontException(SBIX, "unsupported sbix version " + version,
                    tableStart);
        }
        if (numStrikes * 4 > sbix.getLength() - 8) {
            throw new MalformedFontException(SBIX, "strike count " + numStrikes
                    + " exceeds table length", tableStart + 4);
        }

        buf = readTable(reader, sbix, 8, (int) numStrikes * 4);
        long[] strikeOffsets = new long[(int) numStrikes];
        for (int i = 0; i < strikeOffsets.length; i++) {
            strikeOffsets[i] = buf.getInt() & 0xFFFFFFFFL;
        }

        int[] sizes = new int[strikeOffsets.length];
        for (int i = 0; i < strikeOffsets.length; i++) {
            buf = readTable(reader, sbix, strikeOffsets[i], 4);
            int strikePpem = buf.getShort() & 0xFFFF;
            int strikeResolution = buf.getShort() & 0xFFFF;
            sizes[i] = strikePpem;
            if (strikePpem != ppem) {
                continue;
            }

            buf = readTable(reader, sbix, strikeOffsets[i] + 4, (numGlyphs + 1) * 4);
            long[] glyphDataOffsets = new long[numGlyphs + 1];
            for (int g = 0; g <= numGlyphs; g++) {
                glyphDataOffsets[g] = buf.getInt() & 0xFFFFFFFFL;
            }
            LOGGER.debug("sbix version {} flags 0x{}: selected strike {} of {} ({} ppem, {} ppi)",
                    version, Integer.toHexString(flags), i, numStrikes, strikePpem,
                    strikeResolution);
            return new BitmapStrike(reader, sbix, strikePpem, strikeResolution,
                    tableStart + strikeOffsets[i], glyphDataOffsets);
        }
        throw new StrikeNotFoundException(ppem, sizes, tableStart);
    }

    /**
     * Reads a block relative to the start of the sbix table, checking that
     * it lies within the table.
     */
    private static ByteBuffer readTable(FontReader reader, TableRecord sbix, long relative,
                                        int length) throws IOException {
        if (relative < 0 || relative + length > sbix.getLength()) {
            throw new MalformedFontException(SBIX,
                    "read of " + length + " bytes outside sbix table",
                    sbix.getOffset() + relative);
        }
        return reader.read(sbix.getOffset() + relative, length, SBIX);
    }

    public int getPpem() {
        return ppem;
    }

    /**
     * Returns the resolution of the strike in pixels per inch.
     */
    public int getResolution() {
        return resolution;
    }

    /**
     * Returns the absolute offset of the strike in the font file.
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Returns the number of glyphs covered by the offset table.
     */
    public int getNumGlyphs() {
        return glyphDataOffsets.length - 1;
    }

    /**
     * Returns the glyph data offset of a glyph, relative to the strike.
     *
     * @param index a glyph ID, or the glyph count for the end sentinel
     * @return the offset
     */
    public long getGlyphDataOffset(int index) {
        return glyphDataOffsets[index];
    }

    /**
     * Indicates whether a glyph has an image at this strike.
     *
     * @param glyphId the glyph ID
     * @return true if the glyph's data range is not empty
     */
    public boolean hasBitmap(int glyphId) {
        checkGlyphId(glyphId);
        return glyphDataOffsets[glyphId] < glyphDataOffsets[glyphId + 1];
    }

    /**
     * Locates the image of a glyph. Only the glyph record header is read;
     * the image bytes are read on demand through {@link GlyphBitmap#read}.
     *
     * @param glyphId the glyph ID
     * @param glyphName the glyph name to report with the bitmap
     * @return the bitmap, or null if the glyph has no image at this strike
     * @throws MalformedFontException if the glyph record is invalid
     * @throws IOException if an I/O error occurs
     */
    public GlyphBitmap bitmapFor(int glyphId, String glyphName) throws IOException {
        return bitmapFor(glyphId, glyphName, 0);
    }

    private GlyphBitmap bitmapFor(int glyphId, String glyphName, int depth) throws IOException {
        if (!hasBitmap(glyphId)) {
            return null;
        }
        long start = glyphDataOffsets[glyphId];
        long end = glyphDataOffsets[glyphId + 1];
        long recordOffset = offset + start;
        long length = end - start;
        if (recordOffset + length > sbix.getEnd()) {
            throw new MalformedFontException(SBIX,
                    "data of glyph " + glyphId + " extends beyond sbix table", recordOffset);
        }
        if (length < GLYPH_HEADER_SIZE) {
            throw new MalformedFontException(SBIX,
                    "data of glyph " + glyphId + " too short (" + length + " bytes)",
                    recordOffset);
        }

        ByteBuffer buf = reader.read(recordOffset, GLYPH_HEADER_SIZE, SBIX);
        short originX = buf.getShort();
        short originY = buf.getShort();
        byte[] tag = new byte[4];
        buf.get(tag);
        String graphicType = new String(tag, StandardCharsets.US_ASCII);

        if (TYPE_DUPE.equals(graphicType)) {
            if (depth >= MAX_DUPE_DEPTH) {
                throw new MalformedFontException(SBIX,
                        "dupe chain too deep at glyph " + glyphId, recordOffset);
            }
            if (length < GLYPH_HEADER_SIZE + 2) {
                throw new MalformedFontException(SBIX,
                        "dupe record of glyph " + glyphId + " too short (" + length + " bytes)",
                        recordOffset);
            }
            int target = reader.readUInt16(recordOffset + GLYPH_HEADER_SIZE, SBIX);
            if (target >= getNumGlyphs()) {
                throw new MalformedFontException(SBIX,
                        "glyph " + glyphId + " duplicates missing glyph " + target,
                        recordOffset);
            }
            GlyphBitmap original = bitmapFor(target, glyphName, depth + 1);
            if (original == null) {
                return null;
            }
            return new GlyphBitmap(glyphId, glyphName, original.getOriginX(),
                    original.getOriginY(), original.getGraphicType(), original.getImage());
        }

        ImageData image = new ImageData(reader, recordOffset + GLYPH_HEADER_SIZE,
                (int) (length - GLYPH_HEADER_SIZE));
        return new GlyphBitmap(glyphId, glyphName, originX, originY, graphicType, image);
    }

    private void checkGlyphId(int glyphId) {
        if (glyphId < 0 || glyphId >= getNumGlyphs()) {
            throw new IndexOutOfBoundsException("Glyph ID out of range: " + glyphId);
        }
    }

    @Override
    public String toString() {
        return "strike " + ppem + " ppem " + resolution + " ppi at offset " + offset;
    }

}
