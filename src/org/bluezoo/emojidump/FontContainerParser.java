/*
 * FontContainerParser.java
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
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bluezoo.emojidump.FontParseException.Stage.CONTAINER;

/**
 * Parser for the container structure of TrueType fonts and TrueType
 * Collections.
 * <p>
 * If the file starts with the {@code ttcf} signature the collection header
 * is decoded and the font at the configured index is selected; otherwise
 * the whole file is treated as a single SFNT font starting at offset 0.
 * The selected font's table directory is then decoded into a
 * {@link TableDirectory}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FontContainerParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(FontContainerParser.class);

    /** TrueType sfnt version (0x00010000). */
    static final int SFNT_VERSION_TRUETYPE = 0x00010000;

    /** OpenType/CFF sfnt version ('OTTO'). */
    static final int SFNT_VERSION_CFF = 0x4F54544F;

    /** Apple TrueType sfnt version ('true'). */
    static final int SFNT_VERSION_APPLE = 0x74727565;

    /** TrueType collection version ('ttcf'). */
    static final int TTC_TAG = 0x74746366;

    private static final int OFFSET_TABLE_SIZE = 12;
    private static final int TABLE_RECORD_SIZE = 16;

    private int fontIndex;

    /**
     * Creates a parser selecting the first font of a collection.
     */
    public FontContainerParser() {
        this(0);
    }

    /**
     * Creates a parser selecting the given font of a collection.
     *
     * @param fontIndex the index of the font within a TTC
     */
    public FontContainerParser(int fontIndex) {
        setFontIndex(fontIndex);
    }

    public int getFontIndex() {
        return fontIndex;
    }

    /**
     * Sets which font of a collection to select. Ignored for single fonts.
     *
     * @param fontIndex the index of the font within a TTC
     */
    public void setFontIndex(int fontIndex) {
        if (fontIndex < 0) {
            throw new IllegalArgumentException("Font index must be non-negative: " + fontIndex);
        }
        this.fontIndex = fontIndex;
    }

    /**
     * Decodes the container and returns the table directory of the
     * selected font.
     *
     * @param reader the font data
     * @return the table directory
     * @throws MalformedFontException if the container is invalid
     * @throws IOException if an I/O error occurs
     */
    public TableDirectory parse(FontReader reader) throws IOException {
        int signature = reader.readInt32(0, CONTAINER);
        long fontOffset = 0;
        if (signature == TTC_TAG) {
            fontOffset = parseTTC(reader);
        }
        return parseFont(reader, fontOffset);
    }

    /**
     * Decodes a TrueType Collection header.
     *
     * @return the offset of the selected font's offset table
     */
    private long parseTTC(FontReader reader) throws IOException {
        ByteBuffer buf = reader.read(4, 8, CONTAINER);
        int majorVersion = buf.getShort() & 0xFFFF;
        int minorVersion = buf.getShort() & 0xFFFF;
        long numFonts = buf.getInt() & 0xFFFFFFFFL;

        if (numFonts == 0) {
            throw new MalformedFontException(CONTAINER, "collection contains no fonts", 8);
        }
        if (fontIndex >= numFonts) {
            throw new MalformedFontException(CONTAINER,
                    "font index " + fontIndex + " out of range for " + numFonts + " fonts", 8);
        }

        // Only the selected entry of the offset table is needed
        long offset = reader.readInt32(12 + 4L * fontIndex, CONTAINER) & 0xFFFFFFFFL;
        LOGGER.debug("TTC version {}.{} with {} fonts, font {} at offset {}",
                majorVersion, minorVersion, numFonts, fontIndex, offset);
        return offset;
    }

    /**
     * Decodes the offset table and table directory of a single font.
     */
    private TableDirectory parseFont(FontReader reader, long fontOffset) throws IOException {
        ByteBuffer buf = reader.read(fontOffset, OFFSET_TABLE_SIZE, CONTAINER);
        int sfntVersion = buf.getInt();
        if (sfntVersion != SFNT_VERSION_TRUETYPE
                && sfntVersion != SFNT_VERSION_CFF
                && sfntVersion != SFNT_VERSION_APPLE) {
            throw new MalformedFontException(CONTAINER,
                    String.format("unrecognized sfnt version 0x%08X", sfntVersion), fontOffset);
        }
        int numTables = buf.getShort() & 0xFFFF;
        // searchRange, entrySelector and rangeShift are not needed

        long directoryOffset = fontOffset + OFFSET_TABLE_SIZE;
        buf = reader.read(directoryOffset, numTables * TABLE_RECORD_SIZE, CONTAINER);

        Map<String, TableRecord> tablesByTag = new LinkedHashMap<>();
        for (int i = 0; i < numTables; i++) {
            String tag = readTag(buf);
            int checksum = buf.getInt();
            long offset = buf.getInt() & 0xFFFFFFFFL;
            long length = buf.getInt() & 0xFFFFFFFFL;

            long recordOffset = directoryOffset + (long) i * TABLE_RECORD_SIZE;
            if (offset + length > reader.size()) {
                throw new MalformedFontException(CONTAINER,
                        "table '" + tag + "' extends beyond end of file", recordOffset);
            }

            TableRecord record = new TableRecord(tag, checksum, offset, length);
            tablesByTag.put(tag, record);
            LOGGER.debug("table {}", record);
        }

        return new TableDirectory(sfntVersion, fontOffset, tablesByTag);
    }

    private static String readTag(ByteBuffer buf) {
        byte[] tag = new byte[4];
        buf.get(tag);
        return new String(tag, StandardCharsets.US_ASCII);
    }

}
