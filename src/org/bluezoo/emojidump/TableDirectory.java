/*
 * TableDirectory.java
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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The table directory of one SFNT font, keyed by table tag.
 * <p>
 * Records keep the order in which they appear in the font. The directory
 * is immutable once parsed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TableDirectory {

    private final int sfntVersion;
    private final long fontOffset;
    private final Map<String, TableRecord> tablesByTag;

    TableDirectory(int sfntVersion, long fontOffset, Map<String, TableRecord> tablesByTag) {
        this.sfntVersion = sfntVersion;
        this.fontOffset = fontOffset;
        this.tablesByTag = Collections.unmodifiableMap(new LinkedHashMap<>(tablesByTag));
    }

    /**
     * Returns the sfnt version tag of the font
     * (0x00010000 for TrueType, 'OTTO' for CFF, 'true' for Apple TrueType).
     *
     * @return the sfnt version
     */
    public int getSfntVersion() {
        return sfntVersion;
    }

    /**
     * Returns the offset of this font's offset table within the file.
     *
     * @return 0 for a single font, otherwise the TTC entry offset
     */
    public long getFontOffset() {
        return fontOffset;
    }

    /**
     * Returns the record for the given tag.
     *
     * @param tag the 4-character table tag
     * @return the record, or null if the font has no such table
     */
    public TableRecord get(String tag) {
        return tablesByTag.get(tag);
    }

    /**
     * Returns the record for a table the caller cannot proceed without.
     *
     * @param tag the 4-character table tag
     * @param stage the stage requiring the table
     * @return the record
     * @throws MalformedFontException if the font has no such table
     */
    public TableRecord require(String tag, FontParseException.Stage stage) {
        TableRecord record = tablesByTag.get(tag);
        if (record == null) {
            throw new MalformedFontException(stage, "missing required table '" + tag + "'",
                    fontOffset);
        }
        return record;
    }

    public boolean contains(String tag) {
        return tablesByTag.containsKey(tag);
    }

    public int size() {
        return tablesByTag.size();
    }

    /**
     * Returns all records in directory order.
     *
     * @return an unmodifiable view of the records
     */
    public Collection<TableRecord> getTables() {
        return tablesByTag.values();
    }

}
