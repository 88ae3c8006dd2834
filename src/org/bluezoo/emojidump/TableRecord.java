/*
 * TableRecord.java
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

/**
 * Table record from an SFNT table directory.
 * <p>
 * Offsets are relative to the start of the file, including for fonts
 * embedded in a TrueType Collection.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TableRecord {

    private final String tag;
    private final int checksum;
    private final long offset;
    private final long length;

    /**
     * Creates a new table record.
     *
     * @param tag the 4-character table tag
     * @param checksum the table checksum
     * @param offset the offset of the table from the beginning of the file
     * @param length the length of the table in bytes
     */
    public TableRecord(String tag, int checksum, long offset, long length) {
        this.tag = tag;
        this.checksum = checksum;
        this.offset = offset;
        this.length = length;
    }

    public String getTag() {
        return tag;
    }

    public int getChecksum() {
        return checksum;
    }

    public long getOffset() {
        return offset;
    }

    public long getLength() {
        return length;
    }

    /**
     * Returns the offset of the first byte after the table.
     *
     * @return offset plus length
     */
    public long getEnd() {
        return offset + length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof TableRecord) {
            TableRecord other = (TableRecord) obj;
            return tag.equals(other.tag)
                && checksum == other.checksum
                && offset == other.offset
                && length == other.length;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return String.format("'%s' checksum=0x%08X offset=%d length=%d",
                tag, checksum, offset, length);
    }

}
