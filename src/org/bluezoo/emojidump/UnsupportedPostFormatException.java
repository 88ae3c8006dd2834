/*
 * UnsupportedPostFormatException.java
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
 * Thrown when the {@code post} table is not version 2.0, so that no glyph
 * names can be recovered from it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnsupportedPostFormatException extends FontParseException {

    private static final long serialVersionUID = 1L;

    private final int version;

    /**
     * Creates a new exception.
     *
     * @param version the 16.16 fixed version found in the table
     * @param offset the offset of the version field
     */
    public UnsupportedPostFormatException(int version, long offset) {
        super(Stage.POST, String.format("unsupported post table version 0x%08X", version),
                offset);
        this.version = version;
    }

    /**
     * Returns the raw 16.16 fixed version of the table.
     *
     * @return the version
     */
    public int getVersion() {
        return version;
    }

}
