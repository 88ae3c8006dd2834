/*
 * MalformedFontException.java
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
 * Thrown when the font data is structurally invalid: a bad signature,
 * a truncated read, an offset outside the file or a missing required
 * table.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MalformedFontException extends FontParseException {

    private static final long serialVersionUID = 1L;

    public MalformedFontException(Stage stage, String message) {
        super(stage, message);
    }

    public MalformedFontException(Stage stage, String message, long offset) {
        super(stage, message, offset);
    }

}
