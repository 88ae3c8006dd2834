/*
 * FontParseException.java
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
 * Exception thrown when a font file cannot be decoded.
 * <p>
 * Structural failures abort the whole extraction: no part of a font is
 * ever partially decoded. The exception records which stage of decoding
 * failed and, where known, the byte offset in the font file at which the
 * data diverged from what was expected.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FontParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * The decoding stage at which a failure occurred.
     */
    public enum Stage {

        /** TTC header or SFNT table directory. */
        CONTAINER,

        /** The {@code post} table. */
        POST,

        /** The {@code sbix} table. */
        SBIX

    }

    private final Stage stage;
    private final long offset;

    /**
     * Creates a new exception with no known offset.
     *
     * @param stage the stage that failed
     * @param message the error message
     */
    public FontParseException(Stage stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
        this.offset = -1;
    }

    /**
     * Creates a new exception with the specified byte offset.
     *
     * @param stage the stage that failed
     * @param message the error message
     * @param offset the byte offset in the font file where the error occurred
     */
    public FontParseException(Stage stage, String message, long offset) {
        super(stage + ": " + message + " at offset " + offset);
        this.stage = stage;
        this.offset = offset;
    }

    /**
     * Returns the stage at which decoding failed.
     *
     * @return the stage
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * Returns the byte offset in the font file where the error occurred.
     *
     * @return the offset, or -1 if not available
     */
    public long getOffset() {
        return offset;
    }

}
