/*
 * ImageData.java
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
 * A byte range of embedded image data within a font file.
 * <p>
 * Nothing is read until {@link #read} is called, so a whole strike can be
 * enumerated without holding every image in memory. The range is fixed
 * and reads are positioned, so the same instance may be read repeatedly
 * and from any thread while the underlying {@link FontReader} is open.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ImageData {

    private final FontReader reader;
    private final long offset;
    private final int length;

    ImageData(FontReader reader, long offset, int length) {
        this.reader = reader;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Returns the absolute offset of the image in the font file.
     *
     * @return the file offset
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Returns the length of the image in bytes.
     *
     * @return the length
     */
    public int getLength() {
        return length;
    }

    /**
     * Reads the image bytes.
     *
     * @return the image, typically PNG-encoded
     * @throws IOException if an I/O error occurs or the font has been closed
     */
    public byte[] read() throws IOException {
        return reader.readBytes(offset, length, FontParseException.Stage.SBIX);
    }

    @Override
    public String toString() {
        return "[" + offset + ", " + (offset + length) + ")";
    }

}
