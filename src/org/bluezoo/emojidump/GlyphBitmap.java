/*
 * GlyphBitmap.java
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
 * The embedded image of one glyph at one strike.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GlyphBitmap {

    /** Graphic type of PNG images. */
    public static final String TYPE_PNG = "png ";

    private final int glyphId;
    private final String glyphName;
    private final short originX;
    private final short originY;
    private final String graphicType;
    private final ImageData image;

    GlyphBitmap(int glyphId, String glyphName, short originX, short originY,
                String graphicType, ImageData image) {
        this.glyphId = glyphId;
        this.glyphName = glyphName;
        this.originX = originX;
        this.originY = originY;
        this.graphicType = graphicType;
        this.image = image;
    }

    public int getGlyphId() {
        return glyphId;
    }

    public String getGlyphName() {
        return glyphName;
    }

    /**
     * Returns the horizontal offset of the image origin from the glyph origin.
     */
    public short getOriginX() {
        return originX;
    }

    /**
     * Returns the vertical offset of the image origin from the glyph origin.
     */
    public short getOriginY() {
        return originY;
    }

    /**
     * Returns the 4-character graphic type tag, e.g. {@code "png "}.
     *
     * @return the graphic type
     */
    public String getGraphicType() {
        return graphicType;
    }

    public ImageData getImage() {
        return image;
    }

    /**
     * Reads the image bytes. Shorthand for {@code getImage().read()}.
     *
     * @return the image bytes
     * @throws IOException if an I/O error occurs
     */
    public byte[] read() throws IOException {
        return image.read();
    }

    @Override
    public String toString() {
        return String.format("glyph %d '%s' %s origin=(%d,%d) image=%s",
                glyphId, glyphName, graphicType.trim(), originX, originY, image);
    }

}
