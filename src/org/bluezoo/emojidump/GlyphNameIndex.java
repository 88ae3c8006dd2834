/*
 * GlyphNameIndex.java
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
import java.util.ArrayList;
import java.util.List;
import java.util.function.ObjIntConsumer;

import static org.bluezoo.emojidump.FontParseException.Stage.POST;

/**
 * Glyph names decoded from a format 2.0 {@code post} table.
 * <p>
 * Each glyph ID maps to a name index. Indices below 258 refer to the
 * standard Macintosh glyph order; higher indices refer to entry
 * {@code index - 258} of the Pascal string pool that follows the index
 * array. Names are resolved once when the table is parsed, so
 * {@link #nameFor} is a constant-time lookup.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class GlyphNameIndex {

    /** The only post table version that carries glyph names we decode. */
    static final int VERSION_2_0 = 0x00020000;

    /** Number of names in the standard Macintosh glyph order. */
    static final int NUM_STANDARD_NAMES = 258;

    /** Size of the fixed post table header. */
    private static final int HEADER_SIZE = 32;

    private final String[] names;

    GlyphNameIndex(String[] names) {
        this.names = names;
    }

    /**
     * Parses the glyph names in a {@code post} table.
     *
     * @param reader the font data
     * @param post the post table record
     * @return the glyph name index
     * @throws UnsupportedPostFormatException if the table is not version 2.0
     * @throws MalformedFontException if the table is truncated or its
     *         string pool has fewer entries than the index refers to
     * @throws IOException if an I/O error occurs
     */
    public static GlyphNameIndex parse(FontReader reader, TableRecord post) throws IOException {
        long tableStart = post.getOffset();
        if (post.getLength() < 4) {
            throw new MalformedFontException(POST,
                    "post table too short (" + post.getLength() + " bytes)", tableStart);
        }
        // Formats 1.0 and 3.0 have no index, so the version decides before the length
        int version = reader.readInt32(tableStart, POST);
        if (version != VERSION_2_0) {
            throw new UnsupportedPostFormatException(version, tableStart);
        }
        if (post.getLength() < HEADER_SIZE + 2) {
            throw new MalformedFontException(POST,
                    "post table too short (" + post.getLength() + " bytes)", tableStart);
        }
        ByteBuffer buf = reader.read(tableStart, (int) post.getLength(), POST);
        // italicAngle, underline metrics, isFixedPitch and memory hints are not needed
        buf.position(HEADER_SIZE);

        int numGlyphs = buf.getShort() & 0xFFFF;
        if (buf.remaining() < numGlyphs * 2) {
            throw new MalformedFontException(POST,
                    "glyph name index truncated", tableStart + buf.position());
        }
        int[] glyphNameIndex = new int[numGlyphs];
        int maxIndex = -1;
        for (int i = 0; i < numGlyphs; i++) {
            glyphNameIndex[i] = buf.getShort() & 0xFFFF;
            maxIndex = Math.max(maxIndex, glyphNameIndex[i]);
        }

        // Read Pascal strings up to the end of the table
        List<String> extraNames = new ArrayList<>();
        while (buf.hasRemaining()) {
            int stringStart = buf.position();
            int nameLength = buf.get() & 0xFF;
            if (buf.remaining() < nameLength) {
                throw new MalformedFontException(POST,
                        "glyph name string overruns table", tableStart + stringStart);
            }
            byte[] nameBytes = new byte[nameLength];
            buf.get(nameBytes);
            extraNames.add(new String(nameBytes, StandardCharsets.US_ASCII));
        }

        if (maxIndex - NUM_STANDARD_NAMES >= extraNames.size()) {
            throw new MalformedFontException(POST,
                    "string pool has " + extraNames.size() + " names but index refers to name "
                    + (maxIndex - NUM_STANDARD_NAMES), post.getEnd());
        }

        String[] names = new String[numGlyphs];
        for (int i = 0; i < numGlyphs; i++) {
            int index = glyphNameIndex[i];
            if (index < NUM_STANDARD_NAMES) {
                names[i] = STANDARD_GLYPH_NAMES[index];
            } else {
                names[i] = extraNames.get(index - NUM_STANDARD_NAMES);
            }
        }
        return new GlyphNameIndex(names);
    }

    /**
     * Returns the number of glyphs named by the table.
     *
     * @return the glyph count
     */
    public int size() {
        return names.length;
    }

    /**
     * Returns the name of a glyph.
     *
     * @param glyphId the glyph ID
     * @return the glyph name
     * @throws IndexOutOfBoundsException if the glyph ID is not in the table
     */
    public String nameFor(int glyphId) {
        if (glyphId < 0 || glyphId >= names.length) {
            throw new IndexOutOfBoundsException("Glyph ID out of range: " + glyphId);
        }
        return names[glyphId];
    }

    /**
     * Calls the given action for every glyph in glyph ID order.
     *
     * @param action receives each glyph name and its glyph ID
     */
    public void forEach(ObjIntConsumer<String> action) {
        for (int i = 0; i < names.length; i++) {
            action.accept(names[i], i);
        }
    }

    // Standard Macintosh glyph order used by post formats 1.0 and 2.0
    static final String[] STANDARD_GLYPH_NAMES = {
        ".notdef", ".null", "nonmarkingreturn", "space", "exclam", "quotedbl", "numbersign",
        "dollar", "percent", "ampersand", "quotesingle", "parenleft", "parenright", "asterisk",
        "plus", "comma", "hyphen", "period", "slash", "zero", "one", "two", "three", "four",
        "five", "six", "seven", "eight", "nine", "colon", "semicolon", "less", "equal", "greater",
        "question", "at", "A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K", "L", "M", "N",
        "O", "P", "Q", "R", "S", "T", "U", "V", "W", "X", "Y", "Z", "bracketleft", "backslash",
        "bracketright", "asciicircum", "underscore", "grave", "a", "b", "c", "d", "e", "f", "g",
        "h", "i", "j", "k", "l", "m", "n", "o", "p", "q", "r", "s", "t", "u", "v", "w", "x", "y",
        "z", "braceleft", "bar", "braceright", "asciitilde", "Adieresis", "Aring", "Ccedilla",
        "Eacute", "Ntilde", "Odieresis", "Udieresis", "aacute", "agrave", "acircumflex",
        "adieresis", "atilde", "aring", "ccedilla", "eacute", "egrave", "ecircumflex", "edieresis",
        "iacute", "igrave", "icircumflex", "idieresis", "ntilde", "oacute", "ograve", "ocircumflex",
        "odieresis", "otilde", "uacute", "ugrave", "ucircumflex", "udieresis", "dagger", "degree",
        "cent", "sterling", "section", "bullet", "paragraph", "germandbls", "registered",
        "copyright", "trademark", "acute", "dieresis", "notequal", "AE", "Oslash", "infinity",
        "plusminus", "lessequal", "greaterequal", "yen", "mu", "partialdiff", "summation",
        "product", "pi", "integral", "ordfeminine", "ordmasculine", "Omega", "ae", "oslash",
        "questiondown", "exclamdown", "logicalnot", "radical", "florin", "approxequal", "Delta",
        "guillemotleft", "guillemotright", "ellipsis", "nonbreakingspace", "Agrave", "Atilde",
        "Otilde", "OE", "oe", "endash", "emdash", "quotedblleft", "quotedblright", "quoteleft",
        "quoteright", "divide", "lozenge", "ydieresis", "Ydieresis", "fraction", "currency",
        "guilsinglleft", "guilsinglright", "fi", "fl", "daggerdbl", "periodcentered",
        "quotesinglbase", "quotedblbase", "perthousand", "Acircumflex", "Ecircumflex", "Aacute",
        "Edieresis", "Egrave", "Iacute", "Icircumflex", "Idieresis", "Igrave", "Oacute",
        "Ocircumflex", "apple", "Ograve", "Uacute", "Ucircumflex", "Ugrave", "dotlessi",
        "circumflex", "tilde", "macron", "breve", "dotaccent", "ring", "cedilla", "hungarumlaut",
        "ogonek", "caron", "Lslash", "lslash", "Scaron", "scaron", "Zcaron", "zcaron",
        "brokenbar", "Eth", "eth", "Yacute", "yacute", "Thorn", "thorn", "minus", "multiply",
        "onesuperior", "twosuperior", "threesuperior", "onehalf", "onequarter", "threequarters",
        "franc", "Gbreve", "gbreve", "Idotaccent", "Scedilla", "scedilla", "Cacute", "cacute",
        "Ccaron", "ccaron", "dcroat"
    };

}
