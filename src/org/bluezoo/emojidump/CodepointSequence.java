/*
 * CodepointSequence.java
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

import java.util.Arrays;

/**
 * An immutable sequence of Unicode scalar values representing one emoji.
 * <p>
 * Two sequences are equal only if they are identical codepoint for
 * codepoint; no normalization is applied.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CodepointSequence {

    /** Zero width joiner. */
    public static final int ZWJ = 0x200D;

    /** Variation selector 16, requesting emoji presentation. */
    public static final int VS16 = 0xFE0F;

    public static final int MALE_SIGN = 0x2642;
    public static final int FEMALE_SIGN = 0x2640;

    /** Fitzpatrick type 1-2 (light skin tone). */
    public static final int SKIN_TONE_1 = 0x1F3FB;

    /** Fitzpatrick type 6 (dark skin tone). */
    public static final int SKIN_TONE_5 = 0x1F3FF;

    private final int[] codepoints;

    private CodepointSequence(int[] codepoints) {
        this.codepoints = codepoints;
    }

    /**
     * Creates a sequence from codepoints.
     *
     * @param codepoints the Unicode scalar values
     * @return the sequence
     * @throws IllegalArgumentException if a value is not a valid codepoint
     */
    public static CodepointSequence of(int... codepoints) {
        for (int cp : codepoints) {
            if (!Character.isValidCodePoint(cp)) {
                throw new IllegalArgumentException("Invalid codepoint: " + Integer.toHexString(cp));
            }
        }
        return new CodepointSequence(codepoints.clone());
    }

    /**
     * Creates a sequence from the codepoints of a string.
     *
     * @param s the string
     * @return the sequence
     */
    public static CodepointSequence fromString(CharSequence s) {
        return new CodepointSequence(s.codePoints().toArray());
    }

    /**
     * Parses whitespace separated hexadecimal codepoints, as found in the
     * Unicode data files, e.g. {@code "1F468 200D 1F469"}.
     *
     * @param hex the codepoints
     * @return the sequence
     * @throws IllegalArgumentException if a field is not hexadecimal or not a codepoint
     */
    public static CodepointSequence parse(String hex) {
        String trimmed = hex.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty codepoint sequence");
        }
        String[] fields = trimmed.split("\\s+");
        int[] codepoints = new int[fields.length];
        for (int i = 0; i < fields.length; i++) {
            try {
                codepoints[i] = Integer.parseInt(fields[i], 16);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a hexadecimal codepoint: " + fields[i], e);
            }
        }
        return of(codepoints);
    }

    /**
     * Indicates whether a codepoint is one of the five skin tone modifiers.
     *
     * @param cp the codepoint
     * @return true for U+1F3FB..U+1F3FF
     */
    public static boolean isSkinTone(int cp) {
        return cp >= SKIN_TONE_1 && cp <= SKIN_TONE_5;
    }

    public int length() {
        return codepoints.length;
    }

    public int codepointAt(int index) {
        return codepoints[index];
    }

    /**
     * Returns a copy of the codepoints.
     *
     * @return the codepoints
     */
    public int[] toArray() {
        return codepoints.clone();
    }

    public boolean contains(int cp) {
        for (int c : codepoints) {
            if (c == cp) {
                return true;
            }
        }
        return false;
    }

    /**
     * Indicates whether this sequence carries a skin tone modifier.
     *
     * @return true if any codepoint is a skin tone modifier
     */
    public boolean hasSkinTone() {
        for (int c : codepoints) {
            if (isSkinTone(c)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns this sequence followed by the given codepoints.
     *
     * @param suffix the codepoints to append
     * @return the extended sequence
     */
    public CodepointSequence append(int... suffix) {
        int[] result = Arrays.copyOf(codepoints, codepoints.length + suffix.length);
        System.arraycopy(suffix, 0, result, codepoints.length, suffix.length);
        return of(result);
    }

    /**
     * Returns this sequence without its first occurrence of a codepoint.
     *
     * @param cp the codepoint to remove
     * @return the shortened sequence, or this sequence if it does not contain cp
     */
    public CodepointSequence removeFirst(int cp) {
        for (int i = 0; i < codepoints.length; i++) {
            if (codepoints[i] == cp) {
                int[] result = new int[codepoints.length - 1];
                System.arraycopy(codepoints, 0, result, 0, i);
                System.arraycopy(codepoints, i + 1, result, i, codepoints.length - i - 1);
                return new CodepointSequence(result);
            }
        }
        return this;
    }

    /**
     * Returns this sequence without any occurrence of a codepoint.
     *
     * @param cp the codepoint to remove
     * @return the filtered sequence
     */
    public CodepointSequence removeAll(int cp) {
        return new CodepointSequence(Arrays.stream(codepoints).filter(c -> c != cp).toArray());
    }

    /**
     * Returns the identifier under which the image of this emoji is stored:
     * the lowercase hexadecimal codepoints, zero padded to at least four
     * digits and joined by underscores, with variation selectors omitted
     * and the given prefix prepended, e.g. {@code emoji_u1f468_200d_1f469}.
     *
     * @param prefix the identifier prefix
     * @return the identifier
     */
    public String toIdentifier(String prefix) {
        StringBuilder buf = new StringBuilder(prefix);
        boolean first = true;
        for (int cp : codepoints) {
            if (cp == VS16) {
                continue;
            }
            if (!first) {
                buf.append('_');
            }
            String hex = Integer.toHexString(cp);
            for (int i = hex.length(); i < 4; i++) {
                buf.append('0');
            }
            buf.append(hex);
            first = false;
        }
        return buf.toString();
    }

    /**
     * Returns the emoji as a Java string.
     *
     * @return the string
     */
    public String toUnicodeString() {
        return new String(codepoints, 0, codepoints.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof CodepointSequence) {
            return Arrays.equals(codepoints, ((CodepointSequence) obj).codepoints);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codepoints);
    }

    /**
     * Returns the sequence in Unicode data file notation, e.g.
     * {@code "1F468 200D 1F469"}.
     */
    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (int cp : codepoints) {
            if (buf.length() > 0) {
                buf.append(' ');
            }
            buf.append(String.format("%04X", cp));
        }
        return buf.toString();
    }

}
