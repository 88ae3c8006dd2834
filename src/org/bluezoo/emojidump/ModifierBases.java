/*
 * ModifierBases.java
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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The set of emoji that take skin tone modifiers.
 * <p>
 * Built once from the {@code Emoji_Modifier_Sequence} lines of the Unicode
 * {@code emoji-sequences.txt} data: the leading codepoint of every such
 * line is a modifier base. Immutable once built.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ModifierBases {

    /** Marks lines describing modifier sequences. */
    static final String MARKER = "Emoji_Modifier_Sequence";

    private static final Pattern LEADING_CODEPOINT = Pattern.compile("^([0-9A-F]{4,5})");

    private final Set<Integer> bases;

    private ModifierBases(Set<Integer> bases) {
        this.bases = Collections.unmodifiableSet(bases);
    }

    /**
     * Extracts the modifier bases from reference data lines. Lines without
     * the marker or without a leading codepoint are ignored.
     *
     * @param lines the lines of {@code emoji-sequences.txt}
     * @return the modifier bases
     */
    public static ModifierBases parse(Iterable<String> lines) {
        Set<Integer> bases = new TreeSet<>();
        for (String line : lines) {
            if (line.startsWith("#") || !line.contains(MARKER)) {
                continue;
            }
            Matcher m = LEADING_CODEPOINT.matcher(line);
            if (m.find()) {
                bases.add(Integer.parseInt(m.group(1), 16));
            }
        }
        return new ModifierBases(bases);
    }

    /**
     * Indicates whether a codepoint is a modifier base.
     *
     * @param cp the codepoint
     * @return true if the codepoint takes skin tone modifiers
     */
    public boolean contains(int cp) {
        return bases.contains(cp);
    }

    public int size() {
        return bases.size();
    }

    /**
     * Returns the modifier bases in codepoint order.
     *
     * @return an unmodifiable set of codepoints
     */
    public Set<Integer> getCodepoints() {
        return bases;
    }

}
