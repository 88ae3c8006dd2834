/*
 * CompositeNamePattern.java
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names of family, couple and kiss glyphs.
 * <p>
 * These are written as a legacy composite codepoint, a dot, and one
 * letter per person: {@code B}oy, {@code G}irl, {@code M}an and
 * {@code W}oman. For example {@code u1F46A.MWG} is the family of man,
 * woman and girl, which Unicode encodes as the person emoji joined by
 * connective codepoints. Letter codes listed as canonical are the
 * combinations the legacy codepoint itself stands for, and resolve to
 * that single codepoint instead.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CompositeNamePattern implements GlyphNamePattern {

    public static final int BOY = 0x1F466;
    public static final int GIRL = 0x1F467;
    public static final int MAN = 0x1F468;
    public static final int WOMAN = 0x1F469;

    public static final int FAMILY = 0x1F46A;
    public static final int COUPLE_WITH_HEART = 0x1F491;
    public static final int KISS = 0x1F48F;

    static final int HEAVY_BLACK_HEART = 0x2764;
    static final int KISS_MARK = 0x1F48B;

    /** Family members, joined by ZWJ. {@code u1F46A.MWB} is the legacy family. */
    public static final CompositeNamePattern FAMILY_PATTERN = new CompositeNamePattern(
            FAMILY, new int[] { CodepointSequence.ZWJ }, Collections.singleton("MWB"));

    /** Couple with heart. {@code u1F491.WM} is the legacy couple. */
    public static final CompositeNamePattern COUPLE_PATTERN = new CompositeNamePattern(
            COUPLE_WITH_HEART,
            new int[] { CodepointSequence.ZWJ, HEAVY_BLACK_HEART, CodepointSequence.VS16,
                    CodepointSequence.ZWJ },
            Collections.singleton("WM"));

    /** Kiss. {@code u1F48F.WM} is the legacy kiss. */
    public static final CompositeNamePattern KISS_PATTERN = new CompositeNamePattern(
            KISS,
            new int[] { CodepointSequence.ZWJ, HEAVY_BLACK_HEART, CodepointSequence.VS16,
                    CodepointSequence.ZWJ, KISS_MARK, CodepointSequence.ZWJ },
            Collections.singleton("WM"));

    private final int composite;
    private final int[] connective;
    private final Set<String> canonicalCodes;
    private final Pattern pattern;

    /**
     * Creates a composite pattern.
     *
     * @param composite the legacy codepoint named by the glyph
     * @param connective the codepoints placed between consecutive persons
     * @param canonicalCodes letter codes that resolve to the legacy codepoint
     */
    public CompositeNamePattern(int composite, int[] connective, Set<String> canonicalCodes) {
        this.composite = composite;
        this.connective = connective.clone();
        this.canonicalCodes = Collections.unmodifiableSet(new HashSet<>(canonicalCodes));
        this.pattern = Pattern.compile("^u" + String.format("%04X", composite) + "\\.([BGMW]+)$");
    }

    public int getComposite() {
        return composite;
    }

    public Set<String> getCanonicalCodes() {
        return canonicalCodes;
    }

    @Override
    public List<CodepointSequence> candidates(String glyphName) {
        Matcher m = pattern.matcher(glyphName);
        if (!m.matches()) {
            return null;
        }
        String code = m.group(1);
        if (canonicalCodes.contains(code)) {
            return Collections.singletonList(CodepointSequence.of(composite));
        }

        int[] result = new int[code.length() + (code.length() - 1) * connective.length];
        int pos = 0;
        for (int i = 0; i < code.length(); i++) {
            if (i > 0) {
                System.arraycopy(connective, 0, result, pos, connective.length);
                pos += connective.length;
            }
            result[pos++] = person(code.charAt(i));
        }
        return Collections.singletonList(CodepointSequence.of(result));
    }

    private static int person(char c) {
        switch (c) {
            case 'B':
                return BOY;
            case 'G':
                return GIRL;
            case 'M':
                return MAN;
            case 'W':
                return WOMAN;
            default:
                throw new IllegalArgumentException("Not a person code: " + c);
        }
    }

    @Override
    public String toString() {
        return "CompositeNamePattern[" + pattern.pattern() + " canonical=" + canonicalCodes + "]";
    }

}
