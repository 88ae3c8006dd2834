/*
 * TokenNamePattern.java
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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names built from {@code u<HEX>} tokens with optional suffixes.
 * <p>
 * Each token decodes to its codepoint; tokens after the first are joined
 * with ZWJ. The suffixes are then rewritten in this order:
 * <ol>
 *   <li>{@code .0}, the gender neutral marker, is removed;</li>
 *   <li>{@code .1} to {@code .5} become the corresponding skin tone modifier;</li>
 *   <li>a final {@code .M} or {@code .W} becomes VS16, ZWJ and the male or
 *       female sign.</li>
 * </ol>
 * Since fonts and the Unicode data disagree about optional variation
 * selectors, the candidates also include the sequence without its first
 * VS16, without any ZWJ, and each of those with a VS16 appended.
 * <p>
 * This pattern accepts every name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TokenNamePattern implements GlyphNamePattern {

    private static final Pattern TOKEN = Pattern.compile("(^|_)u([0-9A-F]+)");
    private static final Pattern NEUTRAL = Pattern.compile("\\.0\\b");
    private static final Pattern SKIN_TONE = Pattern.compile("\\.([1-5])");
    private static final Pattern GENDER = Pattern.compile("\\.([MW])$");

    @Override
    public List<CodepointSequence> candidates(String glyphName) {
        CodepointSequence raw = CodepointSequence.fromString(rewrite(glyphName));

        Set<CodepointSequence> candidates = new LinkedHashSet<>();
        candidates.add(raw);
        if (raw.contains(CodepointSequence.VS16)) {
            candidates.add(raw.removeFirst(CodepointSequence.VS16));
        }
        if (raw.contains(CodepointSequence.ZWJ)) {
            candidates.add(raw.removeAll(CodepointSequence.ZWJ));
        }
        for (CodepointSequence c : new ArrayList<>(candidates)) {
            candidates.add(c.append(CodepointSequence.VS16));
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Rewrites tokens and suffixes of a glyph name into the characters of
     * the base candidate. Text that is not part of a token or suffix is
     * kept as it is.
     *
     * @param glyphName the glyph name
     * @return the base candidate as a string
     */
    static String rewrite(String glyphName) {
        StringBuffer buf = new StringBuffer();
        Matcher m = TOKEN.matcher(glyphName);
        while (m.find()) {
            String replacement = m.group();
            int cp = parseCodepoint(m.group(2));
            if (cp >= 0) {
                StringBuilder chars = new StringBuilder();
                if (!m.group(1).isEmpty()) {
                    chars.append((char) CodepointSequence.ZWJ);
                }
                chars.appendCodePoint(cp);
                replacement = chars.toString();
            }
            m.appendReplacement(buf, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(buf);
        String raw = buf.toString();

        raw = NEUTRAL.matcher(raw).replaceFirst("");

        m = SKIN_TONE.matcher(raw);
        if (m.find()) {
            int tone = CodepointSequence.SKIN_TONE_1 + (m.group(1).charAt(0) - '1');
            raw = raw.substring(0, m.start()) + new String(Character.toChars(tone))
                    + raw.substring(m.end());
        }

        m = GENDER.matcher(raw);
        if (m.find()) {
            int sign = "M".equals(m.group(1))
                    ? CodepointSequence.MALE_SIGN : CodepointSequence.FEMALE_SIGN;
            raw = raw.substring(0, m.start())
                    + (char) CodepointSequence.VS16 + (char) CodepointSequence.ZWJ + (char) sign
                    + raw.substring(m.end());
        }
        return raw;
    }

    /**
     * Returns the codepoint of a hexadecimal token, or -1 if it is not a
     * valid codepoint.
     */
    private static int parseCodepoint(String hex) {
        if (hex.length() > 6) {
            return -1;
        }
        int cp = Integer.parseInt(hex, 16);
        return Character.isValidCodePoint(cp) ? cp : -1;
    }

}
