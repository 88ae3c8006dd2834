/*
 * GlyphNamePattern.java
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

import java.util.List;

/**
 * A rule that turns a font's internal glyph name into the codepoint
 * sequences it could represent.
 * <p>
 * A {@link SequenceResolver} consults its patterns in order and uses the
 * candidates of the first pattern that accepts the name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface GlyphNamePattern {

    /**
     * Generates candidate sequences for a glyph name.
     *
     * @param glyphName the glyph name from the {@code post} table
     * @return the candidates, most likely first, or null if this pattern
     *         does not apply to the name
     */
    List<CodepointSequence> candidates(String glyphName);

}
