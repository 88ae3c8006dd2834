/*
 * EmojiDatabase.java
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

import java.util.Collection;

/**
 * The canonical set of emoji against which glyph name candidates are
 * checked.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface EmojiDatabase {

    /**
     * Looks up an emoji by its exact codepoint sequence.
     *
     * @param sequence the candidate sequence
     * @return the canonical sequence of the emoji, or null if there is none
     */
    CodepointSequence find(CodepointSequence sequence);

    /**
     * Returns every emoji in the database, in database order.
     *
     * @return the sequences
     */
    Collection<CodepointSequence> getSequences();

}
