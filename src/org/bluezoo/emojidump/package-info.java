/*
 * package-info.java
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

/**
 * Emojidump colour emoji extractor.
 * <p>
 * Extracts the per-glyph bitmaps of a TrueType font or collection that
 * stores colour glyphs in an {@code sbix} table, and names each image
 * after the Unicode emoji sequence its glyph represents.
 * <p>
 * The main entry points are:
 * <ul>
 *   <li>{@link org.bluezoo.emojidump.EmojiFont} - The decoded font</li>
 *   <li>{@link org.bluezoo.emojidump.EmojiExtractor} - The extractor</li>
 *   <li>{@link org.bluezoo.emojidump.EmojiHandler} - The callback handler interface</li>
 * </ul>
 * <p>
 * Glyph names are turned into codepoint sequences by a
 * {@link org.bluezoo.emojidump.SequenceResolver} and checked against an
 * {@link org.bluezoo.emojidump.EmojiDatabase}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.emojidump;
