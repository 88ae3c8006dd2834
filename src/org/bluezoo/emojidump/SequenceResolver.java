/*
 * SequenceResolver.java
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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Resolves glyph names to the Unicode codepoint sequences they represent.
 * <p>
 * The patterns are tried in order and the first one accepting a name
 * supplies its candidate sequences. By default these are the family,
 * couple and kiss {@link CompositeNamePattern}s followed by the catch-all
 * {@link TokenNamePattern}.
 * <p>
 * A resolver is stateless apart from its configuration, so resolving the
 * same name twice yields the same result.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SequenceResolver {

    private final EmojiDatabase database;
    private final List<GlyphNamePattern> patterns;

    /**
     * Creates a resolver with the default patterns.
     *
     * @param database the canonical emoji database
     */
    public SequenceResolver(EmojiDatabase database) {
        this(database, defaultPatterns());
    }

    /**
     * Creates a resolver.
     *
     * @param database the canonical emoji database
     * @param patterns the glyph name patterns, in the order they are tried
     */
    public SequenceResolver(EmojiDatabase database, List<GlyphNamePattern> patterns) {
        if (database == null) {
            throw new NullPointerException("Database cannot be null");
        }
        this.database = database;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    /**
     * Returns the default patterns.
     *
     * @return family, couple, kiss and token patterns
     */
    public static List<GlyphNamePattern> defaultPatterns() {
        return Arrays.asList(
                CompositeNamePattern.FAMILY_PATTERN,
                CompositeNamePattern.COUPLE_PATTERN,
                CompositeNamePattern.KISS_PATTERN,
                new TokenNamePattern());
    }

    public EmojiDatabase getDatabase() {
        return database;
    }

    public List<GlyphNamePattern> getPatterns() {
        return patterns;
    }

    /**
     * Returns every candidate sequence for a glyph name, whether or not it
     * is a known emoji.
     *
     * @param glyphName the glyph name
     * @return the candidates, most likely first
     */
    public List<CodepointSequence> candidates(String glyphName) {
        for (GlyphNamePattern pattern : patterns) {
            List<CodepointSequence> candidates = pattern.candidates(glyphName);
            if (candidates != null) {
                return candidates;
            }
        }
        return Collections.emptyList();
    }

    /**
     * Resolves a glyph name to the single emoji it stands for: the first
     * candidate present in the database.
     *
     * @param glyphName the glyph name
     * @return the canonical sequence, or null if the name is unresolved
     */
    public CodepointSequence resolve(String glyphName) {
        for (CodepointSequence candidate : candidates(glyphName)) {
            CodepointSequence emoji = database.find(candidate);
            if (emoji != null) {
                return emoji;
            }
        }
        return null;
    }

    /**
     * Returns every candidate of a glyph name that is present in the
     * database. All of them are valid aliases of the glyph.
     *
     * @param glyphName the glyph name
     * @return the canonical sequences, possibly empty
     */
    public List<CodepointSequence> aliases(String glyphName) {
        List<CodepointSequence> aliases = new ArrayList<>();
        for (CodepointSequence candidate : candidates(glyphName)) {
            CodepointSequence emoji = database.find(candidate);
            if (emoji != null && !aliases.contains(emoji)) {
                aliases.add(emoji);
            }
        }
        return aliases;
    }

    /**
     * Indicates whether a glyph name could represent the given sequence.
     * Computes the name's candidates anew on each call.
     *
     * @param glyphName the glyph name
     * @param sequence the sequence
     * @return true if the sequence is among the name's candidates
     */
    boolean matches(String glyphName, CodepointSequence sequence) {
        return candidates(glyphName).contains(sequence);
    }

}
