/*
 * UnicodeEmojiDatabase.java
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EmojiDatabase} read from Unicode emoji data files such as
 * {@code emoji-sequences.txt}, {@code emoji-zwj-sequences.txt} and
 * {@code emoji-test.txt}.
 * <p>
 * Each data line has semicolon separated fields, the first of which is
 * either a single sequence of space separated hexadecimal codepoints or a
 * range {@code XXXX..YYYY} of single codepoints. Text after {@code #} is a
 * comment.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnicodeEmojiDatabase implements EmojiDatabase {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnicodeEmojiDatabase.class);

    private final Set<CodepointSequence> sequences;

    private UnicodeEmojiDatabase(Set<CodepointSequence> sequences) {
        this.sequences = Collections.unmodifiableSet(sequences);
    }

    /**
     * Builds a database from data file lines.
     *
     * @param lines the lines of one or more data files
     * @return the database
     */
    public static UnicodeEmojiDatabase parse(Iterable<String> lines) {
        Set<CodepointSequence> sequences = new LinkedHashSet<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            int hash = line.indexOf('#');
            String data = (hash >= 0) ? line.substring(0, hash) : line;
            if (data.trim().isEmpty()) {
                continue;
            }
            int semi = data.indexOf(';');
            String field = ((semi >= 0) ? data.substring(0, semi) : data).trim();
            try {
                int range = field.indexOf("..");
                if (range >= 0) {
                    int first = Integer.parseInt(field.substring(0, range).trim(), 16);
                    int last = Integer.parseInt(field.substring(range + 2).trim(), 16);
                    for (int cp = first; cp <= last; cp++) {
                        sequences.add(CodepointSequence.of(cp));
                    }
                } else {
                    sequences.add(CodepointSequence.parse(field));
                }
            } catch (IllegalArgumentException e) {
                LOGGER.debug("Ignoring line {}: {}", lineNumber, e.getMessage());
            }
        }
        return new UnicodeEmojiDatabase(sequences);
    }

    /**
     * Reads a database from data files.
     *
     * @param files the data files, read as UTF-8
     * @return the database
     * @throws IOException if a file cannot be read
     */
    public static UnicodeEmojiDatabase load(Path... files) throws IOException {
        Set<CodepointSequence> sequences = new LinkedHashSet<>();
        for (Path file : files) {
            sequences.addAll(parse(Files.readAllLines(file, StandardCharsets.UTF_8)).sequences);
        }
        LOGGER.info("Loaded {} emoji sequences from {} files", sequences.size(), files.length);
        return new UnicodeEmojiDatabase(sequences);
    }

    @Override
    public CodepointSequence find(CodepointSequence sequence) {
        return sequences.contains(sequence) ? sequence : null;
    }

    @Override
    public Collection<CodepointSequence> getSequences() {
        return sequences;
    }

    public int size() {
        return sequences.size();
    }

}
