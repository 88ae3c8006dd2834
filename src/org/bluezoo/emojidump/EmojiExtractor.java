/*
 * EmojiExtractor.java
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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the emoji images of a colour emoji font.
 * <p>
 * Extraction makes two passes. The first reports every glyph that has a
 * bitmap at the font's strike, keyed by the emoji its name resolves to.
 * The second uses a {@link ModifierSequenceEnumerator} to report skin tone
 * sequences whose images exist in the font under another glyph's name.
 * Events are delivered to an {@link EmojiHandler}.
 * <p>
 * Example usage:
 * <pre>
 * EmojiDatabase database = UnicodeEmojiDatabase.load(sequencesFile, zwjFile);
 * ModifierBases bases = ModifierBases.parse(Files.readAllLines(sequencesFile));
 * EmojiExtractor extractor = new EmojiExtractor(database, bases);
 *
 * try (EmojiFont font = EmojiFont.open(fontFile, 0, 160)) {
 *     extractor.extract(font, new DirectoryEmojiHandler(outputDir));
 * }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EmojiExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmojiExtractor.class);

    /** Strike size extracted when none is given. */
    public static final int DEFAULT_PPEM = 160;

    private final SequenceResolver resolver;
    private final ModifierSequenceEnumerator enumerator;

    /**
     * Creates an extractor with the default glyph name patterns.
     *
     * @param database the canonical emoji database
     * @param bases the modifier bases, or null to skip the skin tone pass
     */
    public EmojiExtractor(EmojiDatabase database, ModifierBases bases) {
        this.resolver = new SequenceResolver(database);
        this.enumerator = (bases == null) ? null : new ModifierSequenceEnumerator(bases, resolver);
    }

    /**
     * Creates an extractor.
     *
     * @param resolver resolves glyph names
     * @param enumerator synthesizes skin tone sequences, or null to skip that pass
     */
    public EmojiExtractor(SequenceResolver resolver, ModifierSequenceEnumerator enumerator) {
        if (resolver == null) {
            throw new NullPointerException("Resolver cannot be null");
        }
        this.resolver = resolver;
        this.enumerator = enumerator;
    }

    public SequenceResolver getResolver() {
        return resolver;
    }

    public ModifierSequenceEnumerator getEnumerator() {
        return enumerator;
    }

    /**
     * Extracts the emoji of a font.
     *
     * @param font the opened font
     * @param handler receives the extraction events
     * @throws IOException if the font cannot be read or the handler fails
     */
    public void extract(EmojiFont font, EmojiHandler handler) throws IOException {
        int ppem = font.getStrike().getPpem();
        handler.startExtraction(font.getNumGlyphs(), ppem);

        List<GlyphBitmap> bitmaps = font.getBitmaps();
        LOGGER.info("Exporting {} glyph bitmaps at {} ppem", bitmaps.size(), ppem);
        int resolved = 0;
        int unresolved = 0;
        for (GlyphBitmap bitmap : bitmaps) {
            CodepointSequence sequence = resolver.resolve(bitmap.getGlyphName());
            if (sequence == null) {
                LOGGER.warn("Unresolved glyph name '{}' (glyph {})",
                        bitmap.getGlyphName(), bitmap.getGlyphId());
                handler.unresolvedGlyph(bitmap);
                unresolved++;
            } else {
                LOGGER.debug("{} -> {}", bitmap.getGlyphName(), sequence);
                handler.emoji(sequence, bitmap);
                resolved++;
            }
        }
        LOGGER.info("Exported {} emoji, {} glyphs unresolved", resolved, unresolved);

        if (enumerator != null) {
            LOGGER.info("Exporting emoji modifier sequences");
            int derived = enumerator.synthesize(font, handler);
            LOGGER.info("Exported {} emoji modifier sequences", derived);
        }

        handler.endExtraction();
    }

    /**
     * Command-line entry point. With {@code -d} the extraction events are
     * printed instead of written to the output directory.
     *
     * @param args {@code [-s ppem] [-i fontIndex] [-k] [-d] <font> <output-dir> <unicode-data-file>...}
     */
    public static void main(String[] args) {
        int ppem = DEFAULT_PPEM;
        int fontIndex = 0;
        boolean keepUnresolved = false;
        boolean debug = false;
        List<String> operands = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                if ("-s".equals(args[i]) && i + 1 < args.length) {
                    ppem = Integer.parseInt(args[++i]);
                } else if ("-i".equals(args[i]) && i + 1 < args.length) {
                    fontIndex = Integer.parseInt(args[++i]);
                } else if ("-k".equals(args[i])) {
                    keepUnresolved = true;
                } else if ("-d".equals(args[i])) {
                    debug = true;
                } else {
                    operands.add(args[i]);
                }
            }
        } catch (NumberFormatException e) {
            operands.clear();
        }
        if (operands.size() < 3) {
            System.err.println("Usage: java org.bluezoo.emojidump.EmojiExtractor"
                    + " [-s ppem] [-i fontIndex] [-k] [-d] <font> <output-dir> <unicode-data-file>...");
            System.exit(1);
        }

        Path fontFile = Paths.get(operands.get(0));
        Path outputDir = Paths.get(operands.get(1));
        Path[] dataFiles = new Path[operands.size() - 2];
        for (int i = 0; i < dataFiles.length; i++) {
            dataFiles[i] = Paths.get(operands.get(i + 2));
        }

        try {
            EmojiDatabase database = UnicodeEmojiDatabase.load(dataFiles);
            List<String> referenceLines = new ArrayList<>();
            for (Path dataFile : dataFiles) {
                referenceLines.addAll(Files.readAllLines(dataFile, StandardCharsets.UTF_8));
            }
            ModifierBases bases = ModifierBases.parse(referenceLines);
            EmojiExtractor extractor = new EmojiExtractor(database, bases);

            EmojiHandler handler;
            if (debug) {
                handler = new DebugEmojiHandler();
            } else {
                DirectoryEmojiHandler directoryHandler = new DirectoryEmojiHandler(outputDir);
                directoryHandler.setKeepUnresolved(keepUnresolved);
                handler = directoryHandler;
            }
            try (EmojiFont font = EmojiFont.open(fontFile, fontIndex, ppem)) {
                extractor.extract(font, handler);
            }
        } catch (FontParseException e) {
            System.err.println("Error parsing " + fontFile + " (" + e.getStage() + " stage, offset "
                    + e.getOffset() + "): " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error extracting emoji: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

}
