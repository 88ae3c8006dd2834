/*
 * DirectoryEmojiHandler.java
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
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EmojiHandler} that writes emoji images to a directory.
 * <p>
 * Each image is stored as {@code emoji_u<hex>_<hex>.png}, named after its
 * codepoint sequence as described in
 * {@link CodepointSequence#toIdentifier}. Images of glyphs that resolve to
 * no emoji can optionally be kept under {@code glyphs/<glyph name>.png}.
 * <p>
 * Every file is written to a temporary file and then moved into place, so
 * a file is either absent or complete. Images of resolved glyphs replace
 * existing files; derived images never do. The existence check and the
 * move of a derived image are not one atomic step, so that guarantee only
 * holds while this handler is the only writer to the directory.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DirectoryEmojiHandler implements EmojiHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryEmojiHandler.class);

    /** Prefix of emoji image file names. */
    public static final String PREFIX = "emoji_u";

    /** Subdirectory for images of unresolved glyphs. */
    public static final String GLYPHS_DIRECTORY = "glyphs";

    private final Path directory;
    private boolean keepUnresolved;
    private int written;

    /**
     * Creates a handler writing to the given directory.
     *
     * @param directory the output directory, created if necessary
     */
    public DirectoryEmojiHandler(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public boolean isKeepUnresolved() {
        return keepUnresolved;
    }

    /**
     * Sets whether images of unresolved glyphs are written under their
     * glyph names.
     *
     * @param keepUnresolved true to keep unresolved glyphs
     */
    public void setKeepUnresolved(boolean keepUnresolved) {
        this.keepUnresolved = keepUnresolved;
    }

    /**
     * Returns the number of files written since extraction started.
     *
     * @return the file count
     */
    public int getWritten() {
        return written;
    }

    /**
     * Returns the file an emoji image is stored in.
     *
     * @param sequence the emoji
     * @return the path of its PNG image
     */
    public Path pathFor(CodepointSequence sequence) {
        return directory.resolve(sequence.toIdentifier(PREFIX) + ".png");
    }

    @Override
    public void startExtraction(int numGlyphs, int ppem) {
        written = 0;
    }

    @Override
    public void emoji(CodepointSequence sequence, GlyphBitmap bitmap) throws IOException {
        write(pathFor(sequence), bitmap, true);
    }

    @Override
    public void unresolvedGlyph(GlyphBitmap bitmap) throws IOException {
        if (keepUnresolved) {
            String extension = bitmap.getGraphicType().trim();
            String fileName = bitmap.getGlyphName().replaceAll("[^A-Za-z0-9._-]", "_");
            Path path = directory.resolve(GLYPHS_DIRECTORY).resolve(fileName + "." + extension);
            write(path, bitmap, true);
        }
    }

    @Override
    public boolean hasEmoji(CodepointSequence sequence) {
        return Files.exists(pathFor(sequence));
    }

    @Override
    public void derivedEmoji(CodepointSequence sequence, GlyphBitmap bitmap) throws IOException {
        write(pathFor(sequence), bitmap, false);
    }

    @Override
    public void endExtraction() {
        LOGGER.info("Wrote {} files to {}", written, directory);
    }

    private void write(Path path, GlyphBitmap bitmap, boolean replace) throws IOException {
        Path parent = path.getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, ".emoji", ".tmp");
        try {
            Files.write(tmp, bitmap.read());
            if (replace) {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } else {
                // Without options the move fails if the target exists
                Files.move(tmp, path);
            }
            written++;
            LOGGER.debug("Wrote {}", path);
        } catch (FileAlreadyExistsException e) {
            LOGGER.debug("Not replacing {}", path);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

}
