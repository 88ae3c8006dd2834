/*
 * FontReader.java
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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Positioned, big-endian reader over a font file.
 * <p>
 * Font structures reference each other by absolute offset, so every read
 * names the position it starts at rather than advancing a shared cursor.
 * Reads return a {@link ByteBuffer} holding exactly the requested number
 * of bytes in big-endian order; a short read means the file is truncated
 * and is reported as a {@link MalformedFontException} for the stage
 * being decoded.
 * <p>
 * A {@link FileChannel} is read with positional reads, which are safe to
 * issue from several threads. Any other {@link SeekableByteChannel} is
 * repositioned under this reader's lock.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FontReader implements Closeable {

    private final SeekableByteChannel channel;
    private final long size;

    /**
     * Creates a reader over the given channel.
     *
     * @param channel the font data (only read, never written)
     * @throws IOException if the channel size cannot be determined
     */
    public FontReader(SeekableByteChannel channel) throws IOException {
        if (channel == null) {
            throw new NullPointerException("Channel cannot be null");
        }
        this.channel = channel;
        this.size = channel.size();
    }

    /**
     * Opens a font file read-only.
     *
     * @param path the font file
     * @return a reader that owns the opened channel
     * @throws IOException if the file cannot be opened
     */
    public static FontReader open(Path path) throws IOException {
        return new FontReader(FileChannel.open(path, StandardOpenOption.READ));
    }

    /**
     * Creates a reader over font data held in memory.
     *
     * @param data the font data, which must not be modified while the
     *        reader is in use
     * @return a reader over the data
     */
    public static FontReader wrap(byte[] data) {
        try {
            return new FontReader(new ByteBufferChannel(ByteBuffer.wrap(data)));
        } catch (IOException e) {
            // an open in-memory channel always knows its size
            throw new IllegalStateException(e);
        }
    }

    /**
     * Returns the size of the font data in bytes.
     *
     * @return the file size
     */
    public long size() {
        return size;
    }

    /**
     * Reads a block of bytes.
     *
     * @param position the absolute offset of the first byte
     * @param length the number of bytes to read
     * @param stage the decoding stage, for error reporting
     * @return a big-endian buffer positioned at 0 with {@code length} bytes remaining
     * @throws MalformedFontException if the block does not lie within the file
     * @throws IOException if an I/O error occurs
     */
    public ByteBuffer read(long position, int length, FontParseException.Stage stage)
            throws IOException {
        checkRange(position, length, stage);
        ByteBuffer buf = ByteBuffer.allocate(length);
        buf.order(ByteOrder.BIG_ENDIAN);
        if (channel instanceof FileChannel) {
            FileChannel fc = (FileChannel) channel;
            long pos = position;
            while (buf.hasRemaining()) {
                int n = fc.read(buf, pos);
                if (n < 0) {
                    throw new MalformedFontException(stage,
                            "truncated read of " + length + " bytes", position);
                }
                pos += n;
            }
        } else {
            synchronized (this) {
                channel.position(position);
                while (buf.hasRemaining()) {
                    if (channel.read(buf) < 0) {
                        throw new MalformedFontException(stage,
                                "truncated read of " + length + " bytes", position);
                    }
                }
            }
        }
        buf.flip();
        return buf;
    }

    /**
     * Reads a block of bytes into a new array.
     *
     * @param position the absolute offset of the first byte
     * @param length the number of bytes to read
     * @param stage the decoding stage, for error reporting
     * @return the bytes read
     * @throws MalformedFontException if the block does not lie within the file
     * @throws IOException if an I/O error occurs
     */
    public byte[] readBytes(long position, int length, FontParseException.Stage stage)
            throws IOException {
        ByteBuffer buf = read(position, length, stage);
        byte[] result = new byte[length];
        buf.get(result);
        return result;
    }

    /**
     * Reads an unsigned 16-bit value.
     */
    public int readUInt16(long position, FontParseException.Stage stage) throws IOException {
        return read(position, 2, stage).getShort() & 0xFFFF;
    }

    /**
     * Reads a 32-bit value.
     */
    public int readInt32(long position, FontParseException.Stage stage) throws IOException {
        return read(position, 4, stage).getInt();
    }

    /**
     * Checks that a byte range lies within the file.
     *
     * @param position the start of the range
     * @param length the length of the range
     * @param stage the decoding stage, for error reporting
     * @throws MalformedFontException if the range is outside the file
     */
    public void checkRange(long position, long length, FontParseException.Stage stage) {
        if (position < 0 || length < 0 || position + length > size) {
            throw new MalformedFontException(stage,
                    "range of " + length + " bytes outside file of " + size + " bytes",
                    position);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

}
