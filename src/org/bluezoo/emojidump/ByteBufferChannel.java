/*
 * ByteBufferChannel.java
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
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only {@link SeekableByteChannel} over font data held in memory.
 * <p>
 * Position 0 of the channel is the position of the source buffer when the
 * channel was created, and the channel ends at the buffer's limit. The
 * source buffer itself is never moved.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ByteBufferChannel implements SeekableByteChannel {

    private final ByteBuffer buffer;
    private boolean open = true;

    ByteBufferChannel(ByteBuffer source) {
        this.buffer = source.slice();
    }

    private void ensureOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        if (!buffer.hasRemaining()) {
            return -1;
        }
        int n = Math.min(buffer.remaining(), dst.remaining());
        ByteBuffer chunk = buffer.duplicate();
        chunk.limit(chunk.position() + n);
        dst.put(chunk);
        buffer.position(buffer.position() + n);
        return n;
    }

    @Override
    public int write(ByteBuffer src) {
        throw new NonWritableChannelException();
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return buffer.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        // Seeking past the end is allowed; reads there return end of stream
        buffer.position((int) Math.min(newPosition, buffer.limit()));
        return this;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return buffer.limit();
    }

    @Override
    public SeekableByteChannel truncate(long size) {
        throw new NonWritableChannelException();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

}
