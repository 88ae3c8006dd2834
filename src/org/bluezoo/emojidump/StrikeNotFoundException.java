/*
 * StrikeNotFoundException.java
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

import java.util.Arrays;

/**
 * Thrown when the {@code sbix} table contains no strike for the requested
 * pixels-per-em. Callers usually treat this as a configuration error and
 * retry with one of the {@link #getAvailableSizes available sizes}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StrikeNotFoundException extends FontParseException {

    private static final long serialVersionUID = 1L;

    private final int requestedSize;
    private final int[] availableSizes;

    /**
     * Creates a new exception.
     *
     * @param requestedSize the ppem that was requested
     * @param availableSizes the ppem of every strike in the table
     * @param offset the offset of the sbix table
     */
    public StrikeNotFoundException(int requestedSize, int[] availableSizes, long offset) {
        super(Stage.SBIX, "no strike for " + requestedSize + " ppem (available: "
                + Arrays.toString(availableSizes) + ")", offset);
        this.requestedSize = requestedSize;
        this.availableSizes = availableSizes.clone();
    }

    public int getRequestedSize() {
        return requestedSize;
    }

    public int[] getAvailableSizes() {
        return availableSizes.clone();
    }

}
