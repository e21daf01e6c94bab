//
// ========================================================================
// Copyright (c) 1995 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.eclipse.jetty.search;

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The bad character shift table of a byte pattern.
 * <p>
 * Bytes are taken as unsigned values. A byte absent from the pattern maps to the
 * pattern length {@code m}. A byte present in the pattern maps to
 * {@code m - 1 - i} where {@code i} is the position of its rightmost occurrence.
 * </p>
 */
public final class BadCharacterTable
{
    public static final int ALPHABET_SIZE = 256;

    private static final Logger LOG = LoggerFactory.getLogger(BadCharacterTable.class);

    private final int[] table;
    private final int patternLength;

    private BadCharacterTable(int[] table, int patternLength)
    {
        this.table = table;
        this.patternLength = patternLength;
    }

    /**
     * Build the bad character table of a pattern.
     *
     * @param pattern the pattern
     * @return the shift table for the pattern
     */
    public static BadCharacterTable build(byte[] pattern)
    {
        Objects.requireNonNull(pattern, "pattern");

        int m = pattern.length;
        int[] table = new int[ALPHABET_SIZE];
        Arrays.fill(table, m);
        // Later occurrences overwrite earlier ones.
        for (int i = 0; i < m; i++)
        {
            table[pattern[i] & 0xFF] = m - 1 - i;
        }

        if (LOG.isDebugEnabled())
            LOG.debug("Built bad character table for pattern of length {}", m);
        return new BadCharacterTable(table, m);
    }

    /**
     * @param b the byte, only the low 8 bits are used
     * @return the shift stored for the byte
     */
    public int getShift(int b)
    {
        return table[b & 0xFF];
    }

    /**
     * @return the length of the pattern this table was built for
     */
    public int getPatternLength()
    {
        return patternLength;
    }

    /**
     * @return a copy of the 256 shifts, indexed by unsigned byte value
     */
    public int[] toArray()
    {
        return table.clone();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{m=%d}", getClass().getSimpleName(), hashCode(), patternLength);
    }
}
