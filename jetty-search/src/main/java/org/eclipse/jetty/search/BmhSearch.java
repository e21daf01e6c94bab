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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Boyer-Moore-Horspool search of a byte pattern in arbitrary binary data.
 * <p>
 * Each candidate is compared from the end of the pattern backward. On a
 * mismatch the text byte that failed selects the shift from the
 * {@link BadCharacterTable}: the window moves so that the rightmost occurrence
 * of that byte in the pattern lines up with it, or past it when the byte does
 * not occur in the pattern, and always by at least one.
 * </p>
 * <p>
 * Indices are byte indices. They are not comparable with the element indices
 * reported by {@link LinearSearch} or {@link KmpSearch} over decoded characters
 * when the text holds multi-byte characters.
 * </p>
 */
public final class BmhSearch
{
    private BmhSearch()
    {
    }

    /**
     * Search for the first occurrence of the pattern within the data.
     * The empty pattern is never found.
     *
     * @param pattern the pattern to search for
     * @param data the data to search in
     * @param table the bad character table built for the pattern
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public static OptionalInt search(byte[] pattern, byte[] data, BadCharacterTable table)
    {
        Objects.requireNonNull(data, "data");
        return search(pattern, data, 0, data.length, table);
    }

    /**
     * Search for the first occurrence of the pattern within a range of the data.
     * The empty pattern is never found.
     *
     * @param pattern the pattern to search for
     * @param data the data to search in
     * @param offset the offset within the data to start the search
     * @param length the length of the data to search
     * @param table the bad character table built for the pattern
     * @return the index within the data array of the first occurrence of the pattern, or empty if not found
     * @throws IndexOutOfBoundsException if the range is not within the data
     * @throws IllegalArgumentException if the table was built for a pattern of another length
     */
    public static OptionalInt search(byte[] pattern, byte[] data, int offset, int length, BadCharacterTable table)
    {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(table, "table");
        Objects.checkFromIndexSize(offset, length, data.length);

        int m = pattern.length;
        if (table.getPatternLength() != m)
            throw new IllegalArgumentException("Bad character table built for a pattern of length " + table.getPatternLength() + ", not " + m);
        if (m == 0)
            return OptionalInt.empty();

        int last = offset + length - m;
        int t = offset;
        while (t <= last)
        {
            int p = m - 1;
            while (data[t + p] == pattern[p])
            {
                if (p == 0)
                    return OptionalInt.of(t);
                p--;
            }

            // The stored shift aligns the byte with the last pattern position,
            // so take off the distance from p to the end of the pattern.
            t += Math.max(1, table.getShift(data[t + p]) - (m - 1 - p));
        }
        return OptionalInt.empty();
    }
}
