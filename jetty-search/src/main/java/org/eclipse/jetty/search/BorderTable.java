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
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Knuth-Morris-Pratt failure function of a pattern.
 * <p>
 * For a pattern of length {@code m > 0} the table has {@code m + 1} entries,
 * indexed by prefix length. Entry {@code i} is the length of the longest proper
 * border of the first {@code i} pattern elements, that is the longest proper
 * prefix of that prefix which is also its suffix. Entries 0 and 1 are always 0.
 * The table of the empty pattern has no entries.
 * </p>
 * <p>
 * The table depends only on the pattern and is immutable once built.
 * </p>
 */
public final class BorderTable
{
    private static final Logger LOG = LoggerFactory.getLogger(BorderTable.class);
    private static final BorderTable EMPTY = new BorderTable(new int[0]);

    private final int[] borders;

    private BorderTable(int[] borders)
    {
        this.borders = borders;
    }

    /**
     * @param pattern the pattern
     * @param <T> the element type
     * @return the border table of the pattern, comparing elements with {@link Object#equals(Object)}
     */
    public static <T> BorderTable build(List<? extends T> pattern)
    {
        return build(pattern, Equivalence.natural());
    }

    /**
     * Build the border table of a pattern.
     *
     * @param pattern the pattern
     * @param equivalence how elements are compared
     * @param <T> the element type
     * @return the border table of the pattern
     */
    public static <T> BorderTable build(List<? extends T> pattern, Equivalence<? super T> equivalence)
    {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(equivalence, "equivalence");

        int m = pattern.size();
        if (m == 0)
            return EMPTY;

        int[] borders = new int[m + 1];
        for (int i = 2; i <= m; i++)
        {
            T last = pattern.get(i - 1);
            int b = borders[i - 1];
            // Follow the border chain until the border can be extended or is exhausted.
            while (b != 0 && !equivalence.equivalent(pattern.get(b), last))
            {
                b = borders[b];
            }
            borders[i] = equivalence.equivalent(pattern.get(b), last) ? b + 1 : 0;
        }

        if (LOG.isDebugEnabled())
            LOG.debug("Built border table {} for pattern of length {}", Arrays.toString(borders), m);
        return new BorderTable(borders);
    }

    /**
     * @return the number of entries, {@code m + 1} for a non empty pattern of length {@code m}, else 0
     */
    public int size()
    {
        return borders.length;
    }

    /**
     * @return the length of the pattern this table was built for
     */
    public int getPatternLength()
    {
        return borders.length == 0 ? 0 : borders.length - 1;
    }

    /**
     * @param prefixLength the length of a pattern prefix, from 0 to the pattern length
     * @return the length of the longest proper border of that prefix
     */
    public int get(int prefixLength)
    {
        return borders[prefixLength];
    }

    /**
     * @return a copy of the table entries
     */
    public int[] toArray()
    {
        return borders.clone();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), Arrays.toString(borders));
    }
}
