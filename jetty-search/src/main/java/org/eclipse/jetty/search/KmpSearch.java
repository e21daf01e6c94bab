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

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Implements the
 * <a href="https://en.wikipedia.org/wiki/Knuth%E2%80%93Morris%E2%80%93Pratt_algorithm">Knuth-Morris-Pratt</a>
 * substring search.
 * <p>
 * On a mismatch the {@link BorderTable} of the pattern tells how far the
 * candidate start may advance without re-examining text already matched, so
 * the search runs in {@code O(n + m)}.
 * </p>
 */
public final class KmpSearch
{
    private KmpSearch()
    {
    }

    /**
     * @param pattern the pattern to search for
     * @param text the text to search in
     * @param borders the border table built for the pattern
     * @param <T> the element type
     * @return the index of the first occurrence of the pattern, or empty if not found
     * @see #search(List, List, BorderTable, Equivalence)
     */
    public static <T> OptionalInt search(List<? extends T> pattern, List<? extends T> text, BorderTable borders)
    {
        return search(pattern, text, borders, Equivalence.natural());
    }

    /**
     * Search for the first occurrence of the pattern within the text.
     * An empty pattern matches at index 0.
     *
     * @param pattern the pattern to search for
     * @param text the text to search in
     * @param borders the border table built for the pattern with the same equivalence
     * @param equivalence how elements are compared
     * @param <T> the element type
     * @return the index of the first occurrence of the pattern, or empty if not found
     * @throws IllegalArgumentException if the table was built for a pattern of another length
     */
    public static <T> OptionalInt search(List<? extends T> pattern, List<? extends T> text, BorderTable borders, Equivalence<? super T> equivalence)
    {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(borders, "borders");
        Objects.requireNonNull(equivalence, "equivalence");

        int m = pattern.size();
        if (borders.getPatternLength() != m)
            throw new IllegalArgumentException("Border table built for a pattern of length " + borders.getPatternLength() + ", not " + m);
        if (m == 0)
            return OptionalInt.of(0);

        int n = text.size();
        int t = 0;
        int p = 0;
        while (t + p < n)
        {
            if (equivalence.equivalent(pattern.get(p), text.get(t + p)))
            {
                if (++p == m)
                    return OptionalInt.of(t);
            }
            else if (p == 0)
            {
                t++;
            }
            else
            {
                // Realign on the longest border of the matched prefix, it is already verified.
                int border = borders.get(p);
                t += p - border;
                p = border;
            }
        }
        return OptionalInt.empty();
    }
}
