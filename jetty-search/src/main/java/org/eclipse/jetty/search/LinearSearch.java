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
 * Brute force substring search.
 * <p>
 * Every candidate start in the text is tried in turn and the pattern compared
 * left to right against it. Worst case is {@code O(n*m)} and no auxiliary
 * memory is used. The lists are expected to be {@link java.util.RandomAccess}.
 * </p>
 */
public final class LinearSearch
{
    private LinearSearch()
    {
    }

    /**
     * @param pattern the pattern to search for
     * @param text the text to search in
     * @param <T> the element type
     * @return the index of the first occurrence of the pattern, or empty if not found
     * @see #search(List, List, Equivalence)
     */
    public static <T> OptionalInt search(List<? extends T> pattern, List<? extends T> text)
    {
        return search(pattern, text, Equivalence.natural());
    }

    /**
     * Search for the first occurrence of the pattern within the text.
     * An empty pattern matches at index 0.
     *
     * @param pattern the pattern to search for
     * @param text the text to search in
     * @param equivalence how elements are compared
     * @param <T> the element type
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public static <T> OptionalInt search(List<? extends T> pattern, List<? extends T> text, Equivalence<? super T> equivalence)
    {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(equivalence, "equivalence");

        int m = pattern.size();
        int last = text.size() - m;

        // Candidates past last would overrun the text, so they are never tried.
        for (int s = 0; s <= last; s++)
        {
            int i = 0;
            while (i < m && equivalence.equivalent(pattern.get(i), text.get(s + i)))
            {
                i++;
            }
            if (i == m)
                return OptionalInt.of(s);
        }
        return OptionalInt.empty();
    }
}
