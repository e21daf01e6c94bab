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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled pattern of generic elements that can be searched for in many texts.
 * <p>
 * The {@link BorderTable} needed by {@link #kmp(List)} is built on the first
 * KMP search and reused by every later search with this instance.
 * Instances are immutable from the caller's point of view and may be shared
 * between threads.
 * </p>
 * <p>
 * Unless an algorithm is given to {@code compile}, {@link #search(List)} uses the
 * algorithm named by the {@value #ALGORITHM_PROPERTY} system property, read when
 * the pattern is compiled, or {@link SearchAlgorithm#KMP} when it is not set.
 * </p>
 *
 * @param <T> the element type
 * @see ByteSearchPattern
 */
public class SearchPattern<T>
{
    public static final String ALGORITHM_PROPERTY = "org.eclipse.jetty.search.SearchPattern.algorithm";

    private static final Logger LOG = LoggerFactory.getLogger(SearchPattern.class);

    private final List<T> pattern;
    private final Equivalence<? super T> equivalence;
    private final SearchAlgorithm algorithm;
    private final LazyTable<BorderTable> borders;

    /**
     * @param pattern The pattern to search for.
     * @param <T> the element type
     * @return A pattern comparing elements with {@link Object#equals(Object)}
     */
    public static <T> SearchPattern<T> compile(List<? extends T> pattern)
    {
        return compile(pattern, Equivalence.natural());
    }

    /**
     * @param pattern The pattern to search for.
     * @param equivalence how elements are compared
     * @param <T> the element type
     * @return A pattern using the configured default algorithm
     */
    public static <T> SearchPattern<T> compile(List<? extends T> pattern, Equivalence<? super T> equivalence)
    {
        return compile(pattern, equivalence, SearchAlgorithm.fromProperty(ALGORITHM_PROPERTY, SearchAlgorithm.KMP));
    }

    /**
     * @param pattern The pattern to search for, it must not contain null elements.
     * @param equivalence how elements are compared
     * @param algorithm the algorithm used by {@link #search(List)}
     * @param <T> the element type
     * @return A pattern instance
     * @throws IllegalArgumentException if the algorithm is {@link SearchAlgorithm#BMH}
     */
    public static <T> SearchPattern<T> compile(List<? extends T> pattern, Equivalence<? super T> equivalence, SearchAlgorithm algorithm)
    {
        return new SearchPattern<>(pattern, equivalence, algorithm);
    }

    /**
     * @param pattern The pattern to search for, as Unicode code points.
     * @return A pattern to search texts converted with {@link StringSearch#codePoints(String)}
     */
    public static SearchPattern<Integer> compile(String pattern)
    {
        return compile(StringSearch.codePoints(pattern));
    }

    private SearchPattern(List<? extends T> pattern, Equivalence<? super T> equivalence, SearchAlgorithm algorithm)
    {
        Objects.requireNonNull(algorithm, "algorithm");
        if (algorithm == SearchAlgorithm.BMH)
            throw new IllegalArgumentException("BMH requires a byte pattern, use " + ByteSearchPattern.class.getSimpleName());
        this.pattern = List.copyOf(Objects.requireNonNull(pattern, "pattern"));
        this.equivalence = Objects.requireNonNull(equivalence, "equivalence");
        this.algorithm = algorithm;
        this.borders = new LazyTable<>(() -> BorderTable.build(this.pattern, this.equivalence));
        if (LOG.isDebugEnabled())
            LOG.debug("Compiled {}", this);
    }

    /**
     * @return the length of the pattern
     */
    public int length()
    {
        return pattern.size();
    }

    /**
     * @return the algorithm used by {@link #search(List)}
     */
    public SearchAlgorithm getAlgorithm()
    {
        return algorithm;
    }

    /**
     * @return the border table of the pattern, built on first call
     */
    public BorderTable getBorderTable()
    {
        return borders.get();
    }

    boolean isBorderTableBuilt()
    {
        return borders.isComputed();
    }

    /**
     * Search with the brute force scan.
     *
     * @param text the text to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt linear(List<? extends T> text)
    {
        return LinearSearch.search(pattern, text, equivalence);
    }

    /**
     * Search with Knuth-Morris-Pratt.
     *
     * @param text the text to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt kmp(List<? extends T> text)
    {
        return KmpSearch.search(pattern, text, borders.get(), equivalence);
    }

    /**
     * Search with the algorithm of this pattern.
     *
     * @param text the text to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt search(List<? extends T> text)
    {
        switch (algorithm)
        {
            case LINEAR:
                return linear(text);
            case KMP:
                return kmp(text);
            default:
                throw new IllegalStateException(algorithm.toString());
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{m=%d,%s}", getClass().getSimpleName(), hashCode(), pattern.size(), algorithm);
    }
}
