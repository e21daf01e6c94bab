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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled byte pattern that can be searched for in arbitrary binary data.
 * <p>
 * All three algorithms are available. The {@link BorderTable} and the
 * {@link BadCharacterTable} are each built on the first search that needs them
 * and reused afterwards. Instances may be shared between threads.
 * </p>
 * <p>
 * {@link #search(byte[])} uses the algorithm named by the
 * {@value #ALGORITHM_PROPERTY} system property ({@link SearchAlgorithm#BMH} by
 * default). Patterns shorter than the {@value #MIN_BMH_LENGTH_PROPERTY} system
 * property (2 by default) are searched with the linear scan instead of BMH, so
 * that the empty pattern matches at 0 as it does for the other algorithms.
 * </p>
 */
public class ByteSearchPattern
{
    public static final String ALGORITHM_PROPERTY = "org.eclipse.jetty.search.ByteSearchPattern.algorithm";
    public static final String MIN_BMH_LENGTH_PROPERTY = "org.eclipse.jetty.search.ByteSearchPattern.minBmhLength";

    private static final Logger LOG = LoggerFactory.getLogger(ByteSearchPattern.class);
    private static final int DEFAULT_MIN_BMH_LENGTH = 2;

    private final byte[] pattern;
    private final List<Byte> elements;
    private final SearchAlgorithm algorithm;
    private final int minBmhLength;
    private final LazyTable<BorderTable> borders;
    private final LazyTable<BadCharacterTable> badCharacters;

    /**
     * @param pattern The pattern to search for.
     * @return A pattern using the configured default algorithm
     */
    public static ByteSearchPattern compile(byte[] pattern)
    {
        return compile(pattern, SearchAlgorithm.fromProperty(ALGORITHM_PROPERTY, SearchAlgorithm.BMH));
    }

    /**
     * @param pattern The pattern to search for.
     * @param algorithm the algorithm used by {@link #search(byte[])}
     * @return A pattern instance
     */
    public static ByteSearchPattern compile(byte[] pattern, SearchAlgorithm algorithm)
    {
        return new ByteSearchPattern(pattern, algorithm, minBmhLength());
    }

    /**
     * @param pattern The pattern to search for, it will be {@link StandardCharsets#UTF_8} encoded.
     * @return A pattern using the configured default algorithm
     */
    public static ByteSearchPattern compile(String pattern)
    {
        return compile(Objects.requireNonNull(pattern, "pattern").getBytes(StandardCharsets.UTF_8));
    }

    private static int minBmhLength()
    {
        int value = Integer.getInteger(MIN_BMH_LENGTH_PROPERTY, DEFAULT_MIN_BMH_LENGTH);
        if (value < 0)
            throw new IllegalArgumentException("Invalid " + MIN_BMH_LENGTH_PROPERTY + ": " + value);
        return value;
    }

    private ByteSearchPattern(byte[] pattern, SearchAlgorithm algorithm, int minBmhLength)
    {
        this.pattern = Objects.requireNonNull(pattern, "pattern").clone();
        this.elements = new ByteArrayList(this.pattern);
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.minBmhLength = minBmhLength;
        this.borders = new LazyTable<>(() -> BorderTable.build(elements));
        this.badCharacters = new LazyTable<>(() -> BadCharacterTable.build(this.pattern));
        if (LOG.isDebugEnabled())
            LOG.debug("Compiled {}", this);
    }

    /**
     * @return the length of the pattern in bytes
     */
    public int length()
    {
        return pattern.length;
    }

    /**
     * @return the algorithm used by {@link #search(byte[])}
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

    /**
     * @return the bad character table of the pattern, built on first call
     */
    public BadCharacterTable getBadCharacterTable()
    {
        return badCharacters.get();
    }

    boolean isBorderTableBuilt()
    {
        return borders.isComputed();
    }

    boolean isBadCharacterTableBuilt()
    {
        return badCharacters.isComputed();
    }

    /**
     * Search with the brute force scan.
     *
     * @param data the data to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt linear(byte[] data)
    {
        return LinearSearch.search(elements, new ByteArrayList(data));
    }

    /**
     * Search with Knuth-Morris-Pratt.
     *
     * @param data the data to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt kmp(byte[] data)
    {
        return KmpSearch.search(elements, new ByteArrayList(data), borders.get());
    }

    /**
     * Search with Boyer-Moore-Horspool. The empty pattern is never found.
     *
     * @param data the data to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt bmh(byte[] data)
    {
        return BmhSearch.search(pattern, data, badCharacters.get());
    }

    /**
     * Search with Boyer-Moore-Horspool for a complete match of the pattern within a range of the data.
     *
     * @param data The data in which to search for. The data may be arbitrary binary data.
     * @param offset The offset within the data to start the search
     * @param length The length of the data to search
     * @return The index within the data array at which the first instance of the pattern is found, or empty if not found
     */
    public OptionalInt bmh(byte[] data, int offset, int length)
    {
        return BmhSearch.search(pattern, data, offset, length, badCharacters.get());
    }

    /**
     * Search with the algorithm of this pattern.
     *
     * @param data the data to search in
     * @return the index of the first occurrence of the pattern, or empty if not found
     */
    public OptionalInt search(byte[] data)
    {
        switch (algorithm)
        {
            case LINEAR:
                return linear(data);
            case KMP:
                return kmp(data);
            case BMH:
                if (pattern.length < minBmhLength)
                    return linear(data);
                return bmh(data);
            default:
                throw new IllegalStateException(algorithm.toString());
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{m=%d,%s}", getClass().getSimpleName(), hashCode(), pattern.length, algorithm);
    }
}
