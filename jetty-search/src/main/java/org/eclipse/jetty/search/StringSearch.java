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
import java.util.stream.Collectors;

/**
 * One shot searches of a {@link String} pattern in a {@link String} text.
 * <p>
 * {@link #linear(String, String)} and {@link #kmp(String, String)} compare Unicode
 * code points and report code point indices. {@link #bmh(String, String)} compares
 * the {@link StandardCharsets#UTF_8} encoding and reports a byte index. The two
 * agree only for text where every character encodes to a single byte.
 * </p>
 * <p>
 * Each call builds the tables it needs. To search one pattern in many texts,
 * compile a {@link SearchPattern} or {@link ByteSearchPattern} instead.
 * </p>
 */
public final class StringSearch
{
    private StringSearch()
    {
    }

    public static OptionalInt linear(String pattern, String text)
    {
        return LinearSearch.search(codePoints(pattern), codePoints(text));
    }

    public static OptionalInt kmp(String pattern, String text)
    {
        List<Integer> p = codePoints(pattern);
        return KmpSearch.search(p, codePoints(text), BorderTable.build(p));
    }

    public static OptionalInt bmh(String pattern, String text)
    {
        byte[] p = utf8(pattern);
        return BmhSearch.search(p, utf8(text), BadCharacterTable.build(p));
    }

    /**
     * @param s the string
     * @return the Unicode code points of the string
     */
    public static List<Integer> codePoints(String s)
    {
        return Objects.requireNonNull(s).codePoints().boxed().collect(Collectors.toUnmodifiableList());
    }

    private static byte[] utf8(String s)
    {
        return Objects.requireNonNull(s).getBytes(StandardCharsets.UTF_8);
    }
}
