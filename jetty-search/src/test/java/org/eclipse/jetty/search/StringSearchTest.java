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
import java.util.OptionalInt;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class StringSearchTest
{
    private static final String TEXT = "the dog is very dead then";

    public static Stream<Arguments> cases()
    {
        return Stream.of(
            Arguments.of("the", OptionalInt.of(0)),
            Arguments.of("the dog is", OptionalInt.of(0)),
            Arguments.of("he ", OptionalInt.of(1)),
            Arguments.of("dog", OptionalInt.of(4)),
            Arguments.of("dead", OptionalInt.of(16)),
            Arguments.of("then", OptionalInt.of(21)),
            Arguments.of("frank", OptionalInt.empty())
        );
    }

    @ParameterizedTest
    @MethodSource("cases")
    public void testLinear(String pattern, OptionalInt expected)
    {
        assertThat(StringSearch.linear(pattern, TEXT), is(expected));
    }

    @ParameterizedTest
    @MethodSource("cases")
    public void testKmp(String pattern, OptionalInt expected)
    {
        assertThat(StringSearch.kmp(pattern, TEXT), is(expected));
    }

    @ParameterizedTest
    @MethodSource("cases")
    public void testBmh(String pattern, OptionalInt expected)
    {
        assertThat(StringSearch.bmh(pattern, TEXT), is(expected));
    }

    @ParameterizedTest
    @MethodSource("cases")
    public void testCompiledPatterns(String pattern, OptionalInt expected)
    {
        SearchPattern<Integer> sp = SearchPattern.compile(pattern);
        assertThat(sp.search(StringSearch.codePoints(TEXT)), is(expected));

        ByteSearchPattern bsp = ByteSearchPattern.compile(pattern);
        assertThat(bsp.search(TEXT.getBytes(StandardCharsets.UTF_8)), is(expected));
    }

    @Test
    public void testEmptyPattern()
    {
        assertThat(StringSearch.linear("", TEXT), is(OptionalInt.of(0)));
        assertThat(StringSearch.kmp("", TEXT), is(OptionalInt.of(0)));
        assertThat(StringSearch.bmh("", TEXT), is(OptionalInt.empty()));
    }

    @Test
    public void testSuffixOfText()
    {
        for (int i = 0; i < TEXT.length(); i++)
        {
            String suffix = TEXT.substring(i);
            int expected = TEXT.indexOf(suffix);
            assertThat(suffix, StringSearch.linear(suffix, TEXT), is(OptionalInt.of(expected)));
            assertThat(suffix, StringSearch.kmp(suffix, TEXT), is(OptionalInt.of(expected)));
            assertThat(suffix, StringSearch.bmh(suffix, TEXT), is(OptionalInt.of(expected)));
        }
        assertThat(StringSearch.kmp(TEXT + "!", TEXT), is(OptionalInt.empty()));
        assertThat(StringSearch.bmh(TEXT + "!", TEXT), is(OptionalInt.empty()));
    }

    @Test
    public void testMultiByteIndexUnits()
    {
        // Code point indices for linear and KMP, UTF-8 byte indices for BMH.
        String text = "café crème";
        assertThat(StringSearch.linear("cr", text), is(OptionalInt.of(5)));
        assertThat(StringSearch.kmp("cr", text), is(OptionalInt.of(5)));
        assertThat(StringSearch.bmh("cr", text), is(OptionalInt.of(6)));

        // A supplementary character is a single code point.
        String emoji = "a😀b";
        assertThat(StringSearch.codePoints(emoji), contains(0x61, 0x1F600, 0x62));
        assertThat(StringSearch.kmp("b", emoji), is(OptionalInt.of(2)));
        assertThat(StringSearch.bmh("b", emoji), is(OptionalInt.of(5)));
    }
}
