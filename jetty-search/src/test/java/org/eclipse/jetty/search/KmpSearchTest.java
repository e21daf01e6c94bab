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
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class KmpSearchTest
{
    private static OptionalInt kmp(String pattern, String text)
    {
        List<Integer> p = StringSearch.codePoints(pattern);
        return KmpSearch.search(p, StringSearch.codePoints(text), BorderTable.build(p));
    }

    @Test
    public void testFirstOccurrence()
    {
        assertThat(kmp("abab", "abacababcabababab"), is(OptionalInt.of(4)));
        assertThat(kmp("aab", "aaaaab"), is(OptionalInt.of(3)));
        assertThat(kmp("abcab", "abcabcabcab"), is(OptionalInt.of(0)));
    }

    @Test
    public void testBorderRealignment()
    {
        // The mismatch after "ababa" must realign on the border "aba", not restart.
        assertThat(kmp("ababc", "abababc"), is(OptionalInt.of(2)));
        assertThat(kmp("aabaab", "aabaabaab"), is(OptionalInt.of(0)));
        assertThat(kmp("aabaaab", "aabaabaaab"), is(OptionalInt.of(3)));
    }

    @Test
    public void testNotFound()
    {
        assertThat(kmp("abc", "ababab"), is(OptionalInt.empty()));
        assertThat(kmp("abcdef", "abc"), is(OptionalInt.empty()));
        assertThat(kmp("a", ""), is(OptionalInt.empty()));
    }

    @Test
    public void testEmptyPattern()
    {
        assertThat(kmp("", "anything"), is(OptionalInt.of(0)));
        assertThat(kmp("", ""), is(OptionalInt.of(0)));
    }

    @Test
    public void testPatternAtEndOfText()
    {
        assertThat(kmp("xyz", "abcxyz"), is(OptionalInt.of(3)));
        assertThat(kmp("xyzz", "abcxyz"), is(OptionalInt.empty()));
        assertThat(kmp("abcxyz", "abcxyz"), is(OptionalInt.of(0)));
    }

    @Test
    public void testTableForOtherPattern()
    {
        List<Integer> pattern = StringSearch.codePoints("abc");
        BorderTable other = BorderTable.build(StringSearch.codePoints("ab"));
        IllegalArgumentException x = assertThrows(IllegalArgumentException.class,
            () -> KmpSearch.search(pattern, StringSearch.codePoints("xabc"), other));
        assertThat(x.getMessage(), containsString("length 2"));
    }

    @Test
    public void testEquivalence()
    {
        Equivalence<String> ignoreCase = String::equalsIgnoreCase;
        List<String> pattern = List.of("X", "y", "X");
        BorderTable borders = BorderTable.build(pattern, ignoreCase);
        assertThat(KmpSearch.search(pattern, List.of("x", "Y", "y", "x", "Y", "x"), borders, ignoreCase), is(OptionalInt.of(3)));
    }
}
