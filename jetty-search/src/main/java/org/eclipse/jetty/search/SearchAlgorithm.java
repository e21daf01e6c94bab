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

import java.util.Locale;

/**
 * The search algorithms a pattern can use by default.
 */
public enum SearchAlgorithm
{
    /**
     * Brute force scan, see {@link LinearSearch}.
     */
    LINEAR,

    /**
     * Knuth-Morris-Pratt, see {@link KmpSearch}.
     */
    KMP,

    /**
     * Boyer-Moore-Horspool, byte patterns only, see {@link BmhSearch}.
     */
    BMH;

    /**
     * Get the algorithm named by a system property.
     *
     * @param property the system property name
     * @param defaultAlgorithm the algorithm to use when the property is not set
     * @return the configured algorithm
     * @throws IllegalArgumentException if the property does not name an algorithm
     */
    public static SearchAlgorithm fromProperty(String property, SearchAlgorithm defaultAlgorithm)
    {
        String value = System.getProperty(property);
        if (value == null || value.isBlank())
            return defaultAlgorithm;
        try
        {
            return valueOf(value.trim().toUpperCase(Locale.ENGLISH));
        }
        catch (IllegalArgumentException x)
        {
            throw new IllegalArgumentException("Invalid " + property + ": " + value, x);
        }
    }
}
