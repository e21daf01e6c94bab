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

/**
 * Decides whether an element of a pattern matches an element of a text.
 * <p>
 * Matchers always call {@link #equivalent(Object, Object)} with the pattern
 * element first and the text element second.
 * </p>
 *
 * @param <T> the element type
 */
@FunctionalInterface
public interface Equivalence<T>
{
    /**
     * @param patternElement the element of the pattern
     * @param textElement the element of the text
     * @return true if the two elements match
     */
    boolean equivalent(T patternElement, T textElement);

    /**
     * @param <T> the element type
     * @return the equivalence given by {@link Object#equals(Object)}
     */
    static <T> Equivalence<T> natural()
    {
        return Objects::equals;
    }
}
