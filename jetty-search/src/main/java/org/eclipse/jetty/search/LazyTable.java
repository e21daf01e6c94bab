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
import java.util.function.Supplier;

/**
 * A slot for a table that is computed on first use and then reused.
 * <p>
 * Concurrent first use computes the value exactly once. Once published the
 * value is read without locking.
 * </p>
 *
 * @param <V> the table type
 */
class LazyTable<V> implements Supplier<V>
{
    private final Supplier<V> factory;
    private volatile V value;

    LazyTable(Supplier<V> factory)
    {
        this.factory = Objects.requireNonNull(factory);
    }

    @Override
    public V get()
    {
        V v = value;
        if (v == null)
        {
            synchronized (this)
            {
                v = value;
                if (v == null)
                {
                    v = Objects.requireNonNull(factory.get(), "table");
                    value = v;
                }
            }
        }
        return v;
    }

    boolean isComputed()
    {
        return value != null;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), value);
    }
}
