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

import java.util.AbstractList;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Read only {@link java.util.List} view of a byte array, without copying.
 */
class ByteArrayList extends AbstractList<Byte> implements RandomAccess
{
    private final byte[] bytes;

    ByteArrayList(byte[] bytes)
    {
        this.bytes = Objects.requireNonNull(bytes);
    }

    @Override
    public Byte get(int index)
    {
        return bytes[index];
    }

    @Override
    public int size()
    {
        return bytes.length;
    }
}
