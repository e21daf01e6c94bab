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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LazyTableTest
{
    @Test
    public void testComputedOnce()
    {
        AtomicInteger builds = new AtomicInteger();
        LazyTable<int[]> table = new LazyTable<>(() ->
        {
            builds.incrementAndGet();
            return new int[]{1, 2, 3};
        });

        assertFalse(table.isComputed());
        assertThat(builds.get(), is(0));

        int[] first = table.get();
        assertTrue(table.isComputed());
        assertThat(table.get(), sameInstance(first));
        assertThat(builds.get(), is(1));
    }

    @Test
    public void testConcurrentFirstUse() throws Exception
    {
        AtomicInteger builds = new AtomicInteger();
        LazyTable<Object> table = new LazyTable<>(() ->
        {
            builds.incrementAndGet();
            Thread.yield();
            return new Object();
        });

        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try
        {
            List<Future<Object>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++)
            {
                results.add(executor.submit(() ->
                {
                    start.await();
                    return table.get();
                }));
            }
            start.countDown();

            Object value = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Object> result : results)
            {
                assertThat(result.get(5, TimeUnit.SECONDS), sameInstance(value));
            }
            assertThat(builds.get(), is(1));
        }
        finally
        {
            executor.shutdownNow();
        }
    }

    @Test
    public void testNullTableRejected()
    {
        LazyTable<Object> table = new LazyTable<>(() -> null);
        assertThrows(NullPointerException.class, table::get);
        assertFalse(table.isComputed());
    }
}
