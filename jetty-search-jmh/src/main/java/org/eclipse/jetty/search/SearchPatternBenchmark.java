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
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

@State(Scope.Benchmark)
@Threads(4)
@Warmup(iterations = 7, time = 500, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 9, time = 800, timeUnit = TimeUnit.MILLISECONDS)
public class SearchPatternBenchmark
{
    @Param({"4", "16", "64"})
    int patternLength;

    private byte[] data;
    private ByteSearchPattern pattern;

    @Setup
    public void setUp()
    {
        // Random lower case text, so mismatches happen early and often.
        byte[] text = new byte[64 * 1024];
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < text.length; i++)
        {
            text[i] = (byte)('a' + random.nextInt(26));
        }
        byte[] needle = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ!?".substring(0, patternLength).getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(needle, 0, text, text.length - needle.length, needle.length);

        data = text;
        pattern = ByteSearchPattern.compile(needle);
        // Build the tables outside of the measurement.
        pattern.getBorderTable();
        pattern.getBadCharacterTable();
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    public OptionalInt testLinear()
    {
        return pattern.linear(data);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    public OptionalInt testKmp()
    {
        return pattern.kmp(data);
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    public OptionalInt testBmh()
    {
        return pattern.bmh(data);
    }

    public static void main(String[] args) throws RunnerException
    {
        Options opt = new OptionsBuilder()
            .include(SearchPatternBenchmark.class.getSimpleName())
            .forks(1)
            .build();

        new Runner(opt).run();
    }
}
