/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

public class SafeSetTest extends SetLikeTestBase<SafeSet<String>> {
    @Override
    protected SafeSet<String> newSet() {
        return new SafeSet<>();
    }

    @Test
    public void test_of() {
        SafeSet<String> s = SafeSet.of("x", "y", "x");
        assertEquals(2, s.len());
    }

    @Test
    public void test_wraps_ordered_set() {
        OrderedSet<String> inner = OrderedSet.of("z", "a");
        SafeSet<String> s = new SafeSet<>(inner);
        s.add("m");
        assertEquals(ImmutableList.of("z", "a", "m"), s.values());
    }

    @Test
    public void test_copy_self() {
        set.copy(set);
        assertEquals(3, set.len());
    }

    @Test
    public void test_clone() {
        SafeSet<String> s = set.clone();
        s.add("d");
        set.delete("a");
        assertEquals(4, s.len());
        assertTrue(s.has("a"));
        assertEquals(2, set.len());

        SafeSet<String> ordered = new SafeSet<>(OrderedSet.of("z", "a")).clone();
        assertEquals(ImmutableList.of("z", "a"), ordered.values());
    }

    @Test
    public void test_iterator_snapshot() {
        Iterator<String> it = set.all().iterator();
        set.clear();
        int n = 0;
        while (it.hasNext()) {
            it.next();
            n++;
        }
        assertEquals(3, n);
    }

    @Test
    public void test_with_lock() {
        assertEquals(Integer.valueOf(3), set.withReadLock(SetLike::len));
        set.withWriteLock(s -> s.add("d"));
        assertTrue(set.has("d"));
    }

    @Test
    public void cross_equal_with_writers() throws Exception {
        SafeSet<String> other = SafeSet.of("a", "b", "c");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 2000; i++)
                    set.equal(other);
            }));
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 2000; i++)
                    other.equal(set);
            }));
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 2000; i++)
                    set.add("w" + (i % 10));
            }));
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 2000; i++)
                    other.add("w" + (i % 10));
            }));
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertTrue(set.equal(other));
        assertTrue(other.equal(set));
    }

    @Test
    public void concurrent_access() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int id = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String e = id + ":" + i;
                        set.add(e);
                        assertTrue(set.has(e));
                        if (i % 5 == 0) {
                            set.delete(e);
                        }
                        set.values();
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }
        assertEquals(3 + 4 * 400, set.len());
    }
}
