/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import static org.junit.Assert.*;

public class SafeOrderedMapTest extends MapLikeTestBase<SafeOrderedMap<String, Integer>> {
    @Override
    protected SafeOrderedMap<String, Integer> newMap() {
        return new SafeOrderedMap<>();
    }

    @Test
    public void test_order_preserved() {
        assertEquals(ImmutableList.of("a", "b", "c"), hm.keys());
        assertEquals("{\"a\":1,\"b\":2,\"c\":3}", hm.toString());
    }

    @Test
    public void test_positional() {
        hm.setAt(1, "x", 9);
        assertEquals(ImmutableList.of("a", "x", "b", "c"), hm.keys());
        assertEquals(Integer.valueOf(9), hm.getAt(1));
        assertEquals("x", hm.getKeyAt(1));
        assertNull(hm.getAt(4));
    }

    @Test
    public void test_setOrder() {
        SafeOrderedMap<String, Integer> m = SafeOrderedMap.of(ImmutableMap.of("c", 3, "a", 1, "b", 2));
        m.setOrder(EntryOrder.byKey());
        assertTrue(m.order().isPresent());
        assertEquals(ImmutableList.of("a", "b", "c"), m.keys());
        try {
            m.setAt(0, "d", 4);
            fail("setAt allowed with an order installed");
        } catch (IllegalStateException ex) {
            // ok
        }
        m.setOrder(null);
        m.setAt(0, "d", 4);
        assertEquals("d", m.getKeyAt(0));
    }

    /**
     * A value whose comparison blocks until released, so that both sides of
     * a cross comparison are in progress at the same time.
     */
    static final class Gate implements Equaler {
        private final CountDownLatch entered, release;

        Gate(CountDownLatch entered, CountDownLatch release) {
            this.entered = entered;
            this.release = release;
        }

        @Override
        public boolean equalTo(Object other) {
            if (entered != null) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return other instanceof Gate;
        }
    }

    private static SafeOrderedMap<String, Gate> gated(CountDownLatch entered, CountDownLatch release) {
        SafeOrderedMap<String, Gate> m = new SafeOrderedMap<>();
        m.set("x", new Gate(entered, release));
        m.set("y", new Gate(null, null));
        return m;
    }

    @Test
    public void cross_equal_with_pending_writers() throws Exception {
        CountDownLatch entered = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        SafeOrderedMap<String, Gate> a = gated(entered, release);
        SafeOrderedMap<String, Gate> b = gated(entered, release);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<Boolean> ab = executor.submit(() -> a.equal(b));
            Future<Boolean> ba = executor.submit(() -> b.equal(a));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            Future<?> wa = executor.submit(() -> a.set("z", new Gate(null, null)));
            Future<?> wb = executor.submit(() -> b.set("z", new Gate(null, null)));
            Thread.sleep(100);
            release.countDown();

            assertTrue(ab.get(10, TimeUnit.SECONDS));
            assertTrue(ba.get(10, TimeUnit.SECONDS));
            wa.get(10, TimeUnit.SECONDS);
            wb.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertEquals(3, a.len());
        assertTrue(a.equal(b));
    }

    @Test
    public void test_clone() {
        SafeOrderedMap<String, Integer> m = hm.clone();
        m.setAt(0, "z", 26);
        assertEquals(ImmutableList.of("z", "a", "b", "c"), m.keys());
        assertEquals(ImmutableList.of("a", "b", "c"), hm.keys());
    }
}
