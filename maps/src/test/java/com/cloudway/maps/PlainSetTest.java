/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Arrays;

import org.junit.Test;
import static org.junit.Assert.*;

public class PlainSetTest extends SetLikeTestBase<PlainSet<String>> {
    @Override
    protected PlainSet<String> newSet() {
        return new PlainSet<>();
    }

    @Test
    public void test_collect() {
        PlainSet<String> s = PlainSet.collect(Arrays.asList("x", "y", "x"));
        assertEquals(2, s.len());
        assertTrue(s.has("y"));
        assertTrue(PlainSet.collect(set.all()).equal(set));
    }

    @Test
    public void test_clone() {
        PlainSet<String> s = set.clone();
        s.add("d");
        set.delete("a");
        assertEquals(4, s.len());
        assertTrue(s.has("a"));
        assertEquals(2, set.len());
    }
}
