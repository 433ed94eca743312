/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Runs the common map tests against an ordered map that keeps its keys sorted.
 */
public class SortedOrderedMapTest extends MapLikeTestBase<OrderedMap<String, Integer>> {
    @Override
    protected OrderedMap<String, Integer> newMap() {
        OrderedMap<String, Integer> m = new OrderedMap<>();
        m.setOrder(EntryOrder.byKey());
        return m;
    }

    @Test
    public void test_sorted_after_modifications() {
        hm.set("aa", 0);
        hm.set("0", 0);
        hm.delete("b");
        hm.copy(PlainMap.of(ImmutableMap.of("bb", 1, "ab", 2)));
        List<String> keys = hm.keys();
        assertTrue(Ordering.natural().isOrdered(keys));
        assertEquals(ImmutableList.of("0", "a", "aa", "ab", "bb", "c"), keys);
        assertBijection(hm);
    }
}
