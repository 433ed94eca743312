/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

public class OrderedSetTest extends SetLikeTestBase<OrderedSet<String>> {
    @Override
    protected OrderedSet<String> newSet() {
        return new OrderedSet<>();
    }

    @Test
    public void test_insertion_order() {
        OrderedSet<String> s = OrderedSet.of("c", "a", "b", "a");
        assertEquals(ImmutableList.of("c", "a", "b"), s.values());
        assertEquals(ImmutableList.of("c", "a", "b"), listOf(s.all()));
        assertEquals("{\"c\",\"a\",\"b\"}", s.toString());
    }

    @Test
    public void test_setOrder() {
        OrderedSet<String> s = OrderedSet.of("c", "a", "b");
        s.setOrder((a, b) -> a.compareTo(b) > 0);
        assertTrue(s.order().isPresent());
        assertEquals(ImmutableList.of("c", "b", "a"), s.values());
        s.add("bb");
        assertEquals(ImmutableList.of("c", "bb", "b", "a"), s.values());
        s.delete("bb");
        assertEquals(ImmutableList.of("c", "b", "a"), s.values());

        s.setOrder(null);
        assertFalse(s.order().isPresent());
        s.add("d");
        assertEquals(ImmutableList.of("c", "b", "a", "d"), s.values());
    }

    @Test
    public void test_clone() {
        OrderedSet<String> s = set.clone();
        s.add("0");
        assertEquals(ImmutableList.of("a", "b", "c", "0"), s.values());
        assertEquals(3, set.len());
    }

    @Test
    public void test_binary_order() throws IOException {
        OrderedSet<String> s = newSet();
        s.unmarshalBinary(OrderedSet.of("z", "a", "m").marshalBinary());
        assertEquals(ImmutableList.of("z", "a", "m"), s.values());
    }

    @Test
    public void test_json_order() throws IOException {
        assertEquals("[\"a\",\"b\",\"c\"]", set.marshalJson());
        OrderedSet<String> s = newSet();
        s.unmarshalJson("[\"z\",\"a\",\"m\"]", String.class);
        assertEquals(ImmutableList.of("z", "a", "m"), s.values());
    }
}
