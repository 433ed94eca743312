/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps.codec;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.codehaus.jackson.JsonParseException;
import org.codehaus.jackson.map.JsonMappingException;
import org.junit.Test;
import static org.junit.Assert.*;

public class JsonCodecTest {
    @Test
    public void test_encodeMap() throws IOException {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("b", 2);
        m.put("a", 1);
        assertEquals("{\"b\":2,\"a\":1}", JsonCodec.encodeMap(m));
        assertEquals("{}", JsonCodec.encodeMap(new LinkedHashMap<>()));
    }

    @Test
    public void test_encodeList() throws IOException {
        assertEquals("[\"x\",\"y\"]", JsonCodec.encodeList(Arrays.asList("x", "y")));
        assertEquals("[]", JsonCodec.encodeList(ImmutableList.of()));
    }

    @Test
    public void test_decodeMap() throws IOException {
        Map<String, Integer> m = JsonCodec.decodeMap("{\"a\":1,\"b\":2}", String.class, Integer.class);
        assertEquals(ImmutableMap.of("a", 1, "b", 2), m);
        assertTrue(JsonCodec.decodeMap("null", String.class, Integer.class).isEmpty());
    }

    @Test
    public void test_decodeMap_integer_keys() throws IOException {
        Map<Integer, String> m = JsonCodec.decodeMap("{\"1\":\"one\"}", Integer.class, String.class);
        assertEquals("one", m.get(1));
    }

    @Test(expected = JsonMappingException.class)
    public void test_decodeMap_null_value() throws IOException {
        JsonCodec.decodeMap("{\"a\":null}", String.class, Integer.class);
    }

    @Test(expected = JsonParseException.class)
    public void test_decodeMap_malformed() throws IOException {
        JsonCodec.decodeMap("{a:1}", String.class, Integer.class);
    }

    @Test(expected = JsonMappingException.class)
    public void test_decodeMap_wrong_type() throws IOException {
        JsonCodec.decodeMap("[1,2]", String.class, Integer.class);
    }

    @Test
    public void test_decodeList() throws IOException {
        List<Integer> list = JsonCodec.decodeList("[3,1,2]", Integer.class);
        assertEquals(ImmutableList.of(3, 1, 2), list);
        assertTrue(JsonCodec.decodeList("null", Integer.class).isEmpty());
    }

    @Test(expected = JsonMappingException.class)
    public void test_decodeList_null_element() throws IOException {
        JsonCodec.decodeList("[1,null]", Integer.class);
    }
}
