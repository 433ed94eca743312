/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Properties;

import org.junit.Test;
import static org.junit.Assert.*;

public class ConfigTest {
    private static Config configOf(String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            props.setProperty(pairs[i], pairs[i + 1]);
        }
        return new Config(props);
    }

    @Test
    public void test_default() {
        Config config = Config.getDefault();
        assertEquals(16, config.initialCapacity());
        assertFalse(config.prettyJson());
    }

    @Test
    public void test_properties() {
        Config config = configOf(Config.INITIAL_CAPACITY_KEY, " 64 ", Config.JSON_PRETTY_KEY, "true");
        assertEquals(64, config.initialCapacity());
        assertTrue(config.prettyJson());
        assertEquals("fallback", config.get("no.such.key", "fallback"));
        assertFalse(config.get("no.such.key").isPresent());
    }

    @Test
    public void test_invalid_capacity() {
        assertEquals(16, configOf(Config.INITIAL_CAPACITY_KEY, "lots").initialCapacity());
        assertEquals(16, configOf(Config.INITIAL_CAPACITY_KEY, "0").initialCapacity());
        assertEquals(16, configOf(Config.INITIAL_CAPACITY_KEY, "-8").initialCapacity());
    }

    @Test
    public void test_system_property_override() {
        String key = "cloudway.maps.test.override";
        Config config = configOf(key, "from-file");
        assertEquals("from-file", config.get(key, null));
        System.setProperty(key, "from-system");
        try {
            assertEquals("from-system", config.get(key, null));
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    public void test_missing_resource() {
        Config config = new Config("no-such-resource.properties");
        assertEquals(16, config.initialCapacity());
        assertFalse(config.prettyJson());
    }
}
