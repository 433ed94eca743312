/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Ints;

/**
 * Tuning settings read from a properties resource on the class path. A system
 * property with the same name takes precedence over the resource.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    public static final String RESOURCE_NAME = "cloudway-maps.properties";

    public static final String INITIAL_CAPACITY_KEY = "cloudway.maps.initialCapacity";
    public static final String JSON_PRETTY_KEY = "cloudway.maps.json.pretty";

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    private static final Config DEFAULT = new Config(RESOURCE_NAME);

    private final Properties conf;

    public static Config getDefault() {
        return DEFAULT;
    }

    public Config(String resource) {
        this(load(requireNonNull(resource)));
    }

    public Config(Properties conf) {
        this.conf = requireNonNull(conf);
    }

    private static Properties load(String resource) {
        Properties props = new Properties();
        ClassLoader loader = MoreObjects.firstNonNull(
            Thread.currentThread().getContextClassLoader(), Config.class.getClassLoader());
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.fine("No " + resource + " on the class path, using defaults");
            } else {
                props.load(in);
            }
        } catch (IOException ex) {
            logger.log(Level.WARNING, "Could not read " + resource + ", using defaults", ex);
            props.clear();
        }
        return props;
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBool(String name, boolean deflt) {
        return get(name).map(String::trim).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(String::trim).map(Ints::tryParse).orElse(deflt);
    }

    /**
     * Returns the initial capacity of a backing hash table when it is allocated.
     */
    public int initialCapacity() {
        int n = getInt(INITIAL_CAPACITY_KEY, DEFAULT_INITIAL_CAPACITY);
        return n > 0 ? n : DEFAULT_INITIAL_CAPACITY;
    }

    /**
     * Returns whether JSON output should be indented.
     */
    public boolean prettyJson() {
        return getBool(JSON_PRETTY_KEY, false);
    }

    public String toString() {
        return conf.toString();
    }
}
