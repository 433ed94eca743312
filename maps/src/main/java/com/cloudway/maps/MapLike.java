/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * The operations shared by all map-like containers. Code written against this
 * interface can swap a plain, order-preserving or thread-safe map without
 * changing call sites.
 *
 * <p>Null keys and null values are not permitted, so a {@code null} returned
 * from {@link #get} always means the key is absent.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface MapLike<K, V> {

    // Query Operations

    /**
     * Returns the number of key-value mappings in this map.
     *
     * @return the number of key-value mappings in this map
     */
    int len();

    /**
     * Returns the value to which the specified key is mapped, or {@code null}
     * if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @return the mapped value or {@code null}
     */
    V get(K key);

    /**
     * Lookup the value to which the specified key is mapped.
     *
     * @param key the key whose associated value is to be returned
     * @return the mapped value, or an empty {@code Optional} if this map
     *         contains no mapping for the key
     */
    Optional<V> load(K key);

    /**
     * Returns {@code true} if this map contains a mapping for the specified key.
     *
     * @param key key whose presence in this map is to be tested
     * @return {@code true} if this map contains a mapping for the specified key
     */
    boolean has(K key);

    /**
     * Returns a new list containing the keys of this map in iteration order.
     * The list is a snapshot, later changes to the map are not reflected.
     */
    List<K> keys();

    /**
     * Returns a new list containing the values of this map in iteration order.
     * The list is a snapshot, later changes to the map are not reflected.
     */
    List<V> values();

    /**
     * Calls the given function for each key and value in iteration order until
     * the function returns {@code false}.
     *
     * <p>The map must not be modified from within the function. For a thread-safe
     * map, doing so blocks forever.</p>
     *
     * @param f the function to apply
     */
    void range(BiPredicate<? super K, ? super V> f);

    /**
     * Returns {@code true} if both maps contain the same keys, and the values
     * of each key are equal, regardless of iteration order. Values are compared
     * with {@link Equality#equalValues}.
     *
     * @param other the map to compare with, {@code null} is treated as empty
     * @return {@code true} if the maps have the same content
     */
    boolean equal(MapLike<K, V> other);

    /**
     * Returns a lazily evaluated view over the entries of this map. Every call
     * to {@code iterator()} starts again from the first entry.
     */
    Iterable<Map.Entry<K, V>> all();

    /**
     * Returns a lazily evaluated view over the keys of this map.
     */
    Iterable<K> keysIter();

    /**
     * Returns a lazily evaluated view over the values of this map.
     */
    Iterable<V> valuesIter();

    // Modification Operations

    /**
     * Associates the specified value with the specified key in this map.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @throws NullPointerException if key or value is null
     */
    void set(K key, V value);

    /**
     * Removes the mapping for a key from this map if it is present.
     *
     * @param key key whose mapping is to be removed
     * @return the previous value associated with the key, or {@code null}
     */
    V delete(K key);

    /**
     * Removes all of the mappings from this map.
     */
    void clear();

    /**
     * Sets every key and value of the given map into this map, visiting the
     * source in its iteration order.
     *
     * @param other the source map, may be {@code null}
     */
    void copy(MapLike<K, V> other);

    /**
     * Same as {@link #copy}.
     *
     * @deprecated use {@link #copy} instead
     */
    @Deprecated
    default void merge(MapLike<K, V> other) {
        copy(other);
    }

    /**
     * Sets every entry of the given sequence into this map, in sequence order.
     *
     * @param entries the entries to insert
     */
    default void insert(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            set(e.getKey(), e.getValue());
        }
    }

    /**
     * Removes every mapping for which the given predicate returns {@code true}.
     *
     * @param predicate the predicate tested on each key and value
     */
    void deleteFunc(BiPredicate<? super K, ? super V> predicate);
}
