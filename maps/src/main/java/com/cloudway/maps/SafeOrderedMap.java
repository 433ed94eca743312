/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Map;
import java.util.Optional;

/**
 * A thread-safe {@link OrderedMap}. In addition to the common operations it
 * provides positional access and entry ordering, each performed under the
 * lock.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class SafeOrderedMap<K, V> extends SafeMap<K, V>
{
    private static final long serialVersionUID = -3069117728469853152L;

    /**
     * The guarded map, the same object the superclass guards.
     *
     * @serial
     */
    private final OrderedMap<K, V> ordered;

    public SafeOrderedMap() {
        this(new OrderedMap<K, V>());
    }

    /**
     * Construct a thread-safe map that guards the given map. The given map
     * must not be accessed directly afterwards.
     */
    public SafeOrderedMap(OrderedMap<K, V> inner) {
        super(inner);
        this.ordered = inner;
    }

    /**
     * Construct a thread-safe ordered map holding the entries of the given
     * maps, in their iteration order.
     */
    @SafeVarargs
    public static <K, V> SafeOrderedMap<K, V> of(Map<? extends K, ? extends V>... sources) {
        return new SafeOrderedMap<>(OrderedMap.<K, V>of(sources));
    }

    /**
     * @see OrderedMap#setOrder
     */
    public void setOrder(EntryOrder<K, V> f) {
        write(() -> ordered.setOrder(f));
    }

    public Optional<EntryOrder<K, V>> order() {
        return read(ordered::order);
    }

    /**
     * @see OrderedMap#setAt
     * @throws IllegalStateException if an order is installed
     */
    public void setAt(int index, K key, V value) {
        write(() -> ordered.setAt(index, key, value));
    }

    public V getAt(int position) {
        return read(() -> ordered.getAt(position));
    }

    public K getKeyAt(int position) {
        return read(() -> ordered.getKeyAt(position));
    }

    @Override
    public SafeOrderedMap<K, V> clone() {
        return read(() -> new SafeOrderedMap<>(ordered.clone()));
    }
}
