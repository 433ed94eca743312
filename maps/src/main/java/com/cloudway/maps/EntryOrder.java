/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

/**
 * A strict less-than relation over map entries, used by {@link OrderedMap}
 * to keep its keys sorted. Both keys and values are supplied so that either
 * may drive the order.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface EntryOrder<K, V> {
    /**
     * Returns {@code true} if the first entry sorts before the second one.
     */
    boolean before(K key1, K key2, V value1, V value2);

    /**
     * Returns an order comparing keys only, by their natural ordering.
     */
    static <K extends Comparable<? super K>, V> EntryOrder<K, V> byKey() {
        return (k1, k2, v1, v2) -> k1.compareTo(k2) < 0;
    }
}
