/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * A set of naturally ordered elements that are stored unordered and sorted
 * each time they are read. Adding is a plain hash insert, while every call to
 * {@link #values}, {@link #range} or {@link #all} sorts a fresh copy.
 *
 * @param <E> the type of elements maintained by this set
 */
public class LazySortedSet<E extends Comparable<? super E>> extends AbstractMapSet<E, PlainMap<E, Unit>>
{
    private static final long serialVersionUID = 8216375946734911362L;

    public LazySortedSet() {}

    @SafeVarargs
    public static <E extends Comparable<? super E>> LazySortedSet<E> of(E... elements) {
        LazySortedSet<E> s = new LazySortedSet<>();
        s.add(elements);
        return s;
    }

    @Override
    PlainMap<E, Unit> newMap() {
        return new PlainMap<>();
    }

    @Override
    PlainMap<E, Unit> copyOf(PlainMap<E, Unit> m) {
        return m.clone();
    }

    @Override
    public List<E> values() {
        List<E> values = items.keys();
        Collections.sort(values);
        return values;
    }

    @Override
    public void range(Predicate<? super E> f) {
        for (E e : values()) {
            if (!f.test(e))
                break;
        }
    }

    @Override
    public Iterable<E> all() {
        return () -> values().iterator();
    }

    @Override
    public LazySortedSet<E> clone() {
        return (LazySortedSet<E>)super.clone();
    }
}
