/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

/**
 * A set backed by a hash map. The iteration order is unspecified.
 *
 * @param <E> the type of elements maintained by this set
 */
public class PlainSet<E> extends AbstractMapSet<E, PlainMap<E, Unit>>
{
    private static final long serialVersionUID = 4935587315624360829L;

    public PlainSet() {}

    @SafeVarargs
    public static <E> PlainSet<E> of(E... elements) {
        PlainSet<E> s = new PlainSet<>();
        s.add(elements);
        return s;
    }

    /**
     * Collects the given elements into a new set.
     */
    public static <E> PlainSet<E> collect(Iterable<? extends E> elements) {
        PlainSet<E> s = new PlainSet<>();
        s.insert(elements);
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
    public PlainSet<E> clone() {
        return (PlainSet<E>)super.clone();
    }
}
