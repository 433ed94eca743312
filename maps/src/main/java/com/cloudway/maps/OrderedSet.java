/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Optional;

/**
 * A set that iterates in insertion order, or keeps its elements sorted by an
 * {@link ElementOrder}. Elements are placed when they are added, so adding
 * costs a search while reading costs nothing extra. Compare with
 * {@link LazySortedSet}, which sorts on every read instead.
 *
 * @param <E> the type of elements maintained by this set
 */
public class OrderedSet<E> extends AbstractMapSet<E, OrderedMap<E, Unit>>
{
    private static final long serialVersionUID = -6310546064125718473L;

    private transient ElementOrder<E> less;

    public OrderedSet() {}

    @SafeVarargs
    public static <E> OrderedSet<E> of(E... elements) {
        OrderedSet<E> s = new OrderedSet<>();
        s.add(elements);
        return s;
    }

    @Override
    OrderedMap<E, Unit> newMap() {
        return new OrderedMap<>();
    }

    @Override
    OrderedMap<E, Unit> copyOf(OrderedMap<E, Unit> m) {
        return m.clone();
    }

    /**
     * Installs the order that keeps the elements sorted, and sorts the
     * existing elements. Passing {@code null} removes the order.
     *
     * @param f the order, or {@code null}
     */
    public void setOrder(ElementOrder<E> f) {
        less = f;
        items.setOrder(f == null ? null : (a, b, u1, u2) -> f.before(a, b));
    }

    public Optional<ElementOrder<E>> order() {
        return Optional.ofNullable(less);
    }

    @Override
    public OrderedSet<E> clone() {
        return (OrderedSet<E>)super.clone();
    }
}
