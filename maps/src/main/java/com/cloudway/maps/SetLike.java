/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.List;
import java.util.function.Predicate;

/**
 * The operations shared by all set-like containers.
 *
 * @param <E> the type of elements maintained by this set
 */
public interface SetLike<E> {
    /**
     * Adds the given elements to this set. Elements already present are left
     * where they are.
     *
     * @return this set, for chaining
     */
    @SuppressWarnings("unchecked")
    SetLike<E> add(E... elements);

    /**
     * Returns the number of elements in this set.
     */
    int len();

    /**
     * Returns {@code true} if this set contains the specified element.
     */
    boolean has(E element);

    /**
     * Removes the element from this set. Nothing happens if it is absent.
     */
    void delete(E element);

    /**
     * Removes all of the elements from this set.
     */
    void clear();

    /**
     * Returns a new list containing the elements of this set in iteration order.
     */
    List<E> values();

    /**
     * Calls the given function for each element until it returns {@code false}.
     * The set must not be modified from within the function.
     */
    void range(Predicate<? super E> f);

    /**
     * Returns {@code true} if both sets have the same size and contain the same
     * elements. A {@code null} set is treated as empty.
     */
    boolean equal(SetLike<E> other);

    /**
     * Returns a lazily evaluated view over the elements of this set.
     */
    Iterable<E> all();

    /**
     * Adds every element of the given set to this set.
     *
     * @param other the source set, may be {@code null}
     */
    void copy(SetLike<E> other);

    /**
     * Same as {@link #copy}.
     *
     * @deprecated use {@link #copy} instead
     */
    @Deprecated
    default void merge(SetLike<E> other) {
        copy(other);
    }

    /**
     * Adds every element of the given sequence to this set.
     */
    default void insert(Iterable<? extends E> elements) {
        for (E e : elements) {
            add(e);
        }
    }

    /**
     * Removes every element for which the given predicate returns {@code true}.
     */
    void deleteFunc(Predicate<? super E> predicate);
}
