/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

/**
 * A strict less-than relation over set elements.
 *
 * @param <E> the type of elements
 */
@FunctionalInterface
public interface ElementOrder<E> {
    boolean before(E a, E b);
}
