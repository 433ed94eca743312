/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.util.Objects;

public final class Equality
{
    private Equality() {}

    /**
     * Compares two map values. If {@code a} implements {@link Equaler} the
     * comparison is delegated to it, otherwise {@link Object#equals} is used.
     *
     * @throws IllegalArgumentException if the values are arrays that do not
     *         implement {@code Equaler}
     */
    public static boolean equalValues(Object a, Object b) {
        if (a instanceof Equaler) {
            return ((Equaler)a).equalTo(b);
        }
        if (isArray(a) || isArray(b)) {
            throw new IllegalArgumentException(String.format(
                "Values of type %s are not comparable, implement Equaler to compare them",
                (isArray(a) ? a : b).getClass().getSimpleName()));
        }
        return Objects.equals(a, b);
    }

    private static boolean isArray(Object x) {
        return x != null && x.getClass().isArray();
    }
}
