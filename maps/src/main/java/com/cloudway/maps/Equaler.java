/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

/**
 * A value that knows how to compare itself with another value.
 *
 * <p>Map values that have no usable {@code equals}, such as arrays, must be
 * wrapped in a type implementing this interface before {@code equal} is called
 * on the map holding them:</p>
 *
 * <pre>{@code
 * final class Ints implements Equaler {
 *     final int[] data;
 *     ...
 *     public boolean equalTo(Object other) {
 *         return other instanceof Ints && Arrays.equals(data, ((Ints)other).data);
 *     }
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Equaler {
    /**
     * Returns {@code true} if this value is equal to the given value.
     */
    boolean equalTo(Object other);
}
