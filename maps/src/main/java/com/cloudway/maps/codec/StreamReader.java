/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps.codec;

import java.io.IOException;
import java.io.ObjectInputStream;

/**
 * Reads a value from an object stream.
 *
 * @param <T> the type of the value
 */
@FunctionalInterface
public interface StreamReader<T>
{
    /**
     * Reads the value from the given stream.
     *
     * @param in the object stream
     * @return the value read
     * @throws IOException if I/O error occurs or the data is malformed
     * @throws ClassNotFoundException if the class of a serialized object cannot be found
     */
    T read(ObjectInputStream in) throws IOException, ClassNotFoundException;
}
