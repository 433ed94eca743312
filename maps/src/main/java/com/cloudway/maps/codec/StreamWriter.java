/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps.codec;

import java.io.IOException;
import java.io.ObjectOutputStream;

/**
 * Writes the content of a container to an object stream.
 */
@FunctionalInterface
public interface StreamWriter
{
    /**
     * Writes the content to the given stream.
     *
     * @param out the object stream
     * @throws IOException if I/O error occurs
     */
    void write(ObjectOutputStream out) throws IOException;
}
