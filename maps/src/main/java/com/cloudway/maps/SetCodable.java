/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;

/**
 * A set that can be converted to and from binary and JSON form. Decoding
 * adds the decoded elements to the set, it does not replace its content.
 *
 * @param <E> the type of elements maintained by the set
 */
public interface SetCodable<E> {
    byte[] marshalBinary() throws IOException;

    void unmarshalBinary(byte[] data) throws IOException;

    /**
     * Encodes the elements of this set as a JSON array, in iteration order.
     */
    String marshalJson() throws IOException;

    void unmarshalJson(String json, Class<E> elementType) throws IOException;
}
