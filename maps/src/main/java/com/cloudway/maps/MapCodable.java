/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;

/**
 * A map that can be converted to and from binary and JSON form. Decoding never
 * leaves the map half updated: either the whole input is applied or the map
 * is unchanged and an {@code IOException} is thrown.
 *
 * @param <K> the type of keys maintained by the map
 * @param <V> the type of mapped values
 */
public interface MapCodable<K, V> {
    /**
     * Encodes the content of this map with Java object serialization.
     */
    byte[] marshalBinary() throws IOException;

    /**
     * Replaces the content of this map with the decoded content.
     */
    void unmarshalBinary(byte[] data) throws IOException;

    /**
     * Encodes the content of this map as a JSON object.
     */
    String marshalJson() throws IOException;

    /**
     * Replaces the content of this map with the content of a JSON object.
     *
     * @param json the JSON text
     * @param keyType the class of the keys
     * @param valueType the class of the values
     */
    void unmarshalJson(String json, Class<K> keyType, Class<V> valueType) throws IOException;
}
