/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.codehaus.jackson.map.JsonMappingException;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.map.ObjectWriter;
import org.codehaus.jackson.map.type.TypeFactory;
import org.codehaus.jackson.type.JavaType;

import com.cloudway.maps.Config;

/**
 * Converts container content to and from JSON text.
 *
 * <p>Maps are written as JSON objects and sets as JSON arrays. JSON objects
 * carry no order, so a decoded map has the iteration order of a
 * {@link HashMap}.</p>
 */
public final class JsonCodec
{
    private static final Logger logger = Logger.getLogger(JsonCodec.class.getName());

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonCodec() {}

    private static ObjectWriter writer() {
        return Config.getDefault().prettyJson()
            ? mapper.writerWithDefaultPrettyPrinter()
            : mapper.writer();
    }

    /**
     * Writes the given entries as a JSON object, in the map's iteration order.
     */
    public static String encodeMap(Map<?,?> entries) throws IOException {
        return writer().writeValueAsString(requireNonNull(entries));
    }

    /**
     * Writes the given elements as a JSON array.
     */
    public static String encodeList(Collection<?> elements) throws IOException {
        return writer().writeValueAsString(requireNonNull(elements));
    }

    /**
     * Reads a JSON object into a new map. A JSON {@code null} yields an
     * empty map.
     *
     * @throws IOException if the text is malformed, or a key or value cannot
     *         be converted, or a value is {@code null}
     */
    public static <K, V> Map<K, V> decodeMap(String json, Class<K> keyType, Class<V> valueType)
        throws IOException
    {
        requireNonNull(json);
        JavaType type = TypeFactory.defaultInstance().constructMapType(HashMap.class, keyType, valueType);
        try {
            Map<K, V> result = mapper.readValue(json, type);
            if (result == null)
                return new HashMap<>();
            for (Map.Entry<K, V> e : result.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) {
                    throw new JsonMappingException("Null entries are not permitted: " + e.getKey());
                }
            }
            return result;
        } catch (IOException ex) {
            logger.log(Level.FINE, "Failed to decode JSON object", ex);
            throw ex;
        }
    }

    /**
     * Reads a JSON array into a new list. A JSON {@code null} yields an
     * empty list.
     *
     * @throws IOException if the text is malformed, or an element cannot
     *         be converted or is {@code null}
     */
    public static <E> List<E> decodeList(String json, Class<E> elementType) throws IOException {
        requireNonNull(json);
        JavaType type = TypeFactory.defaultInstance().constructCollectionType(ArrayList.class, elementType);
        try {
            List<E> result = mapper.readValue(json, type);
            if (result == null)
                return new ArrayList<>();
            if (result.contains(null)) {
                throw new JsonMappingException("Null elements are not permitted");
            }
            return result;
        } catch (IOException ex) {
            logger.log(Level.FINE, "Failed to decode JSON array", ex);
            throw ex;
        }
    }
}
