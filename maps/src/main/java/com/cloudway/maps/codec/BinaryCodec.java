/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

/**
 * Encodes and decodes container content with Java object serialization.
 */
public final class BinaryCodec
{
    private static final Logger logger = Logger.getLogger(BinaryCodec.class.getName());

    private BinaryCodec() {}

    /**
     * Runs the given writer against a fresh object stream and returns the
     * bytes produced.
     */
    public static byte[] encode(StreamWriter writer) throws IOException {
        requireNonNull(writer);
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buf)) {
            writer.write(out);
        }
        return buf.toByteArray();
    }

    /**
     * Runs the given reader against an object stream over the given bytes.
     * A missing class is reported as {@link InvalidClassException} so that
     * callers only have to deal with {@code IOException}.
     */
    public static <T> T decode(byte[] data, StreamReader<T> reader) throws IOException {
        requireNonNull(data);
        requireNonNull(reader);
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            return reader.read(in);
        } catch (ClassNotFoundException ex) {
            logger.log(Level.FINE, "Failed to decode binary data", ex);
            InvalidClassException ice = new InvalidClassException(ex.getMessage());
            ice.initCause(ex);
            throw ice;
        } catch (ClassCastException ex) {
            logger.log(Level.FINE, "Failed to decode binary data", ex);
            InvalidObjectException ioe = new InvalidObjectException(ex.getMessage());
            ioe.initCause(ex);
            throw ioe;
        } catch (IOException ex) {
            logger.log(Level.FINE, "Failed to decode binary data", ex);
            throw ex;
        }
    }

    /**
     * Reads the next object from the stream and checks its type.
     *
     * @throws InvalidObjectException if the object is not of the expected type
     */
    public static <T> T readObject(ObjectInputStream in, Class<T> type)
        throws IOException, ClassNotFoundException
    {
        Object obj = in.readObject();
        if (!type.isInstance(obj)) {
            throw new InvalidObjectException(String.format(
                "Expected %s but found %s", type.getName(),
                obj == null ? "null" : obj.getClass().getName()));
        }
        return type.cast(obj);
    }
}
