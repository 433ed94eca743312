/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import static java.util.Objects.requireNonNull;

import com.cloudway.maps.codec.BinaryCodec;
import com.cloudway.maps.codec.JsonCodec;

/**
 * Skeleton of a set that stores its elements as the keys of a map, with
 * {@link Unit#U} as the value of every key.
 *
 * @param <E> the type of elements maintained by this set
 * @param <M> the type of the backing map
 */
abstract class AbstractMapSet<E, M extends MapLike<E, Unit>>
    implements SetLike<E>, SetCodable<E>, Cloneable, java.io.Serializable
{
    private static final long serialVersionUID = -1245287716270932245L;

    transient M items;

    AbstractMapSet() {
        items = newMap();
    }

    /**
     * Creates an empty backing map.
     */
    abstract M newMap();

    /**
     * Returns a shallow copy of the given backing map.
     */
    abstract M copyOf(M m);

    @Override
    @SafeVarargs
    public final SetLike<E> add(E... elements) {
        for (E e : elements) {
            items.set(requireNonNull(e), Unit.U);
        }
        return this;
    }

    @Override
    public int len() {
        return items.len();
    }

    @Override
    public boolean has(E element) {
        return items.has(element);
    }

    @Override
    public void delete(E element) {
        items.delete(element);
    }

    @Override
    public void clear() {
        items.clear();
    }

    @Override
    public List<E> values() {
        return items.keys();
    }

    @Override
    public void range(Predicate<? super E> f) {
        items.range((k, u) -> f.test(k));
    }

    @Override
    public Iterable<E> all() {
        return items.keysIter();
    }

    @Override
    public boolean equal(SetLike<E> other) {
        if (other == null) {
            return len() == 0;
        }
        if (len() != other.len()) {
            return false;
        }
        boolean[] result = { true };
        other.range(e -> result[0] = has(e));
        return result[0];
    }

    @Override
    public void copy(SetLike<E> other) {
        if (other == null)
            return;
        other.range(e -> {
            items.set(e, Unit.U);
            return true;
        });
    }

    @Override
    public void deleteFunc(Predicate<? super E> predicate) {
        items.deleteFunc((k, u) -> predicate.test(k));
    }

    @Override
    @SuppressWarnings("unchecked")
    public AbstractMapSet<E, M> clone() {
        try {
            AbstractMapSet<E, M> s = (AbstractMapSet<E, M>)super.clone();
            s.items = copyOf(items);
            return s;
        } catch (CloneNotSupportedException ex) {
            throw new InternalError(ex);
        }
    }

    @Override
    public String toString() {
        return Literals.formatSet(this);
    }

    // Serialization

    @SuppressWarnings("unchecked")
    private static <E> List<E> readElements(ObjectInputStream in)
        throws IOException, ClassNotFoundException
    {
        List<E> elements = BinaryCodec.readObject(in, ArrayList.class);
        if (elements.contains(null)) {
            throw new InvalidObjectException("Null elements are not permitted");
        }
        return elements;
    }

    /**
     * @serialData the elements in iteration order as an {@code ArrayList}
     */
    private void writeObject(ObjectOutputStream s) throws IOException {
        s.defaultWriteObject();
        s.writeObject(new ArrayList<>(values()));
    }

    private void readObject(ObjectInputStream s) throws IOException, ClassNotFoundException {
        s.defaultReadObject();
        items = newMap();
        List<E> elements = readElements(s);
        elements.forEach(e -> items.set(e, Unit.U));
    }

    @Override
    public byte[] marshalBinary() throws IOException {
        List<E> elements = new ArrayList<>(values());
        return BinaryCodec.encode(out -> out.writeObject(elements));
    }

    /**
     * Adds the decoded elements to this set.
     */
    @Override
    public void unmarshalBinary(byte[] data) throws IOException {
        List<E> elements = BinaryCodec.decode(data, AbstractMapSet::readElements);
        elements.forEach(e -> items.set(e, Unit.U));
    }

    @Override
    public String marshalJson() throws IOException {
        return JsonCodec.encodeList(values());
    }

    /**
     * Adds the elements of a JSON array to this set.
     */
    @Override
    public void unmarshalJson(String json, Class<E> elementType) throws IOException {
        List<E> elements = JsonCodec.decodeList(json, elementType);
        elements.forEach(e -> items.set(e, Unit.U));
    }
}
