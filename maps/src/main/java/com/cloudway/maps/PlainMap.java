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
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import com.cloudway.maps.codec.BinaryCodec;
import com.cloudway.maps.codec.JsonCodec;

/**
 * A hash map with the common {@link MapLike} operations. The iteration order
 * is unspecified.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class PlainMap<K, V>
    implements MapLike<K, V>, MapCodable<K, V>, Cloneable, java.io.Serializable
{
    private static final long serialVersionUID = -4517310958262360741L;

    /**
     * The key-value mappings, allocated on first write.
     */
    private transient HashMap<K, V> items;

    public PlainMap() {}

    /**
     * Construct a map holding the entries of the given maps.
     */
    @SafeVarargs
    public static <K, V> PlainMap<K, V> of(Map<? extends K, ? extends V>... sources) {
        PlainMap<K, V> m = new PlainMap<>();
        for (Map<? extends K, ? extends V> source : sources) {
            source.forEach(m::set);
        }
        return m;
    }

    /**
     * Collects the given entries into a new map. Later entries replace earlier
     * ones with the same key.
     */
    public static <K, V> PlainMap<K, V> collect(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        PlainMap<K, V> m = new PlainMap<>();
        m.insert(entries);
        return m;
    }

    @Override
    public void set(K key, V value) {
        requireNonNull(key);
        requireNonNull(value);
        if (items == null) {
            items = new HashMap<>(Config.getDefault().initialCapacity());
        }
        items.put(key, value);
    }

    @Override
    public V get(K key) {
        return items == null ? null : items.get(key);
    }

    @Override
    public Optional<V> load(K key) {
        return Optional.ofNullable(get(key));
    }

    @Override
    public boolean has(K key) {
        return items != null && items.containsKey(key);
    }

    @Override
    public V delete(K key) {
        return items == null ? null : items.remove(key);
    }

    @Override
    public int len() {
        return items == null ? 0 : items.size();
    }

    @Override
    public List<K> keys() {
        return items == null ? new ArrayList<>() : new ArrayList<>(items.keySet());
    }

    @Override
    public List<V> values() {
        return items == null ? new ArrayList<>() : new ArrayList<>(items.values());
    }

    @Override
    public void range(BiPredicate<? super K, ? super V> f) {
        if (items == null)
            return;
        for (Map.Entry<K, V> e : items.entrySet()) {
            if (!f.test(e.getKey(), e.getValue()))
                break;
        }
    }

    @Override
    public void clear() {
        items = null;
    }

    @Override
    public void copy(MapLike<K, V> other) {
        if (other == null)
            return;
        other.range((k, v) -> {
            set(k, v);
            return true;
        });
    }

    @Override
    public boolean equal(MapLike<K, V> other) {
        if (other == null) {
            return len() == 0;
        }
        if (len() != other.len()) {
            return false;
        }
        if (items == null) {
            return true;
        }
        for (Map.Entry<K, V> e : items.entrySet()) {
            Optional<V> ov = other.load(e.getKey());
            if (!ov.isPresent() || !Equality.equalValues(e.getValue(), ov.get()))
                return false;
        }
        return true;
    }

    @Override
    public void deleteFunc(BiPredicate<? super K, ? super V> predicate) {
        if (items != null) {
            items.entrySet().removeIf(e -> predicate.test(e.getKey(), e.getValue()));
        }
    }

    private Iterator<Map.Entry<K, V>> entryIterator() {
        return items == null
            ? Collections.emptyIterator()
            : Iterators.transform(items.entrySet().iterator(),
                                  e -> Maps.immutableEntry(e.getKey(), e.getValue()));
    }

    @Override
    public Iterable<Map.Entry<K, V>> all() {
        return this::entryIterator;
    }

    @Override
    public Iterable<K> keysIter() {
        return () -> Iterators.transform(entryIterator(), Map.Entry::getKey);
    }

    @Override
    public Iterable<V> valuesIter() {
        return () -> Iterators.transform(entryIterator(), Map.Entry::getValue);
    }

    /**
     * Returns a shallow copy of this map.
     */
    @Override
    @SuppressWarnings("unchecked")
    public PlainMap<K, V> clone() {
        try {
            PlainMap<K, V> m = (PlainMap<K, V>)super.clone();
            if (items != null) {
                m.items = new HashMap<>(items);
            }
            return m;
        } catch (CloneNotSupportedException ex) {
            throw new InternalError(ex);
        }
    }

    @Override
    public String toString() {
        return Literals.formatMap(this);
    }

    // Serialization

    private HashMap<K, V> snapshot() {
        return items == null ? new HashMap<>() : items;
    }

    @SuppressWarnings("unchecked")
    private static <K, V> HashMap<K, V> readItems(ObjectInputStream in)
        throws IOException, ClassNotFoundException
    {
        HashMap<K, V> m = BinaryCodec.readObject(in, HashMap.class);
        if (m.containsKey(null) || m.containsValue(null)) {
            throw new InvalidObjectException("Null entries are not permitted");
        }
        return m.isEmpty() ? null : m;
    }

    /**
     * @serialData the entries as a {@code HashMap}
     */
    private void writeObject(ObjectOutputStream s) throws IOException {
        s.defaultWriteObject();
        s.writeObject(snapshot());
    }

    private void readObject(ObjectInputStream s) throws IOException, ClassNotFoundException {
        s.defaultReadObject();
        items = readItems(s);
    }

    @Override
    public byte[] marshalBinary() throws IOException {
        HashMap<K, V> m = snapshot();
        return BinaryCodec.encode(out -> out.writeObject(m));
    }

    @Override
    public void unmarshalBinary(byte[] data) throws IOException {
        items = BinaryCodec.decode(data, PlainMap::readItems);
    }

    @Override
    public String marshalJson() throws IOException {
        return JsonCodec.encodeMap(snapshot());
    }

    @Override
    public void unmarshalJson(String json, Class<K> keyType, Class<V> valueType) throws IOException {
        Map<K, V> decoded = JsonCodec.decodeMap(json, keyType, valueType);
        items = decoded.isEmpty() ? null : new HashMap<>(decoded);
    }
}
