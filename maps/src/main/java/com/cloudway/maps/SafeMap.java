/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.maps;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * A thread-safe map that guards another map with a single read-write lock.
 * Read operations share the read lock, and modifications take the write lock.
 *
 * <p>Iterators returned by {@link #all}, {@link #keysIter} and
 * {@link #valuesIter} walk a snapshot taken when the iterator is created.</p>
 *
 * <p>The function passed to {@link #range} runs while the read lock is held.
 * It may read the map, but modifying the map from within it blocks forever.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class SafeMap<K, V> implements MapLike<K, V>, MapCodable<K, V>, java.io.Serializable
{
    private static final long serialVersionUID = 6618090327014421773L;

    /**
     * The guarded map.
     *
     * @serial
     */
    private final MapLike<K, V> inner;

    /**
     * The guarded map viewed as codable, the same object as inner.
     *
     * @serial
     */
    private final MapCodable<K, V> codable;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Construct an empty thread-safe map backed by a {@link PlainMap}.
     */
    public SafeMap() {
        this(new PlainMap<K, V>());
    }

    /**
     * Construct a thread-safe map that guards the given map. The given map
     * must not be accessed directly afterwards.
     */
    public <M extends MapLike<K, V> & MapCodable<K, V>> SafeMap(M inner) {
        this.inner = requireNonNull(inner);
        this.codable = inner;
    }

    /**
     * Construct a thread-safe map holding the entries of the given maps.
     */
    @SafeVarargs
    public static <K, V> SafeMap<K, V> of(Map<? extends K, ? extends V>... sources) {
        return new SafeMap<>(PlainMap.<K, V>of(sources));
    }

    protected final <R> R read(Supplier<R> action) {
        Lock l = lock.readLock();
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }

    protected final void write(Runnable action) {
        Lock l = lock.writeLock();
        l.lock();
        try {
            action.run();
        } finally {
            l.unlock();
        }
    }

    protected final <R> R writeAndGet(Supplier<R> action) {
        Lock l = lock.writeLock();
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }

    /**
     * Applies the given function to the guarded map while the read lock is held.
     */
    public <R> R withReadLock(Function<? super MapLike<K, V>, ? extends R> f) {
        return read(() -> f.apply(inner));
    }

    /**
     * Applies the given action to the guarded map while the write lock is held.
     */
    public void withWriteLock(Consumer<? super MapLike<K, V>> action) {
        write(() -> action.accept(inner));
    }

    @Override
    public void set(K key, V value) {
        write(() -> inner.set(key, value));
    }

    @Override
    public V get(K key) {
        return read(() -> inner.get(key));
    }

    @Override
    public Optional<V> load(K key) {
        return read(() -> inner.load(key));
    }

    @Override
    public boolean has(K key) {
        return read(() -> inner.has(key));
    }

    @Override
    public V delete(K key) {
        return writeAndGet(() -> inner.delete(key));
    }

    @Override
    public int len() {
        return read(inner::len);
    }

    @Override
    public List<K> keys() {
        return read(inner::keys);
    }

    @Override
    public List<V> values() {
        return read(inner::values);
    }

    @Override
    public void range(BiPredicate<? super K, ? super V> f) {
        read(() -> {
            inner.range(f);
            return null;
        });
    }

    @Override
    public void clear() {
        write(inner::clear);
    }

    /**
     * Sets every entry of the given map into this map. The source entries are
     * collected before the write lock is taken, so copying a map into itself
     * is allowed.
     */
    @Override
    public void copy(MapLike<K, V> other) {
        if (other == null)
            return;
        List<Map.Entry<K, V>> entries = snapshotOf(other);
        write(() -> entries.forEach(e -> inner.set(e.getKey(), e.getValue())));
    }

    @Override
    public void insert(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        List<Map.Entry<? extends K, ? extends V>> list = ImmutableList.copyOf(entries);
        write(() -> list.forEach(e -> inner.set(e.getKey(), e.getValue())));
    }

    private static <K, V> List<Map.Entry<K, V>> snapshotOf(MapLike<K, V> m) {
        List<Map.Entry<K, V>> entries = new ArrayList<>(m.len());
        m.range((k, v) -> entries.add(Maps.immutableEntry(k, v)));
        return entries;
    }

    /**
     * Compares against a snapshot of the given map taken before the read lock
     * is acquired, so no two locks are ever held at once.
     */
    @Override
    public boolean equal(MapLike<K, V> other) {
        if (other == null) {
            return read(() -> inner.equal(null));
        }
        PlainMap<K, V> snapshot = new PlainMap<>();
        snapshot.copy(other);
        return read(() -> inner.equal(snapshot));
    }

    @Override
    public void deleteFunc(BiPredicate<? super K, ? super V> predicate) {
        write(() -> inner.deleteFunc(predicate));
    }

    @Override
    public Iterable<Map.Entry<K, V>> all() {
        return () -> read(() -> snapshotOf(inner)).iterator();
    }

    @Override
    public Iterable<K> keysIter() {
        return () -> keys().iterator();
    }

    @Override
    public Iterable<V> valuesIter() {
        return () -> values().iterator();
    }

    /**
     * Returns a new thread-safe map guarding a shallow copy of the guarded map,
     * taken under the read lock.
     */
    @Override
    public SafeMap<K, V> clone() {
        return read(() -> {
            if (inner instanceof OrderedMap) {
                return new SafeMap<>(((OrderedMap<K, V>)inner).clone());
            } else if (inner instanceof PlainMap) {
                return new SafeMap<>(((PlainMap<K, V>)inner).clone());
            } else {
                OrderedMap<K, V> copy = new OrderedMap<>();
                copy.copy(inner);
                return new SafeMap<>(copy);
            }
        });
    }

    @Override
    public String toString() {
        return read(inner::toString);
    }

    // Serialization

    /**
     * Holds the read lock so that a consistent state is written.
     */
    private void writeObject(ObjectOutputStream s) throws IOException {
        Lock l = lock.readLock();
        l.lock();
        try {
            s.defaultWriteObject();
        } finally {
            l.unlock();
        }
    }

    @Override
    public byte[] marshalBinary() throws IOException {
        Lock l = lock.readLock();
        l.lock();
        try {
            return codable.marshalBinary();
        } finally {
            l.unlock();
        }
    }

    @Override
    public void unmarshalBinary(byte[] data) throws IOException {
        Lock l = lock.writeLock();
        l.lock();
        try {
            codable.unmarshalBinary(data);
        } finally {
            l.unlock();
        }
    }

    @Override
    public String marshalJson() throws IOException {
        Lock l = lock.readLock();
        l.lock();
        try {
            return codable.marshalJson();
        } finally {
            l.unlock();
        }
    }

    @Override
    public void unmarshalJson(String json, Class<K> keyType, Class<V> valueType) throws IOException {
        Lock l = lock.writeLock();
        l.lock();
        try {
            codable.unmarshalJson(json, keyType, valueType);
        } finally {
            l.unlock();
        }
    }
}
