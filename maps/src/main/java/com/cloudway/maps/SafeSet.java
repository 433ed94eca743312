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
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * A thread-safe set that guards another set with a single read-write lock.
 * Iterators walk a snapshot taken when they are created.
 *
 * @param <E> the type of elements maintained by this set
 */
public class SafeSet<E> implements SetLike<E>, SetCodable<E>, java.io.Serializable
{
    private static final long serialVersionUID = -7738209518436612304L;

    /**
     * @serial
     */
    private final SetLike<E> inner;

    /**
     * @serial
     */
    private final SetCodable<E> codable;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Construct an empty thread-safe set backed by a {@link PlainSet}.
     */
    public SafeSet() {
        this(new PlainSet<E>());
    }

    /**
     * Construct a thread-safe set that guards the given set. The given set
     * must not be accessed directly afterwards.
     */
    public <S extends SetLike<E> & SetCodable<E>> SafeSet(S inner) {
        this.inner = requireNonNull(inner);
        this.codable = inner;
    }

    @SafeVarargs
    public static <E> SafeSet<E> of(E... elements) {
        return new SafeSet<>(PlainSet.<E>of(elements));
    }

    private <R> R read(Supplier<R> action) {
        Lock l = lock.readLock();
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }

    private void write(Runnable action) {
        Lock l = lock.writeLock();
        l.lock();
        try {
            action.run();
        } finally {
            l.unlock();
        }
    }

    /**
     * Applies the given function to the guarded set while the read lock is held.
     */
    public <R> R withReadLock(Function<? super SetLike<E>, ? extends R> f) {
        return read(() -> f.apply(inner));
    }

    /**
     * Applies the given action to the guarded set while the write lock is held.
     */
    public void withWriteLock(Consumer<? super SetLike<E>> action) {
        write(() -> action.accept(inner));
    }

    @Override
    @SafeVarargs
    public final SetLike<E> add(E... elements) {
        write(() -> inner.add(elements));
        return this;
    }

    @Override
    public int len() {
        return read(inner::len);
    }

    @Override
    public boolean has(E element) {
        return read(() -> inner.has(element));
    }

    @Override
    public void delete(E element) {
        write(() -> inner.delete(element));
    }

    @Override
    public void clear() {
        write(inner::clear);
    }

    @Override
    public List<E> values() {
        return read(inner::values);
    }

    /**
     * Calls the given function for each element while the read lock is held.
     * Modifying the set from within the function blocks forever.
     */
    @Override
    public void range(Predicate<? super E> f) {
        read(() -> {
            inner.range(f);
            return null;
        });
    }

    /**
     * Compares against a snapshot of the given set taken before the read lock
     * is acquired.
     */
    @Override
    public boolean equal(SetLike<E> other) {
        if (other == null) {
            return read(() -> inner.equal(null));
        }
        PlainSet<E> snapshot = new PlainSet<>();
        snapshot.copy(other);
        return read(() -> inner.equal(snapshot));
    }

    @Override
    public Iterable<E> all() {
        return () -> values().iterator();
    }

    /**
     * Adds every element of the given set. The source elements are collected
     * before the write lock is taken.
     */
    @Override
    public void copy(SetLike<E> other) {
        if (other == null)
            return;
        List<E> elements = new ArrayList<>(other.len());
        other.range(elements::add);
        write(() -> inner.insert(elements));
    }

    @Override
    public void insert(Iterable<? extends E> elements) {
        List<E> list = ImmutableList.copyOf(elements);
        write(() -> inner.insert(list));
    }

    @Override
    public void deleteFunc(Predicate<? super E> predicate) {
        write(() -> inner.deleteFunc(predicate));
    }

    /**
     * Returns a new thread-safe set guarding a shallow copy of the guarded set,
     * taken under the read lock.
     */
    @Override
    public SafeSet<E> clone() {
        return read(() -> {
            if (inner instanceof AbstractMapSet) {
                return new SafeSet<>(((AbstractMapSet<E, ?>)inner).clone());
            } else {
                OrderedSet<E> copy = new OrderedSet<>();
                copy.copy(inner);
                return new SafeSet<>(copy);
            }
        });
    }

    @Override
    public String toString() {
        return read(inner::toString);
    }

    // Serialization

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
    public void unmarshalJson(String json, Class<E> elementType) throws IOException {
        Lock l = lock.writeLock();
        l.lock();
        try {
            codable.unmarshalJson(json, elementType);
        } finally {
            l.unlock();
        }
    }
}
