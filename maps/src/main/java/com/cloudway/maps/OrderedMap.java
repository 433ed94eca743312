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
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import com.cloudway.maps.codec.BinaryCodec;
import com.cloudway.maps.codec.JsonCodec;

/**
 * A hash map that remembers the order of its keys, so that it always iterates
 * in a predictable order. By default the order is the insertion order. An
 * {@link EntryOrder} may be installed to keep the keys sorted instead.
 *
 * <p>Setting a key that is already present replaces its value but never moves
 * the key, even when an order is installed. Delete the key first to have it
 * placed again.</p>
 *
 * <p>This class is not thread-safe, wrap it in a {@link SafeOrderedMap} to
 * share it between threads.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class OrderedMap<K, V>
    implements MapLike<K, V>, MapCodable<K, V>, Cloneable, java.io.Serializable
{
    private static final long serialVersionUID = 2871605395178436019L;

    /**
     * The key-value mappings, allocated on first write.
     */
    private transient HashMap<K, V> items;

    /**
     * The keys in iteration order, always holding the same keys as items.
     */
    private transient ArrayList<K> order;

    /**
     * The order used to keep keys sorted, or null for insertion order.
     */
    private transient EntryOrder<K, V> less;

    /**
     * Construct an empty map that iterates in insertion order.
     */
    public OrderedMap() {}

    /**
     * Construct a map holding the entries of the given maps, in their
     * iteration order.
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> of(Map<? extends K, ? extends V>... sources) {
        OrderedMap<K, V> m = new OrderedMap<>();
        for (Map<? extends K, ? extends V> source : sources) {
            source.forEach(m::set);
        }
        return m;
    }

    /**
     * Collects the given entries into a new map, in sequence order.
     */
    public static <K, V> OrderedMap<K, V> collect(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        OrderedMap<K, V> m = new OrderedMap<>();
        m.insert(entries);
        return m;
    }

    private void allocate() {
        if (items == null) {
            items = new HashMap<>(Config.getDefault().initialCapacity());
            order = new ArrayList<>();
        }
    }

    /**
     * Installs the order that keeps the keys sorted from now on, and sorts the
     * existing keys with a stable sort. Passing {@code null} removes the order,
     * the keys stay where they are and new keys are appended.
     *
     * @param f the order, or {@code null}
     */
    public void setOrder(EntryOrder<K, V> f) {
        less = f;
        if (f != null && order != null && order.size() > 1) {
            order.sort((a, b) -> {
                V va = items.get(a), vb = items.get(b);
                if (f.before(a, b, va, vb))
                    return -1;
                if (f.before(b, a, vb, va))
                    return 1;
                return 0;
            });
        }
    }

    /**
     * Returns the installed order.
     */
    public Optional<EntryOrder<K, V>> order() {
        return Optional.ofNullable(less);
    }

    @Override
    public void set(K key, V value) {
        requireNonNull(key);
        requireNonNull(value);
        allocate();

        if (items.containsKey(key)) {
            items.put(key, value);
            return;
        }

        if (less != null) {
            order.add(searchInsert(key, value), key);
        } else {
            order.add(key);
        }
        items.put(key, value);
    }

    /**
     * Returns the first position whose key sorts after the given entry.
     */
    private int searchInsert(K key, V value) {
        int lo = 0, hi = order.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            K k = order.get(mid);
            if (less.before(key, k, value, items.get(k))) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Returns the position of the given key, or -1 if it is absent.
     */
    private int indexOf(K key, V value) {
        if (less == null) {
            return order.indexOf(key);
        }

        // first position that does not sort before the key
        int lo = 0, hi = order.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            K k = order.get(mid);
            if (!less.before(k, key, items.get(k), value)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }

        // walk the run of keys that sort equal to the key
        for (int i = lo; i < order.size(); i++) {
            K k = order.get(i);
            if (k.equals(key))
                return i;
            if (less.before(key, k, value, items.get(k)))
                break;
        }

        // an updated value may have left the key out of place
        return order.indexOf(key);
    }

    /**
     * Sets the given key to the given value and places the key at the given
     * position, shifting the following keys. A key already present is first
     * removed. Negative positions count back from the end, so that {@code -1}
     * places the key before the last one. Positions before the start insert at
     * the start, and positions at or past the end append.
     *
     * @throws IllegalStateException if an order is installed
     */
    public void setAt(int index, K key, V value) {
        Preconditions.checkState(less == null, "Cannot use setAt while an entry order is installed");
        requireNonNull(key);
        requireNonNull(value);

        if (index >= len()) {
            set(key, value);
            return;
        }

        allocate();
        if (items.containsKey(key)) {
            delete(key);
        }

        int n = items.size();
        if (index <= -n) {
            index = 0;
        } else if (index < 0) {
            index = n + index;
        }

        order.add(index, key);
        items.put(key, value);
    }

    @Override
    public V delete(K key) {
        if (items == null || key == null || !items.containsKey(key)) {
            return null;
        }

        V value = items.get(key);
        int loc = indexOf(key, value);
        order.remove(loc);
        items.remove(key);
        return value;
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

    /**
     * Returns the value at the given position, or {@code null} if the position
     * is out of range.
     */
    public V getAt(int position) {
        if (order == null || position < 0 || position >= order.size()) {
            return null;
        }
        return items.get(order.get(position));
    }

    /**
     * Returns the key at the given position, or {@code null} if the position
     * is out of range.
     */
    public K getKeyAt(int position) {
        if (order == null || position < 0 || position >= order.size()) {
            return null;
        }
        return order.get(position);
    }

    @Override
    public List<K> keys() {
        return order == null ? new ArrayList<>() : new ArrayList<>(order);
    }

    @Override
    public List<V> values() {
        List<V> values = new ArrayList<>(len());
        range((k, v) -> values.add(v));
        return values;
    }

    @Override
    public int len() {
        return items == null ? 0 : items.size();
    }

    @Override
    public void range(BiPredicate<? super K, ? super V> f) {
        if (order == null)
            return;
        for (K k : order) {
            if (!f.test(k, items.get(k)))
                break;
        }
    }

    /**
     * Removes all entries. The installed order, if any, is kept.
     */
    @Override
    public void clear() {
        items = null;
        order = null;
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

        boolean[] result = { true };
        range((k, v) -> {
            Optional<V> ov = other.load(k);
            if (!ov.isPresent() || !Equality.equalValues(v, ov.get())) {
                result[0] = false;
            }
            return result[0];
        });
        return result[0];
    }

    @Override
    public void deleteFunc(BiPredicate<? super K, ? super V> predicate) {
        if (order == null)
            return;
        for (int i = order.size() - 1; i >= 0; i--) {
            K k = order.get(i);
            if (predicate.test(k, items.get(k))) {
                items.remove(k);
                order.remove(i);
            }
        }
    }

    private Iterator<K> keyIterator() {
        return order == null
            ? Collections.emptyIterator()
            : Iterators.unmodifiableIterator(order.iterator());
    }

    @Override
    public Iterable<Map.Entry<K, V>> all() {
        return () -> {
            Map<K, V> m = items;
            return Iterators.transform(keyIterator(), k -> Maps.immutableEntry(k, m.get(k)));
        };
    }

    @Override
    public Iterable<K> keysIter() {
        return this::keyIterator;
    }

    @Override
    public Iterable<V> valuesIter() {
        return () -> {
            Map<K, V> m = items;
            return Iterators.transform(keyIterator(), k -> m.get(k));
        };
    }

    /**
     * Returns a shallow copy of this map. The copy has its own storage and
     * shares the installed order, the keys and values themselves are not
     * cloned.
     */
    @Override
    @SuppressWarnings("unchecked")
    public OrderedMap<K, V> clone() {
        try {
            OrderedMap<K, V> m = (OrderedMap<K, V>)super.clone();
            if (items != null) {
                m.items = new HashMap<>(items);
                m.order = new ArrayList<>(order);
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

    /**
     * Writes the entries followed by the keys in iteration order. The entry
     * order is a function and is never written.
     */
    private void writeContent(ObjectOutputStream out) throws IOException {
        out.writeObject(items == null ? new HashMap<K, V>() : items);
        out.writeObject(order == null ? new ArrayList<K>() : order);
    }

    /**
     * Reads the content written by {@link #writeContent} into this map.
     */
    @SuppressWarnings("unchecked")
    private void readContent(ObjectInputStream in) throws IOException, ClassNotFoundException {
        HashMap<K, V> m = BinaryCodec.readObject(in, HashMap.class);
        ArrayList<K> o = BinaryCodec.readObject(in, ArrayList.class);
        verify(m, o);
        if (m.isEmpty()) {
            items = null;
            order = null;
        } else {
            items = m;
            order = o;
        }
    }

    private static <K> void verify(Map<K, ?> items, List<K> order) throws InvalidObjectException {
        if (items.size() != order.size()
                || new HashSet<>(order).size() != order.size()
                || !items.keySet().containsAll(order)) {
            throw new InvalidObjectException("Keys do not match the key order");
        }
        if (items.containsKey(null) || items.containsValue(null)) {
            throw new InvalidObjectException("Null entries are not permitted");
        }
    }

    /**
     * @serialData the entries as a {@code HashMap}, followed by the keys in
     *             iteration order as an {@code ArrayList}
     */
    private void writeObject(ObjectOutputStream s) throws IOException {
        s.defaultWriteObject();
        writeContent(s);
    }

    private void readObject(ObjectInputStream s) throws IOException, ClassNotFoundException {
        s.defaultReadObject();
        readContent(s);
    }

    @Override
    public byte[] marshalBinary() throws IOException {
        return BinaryCodec.encode(this::writeContent);
    }

    /**
     * Replaces the content of this map with the decoded content. When an order
     * is installed the decoded keys are sorted with it.
     */
    @Override
    public void unmarshalBinary(byte[] data) throws IOException {
        OrderedMap<K, V> decoded = BinaryCodec.decode(data, in -> {
            OrderedMap<K, V> m = new OrderedMap<>();
            m.readContent(in);
            return m;
        });
        replaceWith(decoded.items, decoded.order);
    }

    @Override
    public String marshalJson() throws IOException {
        Map<K, V> entries = new LinkedHashMap<>();
        range((k, v) -> {
            entries.put(k, v);
            return true;
        });
        return JsonCodec.encodeMap(entries);
    }

    /**
     * Replaces the content of this map with the content of a JSON object. JSON
     * objects are unordered, the keys take the iteration order of the decoded
     * hash map, or the installed order if there is one.
     */
    @Override
    public void unmarshalJson(String json, Class<K> keyType, Class<V> valueType) throws IOException {
        Map<K, V> decoded = JsonCodec.decodeMap(json, keyType, valueType);
        if (decoded.isEmpty()) {
            replaceWith(null, null);
        } else {
            HashMap<K, V> m = new HashMap<>(decoded);
            replaceWith(m, new ArrayList<>(m.keySet()));
        }
    }

    private void replaceWith(HashMap<K, V> m, ArrayList<K> o) {
        items = m;
        order = o;
        setOrder(less);
    }
}
