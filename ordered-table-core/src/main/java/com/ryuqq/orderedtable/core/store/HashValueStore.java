package com.ryuqq.orderedtable.core.store;

import com.ryuqq.orderedtable.core.spi.ValueStore;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link ValueStore} default implementation backed by {@link HashMap}.
 *
 * <p>Rehashing and capacity growth are left entirely to {@link HashMap}.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / put / remove:</strong> O(1) average</li>
 *   <li><strong>clear:</strong> O(capacity)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Key equality is {@link Object#equals(Object)} / {@link Object#hashCode()}</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Ordered Table Team
 * @since 1.0.0
 */
public class HashValueStore<K, V> implements ValueStore<K, V> {

    private final Map<K, V> values;

    /**
     * Creates a new HashValueStore with default capacity.
     */
    public HashValueStore() {
        this.values = new HashMap<>();
    }

    /**
     * Creates a new HashValueStore sized for the given number of keys.
     *
     * @param initialCapacity initial capacity of the backing table
     * @throws IllegalArgumentException if initialCapacity is not positive
     */
    public HashValueStore(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive, but was: " + initialCapacity);
        }
        this.values = new HashMap<>(initialCapacity);
    }

    @Override
    public V get(K key) {
        return values.get(key);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if value is null
     */
    @Override
    public V put(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return values.put(key, value);
    }

    @Override
    public V remove(K key) {
        return values.remove(key);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public void clear() {
        values.clear();
    }
}
