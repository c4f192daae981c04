package io.github.goodees.patterns.collection;

/*-
 * #%L
 * patterns
 * %%
 * Copyright (C) 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Map;

/**
 * The Registry pattern. A well-known object that other objects use to find common objects and services, keeping
 * references to them by a String key. It is essentially an associative map with an object-oriented interface.
 * <p>Registries are often made static or singletons, because they hold objects needed in wide context. Nothing here
 * requires that, and it is discouraged: a store is owned by the object that creates it, and its lifecycle ends with
 * that owner.</p>
 * <p>The basic interface of a store is the basis of other map-like patterns, e. g. the cache of a
 * {@link io.github.goodees.patterns.creation.CachingFlyweightFactory}.</p>
 * <p>Neither keys nor values may be {@code null}, as a stored {@code null} could not be told apart from a miss in
 * {@link #get(String, Object)}.</p>
 *
 * @param <V> type of stored values
 * @see Registry
 * @see ForwardingKeyedStore
 */
public interface KeyedStore<V> {
    /**
     * Get a value out of the store.
     *
     * @param key          the key of the value to retrieve
     * @param defaultValue value to return if the key is missing, may be null
     * @return the stored value, or {@code defaultValue}
     */
    V get(String key, V defaultValue);

    /**
     * Get a value out of the store.
     *
     * @param key the key of the value to retrieve
     * @return the stored value, or {@code null} when the key is missing
     */
    default V get(String key) {
        return get(key, null);
    }

    /**
     * Store a value, replacing any value stored under the same key.
     *
     * @param key   the key of the value
     * @param value the value to store
     * @return this store, for chaining
     */
    KeyedStore<V> set(String key, V value);

    /**
     * Check whether a key exists in the store.
     *
     * @param key the key to check
     * @return true if a value is stored under the key
     */
    boolean has(String key);

    /**
     * Remove a value from the store. Removing missing key does nothing.
     *
     * @param key the key of the value to remove
     * @return this store, for chaining
     */
    KeyedStore<V> remove(String key);

    /**
     * Remove a value from the store and return it. Of concurrent calls for the same key only one receives the value.
     *
     * @param key the key of the value to remove
     * @return the removed value, or {@code null} when the key was missing
     */
    V take(String key);

    /**
     * Remove all values from the store.
     *
     * @return this store, for chaining
     */
    KeyedStore<V> clear();

    /**
     * Return all values of the store. The result is an immutable copy, later changes of the store are not reflected
     * in it.
     *
     * @return snapshot of all entries
     */
    Map<String, V> all();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
