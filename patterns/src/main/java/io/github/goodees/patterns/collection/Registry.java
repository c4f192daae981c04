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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps the values in memory. Single operations are atomic and the registry may be shared between threads;
 * {@link #all()} returns weakly consistent snapshot when the registry is modified concurrently.
 *
 * @param <V> type of stored values
 */
public class Registry<V> implements KeyedStore<V> {
    private final ConcurrentMap<String, V> data = new ConcurrentHashMap<>();

    @Override
    public V get(String key, V defaultValue) {
        return data.getOrDefault(Objects.requireNonNull(key, "Key must be specified"), defaultValue);
    }

    @Override
    public Registry<V> set(String key, V value) {
        data.put(Objects.requireNonNull(key, "Key must be specified"),
                Objects.requireNonNull(value, () -> "Value for key " + key + " must not be null"));
        return this;
    }

    @Override
    public boolean has(String key) {
        return data.containsKey(Objects.requireNonNull(key, "Key must be specified"));
    }

    @Override
    public Registry<V> remove(String key) {
        data.remove(Objects.requireNonNull(key, "Key must be specified"));
        return this;
    }

    @Override
    public V take(String key) {
        return data.remove(Objects.requireNonNull(key, "Key must be specified"));
    }

    @Override
    public Registry<V> clear() {
        data.clear();
        return this;
    }

    @Override
    public Map<String, V> all() {
        return Collections.unmodifiableMap(new HashMap<>(data));
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public boolean isEmpty() {
        return data.isEmpty();
    }

    @Override
    public String toString() {
        return "Registry" + data.keySet();
    }
}
