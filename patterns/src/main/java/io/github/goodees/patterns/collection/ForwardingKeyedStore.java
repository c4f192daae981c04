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
 * Mixes registry behaviour into any class. The host implements this interface and supplies the store holding its data,
 * usually a private {@link Registry} field; all operations forward to it and chaining methods return the host.
 * <pre>{@code
 * class Services implements ForwardingKeyedStore<Object> {
 *     private final Registry<Object> services = new Registry<>();
 *
 *     public KeyedStore<Object> delegate() {
 *         return services;
 *     }
 * }
 * }</pre>
 *
 * @param <V> type of stored values
 */
public interface ForwardingKeyedStore<V> extends KeyedStore<V> {

    /**
     * The store the host keeps its data in. Must return the same instance on every call.
     *
     * @return backing store
     */
    KeyedStore<V> delegate();

    @Override
    default V get(String key, V defaultValue) {
        return delegate().get(key, defaultValue);
    }

    @Override
    default ForwardingKeyedStore<V> set(String key, V value) {
        delegate().set(key, value);
        return this;
    }

    @Override
    default boolean has(String key) {
        return delegate().has(key);
    }

    @Override
    default ForwardingKeyedStore<V> remove(String key) {
        delegate().remove(key);
        return this;
    }

    @Override
    default V take(String key) {
        return delegate().take(key);
    }

    @Override
    default ForwardingKeyedStore<V> clear() {
        delegate().clear();
        return this;
    }

    @Override
    default Map<String, V> all() {
        return delegate().all();
    }

    @Override
    default int size() {
        return delegate().size();
    }

    @Override
    default boolean isEmpty() {
        return delegate().isEmpty();
    }
}
