package io.github.goodees.patterns.creation;

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

import io.github.goodees.patterns.collection.KeyedStore;
import io.github.goodees.patterns.collection.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Flyweight factory keeping its instances in a {@link KeyedStore}. Construction is delegated to a {@link Producer},
 * keys are computed by a {@link KeyDerivation}.
 * <h2>Acquisition</h2>
 * <ol>
 * <li>The derived key of identifier and context is computed</li>
 * <li>When the cache holds the key, the cached instance is returned</li>
 * <li>Otherwise the producer constructs new instance, it is stored under the key and returned</li>
 * </ol>
 * <h2>Concurrency</h2>
 * <p>The factory is thread safe, provided the cache store is. For a single derived key at most one construction runs
 * at a time; callers arriving during the construction wait for it and receive its result, or the exception it failed
 * with. Constructions of different keys run in parallel.</p>
 * <p>Failures are not remembered. After failed construction completes, the next call constructs again.</p>
 * <p>A producer must not acquire the key it is constructing from the same factory, such call never returns.</p>
 * <h2>Composition</h2>
 * Types that want to act as flyweight factory hold an instance and delegate to it, providing their own construction
 * method:
 * <pre>{@code
 * class Glyphs implements FlyweightFactory<Glyph> {
 *     private final CachingFlyweightFactory<Glyph> flyweights = new CachingFlyweightFactory<>(this::construct);
 *
 *     public Glyph acquire(String identifier, Map<String, ?> context) {
 *         return flyweights.acquire(identifier, context);
 *     }
 *
 *     private Glyph construct(String identifier, Map<String, ?> context) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @param <V> type of produced values
 */
public class CachingFlyweightFactory<V> implements FlyweightFactory<V> {
    private static final Logger logger = LoggerFactory.getLogger(CachingFlyweightFactory.class);

    private final String name;
    private final Producer<? extends V> producer;
    private final KeyedStore<V> cache;
    private final KeyDerivation keyDerivation;
    private final ConcurrentMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder failures = new LongAdder();

    /**
     * Create factory with in-memory cache and canonical key derivation.
     *
     * @param producer producer to construct instances with
     */
    public CachingFlyweightFactory(Producer<? extends V> producer) {
        this(CachingFlyweightFactory.<V>builder(producer));
    }

    private CachingFlyweightFactory(Builder<V> b) {
        this.name = Objects.requireNonNull(b.name, "Name must be specified");
        this.producer = Objects.requireNonNull(b.producer, "Producer must be specified");
        this.cache = b.cache != null ? b.cache : new Registry<>();
        this.keyDerivation = b.keyDerivation != null ? b.keyDerivation : new CanonicalKeyDerivation();
    }

    @Override
    public V acquire(String identifier, Map<String, ?> context) {
        Objects.requireNonNull(identifier, "Identifier must be specified");
        Map<String, ?> ctx = context == null ? Collections.emptyMap() : Collections.unmodifiableMap(context);
        String key = keyDerivation.deriveKey(identifier, ctx);

        V cached = cache.get(key);
        if (cached != null) {
            logger.trace("Flyweight factory {} reusing {}", name, key);
            hits.increment();
            return cached;
        }

        CompletableFuture<V> construction = new CompletableFuture<>();
        CompletableFuture<V> running = inFlight.putIfAbsent(key, construction);
        if (running != null) {
            logger.trace("Flyweight factory {} awaiting construction of {}", name, key);
            hits.increment();
            return await(running);
        }
        try {
            // previous construction might have finished between the lookup and our registration
            V value = cache.get(key);
            if (value == null) {
                value = construct(identifier, ctx, key);
                cache.set(key, value);
            } else {
                hits.increment();
            }
            construction.complete(value);
            return value;
        } catch (Throwable t) {
            // also checked exceptions thrown undeclared
            construction.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, construction);
        }
    }

    private V construct(String identifier, Map<String, ?> context, String key) {
        misses.increment();
        logger.debug("Flyweight factory {} constructing {}", name, key);
        V value;
        try {
            value = producer.construct(identifier, context);
        } catch (Throwable t) {
            failures.increment();
            logger.debug("Flyweight factory {} failed to construct {}", name, key, t);
            throw t;
        }
        if (value == null) {
            failures.increment();
            throw ConstructionException.nullProduct(identifier);
        }
        return value;
    }

    private static <V> V await(CompletableFuture<V> construction) {
        try {
            return construction.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    public boolean isCached(String identifier, Map<String, ?> context) {
        return cache.has(deriveKey(identifier, context));
    }

    /**
     * Remove instance from the cache. Next acquisition with same arguments will construct new instance.
     *
     * @param identifier identifier of the instance
     * @param context    context of the instance
     * @return true if instance was cached
     */
    public boolean evict(String identifier, Map<String, ?> context) {
        String key = deriveKey(identifier, context);
        if (cache.take(key) == null) {
            return false;
        }
        logger.debug("Flyweight factory {} evicted {}", name, key);
        return true;
    }

    public void clear() {
        cache.clear();
        logger.debug("Flyweight factory {} cleared", name);
    }

    public int size() {
        return cache.size();
    }

    public boolean isEmpty() {
        return cache.isEmpty();
    }

    /**
     * @return snapshot of cached instances by their derived key
     */
    public Map<String, V> cached() {
        return cache.all();
    }

    public FlyweightStatistics statistics() {
        return FlyweightStatistics.of(hits.sum(), misses.sum(), failures.sum(), cache.size());
    }

    public String getName() {
        return name;
    }

    private String deriveKey(String identifier, Map<String, ?> context) {
        Objects.requireNonNull(identifier, "Identifier must be specified");
        return keyDerivation.deriveKey(identifier, context == null ? Collections.emptyMap() : context);
    }

    @Override
    public String toString() {
        return "CachingFlyweightFactory{" + name + ", size=" + cache.size() + "}";
    }

    public static <V> Builder<V> builder(Producer<? extends V> producer) {
        return new Builder<V>().producer(producer);
    }

    /**
     * Configuration of a factory. Only the producer is mandatory, by default the factory is named
     * {@value #DEFAULT_NAME}, caches in a {@link Registry} and uses {@link CanonicalKeyDerivation}.
     */
    public static class Builder<V> {
        public static final String DEFAULT_NAME = "flyweights";

        private String name = DEFAULT_NAME;
        private Producer<? extends V> producer;
        private KeyedStore<V> cache;
        private KeyDerivation keyDerivation;

        public Builder<V> name(String name) {
            this.name = Objects.requireNonNull(name, "Name must be specified");
            return this;
        }

        public Builder<V> producer(Producer<? extends V> producer) {
            this.producer = Objects.requireNonNull(producer, "Producer must be specified");
            return this;
        }

        /**
         * Store to cache instances in. The factory becomes its exclusive user, entries written by others may be
         * returned as flyweights.
         *
         * @param cache the store
         * @return this builder
         */
        public Builder<V> cache(KeyedStore<V> cache) {
            this.cache = Objects.requireNonNull(cache, "Cache must be specified");
            return this;
        }

        public Builder<V> keyDerivation(KeyDerivation keyDerivation) {
            this.keyDerivation = Objects.requireNonNull(keyDerivation, "Key derivation must be specified");
            return this;
        }

        public CachingFlyweightFactory<V> build() {
            return new CachingFlyweightFactory<>(this);
        }
    }
}
