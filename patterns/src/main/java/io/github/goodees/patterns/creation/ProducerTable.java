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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Producer dispatching on identifier to explicitly registered construction functions. Identifiers that are not
 * registered are passed to the fallback, or fail with {@link ConstructionException.Fault#UNKNOWN_IDENTIFIER}.
 * <pre>{@code
 * ProducerTable<RuntimeException> exceptions = ProducerTable.builder(RuntimeException.class)
 *         .on("Foo", FooException::new)
 *         .onContext("Bar", ctx -> new BarException((String) ctx.get("message")))
 *         .build();
 * }</pre>
 *
 * @param <V> type of produced values
 */
public class ProducerTable<V> implements Producer<V> {
    private final Map<String, Function<Map<String, ?>, ? extends V>> producers;
    private final Producer<? extends V> fallback;

    private ProducerTable(Builder<V> b) {
        this.producers = Collections.unmodifiableMap(new LinkedHashMap<>(b.producers));
        this.fallback = b.fallback;
    }

    @Override
    public V construct(String identifier, Map<String, ?> context) {
        Function<Map<String, ?>, ? extends V> producer = producers.get(identifier);
        if (producer != null) {
            return producer.apply(context);
        }
        if (fallback != null) {
            return fallback.construct(identifier, context);
        }
        throw ConstructionException.unknownIdentifier(identifier, producers.keySet());
    }

    /**
     * @return identifiers with registered producer, in order of registration
     */
    public Set<String> identifiers() {
        return producers.keySet();
    }

    public boolean knows(String identifier) {
        return producers.containsKey(identifier);
    }

    public static <V> Builder<V> builder(Class<V> productType) {
        return new Builder<>();
    }

    public static class Builder<V> {
        private final Map<String, Function<Map<String, ?>, ? extends V>> producers = new LinkedHashMap<>();
        private Producer<? extends V> fallback;

        /**
         * Register producer that ignores the context.
         *
         * @param identifier identifier to register
         * @param producer   creates the value
         * @return this builder
         */
        public Builder<V> on(String identifier, Supplier<? extends V> producer) {
            Objects.requireNonNull(producer, "Producer must be specified");
            return register(identifier, ctx -> producer.get());
        }

        /**
         * Register producer that reads the context.
         *
         * @param identifier identifier to register
         * @param producer   creates the value out of context
         * @return this builder
         */
        public Builder<V> onContext(String identifier, Function<Map<String, ?>, ? extends V> producer) {
            Objects.requireNonNull(producer, "Producer must be specified");
            return register(identifier, producer);
        }

        /**
         * Producer for identifiers without registered producer.
         *
         * @param fallback producer to delegate to
         * @return this builder
         */
        public Builder<V> otherwise(Producer<? extends V> fallback) {
            this.fallback = Objects.requireNonNull(fallback, "Fallback must be specified");
            return this;
        }

        private Builder<V> register(String identifier, Function<Map<String, ?>, ? extends V> producer) {
            Objects.requireNonNull(identifier, "Identifier must be specified");
            if (producers.putIfAbsent(identifier, producer) != null) {
                throw new IllegalArgumentException("Producer for " + identifier + " is already registered");
            }
            return this;
        }

        public ProducerTable<V> build() {
            return new ProducerTable<>(this);
        }
    }
}
