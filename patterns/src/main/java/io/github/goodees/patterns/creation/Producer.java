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

import java.util.Map;

/**
 * The extension point of a flyweight factory: creates a new value for an identifier and context. The factory calls it
 * only on a cache miss, so it is the only place where the concrete user decides what the identifiers mean.
 *
 * @param <V> type of produced values
 * @see ProducerTable
 */
@FunctionalInterface
public interface Producer<V> {
    /**
     * Create new value.
     * <p>Failure to construct, e. g. unknown identifier or malformed context, should be signalled by throwing
     * {@link ConstructionException}. Any runtime exception is passed to the caller of the factory unchanged, and no
     * value is cached for the failed call.</p>
     *
     * @param identifier the kind of object to produce
     * @param context    named parameters of the construction, never null, read only
     * @return new instance, must not be null
     */
    V construct(String identifier, Map<String, ?> context);
}
