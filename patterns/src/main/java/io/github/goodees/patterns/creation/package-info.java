/**
 * Creational patterns.
 *
 * <h2>Flyweight factory</h2>
 * <p>A {@linkplain io.github.goodees.patterns.creation.FlyweightFactory flyweight factory} avoids creating duplicate
 * objects by handing out a shared instance for every request with equal identifier and context. The identifier names
 * the kind of object, the context carries the named parameters of its construction.</p>
 * <p>{@link io.github.goodees.patterns.creation.CachingFlyweightFactory} implements the caching part: it derives a key
 * from identifier and context using a {@link io.github.goodees.patterns.creation.KeyDerivation}, looks it up in its
 * {@linkplain io.github.goodees.patterns.collection.KeyedStore store} and on a miss asks a
 * {@link io.github.goodees.patterns.creation.Producer} for a new instance. The producer is the extension point users
 * of the pattern supply; {@link io.github.goodees.patterns.creation.ProducerTable} builds one out of a table of
 * construction functions.</p>
 * <p>The factory does not handle failures of the producer. Exception thrown during construction reaches the caller
 * as it is, and nothing is cached for such call.</p>
 *
 * @see io.github.goodees.patterns.creation.CachingFlyweightFactory
 * @see io.github.goodees.patterns.creation.ConstructionException
 */
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
