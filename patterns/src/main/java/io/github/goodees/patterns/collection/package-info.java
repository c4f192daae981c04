/**
 * Registry pattern: key/value stores with object-oriented interface.
 * <p>{@link io.github.goodees.patterns.collection.KeyedStore} defines the operations,
 * {@link io.github.goodees.patterns.collection.Registry} keeps the entries in memory and
 * {@link io.github.goodees.patterns.collection.ForwardingKeyedStore} lets any class expose a store it owns as its own
 * behaviour, without extending a base class.</p>
 */
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
