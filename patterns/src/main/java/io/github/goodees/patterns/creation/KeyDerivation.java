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
 * Computes the cache key of a flyweight. Implementation must be a pure function: value-equal identifiers and contexts
 * yield equal keys, and it should yield different keys otherwise.
 *
 * @see CanonicalKeyDerivation
 */
@FunctionalInterface
public interface KeyDerivation {
    /**
     * @param identifier identifier of the flyweight, never null
     * @param context    context of the flyweight, never null
     * @return derived key
     * @throws IllegalArgumentException when context cannot be represented as a key
     */
    String deriveKey(String identifier, Map<String, ?> context);
}
